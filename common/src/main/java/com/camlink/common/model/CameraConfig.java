/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Camera catalogue entry. {@code strategies} is optional. When absent the
 * catalogue builds them from the default templates using {@code url} and
 * {@code fallback_url}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CameraConfig {

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("url")
    private String url;

    @JsonProperty("fallback_url")
    private String fallbackUrl;

    @JsonProperty("description")
    private String description;

    @JsonProperty("strategies")
    private List<CandidateStrategy> strategies = new ArrayList<>();

    public CameraConfig() {}

    public CameraConfig(String id, String name, String url) {
        this.id = id;
        this.name = name;
        this.url = url;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getName() { return name != null ? name : id; }
    public void setName(String name) { this.name = name; }
    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }
    public String getFallbackUrl() { return fallbackUrl; }
    public void setFallbackUrl(String fallbackUrl) { this.fallbackUrl = fallbackUrl; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public List<CandidateStrategy> getStrategies() { return strategies; }
    public void setStrategies(List<CandidateStrategy> strategies) {
        this.strategies = strategies != null ? strategies : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "CameraConfig{" + id + " '" + getName() + "' " + url + "}";
    }
}
