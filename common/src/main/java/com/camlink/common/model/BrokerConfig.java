/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.HashMap;
import java.util.Map;

/**
 * Configuration for the pub/sub broker the cameras publish to.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BrokerConfig {

    @JsonProperty("broker_id")
    private String brokerId = "default";

    @JsonProperty("broker_type")
    private BrokerType brokerType = BrokerType.ACTIVEMQ;

    @JsonProperty("connection_uri")
    private String connectionUri;

    @JsonProperty("username")
    private String username;

    @JsonProperty("password")
    private String password;

    @JsonProperty("client_id")
    private String clientId;

    @JsonProperty("reconnect_interval_seconds")
    private int reconnectIntervalSeconds = 10;

    @JsonProperty("properties")
    private Map<String, String> properties = new HashMap<>();

    /**
     * ACTIVEMQ speaks to a real broker (which also bridges MQTT devices);
     * LOOPBACK is an in-process bus for local runs and tests.
     */
    public enum BrokerType {
        ACTIVEMQ, LOOPBACK
    }

    public BrokerConfig() {}

    public String getBrokerId() { return brokerId; }
    public void setBrokerId(String brokerId) { this.brokerId = brokerId; }
    public BrokerType getBrokerType() { return brokerType; }
    public void setBrokerType(BrokerType brokerType) { this.brokerType = brokerType; }
    public String getConnectionUri() { return connectionUri; }
    public void setConnectionUri(String connectionUri) { this.connectionUri = connectionUri; }
    public void setUsername(String username) { this.username = username; }
    public void setPassword(String password) { this.password = password; }
    public void setClientId(String clientId) { this.clientId = clientId; }
    public void setReconnectIntervalSeconds(int reconnectIntervalSeconds) { this.reconnectIntervalSeconds = reconnectIntervalSeconds; }
    public void setProperties(Map<String, String> properties) { this.properties = properties; }

    /** Flatten into the config map handed to {@code initialize()} of publishers and subscribers. */
    public Map<String, Object> toConnectionProps() {
        Map<String, Object> props = new HashMap<>();
        props.put("broker_id", brokerId);
        if (connectionUri != null) props.put("broker_url", connectionUri);
        if (username != null) props.put("username", username);
        if (password != null) props.put("password", password);
        if (clientId != null) props.put("client_id", clientId);
        props.put("reconnect_interval_seconds", reconnectIntervalSeconds);
        if (properties != null) props.putAll(properties);
        return props;
    }
}
