/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One alternative way of opening a stream to a camera.
 *
 * @param pipeline opaque connection description handed to the connection factory
 * @param sinkName name of the sink element that provides the display surface; may be null
 */
public record CandidateStrategy(
        @JsonProperty("pipeline") String pipeline,
        @JsonProperty("sink_name") String sinkName) {

    /** Copy with {@code {url}} in the pipeline replaced. */
    public CandidateStrategy forUrl(String url) {
        return new CandidateStrategy(
                pipeline == null ? null : pipeline.replace("{url}", url),
                sinkName);
    }
}
