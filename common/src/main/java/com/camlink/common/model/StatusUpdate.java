/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Status text shown by the presentation layer.
 *
 * @param deviceId  device the status refers to; null for process-wide messages
 * @param text      human-readable status line
 * @param connected whether a stream session is active after this change
 * @param source    what produced the status
 * @param timestamp when it was produced
 */
public record StatusUpdate(
        @JsonProperty("device_id") String deviceId,
        @JsonProperty("text") String text,
        @JsonProperty("connected") boolean connected,
        @JsonProperty("source") Source source,
        @JsonProperty("timestamp") Instant timestamp) {

    public enum Source {
        SESSION, DEVICE_STATUS, DEVICE_ALERT, TRANSPORT
    }

    public static StatusUpdate session(String deviceId, String text, boolean connected) {
        return new StatusUpdate(deviceId, text, connected, Source.SESSION, Instant.now());
    }
}
