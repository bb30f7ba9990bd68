/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Read-model entry for one device. Always derived from the event set.
 */
public record DeviceCounts(
        @JsonProperty("device_id") String deviceId,
        @JsonProperty("unviewed_count") int unviewedCount,
        @JsonProperty("last_24h_count") int last24hCount) {

    public static DeviceCounts empty(String deviceId) {
        return new DeviceCounts(deviceId, 0, 0);
    }
}
