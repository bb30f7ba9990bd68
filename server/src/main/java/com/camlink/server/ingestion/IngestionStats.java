/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.ingestion;

import com.fasterxml.jackson.annotation.JsonProperty;

public record IngestionStats(
        @JsonProperty("received") long received,
        @JsonProperty("events") long events,
        @JsonProperty("statuses") long statuses,
        @JsonProperty("alerts") long alerts,
        @JsonProperty("controls") long controls,
        @JsonProperty("malformed") long malformed,
        @JsonProperty("unknown") long unknown,
        @JsonProperty("discarded_at_stop") long discardedAtStop,
        @JsonProperty("queue_depth") int queueDepth) {
}
