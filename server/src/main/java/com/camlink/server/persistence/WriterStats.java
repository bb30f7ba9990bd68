/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.persistence;

import com.fasterxml.jackson.annotation.JsonProperty;

public record WriterStats(
        @JsonProperty("batches") long batches,
        @JsonProperty("largest_batch") int largestBatch,
        @JsonProperty("persisted") long persisted,
        @JsonProperty("failed") long failed,
        @JsonProperty("marked_viewed") long markedViewed,
        @JsonProperty("discarded_at_stop") long discardedAtStop,
        @JsonProperty("queue_depth") int queueDepth) {
}
