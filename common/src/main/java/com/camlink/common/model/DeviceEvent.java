/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A timestamped occurrence observed by a camera, referencing a stored artifact
 * (usually a video clip).
 *
 * <p>Identity is {@code (deviceId, timestamp, artifactReference)}; the {@code viewed}
 * flag is the only mutable aspect and is changed by producing a new instance via
 * {@link #markedViewed()}. Timestamps are kept as the sortable text the camera sent
 * (lexicographic order is chronological order).</p>
 */
public final class DeviceEvent {

    @JsonProperty("device_id")
    private final String deviceId;

    @JsonProperty("timestamp")
    private final String timestamp;

    @JsonProperty("artifact_reference")
    private final String artifactReference;

    @JsonProperty("viewed")
    private final boolean viewed;

    @JsonCreator
    public DeviceEvent(@JsonProperty("device_id") String deviceId,
                       @JsonProperty("timestamp") String timestamp,
                       @JsonProperty("artifact_reference") String artifactReference,
                       @JsonProperty("viewed") boolean viewed) {
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.artifactReference = Objects.requireNonNull(artifactReference, "artifactReference");
        this.viewed = viewed;
    }

    public String getDeviceId() { return deviceId; }
    public String getTimestamp() { return timestamp; }
    public String getArtifactReference() { return artifactReference; }
    public boolean isViewed() { return viewed; }

    public DeviceEvent markedViewed() {
        return viewed ? this : new DeviceEvent(deviceId, timestamp, artifactReference, true);
    }

    /** True when both events describe the same occurrence, regardless of the viewed flag. */
    @JsonIgnore
    public boolean sameOccurrence(DeviceEvent other) {
        return other != null
                && deviceId.equals(other.deviceId)
                && timestamp.equals(other.timestamp)
                && artifactReference.equals(other.artifactReference);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DeviceEvent other)) return false;
        return viewed == other.viewed && sameOccurrence(other);
    }

    @Override
    public int hashCode() {
        return Objects.hash(deviceId, timestamp, artifactReference, viewed);
    }

    @Override
    public String toString() {
        return "DeviceEvent{" + deviceId + " @ " + timestamp + " → " + artifactReference
                + (viewed ? ", viewed" : "") + "}";
    }
}
