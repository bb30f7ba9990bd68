/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.readmodel;

import com.camlink.common.model.DeviceCounts;
import com.camlink.common.model.DeviceEvent;
import com.camlink.common.util.Timestamps;
import com.camlink.server.cache.EventCache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Per-device counters derived from the event cache.
 *
 * <p>Counts are always recomputed from the full cache, never patched.
 * {@link #refresh()} publishes a new immutable table that presentation code
 * reads through {@link #counts(String)} and {@link #allCounts()}. Events whose
 * timestamp cannot be parsed are excluded from the recent window.</p>
 */
public class ReadModel {

    public static final Duration RECENT_WINDOW = Duration.ofHours(24);

    private final EventCache cache;
    private final Clock clock;
    private final ZoneId zone;
    private volatile Map<String, DeviceCounts> table = Collections.emptyMap();

    public ReadModel(EventCache cache, Clock clock) {
        this.cache = cache;
        this.clock = clock;
        this.zone = clock.getZone();
    }

    public int unviewedCount(String deviceId) {
        return unviewedCount(cache.snapshot(), deviceId);
    }

    public int recentCount(String deviceId, Duration window) {
        return recentCount(cache.snapshot(), deviceId, window, clock.instant(), zone);
    }

    /** Recompute every device's counts from the current cache. */
    public void refresh() {
        List<DeviceEvent> events = cache.snapshot();
        Instant now = clock.instant();
        Instant cutoff = now.minus(RECENT_WINDOW);
        Map<String, int[]> acc = new TreeMap<>();
        for (DeviceEvent e : events) {
            int[] c = acc.computeIfAbsent(e.getDeviceId(), k -> new int[2]);
            if (!e.isViewed()) c[0]++;
            if (inWindow(e, cutoff, zone)) c[1]++;
        }
        Map<String, DeviceCounts> next = new TreeMap<>();
        acc.forEach((device, c) -> next.put(device, new DeviceCounts(device, c[0], c[1])));
        table = Collections.unmodifiableMap(next);
    }

    public DeviceCounts counts(String deviceId) {
        return table.getOrDefault(deviceId, DeviceCounts.empty(deviceId));
    }

    public Map<String, DeviceCounts> allCounts() {
        return table;
    }

    // ─── Pure functions over an event list ─────────────────────────────

    public static int unviewedCount(List<DeviceEvent> events, String deviceId) {
        int n = 0;
        for (DeviceEvent e : events) {
            if (e.getDeviceId().equals(deviceId) && !e.isViewed()) n++;
        }
        return n;
    }

    public static int recentCount(List<DeviceEvent> events, String deviceId, Duration window,
                                  Instant now, ZoneId zone) {
        Instant cutoff = now.minus(window);
        int n = 0;
        for (DeviceEvent e : events) {
            if (e.getDeviceId().equals(deviceId) && inWindow(e, cutoff, zone)) n++;
        }
        return n;
    }

    // Stamps slightly ahead of the local clock still count as recent.
    private static boolean inWindow(DeviceEvent e, Instant cutoff, ZoneId zone) {
        Optional<Instant> at = Timestamps.parse(e.getTimestamp(), zone);
        return at.isPresent() && !at.get().isBefore(cutoff);
    }
}
