/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.cache;

import com.camlink.common.model.DeviceEvent;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * In-memory copy of the event history, newest first.
 * Seeded from the store at startup and prepended to as events arrive.
 */
public class EventCache {

    private final LinkedList<DeviceEvent> events = new LinkedList<>();

    public synchronized void seed(List<DeviceEvent> newestFirst) {
        events.clear();
        events.addAll(newestFirst);
    }

    public synchronized void prepend(DeviceEvent event) {
        events.addFirst(event);
    }

    /**
     * Flag the matching event as viewed.
     *
     * @return the updated event, or empty when no unviewed match exists
     */
    public synchronized Optional<DeviceEvent> markViewed(String deviceId, String timestamp, String artifactReference) {
        DeviceEvent probe = new DeviceEvent(deviceId, timestamp, artifactReference, false);
        var it = events.listIterator();
        while (it.hasNext()) {
            DeviceEvent e = it.next();
            if (!e.isViewed() && e.sameOccurrence(probe)) {
                DeviceEvent viewed = e.markedViewed();
                it.set(viewed);
                return Optional.of(viewed);
            }
        }
        return Optional.empty();
    }

    /** Immutable copy, newest first. */
    public synchronized List<DeviceEvent> snapshot() {
        return List.copyOf(events);
    }

    public synchronized List<DeviceEvent> forDevice(String deviceId, int limit) {
        return events.stream()
                .filter(e -> deviceId == null || deviceId.equals(e.getDeviceId()))
                .limit(Math.max(0, limit))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    public synchronized int size() {
        return events.size();
    }
}
