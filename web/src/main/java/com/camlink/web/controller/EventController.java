/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.web.controller;

import com.camlink.common.model.DeviceEvent;
import com.camlink.server.cache.EventCache;
import com.camlink.server.persistence.BatchWriter;
import com.camlink.server.readmodel.ReadModelRefresher;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.NoSuchElementException;

@RestController
@RequestMapping("/api/events")
public class EventController {

    private static final Logger log = LoggerFactory.getLogger(EventController.class);

    static final int MAX_LIMIT = 1000;

    private final EventCache cache;
    private final BatchWriter writer;
    private final ReadModelRefresher refresher;

    public EventController(EventCache cache, BatchWriter writer, ReadModelRefresher refresher) {
        this.cache = cache;
        this.writer = writer;
        this.refresher = refresher;
    }

    public record MarkViewedRequest(@JsonProperty("device_id") String deviceId,
                                    @JsonProperty("timestamp") String timestamp,
                                    @JsonProperty("artifact_reference") String artifactReference) {}

    /** GET /api/events?device=&limit= - newest first. */
    @GetMapping
    public ResponseEntity<List<DeviceEvent>> events(@RequestParam(value = "device", required = false) String device,
                                                    @RequestParam(value = "limit", defaultValue = "100") int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
        return ResponseEntity.ok(cache.forDevice(device == null || device.isBlank() ? null : device, limit));
    }

    /**
     * POST /api/events/viewed - mark one event viewed. The cache and counts change
     * immediately; the store update goes through the batch writer.
     */
    @PostMapping("/viewed")
    public ResponseEntity<DeviceEvent> markViewed(@RequestBody MarkViewedRequest request) {
        if (request == null || request.deviceId() == null || request.timestamp() == null
                || request.artifactReference() == null) {
            throw new IllegalArgumentException("device_id, timestamp and artifact_reference are required");
        }
        DeviceEvent updated = cache.markViewed(request.deviceId(), request.timestamp(), request.artifactReference())
                .orElseThrow(() -> new NoSuchElementException("No event " + request.deviceId() + " @ "
                        + request.timestamp()));
        log.info("[events] ✓ marked viewed {}", updated);
        writer.queueMarkViewed(updated);
        refresher.requestRefresh();
        return ResponseEntity.ok(updated);
    }
}
