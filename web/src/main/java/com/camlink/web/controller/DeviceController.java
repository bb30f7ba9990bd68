/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.web.controller;

import com.camlink.common.model.CameraConfig;
import com.camlink.common.model.DeviceCounts;
import com.camlink.server.readmodel.ReadModel;
import com.camlink.server.session.CameraCatalog;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cameras with their read-model counts. Devices that only appear in events
 * (not configured for streaming) are listed too.
 */
@RestController
@RequestMapping("/api/devices")
public class DeviceController {

    private final CameraCatalog catalog;
    private final ReadModel readModel;

    public DeviceController(CameraCatalog catalog, ReadModel readModel) {
        this.catalog = catalog;
        this.readModel = readModel;
    }

    /** GET /api/devices */
    @GetMapping
    public ResponseEntity<List<Map<String, Object>>> devices() {
        Map<String, DeviceCounts> counts = readModel.allCounts();
        List<Map<String, Object>> result = new ArrayList<>();
        for (CameraConfig camera : catalog.all()) {
            result.add(view(camera.getId(), camera.getName(), true,
                    counts.getOrDefault(camera.getId(), DeviceCounts.empty(camera.getId()))));
        }
        counts.forEach((deviceId, c) -> {
            if (!catalog.contains(deviceId)) result.add(view(deviceId, deviceId, false, c));
        });
        return ResponseEntity.ok(result);
    }

    /** GET /api/devices/{id}/counts - zeros for a device with no events. */
    @GetMapping("/{id}/counts")
    public ResponseEntity<DeviceCounts> counts(@PathVariable("id") String id) {
        return ResponseEntity.ok(readModel.counts(id));
    }

    private static Map<String, Object> view(String id, String name, boolean streamable, DeviceCounts counts) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("device_id", id);
        m.put("name", name);
        m.put("streamable", streamable);
        m.put("unviewed_count", counts.unviewedCount());
        m.put("last_24h_count", counts.last24hCount());
        return m;
    }
}
