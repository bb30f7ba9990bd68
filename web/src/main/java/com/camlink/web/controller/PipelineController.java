/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.web.controller;

import com.camlink.server.cache.EventCache;
import com.camlink.server.gateway.PubSubGateway;
import com.camlink.server.ingestion.IngestionWorker;
import com.camlink.server.persistence.BatchWriter;
import com.camlink.server.readmodel.ReadModelRefresher;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/pipeline")
public class PipelineController {

    private final IngestionWorker ingestion;
    private final BatchWriter writer;
    private final PubSubGateway gateway;
    private final EventCache cache;
    private final ReadModelRefresher refresher;

    public PipelineController(IngestionWorker ingestion, BatchWriter writer, PubSubGateway gateway,
                              EventCache cache, ReadModelRefresher refresher) {
        this.ingestion = ingestion;
        this.writer = writer;
        this.gateway = gateway;
        this.cache = cache;
        this.refresher = refresher;
    }

    /** GET /api/pipeline/stats */
    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> stats() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ingestion", ingestion.getStats());
        body.put("ingestion_running", ingestion.isRunning());
        body.put("writer", writer.getStats());
        body.put("writer_running", writer.isRunning());
        body.put("gateway", gateway.stats());
        body.put("cached_events", cache.size());
        body.put("read_model_refreshes", Map.of(
                "requested", refresher.requestedCount(),
                "executed", refresher.executedCount()));
        return ResponseEntity.ok(body);
    }
}
