/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.web.controller;

import com.camlink.server.gateway.PubSubGateway;
import com.camlink.server.presentation.StatusBoard;
import com.camlink.web.lifecycle.ShutdownOrchestrator;
import com.camlink.web.lifecycle.StartupOrchestrator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class StatusController {

    private final StatusBoard statusBoard;
    private final PubSubGateway gateway;
    private final StartupOrchestrator startup;
    private final ShutdownOrchestrator shutdown;

    public StatusController(StatusBoard statusBoard, PubSubGateway gateway,
                            StartupOrchestrator startup, ShutdownOrchestrator shutdown) {
        this.statusBoard = statusBoard;
        this.gateway = gateway;
        this.startup = startup;
        this.shutdown = shutdown;
    }

    /** GET /api/status - latest session status plus recent device and transport messages. */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ready", startup.isStartupComplete());
        body.put("connected", statusBoard.isConnected());
        body.put("broker_connected", gateway.isConnected());
        body.put("latest", statusBoard.latestSession());
        body.put("recent", statusBoard.recent());
        body.put("shutdown_state", shutdown.state());
        return ResponseEntity.ok(body);
    }

    /** POST /api/shutdown - teardown, then the process exits. */
    @PostMapping("/shutdown")
    public ResponseEntity<Map<String, Object>> shutdown() {
        boolean accepted = shutdown.requestShutdown();
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("status", accepted ? "shutting_down" : "already_requested"));
    }
}
