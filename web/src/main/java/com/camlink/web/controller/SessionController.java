/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.web.controller;

import com.camlink.server.presentation.StatusBoard;
import com.camlink.server.session.CameraCatalog;
import com.camlink.server.session.Session;
import com.camlink.server.session.SessionCommandDispatcher;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Stream session commands. Every command runs on the presentation loop; the
 * response completes when the command has.
 */
@RestController
@RequestMapping("/api/session")
public class SessionController {

    private final SessionCommandDispatcher sessions;
    private final CameraCatalog catalog;
    private final StatusBoard statusBoard;

    public SessionController(SessionCommandDispatcher sessions, CameraCatalog catalog, StatusBoard statusBoard) {
        this.sessions = sessions;
        this.catalog = catalog;
        this.statusBoard = statusBoard;
    }

    /** POST /api/session/connect/{device} - 502 when every candidate failed. */
    @PostMapping("/connect/{device}")
    public CompletableFuture<ResponseEntity<Map<String, Object>>> connect(@PathVariable("device") String device) {
        if (!catalog.contains(device)) {
            throw new NoSuchElementException("Unknown camera: " + device);
        }
        return sessions.connect(device).thenCompose(this::result);
    }

    /** POST /api/session/test-pattern */
    @PostMapping("/test-pattern")
    public CompletableFuture<ResponseEntity<Map<String, Object>>> testPattern() {
        return sessions.connectTestPattern().thenCompose(this::result);
    }

    /** POST /api/session/disconnect */
    @PostMapping("/disconnect")
    public CompletableFuture<ResponseEntity<Map<String, Object>>> disconnect() {
        return sessions.disconnect().thenApply(v -> ResponseEntity.ok(Map.<String, Object>of("connected", false)));
    }

    /** GET /api/session */
    @GetMapping
    public CompletableFuture<ResponseEntity<Map<String, Object>>> current() {
        return sessions.currentSession().thenApply(s -> ResponseEntity.ok(view(s)));
    }

    private CompletableFuture<ResponseEntity<Map<String, Object>>> result(boolean connected) {
        return sessions.currentSession().thenApply(s -> {
            Map<String, Object> body = view(s);
            if (statusBoard.latestSession() != null) body.put("status", statusBoard.latestSession().text());
            return ResponseEntity.status(connected ? HttpStatus.OK : HttpStatus.BAD_GATEWAY).body(body);
        });
    }

    private Map<String, Object> view(Optional<Session> session) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("connected", session.isPresent());
        session.ifPresent(s -> {
            m.put("device_id", s.deviceId());
            m.put("name", catalog.displayName(s.deviceId()));
            m.put("strategy_index", s.strategyIndex());
            m.put("pipeline", s.strategy().pipeline());
            m.put("surface", s.surface().name());
            m.put("external_window", s.surface().isPlaceholder());
            m.put("connected_at", s.connectedAt().toString());
        });
        return m;
    }
}
