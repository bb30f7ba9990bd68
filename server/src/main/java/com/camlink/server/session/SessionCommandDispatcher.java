/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.session;

import com.camlink.server.ingestion.ControlCommand;
import com.camlink.server.ingestion.ControlCommandHandler;
import com.camlink.server.presentation.PresentationLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Posts session commands onto the presentation loop so the session manager is
 * only ever touched from that one thread. Used by REST handlers and by the
 * pub/sub control topic.
 */
public class SessionCommandDispatcher implements ControlCommandHandler {

    private static final Logger log = LoggerFactory.getLogger(SessionCommandDispatcher.class);

    private final ConnectionSessionManager manager;
    private final PresentationLoop loop;

    public SessionCommandDispatcher(ConnectionSessionManager manager, PresentationLoop loop) {
        this.manager = manager;
        this.loop = loop;
    }

    public CompletableFuture<Boolean> connect(String deviceId) {
        return loop.submit(() -> manager.connect(deviceId));
    }

    public CompletableFuture<Boolean> connectTestPattern() {
        return loop.submit(manager::connectTestPattern);
    }

    public CompletableFuture<Void> disconnect() {
        return loop.submit(() -> {
            manager.disconnect();
            return null;
        });
    }

    public CompletableFuture<Optional<Session>> currentSession() {
        return loop.submit(manager::currentSession);
    }

    @Override
    public void onCommand(ControlCommand command, String deviceId) {
        switch (command) {
            case CONNECT -> connect(deviceId).whenComplete((ok, ex) -> {
                if (ex != null) log.error("Control connect for {} failed", deviceId, ex);
            });
            case DISCONNECT -> disconnect();
            default -> log.info("Control command {} for {} not supported", command, deviceId);
        }
    }

    public ConnectionSessionManager manager() { return manager; }
}
