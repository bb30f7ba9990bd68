/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.session;

import com.camlink.common.exception.ConnectionAttemptException;
import com.camlink.common.model.CandidateStrategy;
import com.camlink.common.model.StatusUpdate;
import com.camlink.server.metrics.MetricsService;
import com.camlink.server.presentation.StatusObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Owns the single stream session.
 *
 * <p>{@link #connect(String)} tears down any existing session and then tries the
 * device's candidates in order until one becomes active. Per-candidate failures
 * are only logged; observers see one "Connection failed" when all are exhausted.
 * Asynchronous errors from the active connection are marshaled onto
 * {@code controlContext}; errors from a connection that is no longer active are
 * ignored.</p>
 *
 * <p>Not thread-safe: every method must be called from the controlling context.</p>
 */
public class ConnectionSessionManager {

    private static final Logger log = LoggerFactory.getLogger(ConnectionSessionManager.class);

    private final CameraCatalog catalog;
    private final ConnectionFactory factory;
    private final StatusObserver status;
    private final Executor controlContext;
    private final MetricsService metrics;

    private volatile Session session;
    private volatile SessionState state = SessionState.IDLE;
    private volatile int tryingIndex = -1;
    private volatile Connection attempting;
    private volatile String attemptError;

    public ConnectionSessionManager(CameraCatalog catalog, ConnectionFactory factory, StatusObserver status,
                                    Executor controlContext, MetricsService metrics) {
        this.catalog = catalog;
        this.factory = factory;
        this.status = status;
        this.controlContext = controlContext;
        this.metrics = metrics;
    }

    /** @return true when a candidate became active; false leaves no session installed */
    public boolean connect(String deviceId) {
        disconnect();
        if (!catalog.contains(deviceId)) {
            log.warn("Connect requested for unknown camera '{}'", deviceId);
            report(deviceId, "Unknown camera: " + deviceId, false);
            return false;
        }
        List<CandidateStrategy> candidates = catalog.candidatesFor(deviceId);
        if (candidates.isEmpty()) {
            log.warn("Camera '{}' has no connection strategies", deviceId);
            report(deviceId, "No connection strategies for " + catalog.displayName(deviceId), false);
            return false;
        }
        return tryCandidates(deviceId, candidates);
    }

    /** Connect the built-in test pattern source. */
    public boolean connectTestPattern() {
        return connect(CameraCatalog.TEST_PATTERN_ID);
    }

    private boolean tryCandidates(String deviceId, List<CandidateStrategy> candidates) {
        String name = catalog.displayName(deviceId);
        report(deviceId, "Connecting to " + name + "...", false);

        for (int i = 0; i < candidates.size(); i++) {
            CandidateStrategy candidate = candidates.get(i);
            state = SessionState.TRYING;
            tryingIndex = i;
            log.info("[session] trying {} candidate {}/{}: {}", deviceId, i + 1, candidates.size(),
                    candidate.pipeline());

            Connection connection = null;
            DisplaySurface surface = null;
            try {
                connection = factory.create(deviceId, candidate);
                attempting = connection;
                attemptError = null;
                connection.setErrorListener((src, message, fatal) ->
                        controlContext.execute(() -> onConnectionError(src, message, fatal)));
                connection.setReady();
                surface = surfaceOf(connection);
                connection.setActive();
                if (attemptError != null) {
                    throw new ConnectionAttemptException("failed during activation: " + attemptError);
                }
            } catch (RuntimeException e) {
                metrics.recordConnectionAttempt(false);
                log.warn("[session] ✗ candidate {}/{} for {} failed: {}", i + 1, candidates.size(),
                        deviceId, e.getMessage());
                if (surface != null) surface.release();
                if (connection != null) stopQuietly(connection);
                continue;
            } finally {
                attempting = null;
            }

            Session installed = new Session(deviceId, i, candidate, connection, surface, Instant.now());
            session = installed;
            state = SessionState.ACTIVE;
            tryingIndex = -1;
            metrics.recordConnectionAttempt(true);
            log.info("[session] ✓ {} active with candidate {}/{}{}", deviceId, i + 1, candidates.size(),
                    surface.isPlaceholder() ? " (external window)" : "");
            report(deviceId, "Connected to " + name + " (strategy " + (i + 1) + "/" + candidates.size() + ")", true);
            return true;
        }

        state = SessionState.IDLE;
        tryingIndex = -1;
        log.error("[session] ✗ all {} candidate(s) failed for {}", candidates.size(), deviceId);
        report(deviceId, "Connection failed", false);
        return false;
    }

    private DisplaySurface surfaceOf(Connection connection) {
        try {
            return connection.extractDisplaySurface().orElseGet(PlaceholderSurface::new);
        } catch (RuntimeException e) {
            log.debug("[session] no display surface from {}: {}", connection.describe(), e.getMessage());
            return new PlaceholderSurface();
        }
    }

    /** Stop the active session, if any. */
    public void disconnect() {
        Session current = session;
        if (current == null) return;
        stopQuietly(current.connection());
        current.surface().release();
        session = null;
        state = SessionState.IDLE;
        log.info("[session] {} disconnected", current.deviceId());
        report(current.deviceId(), "Disconnected", false);
    }

    void onConnectionError(Connection source, String message, boolean fatal) {
        Session current = session;
        if (current == null || current.connection() != source) {
            if (fatal && source == attempting) {
                attemptError = message;
                return;
            }
            log.debug("[session] ignoring error from inactive connection: {}", message);
            return;
        }
        if (!fatal) {
            report(current.deviceId(), message, true);
            return;
        }
        log.error("[session] ✗ {} lost: {}", current.deviceId(), message);
        stopQuietly(source);
        current.surface().release();
        session = null;
        state = SessionState.IDLE;
        report(current.deviceId(), "Connection lost: " + message, false);
    }

    private void stopQuietly(Connection connection) {
        try {
            connection.stop();
        } catch (RuntimeException e) {
            log.warn("[session] error stopping {}: {}", connection.describe(), e.getMessage());
        }
    }

    private void report(String deviceId, String text, boolean connected) {
        status.onStatus(StatusUpdate.session(deviceId, text, connected));
    }

    public Optional<Session> currentSession() { return Optional.ofNullable(session); }

    public SessionState state() { return state; }

    /** Index of the candidate being tried, or -1 outside TRYING. */
    public int tryingIndex() { return tryingIndex; }

    public boolean isConnected() { return state == SessionState.ACTIVE && session != null; }

    public CameraCatalog catalog() { return catalog; }
}
