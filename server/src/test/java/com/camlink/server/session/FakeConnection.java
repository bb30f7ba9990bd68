/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.session;

import com.camlink.common.exception.ConnectionAttemptException;
import com.camlink.common.model.CandidateStrategy;

import java.util.Optional;

/**
 * Scripted connection: fails at construction, ready or active when told to,
 * or dies while being activated. Records stop calls.
 */
class FakeConnection implements Connection {

    enum Outcome { OK, FAIL_CREATE, FAIL_READY, FAIL_ACTIVE, EXIT_WHILE_ACTIVATING }

    final String deviceId;
    final CandidateStrategy strategy;
    final Outcome outcome;
    final SinkSurface surface;
    ConnectionErrorListener listener;
    int stopCalls;

    FakeConnection(String deviceId, CandidateStrategy strategy, Outcome outcome) {
        this.deviceId = deviceId;
        this.strategy = strategy;
        this.outcome = outcome;
        this.surface = strategy.sinkName() == null ? null : new SinkSurface(strategy.sinkName());
    }

    @Override
    public void setReady() {
        if (outcome == Outcome.FAIL_READY) throw new ConnectionAttemptException("not ready: " + strategy.pipeline());
    }

    @Override
    public void setActive() {
        if (outcome == Outcome.FAIL_ACTIVE) throw new ConnectionAttemptException("not active: " + strategy.pipeline());
        if (outcome == Outcome.EXIT_WHILE_ACTIVATING) fireError("pipeline exited with code 1", true);
    }

    @Override
    public Optional<DisplaySurface> extractDisplaySurface() {
        return Optional.ofNullable(surface);
    }

    @Override
    public void setErrorListener(ConnectionErrorListener listener) {
        this.listener = listener;
    }

    @Override
    public void stop() {
        stopCalls++;
    }

    @Override
    public String describe() {
        return deviceId + ":" + strategy.pipeline();
    }

    void fireError(String message, boolean fatal) {
        listener.onError(this, message, fatal);
    }
}
