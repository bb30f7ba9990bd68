/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.messaging.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Base publisher with reconnection logic and statistics tracking.
 * Subclasses implement doPublish(), doConnect() and doDisconnect().
 */
public abstract class AbstractPublisher implements DataPublisher {

    protected final Logger log = LoggerFactory.getLogger(getClass());
    protected volatile ConnectionState state = ConnectionState.DISCONNECTED;
    protected Map<String, Object> config = Map.of();
    protected String brokerId = "default";
    protected int reconnectIntervalSeconds = 10;

    private final AtomicLong sentCount = new AtomicLong();
    private final AtomicLong errorCount = new AtomicLong();
    private final AtomicLong bytesSent = new AtomicLong();
    private ScheduledExecutorService reconnectExecutor;

    @Override
    public void initialize(Map<String, Object> config) {
        this.config = config;
        this.brokerId = String.valueOf(config.getOrDefault("broker_id", "default"));
        this.reconnectIntervalSeconds = AbstractSubscriber.intValue(config, "reconnect_interval_seconds", 10);
        state = ConnectionState.CONNECTING;
        doConnect();
    }

    @Override
    public CompletableFuture<Void> publish(String topic, MessageEnvelope envelope) {
        if (state != ConnectionState.CONNECTED) {
            errorCount.incrementAndGet();
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Publisher [" + brokerId + "] not connected (" + state + ")"));
        }
        return doPublish(topic, envelope).thenRun(() -> {
            sentCount.incrementAndGet();
            bytesSent.addAndGet(envelope.getPayloadSize());
        }).exceptionally(ex -> {
            errorCount.incrementAndGet();
            if (state == ConnectionState.CONNECTED) scheduleReconnect();
            throw ex instanceof CompletionException ce ? ce : new CompletionException(ex);
        });
    }

    @Override
    public boolean isConnected() { return state == ConnectionState.CONNECTED; }

    @Override
    public PublisherStats getStats() {
        return new PublisherStats(sentCount.get(), errorCount.get(), bytesSent.get(), isConnected());
    }

    @Override
    public void close() {
        if (state == ConnectionState.CLOSED) return;
        state = ConnectionState.CLOSING;
        if (reconnectExecutor != null) reconnectExecutor.shutdownNow();
        doDisconnect();
        state = ConnectionState.CLOSED;
        log.info("Publisher [{}] closed", brokerId);
    }

    protected synchronized void scheduleReconnect() {
        if (state == ConnectionState.CLOSING || state == ConnectionState.CLOSED) return;
        state = ConnectionState.RECONNECTING;
        if (reconnectExecutor == null || reconnectExecutor.isShutdown()) {
            reconnectExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "pub-reconnect-" + brokerId);
                t.setDaemon(true);
                return t;
            });
        }
        reconnectExecutor.schedule(() -> {
            log.info("Attempting publisher reconnection...");
            doDisconnect();
            doConnect();
            if (state == ConnectionState.CONNECTED) {
                log.info("Publisher reconnected successfully");
            }
        }, reconnectIntervalSeconds, TimeUnit.SECONDS);
    }

    protected abstract CompletableFuture<Void> doPublish(String topic, MessageEnvelope envelope);

    /** Connect and set {@link #state} to CONNECTED, or call {@link #scheduleReconnect()} on failure. */
    protected abstract void doConnect();
    protected abstract void doDisconnect();
}
