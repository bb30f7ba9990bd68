/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.messaging.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Base subscriber with reconnection logic and topic-filter dispatch.
 * Subclasses implement doConnect(), doDisconnect(), doSubscribe(), doUnsubscribe()
 * and hand every arriving message to {@link #dispatch(MessageEnvelope)}.
 *
 * There is no internal queue: listeners are called directly on the delivery
 * thread and are expected to hand work off without blocking.
 */
public abstract class AbstractSubscriber implements DataSubscriber {

    protected final Logger log = LoggerFactory.getLogger(getClass());
    protected volatile ConnectionState state = ConnectionState.DISCONNECTED;
    protected Map<String, Object> config = Map.of();
    protected String brokerId = "default";
    protected int reconnectIntervalSeconds = 10;

    protected final Map<String, MessageListener> listeners = new ConcurrentHashMap<>();
    private final AtomicLong receivedCount = new AtomicLong();
    private final AtomicLong erroredCount = new AtomicLong();
    private volatile ConnectionLossListener connectionLossListener;
    private volatile boolean started;
    private ScheduledExecutorService reconnectExecutor;

    @Override
    public void initialize(Map<String, Object> config) {
        this.config = config;
        this.brokerId = String.valueOf(config.getOrDefault("broker_id", "default"));
        this.reconnectIntervalSeconds = intValue(config, "reconnect_interval_seconds", 10);
        state = ConnectionState.CONNECTING;
        doConnect();
    }

    @Override
    public void subscribe(String topicFilter, MessageListener listener) {
        listeners.put(topicFilter, listener);
        if (started && state == ConnectionState.CONNECTED) {
            doSubscribe(topicFilter);
        }
        log.info("Subscribed to: {}", topicFilter);
    }

    @Override
    public void unsubscribe(String topicFilter) {
        if (listeners.remove(topicFilter) != null) {
            doUnsubscribe(topicFilter);
            log.info("Unsubscribed from: {}", topicFilter);
        }
    }

    @Override
    public Set<String> getSubscriptions() { return Set.copyOf(listeners.keySet()); }

    @Override
    public void start() {
        started = true;
        if (state == ConnectionState.CONNECTED) {
            for (String filter : listeners.keySet()) {
                doSubscribe(filter);
            }
        }
        log.info("Subscriber [{}] started with {} subscriptions", brokerId, listeners.size());
    }

    @Override
    public void setConnectionLossListener(ConnectionLossListener listener) {
        this.connectionLossListener = listener;
    }

    @Override
    public SubscriberStats getStats() {
        return new SubscriberStats(receivedCount.get(), erroredCount.get(), isConnected());
    }

    @Override
    public boolean isConnected() { return state == ConnectionState.CONNECTED; }

    @Override
    public void close() {
        if (state == ConnectionState.CLOSED) return;
        state = ConnectionState.CLOSING;
        started = false;
        if (reconnectExecutor != null) reconnectExecutor.shutdownNow();
        doDisconnect();
        state = ConnectionState.CLOSED;
        log.info("Subscriber [{}] closed", brokerId);
    }

    /** Called by subclasses on the delivery thread for each message from the broker. */
    protected void dispatch(MessageEnvelope envelope) {
        receivedCount.incrementAndGet();
        boolean delivered = false;
        for (Map.Entry<String, MessageListener> entry : listeners.entrySet()) {
            if (!TopicFilter.matches(entry.getKey(), envelope.getTopic())) continue;
            delivered = true;
            try {
                entry.getValue().onMessage(envelope);
            } catch (RuntimeException e) {
                erroredCount.incrementAndGet();
                log.error("Listener error on topic '{}'", envelope.getTopic(), e);
            }
        }
        if (!delivered) {
            log.debug("No subscription matches topic '{}'", envelope.getTopic());
        }
    }

    /** Called by subclasses when an established connection drops. */
    protected void connectionLost(Throwable cause) {
        if (state == ConnectionState.CLOSING || state == ConnectionState.CLOSED) return;
        log.warn("Subscriber [{}] lost connection: {}", brokerId, cause == null ? "unknown" : cause.getMessage());
        ConnectionLossListener l = connectionLossListener;
        if (l != null) {
            try {
                l.onConnectionLost(brokerId, cause);
            } catch (RuntimeException e) {
                log.error("Connection-loss listener failed", e);
            }
        }
        scheduleReconnect();
    }

    protected synchronized void scheduleReconnect() {
        if (state == ConnectionState.CLOSING || state == ConnectionState.CLOSED) return;
        state = ConnectionState.RECONNECTING;
        if (reconnectExecutor == null || reconnectExecutor.isShutdown()) {
            reconnectExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "sub-reconnect-" + brokerId);
                t.setDaemon(true);
                return t;
            });
        }
        reconnectExecutor.schedule(() -> {
            log.info("Attempting subscriber reconnection...");
            doDisconnect();
            doConnect();
            if (state == ConnectionState.CONNECTED && started) {
                for (String filter : listeners.keySet()) doSubscribe(filter);
                log.info("Subscriber reconnected successfully");
            }
        }, reconnectIntervalSeconds, TimeUnit.SECONDS);
    }

    protected static int intValue(Map<String, Object> config, String key, int defaultValue) {
        Object v = config.get(key);
        if (v instanceof Number n) return n.intValue();
        if (v != null) {
            try {
                return Integer.parseInt(v.toString().trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    /** Connect and set {@link #state} to CONNECTED, or call {@link #scheduleReconnect()} on failure. */
    protected abstract void doConnect();
    protected abstract void doDisconnect();
    protected abstract void doSubscribe(String topicFilter);
    protected abstract void doUnsubscribe(String topicFilter);
}
