/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.messaging.loopback;

import com.camlink.messaging.core.MessageEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * In-process broker shared by the loopback publisher and subscriber of the
 * same broker id. Messages are delivered on one delivery thread per broker,
 * in publish order, the way a network client's callback thread would.
 */
public final class LoopbackBroker {

    private static final Logger log = LoggerFactory.getLogger(LoopbackBroker.class);
    private static final Map<String, LoopbackBroker> BROKERS = new ConcurrentHashMap<>();

    private final String brokerId;
    private final Set<LoopbackDataSubscriber> subscribers = new CopyOnWriteArraySet<>();
    private final ExecutorService delivery;

    private LoopbackBroker(String brokerId) {
        this.brokerId = brokerId;
        this.delivery = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "loopback-delivery-" + brokerId);
            t.setDaemon(true);
            return t;
        });
    }

    public static LoopbackBroker named(String brokerId) {
        return BROKERS.computeIfAbsent(brokerId, LoopbackBroker::new);
    }

    /** Drops the broker and its delivery thread; attached clients see a connection loss. */
    public static void destroy(String brokerId) {
        LoopbackBroker broker = BROKERS.remove(brokerId);
        if (broker != null) {
            broker.dropConnections(new IllegalStateException("Loopback broker " + brokerId + " destroyed"));
            broker.delivery.shutdownNow();
        }
    }

    public String getBrokerId() { return brokerId; }

    void attach(LoopbackDataSubscriber subscriber) { subscribers.add(subscriber); }

    void detach(LoopbackDataSubscriber subscriber) { subscribers.remove(subscriber); }

    Future<?> publish(MessageEnvelope envelope) {
        return delivery.submit(() -> {
            for (LoopbackDataSubscriber s : subscribers) {
                s.deliver(envelope);
            }
        });
    }

    /** Simulates the network dropping every attached client. */
    public void dropConnections(Throwable cause) {
        log.warn("Loopback broker [{}] dropping {} connection(s)", brokerId, subscribers.size());
        for (LoopbackDataSubscriber s : subscribers) {
            subscribers.remove(s);
            s.lost(cause);
        }
    }
}
