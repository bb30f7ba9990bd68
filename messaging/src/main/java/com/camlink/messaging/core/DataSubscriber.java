/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.messaging.core;

import java.util.Map;
import java.util.Set;

/**
 * Abstract subscriber for receiving messages from a broker.
 *
 * Subscriptions are MQTT-style topic filters; the envelope handed to the
 * listener always carries the concrete topic the message was published on.
 * Listeners run on the client's delivery thread.
 */
public interface DataSubscriber extends AutoCloseable {

    /** Initialize the subscriber with connection details and connect. */
    void initialize(Map<String, Object> config);

    /** Subscribe to a topic filter. Can be called before or after {@link #start()}. */
    void subscribe(String topicFilter, MessageListener listener);

    void unsubscribe(String topicFilter);

    Set<String> getSubscriptions();

    /** Start consuming messages. */
    void start();

    boolean isConnected();

    void setConnectionLossListener(ConnectionLossListener listener);

    SubscriberStats getStats();

    @Override
    void close();

    record SubscriberStats(long messagesReceived, long messagesErrored, boolean connected) {}
}
