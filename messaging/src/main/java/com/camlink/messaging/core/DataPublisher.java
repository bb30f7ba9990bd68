/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.messaging.core;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Abstract publisher for sending messages to a broker with acknowledged delivery.
 */
public interface DataPublisher extends AutoCloseable {

    /** Initialize the publisher with connection details and connect. */
    void initialize(Map<String, Object> config);

    /** Publish a single message. The future completes once the broker has accepted it. */
    CompletableFuture<Void> publish(String topic, MessageEnvelope envelope);

    boolean isConnected();

    PublisherStats getStats();

    @Override
    void close();

    record PublisherStats(long messagesSent, long messagesErrored, long bytesSent, boolean connected) {}
}
