/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.messaging.loopback;

import com.camlink.messaging.core.AbstractPublisher;
import com.camlink.messaging.core.ConnectionState;
import com.camlink.messaging.core.MessageEnvelope;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Publisher for an in-process {@link LoopbackBroker}. The returned future
 * completes once the message has been handed to every attached subscriber.
 */
public class LoopbackDataPublisher extends AbstractPublisher {

    private LoopbackBroker broker;

    @Override
    protected void doConnect() {
        broker = LoopbackBroker.named(brokerId);
        state = ConnectionState.CONNECTED;
        log.info("Loopback publisher connected to broker [{}]", brokerId);
    }

    @Override
    protected CompletableFuture<Void> doPublish(String topic, MessageEnvelope envelope) {
        MessageEnvelope copy = new MessageEnvelope(topic, envelope.getPayload());
        if (envelope.getMessageId() != null) copy.setMessageId(envelope.getMessageId());
        copy.setHeaders(envelope.getHeaders());
        Future<?> delivered = broker.publish(copy);
        return CompletableFuture.runAsync(() -> {
            try {
                delivered.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CompletionException(e);
            } catch (ExecutionException e) {
                throw new CompletionException(e.getCause());
            }
        });
    }

    @Override
    protected void doDisconnect() {
        broker = null;
    }
}
