/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.messaging.loopback;

import com.camlink.messaging.core.AbstractSubscriber;
import com.camlink.messaging.core.ConnectionState;
import com.camlink.messaging.core.MessageEnvelope;

/**
 * Subscriber attached to an in-process {@link LoopbackBroker}.
 * Used for local runs without a broker and for tests.
 */
public class LoopbackDataSubscriber extends AbstractSubscriber {

    private LoopbackBroker broker;

    @Override
    protected void doConnect() {
        broker = LoopbackBroker.named(brokerId);
        broker.attach(this);
        state = ConnectionState.CONNECTED;
        log.info("Loopback subscriber attached to broker [{}]", brokerId);
    }

    @Override
    protected void doDisconnect() {
        if (broker != null) broker.detach(this);
    }

    // Filtering happens in dispatch(); nothing to register with the broker.
    @Override
    protected void doSubscribe(String topicFilter) {}

    @Override
    protected void doUnsubscribe(String topicFilter) {}

    void deliver(MessageEnvelope envelope) {
        if (state == ConnectionState.CONNECTED) dispatch(envelope);
    }

    void lost(Throwable cause) {
        connectionLost(cause);
    }
}
