/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.messaging.core;

/**
 * Callback for messages arriving on a subscribed topic filter.
 * Invoked on the client's delivery thread, so implementations must return quickly.
 */
@FunctionalInterface
public interface MessageListener {
    void onMessage(MessageEnvelope envelope);
}
