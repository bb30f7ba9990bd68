/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.messaging.config;

import com.camlink.common.model.BrokerConfig;
import com.camlink.messaging.activemq.ActiveMQDataPublisher;
import com.camlink.messaging.activemq.ActiveMQDataSubscriber;
import com.camlink.messaging.core.DataPublisher;
import com.camlink.messaging.core.DataSubscriber;
import com.camlink.messaging.loopback.LoopbackDataPublisher;
import com.camlink.messaging.loopback.LoopbackDataSubscriber;

/**
 * Factory to create DataPublisher and DataSubscriber instances based on BrokerConfig.
 * The returned clients are not yet initialized.
 */
public final class MessagingFactory {

    private MessagingFactory() {}

    public static DataPublisher createPublisher(BrokerConfig brokerConfig) {
        return switch (brokerConfig.getBrokerType()) {
            case ACTIVEMQ -> new ActiveMQDataPublisher();
            case LOOPBACK -> new LoopbackDataPublisher();
        };
    }

    public static DataSubscriber createSubscriber(BrokerConfig brokerConfig) {
        return switch (brokerConfig.getBrokerType()) {
            case ACTIVEMQ -> new ActiveMQDataSubscriber();
            case LOOPBACK -> new LoopbackDataSubscriber();
        };
    }
}
