/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.messaging.activemq;

import com.camlink.messaging.core.AbstractPublisher;
import com.camlink.messaging.core.ConnectionState;
import com.camlink.messaging.core.MessageEnvelope;
import jakarta.jms.BytesMessage;
import jakarta.jms.Connection;
import jakarta.jms.DeliveryMode;
import jakarta.jms.JMSException;
import jakarta.jms.MessageProducer;
import jakarta.jms.Session;
import org.apache.activemq.ActiveMQConnectionFactory;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * ActiveMQ-based DataPublisher using JMS. Messages are sent PERSISTENT, which
 * makes the send synchronous until the broker acknowledges it.
 * A single sender thread owns the JMS session.
 */
public class ActiveMQDataPublisher extends AbstractPublisher {

    private Connection connection;
    private Session session;
    private final ExecutorService sender = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "activemq-publisher");
        t.setDaemon(true);
        return t;
    });

    @Override
    protected void doConnect() {
        String brokerUrl = (String) config.getOrDefault("broker_url", "tcp://localhost:61616");
        try {
            ActiveMQConnectionFactory factory = new ActiveMQConnectionFactory(brokerUrl);
            String username = (String) config.get("username");
            String password = (String) config.get("password");
            connection = username != null
                    ? factory.createConnection(username, password)
                    : factory.createConnection();
            connection.setExceptionListener(ex -> {
                log.error("ActiveMQ producer connection error: {}", ex.getMessage());
                scheduleReconnect();
            });
            connection.start();
            session = connection.createSession(false, Session.AUTO_ACKNOWLEDGE);
            state = ConnectionState.CONNECTED;
            log.info("ActiveMQ producer connected to {}", brokerUrl);
        } catch (JMSException e) {
            log.error("Failed to connect ActiveMQ producer to {}: {}", brokerUrl, e.getMessage());
            scheduleReconnect();
        }
    }

    @Override
    protected CompletableFuture<Void> doPublish(String topic, MessageEnvelope envelope) {
        return CompletableFuture.runAsync(() -> {
            try {
                MessageProducer producer = session.createProducer(
                        session.createTopic(TopicNames.toDestination(topic)));
                try {
                    producer.setDeliveryMode(DeliveryMode.PERSISTENT);
                    BytesMessage message = session.createBytesMessage();
                    message.writeBytes(envelope.getPayload() == null ? new byte[0] : envelope.getPayload());
                    message.setJMSCorrelationID(envelope.getMessageId());
                    for (Map.Entry<String, String> h : envelope.getHeaders().entrySet()) {
                        message.setStringProperty(h.getKey(), h.getValue());
                    }
                    producer.send(message);
                } finally {
                    producer.close();
                }
            } catch (JMSException e) {
                throw new CompletionException("ActiveMQ publish to " + topic + " failed", e);
            }
        }, sender);
    }

    @Override
    protected void doDisconnect() {
        try {
            if (session != null) session.close();
            if (connection != null) connection.close();
        } catch (JMSException e) {
            log.warn("Error closing ActiveMQ connection", e);
        } finally {
            session = null;
            connection = null;
        }
    }

    @Override
    public void close() {
        super.close();
        sender.shutdownNow();
    }
}
