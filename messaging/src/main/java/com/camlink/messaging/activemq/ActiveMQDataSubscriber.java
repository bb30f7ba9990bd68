/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.messaging.activemq;

import com.camlink.messaging.core.AbstractSubscriber;
import com.camlink.messaging.core.ConnectionState;
import com.camlink.messaging.core.MessageEnvelope;
import jakarta.jms.BytesMessage;
import jakarta.jms.Connection;
import jakarta.jms.Destination;
import jakarta.jms.JMSException;
import jakarta.jms.Message;
import jakarta.jms.MessageConsumer;
import jakarta.jms.Session;
import jakarta.jms.TextMessage;
import jakarta.jms.Topic;
import org.apache.activemq.ActiveMQConnectionFactory;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * ActiveMQ-based DataSubscriber using JMS MessageListener. Topic filters use
 * MQTT syntax and are mapped onto ActiveMQ wildcard destinations, so devices
 * publishing over the broker's MQTT connector are received unchanged.
 */
public class ActiveMQDataSubscriber extends AbstractSubscriber {

    private Connection connection;
    private Session session;
    private final Map<String, MessageConsumer> consumers = new ConcurrentHashMap<>();

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
            Object clientId = config.get("client_id");
            if (clientId != null) connection.setClientID(clientId + "-sub");
            connection.setExceptionListener(this::connectionLost);
            session = connection.createSession(false, Session.AUTO_ACKNOWLEDGE);
            connection.start();
            state = ConnectionState.CONNECTED;
            log.info("ActiveMQ subscriber connected to {}", brokerUrl);
        } catch (JMSException e) {
            log.error("Failed to connect ActiveMQ subscriber to {}: {}", brokerUrl, e.getMessage());
            scheduleReconnect();
        }
    }

    @Override
    protected void doSubscribe(String topicFilter) {
        try {
            Topic topic = session.createTopic(TopicNames.toDestination(topicFilter));
            MessageConsumer consumer = session.createConsumer(topic);
            consumer.setMessageListener(this::onJmsMessage);
            MessageConsumer previous = consumers.put(topicFilter, consumer);
            if (previous != null) closeQuietly(previous);
        } catch (JMSException e) {
            log.error("Failed to subscribe to {}", topicFilter, e);
        }
    }

    private void onJmsMessage(Message jmsMessage) {
        try {
            MessageEnvelope envelope = new MessageEnvelope(topicOf(jmsMessage), bodyOf(jmsMessage));
            if (jmsMessage.getJMSMessageID() != null) envelope.setMessageId(jmsMessage.getJMSMessageID());
            dispatch(envelope);
        } catch (JMSException e) {
            log.error("Error reading ActiveMQ message", e);
        }
    }

    private static String topicOf(Message message) throws JMSException {
        Destination dest = message.getJMSDestination();
        if (dest instanceof Topic t) return TopicNames.fromDestination(t.getTopicName());
        return String.valueOf(dest);
    }

    private static byte[] bodyOf(Message message) throws JMSException {
        if (message instanceof BytesMessage bytes) {
            byte[] body = new byte[(int) bytes.getBodyLength()];
            bytes.readBytes(body);
            return body;
        }
        if (message instanceof TextMessage text) {
            String s = text.getText();
            return s == null ? new byte[0] : s.getBytes(StandardCharsets.UTF_8);
        }
        return new byte[0];
    }

    @Override
    protected void doUnsubscribe(String topicFilter) {
        MessageConsumer consumer = consumers.remove(topicFilter);
        if (consumer != null) closeQuietly(consumer);
    }

    @Override
    protected void doDisconnect() {
        consumers.values().forEach(this::closeQuietly);
        consumers.clear();
        try {
            if (session != null) session.close();
            if (connection != null) connection.close();
        } catch (JMSException e) {
            log.warn("Error closing ActiveMQ subscriber connection", e);
        } finally {
            session = null;
            connection = null;
        }
    }

    private void closeQuietly(MessageConsumer consumer) {
        try {
            consumer.close();
        } catch (JMSException e) {
            log.warn("Error closing consumer", e);
        }
    }
}
