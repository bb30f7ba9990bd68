/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.gateway;

import com.camlink.common.model.BrokerConfig;
import com.camlink.common.model.StatusUpdate;
import com.camlink.common.util.JsonUtil;
import com.camlink.messaging.config.MessagingFactory;
import com.camlink.messaging.core.DataPublisher;
import com.camlink.messaging.core.DataSubscriber;
import com.camlink.messaging.core.MessageEnvelope;
import com.camlink.server.ingestion.InboundSink;
import com.camlink.server.presentation.StatusObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Bridges the broker and the ingestion pipeline.
 *
 * <p>Subscribes to camera events, status and alerts plus the control topic and
 * hands every delivery straight to the {@link InboundSink}. As a
 * {@link StatusObserver} it republishes session status to
 * {@code <prefix>/status/<device>} as {@code {"status": ..., "timestamp": <epoch seconds>}}.</p>
 */
public class PubSubGateway implements StatusObserver {

    private static final Logger log = LoggerFactory.getLogger(PubSubGateway.class);

    public static final String DEFAULT_TOPIC_PREFIX = "rtsp_client";

    private final BrokerConfig brokerConfig;
    private final String topicPrefix;
    private final InboundSink sink;
    private final StatusObserver status;
    private final boolean publishStatus;
    private final Function<BrokerConfig, DataSubscriber> subscriberFactory;
    private final Function<BrokerConfig, DataPublisher> publisherFactory;

    private volatile DataSubscriber subscriber;
    private volatile DataPublisher publisher;

    public PubSubGateway(BrokerConfig brokerConfig, String topicPrefix, InboundSink sink,
                         StatusObserver status, boolean publishStatus) {
        this(brokerConfig, topicPrefix, sink, status, publishStatus,
                MessagingFactory::createSubscriber, MessagingFactory::createPublisher);
    }

    PubSubGateway(BrokerConfig brokerConfig, String topicPrefix, InboundSink sink, StatusObserver status,
                  boolean publishStatus, Function<BrokerConfig, DataSubscriber> subscriberFactory,
                  Function<BrokerConfig, DataPublisher> publisherFactory) {
        this.brokerConfig = brokerConfig;
        this.topicPrefix = topicPrefix;
        this.sink = sink;
        this.status = status;
        this.publishStatus = publishStatus;
        this.subscriberFactory = subscriberFactory;
        this.publisherFactory = publisherFactory;
    }

    public List<String> subscriptions() {
        return List.of("camera/+/events", "camera/+/status", "camera/+/alert", topicPrefix + "/control/+");
    }

    public synchronized void connect() {
        if (subscriber != null) {
            log.warn("Pub/sub gateway already connected");
            return;
        }
        Map<String, Object> props = brokerConfig.toConnectionProps();

        DataSubscriber sub = subscriberFactory.apply(brokerConfig);
        sub.setConnectionLossListener((brokerId, cause) -> status.onStatus(new StatusUpdate(null,
                "Broker connection lost: " + (cause != null ? cause.getMessage() : "unknown"),
                false, StatusUpdate.Source.TRANSPORT, Instant.now())));
        sub.initialize(props);
        for (String filter : subscriptions()) {
            sub.subscribe(filter, this::onMessage);
        }
        sub.start();
        subscriber = sub;

        if (publishStatus) {
            DataPublisher pub = publisherFactory.apply(brokerConfig);
            pub.initialize(props);
            publisher = pub;
        }
        log.info("Pub/sub gateway connected to [{}] {} {} ({} subscriptions)", brokerConfig.getBrokerId(),
                brokerConfig.getBrokerType(),
                brokerConfig.getConnectionUri() != null ? brokerConfig.getConnectionUri() : "(in-process)",
                subscriptions().size());
    }

    private void onMessage(MessageEnvelope envelope) {
        sink.enqueue(envelope.getPayload(), envelope.getTopic());
    }

    @Override
    public void onStatus(StatusUpdate update) {
        DataPublisher pub = publisher;
        if (update.source() != StatusUpdate.Source.SESSION || update.deviceId() == null
                || pub == null || !pub.isConnected()) {
            return;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", update.text());
        body.put("timestamp", update.timestamp().getEpochSecond());
        String topic = topicPrefix + "/status/" + update.deviceId();
        pub.publish(topic, MessageEnvelope.ofText(topic, JsonUtil.toJson(body)))
                .whenComplete((v, ex) -> {
                    if (ex != null) log.warn("Status publish to {} failed: {}", topic, ex.getMessage());
                });
    }

    public synchronized void disconnect() {
        if (subscriber != null) {
            subscriber.close();
            subscriber = null;
        }
        if (publisher != null) {
            publisher.close();
            publisher = null;
        }
        log.info("Pub/sub gateway disconnected");
    }

    public boolean isConnected() {
        DataSubscriber sub = subscriber;
        return sub != null && sub.isConnected();
    }

    public Map<String, Object> stats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("broker_id", brokerConfig.getBrokerId());
        stats.put("broker_type", brokerConfig.getBrokerType());
        stats.put("connected", isConnected());
        DataSubscriber sub = subscriber;
        if (sub != null) stats.put("subscriber", sub.getStats());
        DataPublisher pub = publisher;
        if (pub != null) stats.put("publisher", pub.getStats());
        return stats;
    }

    public String getTopicPrefix() { return topicPrefix; }
}
