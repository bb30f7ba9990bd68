/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.ingestion;

import com.camlink.common.exception.MalformedEventException;
import com.camlink.common.model.DeviceEvent;
import com.camlink.common.model.StatusUpdate;
import com.camlink.common.util.JsonUtil;
import com.camlink.messaging.core.TopicFilter;
import com.camlink.server.cache.EventCache;
import com.camlink.server.metrics.MetricsService;
import com.camlink.server.persistence.BatchWriter;
import com.camlink.server.pipeline.BackgroundWorker;
import com.camlink.server.pipeline.WorkQueue;
import com.camlink.server.presentation.StatusObserver;
import com.camlink.server.readmodel.ReadModelRefresher;
import com.fasterxml.jackson.databind.JsonNode;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Consumes the ingestion queue filled by the pub/sub delivery thread.
 *
 * <p>{@link #enqueue(byte[], String)} only appends and signals. The worker pops
 * one message at a time and classifies it by topic:</p>
 * <ul>
 *   <li>EVENT: parsed, prepended to the cache, read-model refresh requested,
 *       handed to the batch writer. Malformed payloads are logged and dropped.</li>
 *   <li>STATUS / ALERT: forwarded as status text, not persisted.</li>
 *   <li>CONTROL: connect / disconnect for the device named by the last topic level.</li>
 *   <li>anything else: logged and dropped.</li>
 * </ul>
 * <p>The worker wakes every {@code wakeInterval} while idle to re-check the stop
 * flag. Messages still queued at stop are counted and discarded.</p>
 */
public class IngestionWorker extends BackgroundWorker<InboundMessage> implements InboundSink {

    public static final Duration DEFAULT_WAKE_INTERVAL = Duration.ofSeconds(5);

    private final EventCache cache;
    private final ReadModelRefresher refresher;
    private final BatchWriter writer;
    private final StatusObserver status;
    private final ControlCommandHandler controlHandler;
    private final MetricsService metrics;
    private final Duration wakeInterval;

    private final AtomicLong received = new AtomicLong();
    private final AtomicLong events = new AtomicLong();
    private final AtomicLong statuses = new AtomicLong();
    private final AtomicLong alerts = new AtomicLong();
    private final AtomicLong controls = new AtomicLong();
    private final AtomicLong malformed = new AtomicLong();
    private final AtomicLong unknown = new AtomicLong();
    private final AtomicLong discarded = new AtomicLong();

    public IngestionWorker(EventCache cache, ReadModelRefresher refresher, BatchWriter writer,
                           StatusObserver status, ControlCommandHandler controlHandler,
                           MetricsService metrics, Duration wakeInterval) {
        super("ingestion-worker", new WorkQueue<>());
        this.cache = cache;
        this.refresher = refresher;
        this.writer = writer;
        this.status = status;
        this.controlHandler = controlHandler;
        this.metrics = metrics;
        this.wakeInterval = wakeInterval;
        metrics.registerQueueDepth("ingestion", queue::size);
    }

    @Override
    public void enqueue(byte[] payload, String topic) {
        queue.put(new InboundMessage(payload, topic, Instant.now()));
    }

    @Override
    protected void pollOnce() throws InterruptedException {
        InboundMessage msg = queue.take(wakeInterval);
        if (msg == null) {
            log.debug("[ingest] idle wake: {} queued, {} received so far", queue.size(), received.get());
            return;
        }
        try {
            process(msg);
        } catch (RuntimeException e) {
            log.error("[ingest] ✗ unexpected error on topic '{}'", msg.topic(), e);
        }
    }

    void process(InboundMessage msg) {
        long n = received.incrementAndGet();
        TopicKind kind = TopicKind.classify(msg.topic());
        metrics.recordMessageReceived(kind.name().toLowerCase());
        log.debug("[ingest] ◀ RECEIVED #{} {} on '{}' ({}B)", n, kind, msg.topic(),
                msg.payload() == null ? 0 : msg.payload().length);

        switch (kind) {
            case EVENT -> handleEvent(msg);
            case STATUS -> handleStatus(msg, StatusUpdate.Source.DEVICE_STATUS, statuses);
            case ALERT -> handleStatus(msg, StatusUpdate.Source.DEVICE_ALERT, alerts);
            case CONTROL -> handleControl(msg);
            default -> {
                unknown.incrementAndGet();
                log.info("[ingest] ✗ dropped message on unrecognised topic '{}'", msg.topic());
            }
        }
    }

    private void handleEvent(InboundMessage msg) {
        DeviceEvent event;
        try {
            event = EventPayloadParser.parse(msg.payload(), msg.topic());
        } catch (MalformedEventException e) {
            malformed.incrementAndGet();
            metrics.recordMalformedEvent();
            log.warn("[ingest] ✗ MALFORMED event on '{}': {}", msg.topic(), e.getMessage());
            return;
        }
        events.incrementAndGet();
        cache.prepend(event);
        refresher.requestRefresh();
        writer.queueEventForPersistence(event);
        log.info("[ingest] ✓ event {}", event);
    }

    private void handleStatus(InboundMessage msg, StatusUpdate.Source source, AtomicLong counter) {
        counter.incrementAndGet();
        String device = TopicFilter.level(msg.topic(), -2);
        String text = statusText(msg.payload());
        status.onStatus(new StatusUpdate(device, text, false, source, msg.receivedAt()));
    }

    // JSON payloads with a "status" or "message" field show that field; anything else verbatim.
    private static String statusText(byte[] payload) {
        String raw = payload == null ? "" : new String(payload, StandardCharsets.UTF_8).trim();
        JsonNode node = raw.startsWith("{") ? JsonUtil.readTreeOrNull(raw) : null;
        if (node != null) {
            for (String field : new String[]{"status", "message", "alert"}) {
                JsonNode v = node.get(field);
                if (v != null && v.isValueNode()) return v.asText();
            }
        }
        return raw;
    }

    private void handleControl(InboundMessage msg) {
        controls.incrementAndGet();
        String device = TopicFilter.level(msg.topic(), -1);
        String payload = msg.payload() == null ? "" : new String(msg.payload(), StandardCharsets.UTF_8);
        Optional<ControlCommand> command = ControlCommand.parse(payload);
        if (command.isEmpty()) {
            log.warn("[ingest] ✗ unknown control command '{}' for {}", payload.trim(), device);
            return;
        }
        if (command.get() == ControlCommand.SNAPSHOT) {
            log.info("[ingest] snapshot requested for {}: not supported, ignored", device);
            return;
        }
        log.info("[ingest] ✓ control {} for {}", command.get(), device);
        controlHandler.onCommand(command.get(), device);
    }

    @Override
    protected void onStopped(List<InboundMessage> undrained) {
        if (!undrained.isEmpty()) {
            discarded.addAndGet(undrained.size());
            log.warn("[ingest] {} message(s) discarded at stop", undrained.size());
        }
    }

    public IngestionStats getStats() {
        return new IngestionStats(received.get(), events.get(), statuses.get(), alerts.get(),
                controls.get(), malformed.get(), unknown.get(), discarded.get(), queue.size());
    }
}
