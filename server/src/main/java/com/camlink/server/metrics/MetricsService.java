/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.TimeGauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Centralised metrics instrumentation for CamLink using Micrometer.
 *
 * <h3>Metric Catalogue</h3>
 * <table>
 *   <tr><th>Metric</th><th>Type</th><th>Tags</th></tr>
 *   <tr><td>camlink.messages.received</td><td>Counter</td><td>kind</td></tr>
 *   <tr><td>camlink.events.malformed</td><td>Counter</td><td>none</td></tr>
 *   <tr><td>camlink.events.persisted</td><td>Counter</td><td>none</td></tr>
 *   <tr><td>camlink.events.persist_failed</td><td>Counter</td><td>none</td></tr>
 *   <tr><td>camlink.writer.batches</td><td>Counter</td><td>none</td></tr>
 *   <tr><td>camlink.connection.attempts</td><td>Counter</td><td>outcome</td></tr>
 *   <tr><td>camlink.queue.depth</td><td>Gauge</td><td>queue</td></tr>
 *   <tr><td>camlink.uptime.seconds</td><td>TimeGauge</td><td>none</td></tr>
 * </table>
 */
public class MetricsService {

    private static final Logger log = LoggerFactory.getLogger(MetricsService.class);

    private final MeterRegistry registry;
    private final Instant startupTime;

    private final Map<String, Counter> receivedCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> attemptCounters = new ConcurrentHashMap<>();
    private final Counter malformed;
    private final Counter persisted;
    private final Counter persistFailed;
    private final Counter batches;

    public MetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.startupTime = Instant.now();

        malformed = Counter.builder("camlink.events.malformed")
                .description("Event payloads dropped as malformed")
                .register(registry);
        persisted = Counter.builder("camlink.events.persisted")
                .description("Events committed to the durable store")
                .register(registry);
        persistFailed = Counter.builder("camlink.events.persist_failed")
                .description("Events whose durable insert failed (not retried)")
                .register(registry);
        batches = Counter.builder("camlink.writer.batches")
                .description("Batches processed by the batch writer")
                .register(registry);

        TimeGauge.builder("camlink.uptime.seconds", this, TimeUnit.SECONDS,
                        ms -> Duration.between(startupTime, Instant.now()).toSeconds())
                .description("CamLink uptime in seconds")
                .register(registry);

        log.info("MetricsService initialized");
    }

    /** Metrics backed by a private in-memory registry. */
    public static MetricsService noop() {
        return new MetricsService(new SimpleMeterRegistry());
    }

    public void recordMessageReceived(String kind) {
        receivedCounters.computeIfAbsent(kind, k ->
                Counter.builder("camlink.messages.received")
                        .description("Inbound pub/sub messages by topic kind")
                        .tag("kind", k)
                        .register(registry)
        ).increment();
    }

    public void recordMalformedEvent() { malformed.increment(); }

    public void recordPersisted() { persisted.increment(); }

    public void recordPersistFailed() { persistFailed.increment(); }

    public void recordBatch() { batches.increment(); }

    public void recordConnectionAttempt(boolean success) {
        String outcome = success ? "success" : "failure";
        attemptCounters.computeIfAbsent(outcome, k ->
                Counter.builder("camlink.connection.attempts")
                        .description("Candidate connection attempts")
                        .tag("outcome", k)
                        .register(registry)
        ).increment();
    }

    public void registerQueueDepth(String queue, Supplier<Number> depth) {
        Gauge.builder("camlink.queue.depth", depth)
                .description("Items waiting in a work queue")
                .tag("queue", queue)
                .register(registry);
    }

}
