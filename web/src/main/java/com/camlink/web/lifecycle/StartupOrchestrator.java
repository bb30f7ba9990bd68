/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.web.lifecycle;

import com.camlink.common.model.DeviceEvent;
import com.camlink.server.cache.EventCache;
import com.camlink.server.gateway.PubSubGateway;
import com.camlink.server.ingestion.IngestionWorker;
import com.camlink.server.persistence.BatchWriter;
import com.camlink.server.presentation.PresentationLoop;
import com.camlink.server.readmodel.ReadModel;
import com.camlink.server.session.CameraCatalog;
import com.camlink.server.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Brings the pipeline up once the Spring context is ready.
 *
 * <pre>
 * Phase 1: Load durable events into the cache
 * Phase 2: Build the read model on the presentation loop
 * Phase 3: Start batch writer and ingestion worker
 * Phase 4: Connect the pub/sub gateway
 * FINAL:   System Ready announcement
 * </pre>
 *
 * <p>The writer starts before the ingestion worker so nothing is queued for
 * persistence without a consumer, and the gateway connects last so no message
 * arrives before the worker runs.</p>
 */
@Component
public class StartupOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(StartupOrchestrator.class);

    private final EventStore store;
    private final EventCache cache;
    private final ReadModel readModel;
    private final PresentationLoop loop;
    private final BatchWriter writer;
    private final IngestionWorker ingestion;
    private final PubSubGateway gateway;
    private final CameraCatalog catalog;

    @Value("${camlink.app-name:CamLink}")
    private String appName;

    @Value("${camlink.version:1.0.0}")
    private String version;

    @Value("${server.port:8080}")
    private int serverPort;

    @Value("${camlink.db.path:data/camera_events.db}")
    private String dbPath;

    private final AtomicBoolean startupComplete = new AtomicBoolean(false);

    public StartupOrchestrator(EventStore store, EventCache cache, ReadModel readModel, PresentationLoop loop,
                               BatchWriter writer, IngestionWorker ingestion, PubSubGateway gateway,
                               CameraCatalog catalog) {
        this.store = store;
        this.cache = cache;
        this.readModel = readModel;
        this.loop = loop;
        this.writer = writer;
        this.ingestion = ingestion;
        this.gateway = gateway;
        this.catalog = catalog;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (startupComplete.get()) return;
        Instant startTime = Instant.now();

        logBanner("STARTUP INITIATED", appName + " v" + version,
                "Timestamp: " + LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")));

        try {
            logPhase(1, "Load Durable Events", "Reading " + dbPath + " newest first...");
            List<DeviceEvent> events = store.findAllNewestFirst();
            cache.seed(events);
            logPhaseComplete(1, events.size() + " event(s) loaded into the cache");

            logPhase(2, "Build Read Model", "Computing per-device counts on the presentation loop...");
            loop.submit(() -> {
                readModel.refresh();
                return null;
            }).get(10, TimeUnit.SECONDS);
            logPhaseComplete(2, readModel.allCounts().size() + " device(s) with events");

            logPhase(3, "Start Workers", "Starting batch writer and ingestion worker threads...");
            writer.start();
            ingestion.start();
            logPhaseComplete(3, "batch-writer and ingestion-worker running");

            logPhase(4, "Connect Pub/Sub", "Subscribing to " + gateway.subscriptions() + "...");
            gateway.connect();
            logPhaseComplete(4, gateway.isConnected() ? "Broker connected"
                    : "Broker not reachable yet, reconnecting in background");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("✗ Startup interrupted", e);
            return;
        } catch (Exception e) {
            log.error("✗ Startup sequence failed: {}", e.getMessage(), e);
            return;
        }

        startupComplete.set(true);
        Duration elapsed = Duration.between(startTime, Instant.now());
        logBanner("SYSTEM READY",
                appName + " v" + version + " started in " + elapsed.toMillis() + " ms",
                "REST API   : http://localhost:" + serverPort + "/api/devices",
                "Cameras    : " + catalog.size() + " configured (+ test pattern)",
                "Topics     : " + gateway.getTopicPrefix() + "/control/+ , camera/+/events");
    }

    public boolean isStartupComplete() {
        return startupComplete.get();
    }

    // ─── Logging Helpers ──────────────────────────────────────────────────────

    private void logBanner(String title, String... lines) {
        log.info("");
        log.info("╔════════════════════════════════════════════════════════════════════╗");
        log.info("║   {}{}║", title, pad(title, 65));
        for (String line : lines) {
            log.info("║   {}{}║", line, pad(line, 65));
        }
        log.info("╚════════════════════════════════════════════════════════════════════╝");
        log.info("");
    }

    private void logPhase(int number, String title, String description) {
        log.info("╔════════════════════════════════════════════════════════════════════╗");
        log.info("║  Phase {}: {}{}║", number, title, pad("Phase " + number + ": " + title, 66));
        log.info("║  {}{}║", description, pad(description, 66));
        log.info("╚════════════════════════════════════════════════════════════════════╝");
    }

    private void logPhaseComplete(int number, String detail) {
        log.info("✓ Phase {} complete: {}", number, detail);
    }

    private String pad(String text, int totalWidth) {
        int remaining = totalWidth - text.length();
        if (remaining <= 0) return " ";
        return " ".repeat(remaining);
    }
}
