/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.shutdown;

import com.camlink.server.gateway.PubSubGateway;
import com.camlink.server.ingestion.IngestionWorker;
import com.camlink.server.persistence.BatchWriter;
import com.camlink.server.presentation.PresentationLoop;
import com.camlink.server.session.SessionCommandDispatcher;
import com.camlink.server.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the teardown sequence exactly once.
 *
 * <p>The first {@link #shutdown()} arms a deadline timer and runs each phase in
 * order; a phase that fails is logged and the next one still runs. If the
 * deadline passes before the sequence completes the process is terminated.
 * A second call while teardown is in progress terminates immediately, and any
 * call after completion does nothing.</p>
 *
 * <pre>
 * Phase 1: Signal worker stop        (ingestion worker, batch writer)
 * Phase 2: Join workers              (no join timeout, the deadline bounds it)
 * Phase 3: Disconnect pub/sub
 * Phase 4: Tear down stream session
 * Phase 5: Close event store
 * Phase 6: Stop presentation loop
 * </pre>
 */
public class ShutdownCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ShutdownCoordinator.class);

    public static final Duration DEFAULT_DEADLINE = Duration.ofSeconds(5);
    public static final int FORCED_EXIT_STATUS = 1;

    private final List<ShutdownPhase> phases;
    private final Duration deadline;
    private final ProcessTerminator terminator;
    private final AtomicReference<ShutdownState> state = new AtomicReference<>(ShutdownState.IDLE);
    private volatile Instant startedAt;
    private volatile Duration elapsed;

    public ShutdownCoordinator(List<ShutdownPhase> phases, Duration deadline, ProcessTerminator terminator) {
        this.phases = List.copyOf(phases);
        this.deadline = deadline;
        this.terminator = terminator;
    }

    /** The standard sequence over the pipeline components. */
    public static ShutdownCoordinator standard(IngestionWorker ingestion, BatchWriter writer,
                                               PubSubGateway gateway, SessionCommandDispatcher sessions,
                                               EventStore store, PresentationLoop loop,
                                               Duration deadline, ProcessTerminator terminator) {
        List<ShutdownPhase> phases = new ArrayList<>();
        phases.add(new ShutdownPhase("Signal Worker Stop",
                "Waking ingestion worker and batch writer...", () -> {
                    ingestion.requestStop();
                    writer.requestStop();
                }));
        phases.add(new ShutdownPhase("Join Workers",
                "Waiting for ingestion worker and batch writer to exit...", () -> {
                    ingestion.join();
                    writer.join();
                }));
        phases.add(new ShutdownPhase("Disconnect Pub/Sub",
                "Closing broker subscriber and publisher...", gateway::disconnect));
        phases.add(new ShutdownPhase("Tear Down Session",
                "Stopping the active stream, if any...", () -> sessions.disconnect().get()));
        phases.add(new ShutdownPhase("Close Event Store",
                "Closing the durable store...", store::close));
        phases.add(new ShutdownPhase("Stop Presentation Loop",
                "Draining queued presentation tasks...", () -> loop.shutdown(Duration.ofSeconds(1))));
        return new ShutdownCoordinator(phases, deadline, terminator);
    }

    public void shutdown() {
        if (state.compareAndSet(ShutdownState.IDLE, ShutdownState.IN_PROGRESS)) {
            runTeardown();
            return;
        }
        if (state.get() == ShutdownState.IN_PROGRESS) {
            log.error("✗ Shutdown requested again while teardown is in progress, forcing termination");
            terminator.terminate(FORCED_EXIT_STATUS);
            return;
        }
        log.debug("Shutdown already completed; ignoring");
    }

    private void runTeardown() {
        startedAt = Instant.now();
        ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "shutdown-deadline");
            t.setDaemon(true);
            return t;
        });
        timer.schedule(this::onDeadline, deadline.toMillis(), TimeUnit.MILLISECONDS);

        log.info("");
        log.info("╔════════════════════════════════════════════════════════════════════╗");
        log.info("║   SHUTDOWN INITIATED (deadline {} ms){}║", deadline.toMillis(),
                pad("SHUTDOWN INITIATED (deadline " + deadline.toMillis() + " ms)", 65));
        log.info("╚════════════════════════════════════════════════════════════════════╝");

        try {
            int n = 0;
            for (ShutdownPhase phase : phases) {
                n++;
                logPhase(n, phase);
                try {
                    phase.action().run();
                    log.info("✓ Phase {} complete: {}", n, phase.title());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("  ⚠ Phase {} interrupted", n);
                } catch (Exception e) {
                    log.warn("  ⚠ Phase {} ({}) issue: {}", n, phase.title(), e.getMessage(), e);
                }
            }
        } finally {
            elapsed = Duration.between(startedAt, Instant.now());
            state.set(ShutdownState.COMPLETED);
            timer.shutdownNow();
        }

        log.info("╔════════════════════════════════════════════════════════════════════╗");
        log.info("║   SHUTDOWN COMPLETE in {} ms{}║", elapsed.toMillis(),
                pad("SHUTDOWN COMPLETE in " + elapsed.toMillis() + " ms", 65));
        log.info("╚════════════════════════════════════════════════════════════════════╝");
    }

    private void onDeadline() {
        if (state.get() != ShutdownState.COMPLETED) {
            log.error("✗ Shutdown deadline of {} ms exceeded, forcing termination", deadline.toMillis());
            terminator.terminate(FORCED_EXIT_STATUS);
        }
    }

    private void logPhase(int number, ShutdownPhase phase) {
        log.info("╔════════════════════════════════════════════════════════════════════╗");
        log.info("║  Phase {}: {}{}║", number, phase.title(),
                pad("Phase " + number + ": " + phase.title(), 66));
        log.info("║  {}{}║", phase.description(), pad(phase.description(), 66));
        log.info("╚════════════════════════════════════════════════════════════════════╝");
    }

    private static String pad(String text, int totalWidth) {
        int remaining = totalWidth - text.length();
        if (remaining <= 0) return " ";
        return " ".repeat(remaining);
    }

    public ShutdownState state() { return state.get(); }

    /** Teardown duration once completed, else null. */
    public Duration elapsed() { return elapsed; }
}
