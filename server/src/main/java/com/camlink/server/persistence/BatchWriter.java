/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.persistence;

import com.camlink.common.model.DeviceEvent;
import com.camlink.server.metrics.MetricsService;
import com.camlink.server.pipeline.BackgroundWorker;
import com.camlink.server.pipeline.WorkQueue;
import com.camlink.server.readmodel.ReadModelRefresher;
import com.camlink.server.store.EventStore;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Moves events from the persistence queue into the durable store in small batches.
 *
 * <p>Each pass drains at most {@code batchSize} requests, releases the queue lock
 * and writes them one by one. A failed write is logged and counted and the rest
 * of the batch continues; nothing is retried. Every successful write requests a
 * read-model refresh. Between batches the writer pauses for {@code batchDelay}
 * so bursts are grouped. This is the only thread that writes to the store.</p>
 */
public class BatchWriter extends BackgroundWorker<PersistenceRequest> {

    public static final int DEFAULT_BATCH_SIZE = 10;
    public static final Duration DEFAULT_BATCH_DELAY = Duration.ofMillis(100);
    private static final Duration WAKE_INTERVAL = Duration.ofSeconds(5);

    private final EventStore store;
    private final ReadModelRefresher refresher;
    private final MetricsService metrics;
    private final int batchSize;
    private final Duration batchDelay;

    private final AtomicLong batches = new AtomicLong();
    private final AtomicInteger largestBatch = new AtomicInteger();
    private final AtomicLong persisted = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong markedViewed = new AtomicLong();
    private final AtomicLong discarded = new AtomicLong();

    public BatchWriter(EventStore store, ReadModelRefresher refresher, MetricsService metrics,
                       int batchSize, Duration batchDelay) {
        super("batch-writer", new WorkQueue<>());
        if (batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1");
        this.store = store;
        this.refresher = refresher;
        this.metrics = metrics;
        this.batchSize = batchSize;
        this.batchDelay = batchDelay;
        metrics.registerQueueDepth("persistence", queue::size);
    }

    public void queueEventForPersistence(DeviceEvent event) {
        queue.put(PersistenceRequest.insert(event));
    }

    public void queueMarkViewed(DeviceEvent event) {
        queue.put(PersistenceRequest.markViewed(event));
    }

    @Override
    protected void pollOnce() throws InterruptedException {
        List<PersistenceRequest> batch = queue.drain(batchSize, WAKE_INTERVAL);
        if (batch.isEmpty()) return;

        long n = batches.incrementAndGet();
        largestBatch.accumulateAndGet(batch.size(), Math::max);
        metrics.recordBatch();
        log.debug("[writer] batch #{} with {} request(s), {} still queued", n, batch.size(), queue.size());

        for (PersistenceRequest request : batch) {
            write(request);
        }
        queue.awaitStop(batchDelay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void write(PersistenceRequest request) {
        DeviceEvent event = request.event();
        boolean ok;
        try {
            ok = switch (request.kind()) {
                case INSERT -> store.append(event);
                case MARK_VIEWED -> store.markViewed(event.getDeviceId(), event.getTimestamp(),
                        event.getArtifactReference());
            };
        } catch (RuntimeException e) {
            log.error("[writer] ✗ {} threw for {}", request.kind(), event, e);
            ok = false;
        }

        if (!ok) {
            failed.incrementAndGet();
            metrics.recordPersistFailed();
            log.warn("[writer] ✗ {} failed for {} (dropped)", request.kind(), event);
            return;
        }
        if (request.kind() == PersistenceRequest.Kind.INSERT) {
            persisted.incrementAndGet();
            metrics.recordPersisted();
        } else {
            markedViewed.incrementAndGet();
        }
        log.debug("[writer] ✓ {} {}", request.kind(), event);
        refresher.requestRefresh();
    }

    @Override
    protected void onStopped(List<PersistenceRequest> undrained) {
        if (!undrained.isEmpty()) {
            discarded.addAndGet(undrained.size());
            log.warn("[writer] {} request(s) not persisted at stop", undrained.size());
        }
    }

    public WriterStats getStats() {
        return new WriterStats(batches.get(), largestBatch.get(), persisted.get(), failed.get(),
                markedViewed.get(), discarded.get(), queue.size());
    }
}
