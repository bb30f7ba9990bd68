/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.persistence;

import com.camlink.common.model.DeviceEvent;
import com.camlink.server.cache.EventCache;
import com.camlink.server.metrics.MetricsService;
import com.camlink.server.presentation.PresentationLoop;
import com.camlink.server.readmodel.ReadModel;
import com.camlink.server.readmodel.ReadModelRefresher;
import com.camlink.server.store.EventStore;
import com.camlink.server.store.SqliteEventStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class BatchWriterTest {

    private PresentationLoop loop;
    private ReadModelRefresher refresher;

    @BeforeEach
    void setUp() {
        loop = new PresentationLoop();
        refresher = new ReadModelRefresher(new ReadModel(new EventCache(), Clock.systemDefaultZone()), loop);
    }

    @AfterEach
    void tearDown() throws Exception {
        loop.shutdown(Duration.ofSeconds(1));
    }

    private static DeviceEvent event(int i) {
        return new DeviceEvent("piir", String.format("2025-01-31 14:%02d:00", i), "/v/" + i + ".mp4", false);
    }

    @Test
    void burstOf25ShouldBeWrittenInBatchesOfAtMost10() throws Exception {
        SqliteEventStore store = SqliteEventStore.inMemory();
        BatchWriter writer = new BatchWriter(store, refresher, MetricsService.noop(), 10, Duration.ofMillis(100));
        List<DeviceEvent> sent = new ArrayList<>();
        for (int i = 0; i < 25; i++) {
            sent.add(event(i));
            writer.queueEventForPersistence(event(i));
        }

        writer.start();
        await().atMost(Duration.ofSeconds(5)).until(() -> writer.getStats().persisted() == 25);
        writer.requestStop();
        writer.join();

        WriterStats stats = writer.getStats();
        assertTrue(stats.largestBatch() <= 10, "largest batch " + stats.largestBatch());
        assertTrue(stats.batches() >= 3);
        assertEquals(0, stats.failed());
        assertEquals(25, store.count());
        assertEquals(new HashSet<>(sent), new HashSet<>(store.findAllNewestFirst()));
        store.close();
    }

    @Test
    void failedInsertShouldBeDroppedAndBatchShouldContinue() throws Exception {
        EventStore store = mock(EventStore.class);
        when(store.append(any())).thenReturn(true);
        when(store.append(event(1))).thenReturn(false);
        BatchWriter writer = new BatchWriter(store, refresher, MetricsService.noop(), 10, Duration.ofMillis(10));
        for (int i = 0; i < 3; i++) writer.queueEventForPersistence(event(i));

        writer.start();
        await().atMost(Duration.ofSeconds(5)).until(() -> writer.getStats().persisted() == 2);
        writer.requestStop();
        writer.join();

        assertEquals(1, writer.getStats().failed());
        verify(store, times(1)).append(event(1));
    }

    @Test
    void markViewedShouldReachStore() throws Exception {
        EventStore store = mock(EventStore.class);
        when(store.markViewed("piir", "2025-01-31 14:00:00", "/v/0.mp4")).thenReturn(true);
        BatchWriter writer = new BatchWriter(store, refresher, MetricsService.noop(), 10, Duration.ofMillis(10));

        writer.start();
        writer.queueMarkViewed(event(0));
        await().atMost(Duration.ofSeconds(5)).until(() -> writer.getStats().markedViewed() == 1);
        writer.requestStop();
        writer.join();

        verify(store).markViewed("piir", "2025-01-31 14:00:00", "/v/0.mp4");
    }

    @Test
    void requestsLeftAtStopShouldBeCountedAsDiscarded() throws Exception {
        EventStore store = mock(EventStore.class);
        BatchWriter writer = new BatchWriter(store, refresher, MetricsService.noop(), 10, Duration.ofMillis(10));
        writer.queueEventForPersistence(event(0));
        writer.queueEventForPersistence(event(1));
        writer.requestStop();

        writer.start();
        writer.join();

        assertEquals(2, writer.getStats().discardedAtStop());
        verifyNoInteractions(store);
    }
}
