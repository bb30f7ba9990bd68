/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.ingestion;

import com.camlink.common.model.DeviceEvent;
import com.camlink.common.model.StatusUpdate;
import com.camlink.server.cache.EventCache;
import com.camlink.server.metrics.MetricsService;
import com.camlink.server.persistence.BatchWriter;
import com.camlink.server.presentation.PresentationLoop;
import com.camlink.server.presentation.StatusObserver;
import com.camlink.server.readmodel.ReadModel;
import com.camlink.server.readmodel.ReadModelRefresher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class IngestionWorkerTest {

    private PresentationLoop loop;
    private EventCache cache;
    private ReadModel readModel;
    private BatchWriter writer;
    private StatusObserver status;
    private ControlCommandHandler control;
    private IngestionWorker worker;

    @BeforeEach
    void setUp() {
        loop = new PresentationLoop();
        cache = new EventCache();
        readModel = new ReadModel(cache, Clock.systemDefaultZone());
        writer = mock(BatchWriter.class);
        status = mock(StatusObserver.class);
        control = mock(ControlCommandHandler.class);
        worker = new IngestionWorker(cache, new ReadModelRefresher(readModel, loop), writer, status, control,
                MetricsService.noop(), Duration.ofMillis(50));
        worker.start();
    }

    @AfterEach
    void tearDown() throws Exception {
        worker.requestStop();
        worker.join();
        loop.shutdown(Duration.ofSeconds(1));
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void eventShouldReachCacheReadModelAndWriter() {
        worker.enqueue(bytes("{\"camera_type\":\"piir\",\"timestamp\":\"2025-01-31 14:02:11\","
                + "\"video_path\":\"/v/a.mp4\"}"), "camera/piir/events");

        DeviceEvent expected = new DeviceEvent("piir", "2025-01-31 14:02:11", "/v/a.mp4", false);
        await().atMost(Duration.ofSeconds(2)).until(() -> cache.size() == 1);
        assertEquals(expected, cache.snapshot().get(0));
        verify(writer, timeout(2000)).queueEventForPersistence(expected);
        await().atMost(Duration.ofSeconds(2)).until(() -> readModel.counts("piir").unviewedCount() == 1);
    }

    @Test
    void malformedEventShouldBeCountedAndDropped() {
        worker.enqueue(bytes("{\"camera_type\":\"piir\"}"), "camera/piir/events");

        await().atMost(Duration.ofSeconds(2)).until(() -> worker.getStats().malformed() == 1);
        assertEquals(0, cache.size());
        verify(writer, never()).queueEventForPersistence(any());
    }

    @Test
    void statusShouldBeForwardedButNotPersisted() {
        worker.enqueue(bytes("{\"status\":\"online\"}"), "camera/piir/status");

        ArgumentCaptor<StatusUpdate> captor = ArgumentCaptor.forClass(StatusUpdate.class);
        verify(status, timeout(2000)).onStatus(captor.capture());
        assertEquals("piir", captor.getValue().deviceId());
        assertEquals("online", captor.getValue().text());
        assertEquals(StatusUpdate.Source.DEVICE_STATUS, captor.getValue().source());
        verify(writer, never()).queueEventForPersistence(any());
    }

    @Test
    void alertShouldBeForwardedVerbatim() {
        worker.enqueue(bytes("battery low"), "camera/piir/alert");

        ArgumentCaptor<StatusUpdate> captor = ArgumentCaptor.forClass(StatusUpdate.class);
        verify(status, timeout(2000)).onStatus(captor.capture());
        assertEquals("battery low", captor.getValue().text());
        assertEquals(StatusUpdate.Source.DEVICE_ALERT, captor.getValue().source());
    }

    @Test
    void controlCommandsShouldReachHandlerExceptSnapshot() {
        worker.enqueue(bytes("connect"), "rtsp_client/control/piir");
        worker.enqueue(bytes("{\"command\":\"snapshot\"}"), "rtsp_client/control/piir");
        worker.enqueue(bytes("disconnect"), "rtsp_client/control/piir");

        verify(control, timeout(2000)).onCommand(ControlCommand.CONNECT, "piir");
        verify(control, timeout(2000)).onCommand(ControlCommand.DISCONNECT, "piir");
        await().atMost(Duration.ofSeconds(2)).until(() -> worker.getStats().controls() == 3);
        verify(control, never()).onCommand(eq(ControlCommand.SNAPSHOT), any());
    }

    @Test
    void unknownTopicShouldBeDropped() {
        worker.enqueue(bytes("{}"), "camera/piir/telemetry");

        await().atMost(Duration.ofSeconds(2)).until(() -> worker.getStats().unknown() == 1);
        verifyNoInteractions(status, control, writer);
    }
}
