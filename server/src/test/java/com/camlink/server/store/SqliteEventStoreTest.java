/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.store;

import com.camlink.common.exception.EventStoreException;
import com.camlink.common.model.DeviceEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqliteEventStoreTest {

    @TempDir
    Path tempDir;

    private SqliteEventStore store;

    @BeforeEach
    void setUp() {
        store = SqliteEventStore.open(tempDir.resolve("db/events.db"));
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void appendedEventsShouldRoundTripFieldForField() {
        DeviceEvent event = new DeviceEvent("piir", "2025-01-31 14:02:11", "/videos/piir_20250131_140211.mp4", false);

        assertTrue(store.append(event));

        assertEquals(List.of(event), store.findAllNewestFirst());
        assertEquals(1, store.count());
    }

    @Test
    void findAllShouldReturnNewestFirst() {
        store.append(new DeviceEvent("a", "2025-01-01 10:00:00", "/v/1.mp4", false));
        store.append(new DeviceEvent("b", "2025-01-03 10:00:00", "/v/3.mp4", true));
        store.append(new DeviceEvent("a", "2025-01-02 10:00:00", "/v/2.mp4", false));

        List<String> stamps = store.findAllNewestFirst().stream().map(DeviceEvent::getTimestamp).toList();

        assertEquals(List.of("2025-01-03 10:00:00", "2025-01-02 10:00:00", "2025-01-01 10:00:00"), stamps);
    }

    @Test
    void markViewedShouldUpdateMatchingRowOnly() {
        store.append(new DeviceEvent("a", "2025-01-01 10:00:00", "/v/1.mp4", false));
        store.append(new DeviceEvent("a", "2025-01-02 10:00:00", "/v/2.mp4", false));

        assertTrue(store.markViewed("a", "2025-01-01 10:00:00", "/v/1.mp4"));
        assertFalse(store.markViewed("a", "2025-01-09 10:00:00", "/v/9.mp4"));

        List<DeviceEvent> all = store.findAllNewestFirst();
        assertFalse(all.get(0).isViewed());
        assertTrue(all.get(1).isViewed());
    }

    @Test
    void dataShouldSurviveReopen() {
        store.append(new DeviceEvent("a", "2025-01-01 10:00:00", "/v/1.mp4", false));
        store.close();

        store = SqliteEventStore.open(tempDir.resolve("db/events.db"));

        assertEquals(1, store.count());
    }

    @Test
    void operationsAfterCloseShouldFailSoftly() {
        store.close();

        assertFalse(store.append(new DeviceEvent("a", "t", "v", false)));
        assertTrue(store.findAllNewestFirst().isEmpty());
        assertFalse(store.isOpen());
    }

    @Test
    void openShouldFailForUnusablePath() throws Exception {
        Path blocker = tempDir.resolve("file");
        Files.writeString(blocker, "x");

        assertThrows(EventStoreException.class, () -> SqliteEventStore.open(blocker.resolve("events.db")));
    }
}
