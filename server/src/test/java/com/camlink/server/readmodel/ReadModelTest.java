/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.readmodel;

import com.camlink.common.model.DeviceCounts;
import com.camlink.common.model.DeviceEvent;
import com.camlink.common.util.Timestamps;
import com.camlink.server.cache.EventCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReadModelTest {

    private static final Instant NOW = Instant.parse("2025-01-31T14:00:00Z");

    private EventCache cache;
    private ReadModel readModel;

    @BeforeEach
    void setUp() {
        cache = new EventCache();
        readModel = new ReadModel(cache, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static String stamp(Instant at) {
        return Timestamps.format(at, ZoneOffset.UTC);
    }

    @Test
    void recentCountShouldIncludeNowAndExcludeOlderThanWindow() {
        cache.seed(List.of(
                new DeviceEvent("piir", stamp(NOW), "/v/now.mp4", false),
                new DeviceEvent("piir", stamp(NOW.minus(Duration.ofHours(23))), "/v/23h.mp4", true),
                new DeviceEvent("piir", stamp(NOW.minus(Duration.ofHours(25))), "/v/25h.mp4", false)));

        assertEquals(2, readModel.recentCount("piir", Duration.ofHours(24)));
    }

    @Test
    void unviewedCountShouldIgnoreViewedAndOtherDevices() {
        cache.seed(List.of(
                new DeviceEvent("piir", stamp(NOW), "/v/1.mp4", false),
                new DeviceEvent("piir", stamp(NOW), "/v/2.mp4", true),
                new DeviceEvent("door", stamp(NOW), "/v/3.mp4", false)));

        assertEquals(1, readModel.unviewedCount("piir"));
        assertEquals(1, readModel.unviewedCount("door"));
        assertEquals(0, readModel.unviewedCount("garage"));
    }

    @Test
    void malformedTimestampsShouldBeExcludedFromRecentCount() {
        cache.seed(List.of(
                new DeviceEvent("piir", "not a time", "/v/x.mp4", false),
                new DeviceEvent("piir", stamp(NOW.minusSeconds(60)), "/v/y.mp4", false)));

        assertEquals(1, readModel.recentCount("piir", ReadModel.RECENT_WINDOW));
        assertEquals(2, readModel.unviewedCount("piir"));
    }

    @Test
    void refreshShouldRecomputeAllDevices() {
        assertEquals(DeviceCounts.empty("piir"), readModel.counts("piir"));

        cache.seed(List.of(
                new DeviceEvent("piir", stamp(NOW), "/v/1.mp4", false),
                new DeviceEvent("door", stamp(NOW.minus(Duration.ofDays(3))), "/v/2.mp4", false)));
        readModel.refresh();

        assertEquals(new DeviceCounts("piir", 1, 1), readModel.counts("piir"));
        assertEquals(new DeviceCounts("door", 1, 0), readModel.counts("door"));
        assertEquals(2, readModel.allCounts().size());

        cache.seed(List.of());
        readModel.refresh();
        assertTrue(readModel.allCounts().isEmpty());
    }
}
