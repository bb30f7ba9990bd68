/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.cache;

import com.camlink.common.model.DeviceEvent;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventCacheTest {

    @Test
    void prependShouldKeepNewestFirst() {
        EventCache cache = new EventCache();
        DeviceEvent older = new DeviceEvent("a", "2025-01-01 10:00:00", "/v/1.mp4", false);
        DeviceEvent newer = new DeviceEvent("a", "2025-01-02 10:00:00", "/v/2.mp4", false);
        cache.seed(List.of(older));

        cache.prepend(newer);

        assertEquals(List.of(newer, older), cache.snapshot());
    }

    @Test
    void markViewedShouldReplaceFirstUnviewedMatch() {
        EventCache cache = new EventCache();
        DeviceEvent e = new DeviceEvent("a", "2025-01-01 10:00:00", "/v/1.mp4", false);
        cache.seed(List.of(e));

        assertTrue(cache.markViewed("a", "2025-01-01 10:00:00", "/v/1.mp4").isPresent());
        assertTrue(cache.snapshot().get(0).isViewed());
        assertTrue(cache.markViewed("a", "2025-01-01 10:00:00", "/v/1.mp4").isEmpty());
    }

    @Test
    void forDeviceShouldFilterAndLimit() {
        EventCache cache = new EventCache();
        cache.seed(List.of(
                new DeviceEvent("a", "3", "/v/3", false),
                new DeviceEvent("b", "2", "/v/2", false),
                new DeviceEvent("a", "1", "/v/1", false)));

        assertEquals(1, cache.forDevice("a", 1).size());
        assertEquals(2, cache.forDevice("a", 10).size());
        assertEquals(3, cache.forDevice(null, 10).size());
    }
}
