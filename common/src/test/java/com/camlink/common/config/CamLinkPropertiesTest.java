/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.common.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CamLinkPropertiesTest {

    @AfterEach
    void tearDown() {
        CamLinkProperties.reset();
    }

    @Test
    void getShouldFailBeforeInit() {
        assertFalse(CamLinkProperties.isInitialized());
        assertThrows(IllegalStateException.class, CamLinkProperties::get);
    }

    @Test
    void typedGettersShouldFallBackOnMissingOrInvalidValues() {
        CamLinkProperties.init(Map.of(
                "camlink.writer.batch-size", "10",
                "camlink.writer.bogus", "ten",
                "camlink.pubsub.status-publish", "TRUE"));
        CamLinkProperties p = CamLinkProperties.get();

        assertEquals(10, p.getInt("camlink.writer.batch-size", 1));
        assertEquals(7, p.getInt("camlink.writer.bogus", 7));
        assertEquals(3, p.getInt("camlink.missing", 3));
        assertTrue(p.getBoolean("camlink.pubsub.status-publish", false));
        assertEquals("x", p.getString("camlink.missing", "x"));
    }

    @Test
    void durationsShouldAcceptUnitsAndIso() {
        assertEquals(Duration.ofMillis(100), CamLinkProperties.parseDuration("100ms", Duration.ZERO));
        assertEquals(Duration.ofSeconds(5), CamLinkProperties.parseDuration("5s", Duration.ZERO));
        assertEquals(Duration.ofMinutes(2), CamLinkProperties.parseDuration("2m", Duration.ZERO));
        assertEquals(Duration.ofHours(24), CamLinkProperties.parseDuration("24h", Duration.ZERO));
        assertEquals(Duration.ofSeconds(30), CamLinkProperties.parseDuration("PT30S", Duration.ZERO));
        assertEquals(Duration.ofMillis(250), CamLinkProperties.parseDuration("250", Duration.ZERO));
        assertEquals(Duration.ofSeconds(1), CamLinkProperties.parseDuration("soon", Duration.ofSeconds(1)));
    }

    @Test
    void subPropertiesShouldStripPrefix() {
        CamLinkProperties.init(Map.of(
                "camlink.pipeline.env.GST_DEBUG", "rtspsrc:4,rtsp:3",
                "camlink.pipeline.launcher", "gst-launch-1.0 -q"));

        Map<String, String> env = CamLinkProperties.get().getSubProperties("camlink.pipeline.env.");
        assertEquals(Map.of("GST_DEBUG", "rtspsrc:4,rtsp:3"), env);
    }

    @Test
    void secondInitShouldMerge() {
        CamLinkProperties.init(Map.of("a", "1"));
        CamLinkProperties.init(Map.of("b", "2"));
        assertEquals(2, CamLinkProperties.get().size());
    }
}
