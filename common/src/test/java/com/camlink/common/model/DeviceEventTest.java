/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.common.model;

import com.camlink.common.util.JsonUtil;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DeviceEventTest {

    @Test
    void shouldSerializeWithSnakeCaseFields() {
        DeviceEvent event = new DeviceEvent("piir", "2025-01-31 14:02:11", "/videos/a.mp4", false);

        String json = JsonUtil.toJson(event);

        assertTrue(json.contains("\"device_id\":\"piir\""));
        assertTrue(json.contains("\"artifact_reference\":\"/videos/a.mp4\""));
        assertEquals(event, JsonUtil.fromJson(json, DeviceEvent.class));
    }

    @Test
    void markedViewedShouldKeepIdentity() {
        DeviceEvent event = new DeviceEvent("piir", "2025-01-31 14:02:11", "/videos/a.mp4", false);
        DeviceEvent viewed = event.markedViewed();

        assertTrue(viewed.isViewed());
        assertFalse(event.isViewed());
        assertTrue(event.sameOccurrence(viewed));
        assertNotEquals(event, viewed);
    }

    @Test
    void shouldRejectMissingIdentityFields() {
        assertThrows(NullPointerException.class, () -> new DeviceEvent(null, "t", "a", false));
        assertThrows(NullPointerException.class, () -> new DeviceEvent("d", null, "a", false));
        assertThrows(NullPointerException.class, () -> new DeviceEvent("d", "t", null, false));
    }
}
