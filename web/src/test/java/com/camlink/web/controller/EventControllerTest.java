/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.web.controller;

import com.camlink.common.model.DeviceEvent;
import com.camlink.server.cache.EventCache;
import com.camlink.server.persistence.BatchWriter;
import com.camlink.server.readmodel.ReadModelRefresher;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(EventController.class)
class EventControllerTest {

    private static final String BODY = "{\"device_id\":\"piir\",\"timestamp\":\"2025-01-31 14:02:11\","
            + "\"artifact_reference\":\"/v/a.mp4\"}";

    @Autowired
    MockMvc mvc;

    @MockBean
    EventCache cache;

    @MockBean
    BatchWriter writer;

    @MockBean
    ReadModelRefresher refresher;

    @Test
    void markViewedShouldUpdateCacheAndQueueWrite() throws Exception {
        DeviceEvent viewed = new DeviceEvent("piir", "2025-01-31 14:02:11", "/v/a.mp4", true);
        when(cache.markViewed("piir", "2025-01-31 14:02:11", "/v/a.mp4")).thenReturn(Optional.of(viewed));

        mvc.perform(post("/api/events/viewed").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.viewed").value(true));

        verify(writer).queueMarkViewed(viewed);
        verify(refresher).requestRefresh();
    }

    @Test
    void unknownEventShouldBeNotFound() throws Exception {
        when(cache.markViewed(any(), any(), any())).thenReturn(Optional.empty());

        mvc.perform(post("/api/events/viewed").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404));
        verifyNoInteractions(writer);
    }

    @Test
    void incompleteRequestShouldBeBadRequest() throws Exception {
        mvc.perform(post("/api/events/viewed").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"device_id\":\"piir\"}"))
                .andExpect(status().isBadRequest());
        mvc.perform(post("/api/events/viewed").contentType(MediaType.APPLICATION_JSON).content("not json"))
                .andExpect(status().isBadRequest());
        mvc.perform(get("/api/events").param("limit", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Bad Request"));
    }

    @Test
    void listShouldPassDeviceAndLimit() throws Exception {
        when(cache.forDevice("piir", 5)).thenReturn(List.of(
                new DeviceEvent("piir", "2025-01-31 14:02:11", "/v/a.mp4", false)));

        mvc.perform(get("/api/events").param("device", "piir").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].device_id").value("piir"))
                .andExpect(jsonPath("$[0].artifact_reference").value("/v/a.mp4"));
    }
}
