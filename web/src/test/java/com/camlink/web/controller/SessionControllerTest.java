/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.web.controller;

import com.camlink.common.model.CandidateStrategy;
import com.camlink.common.model.StatusUpdate;
import com.camlink.server.presentation.StatusBoard;
import com.camlink.server.session.CameraCatalog;
import com.camlink.server.session.PlaceholderSurface;
import com.camlink.server.session.Session;
import com.camlink.server.session.SessionCommandDispatcher;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(SessionController.class)
class SessionControllerTest {

    @Autowired
    MockMvc mvc;

    @MockBean
    SessionCommandDispatcher sessions;

    @MockBean
    CameraCatalog catalog;

    @MockBean
    StatusBoard statusBoard;

    private static Session session() {
        return new Session("shed", 2, new CandidateStrategy("uridecodebin uri=rtsp://shed ! autovideosink", null),
                null, new PlaceholderSurface(), Instant.parse("2025-01-31T14:02:11Z"));
    }

    @Test
    void unknownCameraShouldBeNotFound() throws Exception {
        when(catalog.contains("attic")).thenReturn(false);

        mvc.perform(post("/api/session/connect/attic"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Unknown camera: attic"));
        verify(sessions, never()).connect(anyString());
    }

    @Test
    void successfulConnectShouldDescribeSession() throws Exception {
        when(catalog.contains("shed")).thenReturn(true);
        when(catalog.displayName("shed")).thenReturn("Shed Camera");
        when(sessions.connect("shed")).thenReturn(CompletableFuture.completedFuture(true));
        when(sessions.currentSession()).thenReturn(CompletableFuture.completedFuture(Optional.of(session())));
        when(statusBoard.latestSession()).thenReturn(
                StatusUpdate.session("shed", "Connected to Shed Camera (strategy 3/3)", true));

        MvcResult pending = mvc.perform(post("/api/session/connect/shed"))
                .andExpect(request().asyncStarted()).andReturn();

        mvc.perform(asyncDispatch(pending))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.connected").value(true))
                .andExpect(jsonPath("$.name").value("Shed Camera"))
                .andExpect(jsonPath("$.strategy_index").value(2))
                .andExpect(jsonPath("$.external_window").value(true))
                .andExpect(jsonPath("$.status").value("Connected to Shed Camera (strategy 3/3)"));
    }

    @Test
    void disconnectAndEmptySession() throws Exception {
        when(sessions.disconnect()).thenReturn(CompletableFuture.completedFuture(null));
        when(sessions.currentSession()).thenReturn(CompletableFuture.completedFuture(Optional.empty()));

        MvcResult pending = mvc.perform(post("/api/session/disconnect"))
                .andExpect(request().asyncStarted()).andReturn();
        mvc.perform(asyncDispatch(pending))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.connected").value(false));

        MvcResult current = mvc.perform(get("/api/session"))
                .andExpect(request().asyncStarted()).andReturn();
        mvc.perform(asyncDispatch(current))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.connected").value(false))
                .andExpect(jsonPath("$.device_id").doesNotExist());
    }
}
