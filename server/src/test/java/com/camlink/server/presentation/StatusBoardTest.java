/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.presentation;

import com.camlink.common.model.StatusUpdate;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class StatusBoardTest {

    @Test
    void shouldTrackLatestSessionAndBoundHistory() {
        StatusBoard board = new StatusBoard(3);

        board.onStatus(StatusUpdate.session("piir", "Connecting to Shed...", false));
        board.onStatus(StatusUpdate.session("piir", "Connected to Shed (strategy 1/3)", true));
        board.onStatus(new StatusUpdate("door", "online", false, StatusUpdate.Source.DEVICE_STATUS, Instant.now()));
        board.onStatus(new StatusUpdate("door", "tamper", false, StatusUpdate.Source.DEVICE_ALERT, Instant.now()));

        assertTrue(board.isConnected());
        assertEquals("Connected to Shed (strategy 1/3)", board.latestSession().text());
        List<StatusUpdate> recent = board.recent();
        assertEquals(3, recent.size());
        assertEquals("tamper", recent.get(0).text());
    }

    @Test
    void dispatcherShouldDeliverOnTheLoop() throws Exception {
        PresentationLoop loop = new PresentationLoop();
        try {
            StatusDispatcher dispatcher = new StatusDispatcher(loop);
            List<Boolean> onLoop = new CopyOnWriteArrayList<>();
            dispatcher.addObserver(u -> { throw new IllegalStateException("broken observer"); });
            dispatcher.addObserver(u -> onLoop.add(loop.isOnLoop()));

            dispatcher.onStatus(StatusUpdate.session("piir", "Disconnected", false));

            await().atMost(Duration.ofSeconds(2)).until(() -> onLoop.size() == 1);
            assertTrue(onLoop.get(0));
        } finally {
            loop.shutdown(Duration.ofSeconds(1));
        }
    }
}
