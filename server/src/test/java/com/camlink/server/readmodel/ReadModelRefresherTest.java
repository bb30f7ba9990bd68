/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.readmodel;

import com.camlink.server.cache.EventCache;
import com.camlink.server.presentation.PresentationLoop;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class ReadModelRefresherTest {

    private final PresentationLoop loop = new PresentationLoop();

    @AfterEach
    void tearDown() throws Exception {
        loop.shutdown(Duration.ofSeconds(1));
    }

    @Test
    void requestsWhilePendingShouldCoalesce() throws Exception {
        ReadModel readModel = new ReadModel(new EventCache(), Clock.systemDefaultZone());
        ReadModelRefresher refresher = new ReadModelRefresher(readModel, loop);

        CountDownLatch blocker = new CountDownLatch(1);
        loop.execute(() -> {
            try {
                blocker.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        for (int i = 0; i < 10; i++) refresher.requestRefresh();
        blocker.countDown();

        await().atMost(Duration.ofSeconds(2)).until(() -> refresher.executedCount() == 1);
        assertEquals(10, refresher.requestedCount());

        refresher.requestRefresh();
        await().atMost(Duration.ofSeconds(2)).until(() -> refresher.executedCount() == 2);
    }
}
