/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.readmodel;

import com.camlink.server.presentation.PresentationLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Marshals read-model refreshes onto the presentation loop. Requests that
 * arrive while one is already pending are folded into it.
 */
public class ReadModelRefresher {

    private static final Logger log = LoggerFactory.getLogger(ReadModelRefresher.class);

    private final ReadModel readModel;
    private final PresentationLoop loop;
    private final AtomicBoolean pending = new AtomicBoolean();
    private final AtomicLong requested = new AtomicLong();
    private final AtomicLong executed = new AtomicLong();

    public ReadModelRefresher(ReadModel readModel, PresentationLoop loop) {
        this.readModel = readModel;
        this.loop = loop;
    }

    public void requestRefresh() {
        requested.incrementAndGet();
        if (pending.compareAndSet(false, true)) {
            loop.execute(this::runRefresh);
        }
    }

    private void runRefresh() {
        pending.set(false);
        readModel.refresh();
        long n = executed.incrementAndGet();
        log.debug("Read model refreshed (#{}, {} devices)", n, readModel.allCounts().size());
    }

    public long requestedCount() { return requested.get(); }
    public long executedCount() { return executed.get(); }
}
