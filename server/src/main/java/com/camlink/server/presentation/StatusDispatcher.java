/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.presentation;

import com.camlink.common.model.StatusUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans status updates out to registered observers on the presentation loop,
 * whichever thread they were reported from.
 */
public class StatusDispatcher implements StatusObserver {

    private static final Logger log = LoggerFactory.getLogger(StatusDispatcher.class);

    private final PresentationLoop loop;
    private final List<StatusObserver> observers = new CopyOnWriteArrayList<>();

    public StatusDispatcher(PresentationLoop loop) {
        this.loop = loop;
    }

    public void addObserver(StatusObserver observer) { observers.add(observer); }

    @Override
    public void onStatus(StatusUpdate update) {
        log.info("[status] {}{}: {}", update.source(),
                update.deviceId() != null ? " " + update.deviceId() : "", update.text());
        if (loop.isOnLoop()) {
            deliver(update);
        } else {
            loop.execute(() -> deliver(update));
        }
    }

    private void deliver(StatusUpdate update) {
        for (StatusObserver o : observers) {
            try {
                o.onStatus(update);
            } catch (RuntimeException e) {
                log.error("Status observer {} failed", o.getClass().getSimpleName(), e);
            }
        }
    }
}
