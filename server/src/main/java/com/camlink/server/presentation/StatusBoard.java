/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.presentation;

import com.camlink.common.model.StatusUpdate;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Default observer: remembers the latest session status and a bounded history
 * of everything reported, newest first.
 */
public class StatusBoard implements StatusObserver {

    public static final int DEFAULT_HISTORY = 50;

    private final int capacity;
    private final Deque<StatusUpdate> history = new ArrayDeque<>();
    private StatusUpdate latestSession;

    public StatusBoard() { this(DEFAULT_HISTORY); }

    public StatusBoard(int capacity) {
        this.capacity = Math.max(1, capacity);
    }

    @Override
    public synchronized void onStatus(StatusUpdate update) {
        history.addFirst(update);
        while (history.size() > capacity) history.removeLast();
        if (update.source() == StatusUpdate.Source.SESSION) latestSession = update;
    }

    /** Latest session status, or null before the first one. */
    public synchronized StatusUpdate latestSession() { return latestSession; }

    public synchronized boolean isConnected() {
        return latestSession != null && latestSession.connected();
    }

    public synchronized List<StatusUpdate> recent() { return new ArrayList<>(history); }
}
