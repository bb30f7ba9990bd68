/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.pipeline;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Unbounded FIFO handed from producers to a single consumer thread.
 *
 * <p>The lock guards queue membership only; callers do their work after
 * {@link #take(Duration)} or {@link #drain(int, Duration)} return. A stop
 * request wakes a waiting consumer and takes priority over pending items:
 * once stopped, take and drain return nothing and whatever is left can be
 * collected with {@link #discardRemaining()}.</p>
 */
public class WorkQueue<T> {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmptyOrStopped = lock.newCondition();
    private final ArrayDeque<T> items = new ArrayDeque<>();
    private boolean stopRequested;

    public void put(T item) {
        lock.lock();
        try {
            items.addLast(item);
            notEmptyOrStopped.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wait up to {@code maxWait} for an item.
     *
     * @return the oldest item, or null on timeout or stop
     */
    public T take(Duration maxWait) throws InterruptedException {
        lock.lock();
        try {
            if (!awaitItems(maxWait)) return null;
            return items.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wait up to {@code maxWait} for items, then remove at most {@code max} of them in FIFO order.
     *
     * @return the drained items; empty on timeout or stop
     */
    public List<T> drain(int max, Duration maxWait) throws InterruptedException {
        lock.lock();
        try {
            if (!awaitItems(maxWait)) return Collections.emptyList();
            List<T> batch = new ArrayList<>(Math.min(max, items.size()));
            while (batch.size() < max && !items.isEmpty()) {
                batch.add(items.pollFirst());
            }
            return batch;
        } finally {
            lock.unlock();
        }
    }

    // Caller holds the lock.
    private boolean awaitItems(Duration maxWait) throws InterruptedException {
        long nanos = maxWait.toNanos();
        while (items.isEmpty() && !stopRequested) {
            if (nanos <= 0L) return false;
            nanos = notEmptyOrStopped.awaitNanos(nanos);
        }
        return !stopRequested;
    }

    public void stop() {
        lock.lock();
        try {
            stopRequested = true;
            notEmptyOrStopped.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isStopped() {
        lock.lock();
        try {
            return stopRequested;
        } finally {
            lock.unlock();
        }
    }

    /** Remove and return everything still queued. */
    public List<T> discardRemaining() {
        lock.lock();
        try {
            List<T> rest = new ArrayList<>(items);
            items.clear();
            return rest;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    /** Block until the queue is stopped or {@code timeout} elapses. Used for interruptible pauses. */
    public boolean awaitStop(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lock();
        try {
            while (!stopRequested) {
                if (nanos <= 0L) return false;
                nanos = notEmptyOrStopped.awaitNanos(nanos);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }
}
