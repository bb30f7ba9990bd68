/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * A named consumer thread draining a {@link WorkQueue}.
 * Stop is cooperative: {@link #requestStop()} flips the queue's stop signal,
 * the loop notices it and {@link #join()} waits for the thread to finish.
 */
public abstract class BackgroundWorker<T> {

    protected final Logger log = LoggerFactory.getLogger(getClass());
    protected final WorkQueue<T> queue;
    private final String name;
    private volatile Thread thread;

    protected BackgroundWorker(String name, WorkQueue<T> queue) {
        this.name = name;
        this.queue = queue;
    }

    public synchronized void start() {
        if (thread != null) {
            log.warn("{} already started", name);
            return;
        }
        Thread t = new Thread(this::runLoop, name);
        t.setDaemon(true);
        thread = t;
        t.start();
        log.info("{} started", name);
    }

    private void runLoop() {
        try {
            while (!queue.isStopped()) {
                pollOnce();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{} interrupted", name);
        } catch (RuntimeException e) {
            log.error("{} terminated by unexpected error", name, e);
        } finally {
            onStopped(queue.discardRemaining());
            log.info("{} stopped", name);
        }
    }

    /** Wait for work (bounded) and process it. Returns on timeout so the stop flag is re-checked. */
    protected abstract void pollOnce() throws InterruptedException;

    /** Called on the worker thread with the items left behind at stop. */
    protected abstract void onStopped(List<T> undrained);

    public void requestStop() {
        queue.stop();
    }

    /** Wait for the worker thread to exit. No timeout; the shutdown deadline bounds it. */
    public void join() throws InterruptedException {
        Thread t = thread;
        if (t != null && t != Thread.currentThread()) {
            t.join();
        }
    }

    public boolean isRunning() {
        Thread t = thread;
        return t != null && t.isAlive();
    }

    public int queueDepth() { return queue.size(); }

    public String getName() { return name; }
}
