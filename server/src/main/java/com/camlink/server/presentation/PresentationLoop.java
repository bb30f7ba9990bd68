/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.presentation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * The single controlling context. Status callbacks, read-model refreshes and
 * session commands all run here, one at a time, in submission order.
 */
public class PresentationLoop implements Executor {

    private static final Logger log = LoggerFactory.getLogger(PresentationLoop.class);
    public static final String THREAD_NAME = "presentation-loop";

    private final ExecutorService executor;
    private volatile Thread loopThread;

    public PresentationLoop() {
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, THREAD_NAME);
            t.setDaemon(true);
            loopThread = t;
            return t;
        });
    }

    /** Post a task. Tasks posted after shutdown are dropped with a warning. */
    @Override
    public void execute(Runnable task) {
        try {
            executor.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.error("Presentation task failed", e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Presentation loop stopped; task dropped");
        }
    }

    /** Run a task on the loop and complete the future with its result. */
    public <T> CompletableFuture<T> submit(Callable<T> task) {
        if (isOnLoop()) {
            try {
                return CompletableFuture.completedFuture(task.call());
            } catch (Exception e) {
                return CompletableFuture.failedFuture(e);
            }
        }
        CompletableFuture<T> result = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                try {
                    result.complete(task.call());
                } catch (Exception e) {
                    result.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(new IllegalStateException("Presentation loop stopped", e));
        }
        return result;
    }

    public boolean isOnLoop() {
        return Thread.currentThread() == loopThread;
    }

    /** Stop accepting tasks and let queued ones finish within {@code grace}. */
    public void shutdown(Duration grace) throws InterruptedException {
        executor.shutdown();
        if (!executor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
            log.warn("Presentation loop did not drain within {} ms; cancelling", grace.toMillis());
            executor.shutdownNow();
        }
    }

    public boolean isShutdown() { return executor.isShutdown(); }
}
