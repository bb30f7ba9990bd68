/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.session;

import com.camlink.common.exception.ConnectionAttemptException;
import com.camlink.common.model.CandidateStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Runs one candidate pipeline as an external launcher process.
 *
 * <p>Ready means the process started and is still alive after the probe window;
 * active means it is still alive when streaming is requested. Output lines are
 * forwarded to the log. If the process exits on its own after activation the
 * error listener receives a fatal error.</p>
 */
public class ProcessPipelineConnection implements Connection {

    private static final Logger log = LoggerFactory.getLogger(ProcessPipelineConnection.class);

    private final String deviceId;
    private final CandidateStrategy strategy;
    private final PipelineLauncher launcher;

    private Process process;
    private volatile boolean stopping;
    private volatile ConnectionErrorListener errorListener;

    public ProcessPipelineConnection(String deviceId, CandidateStrategy strategy, PipelineLauncher launcher) {
        if (strategy.pipeline() == null || strategy.pipeline().isBlank()) {
            throw new ConnectionAttemptException("Empty pipeline for " + deviceId);
        }
        this.deviceId = deviceId;
        this.strategy = strategy;
        this.launcher = launcher;
    }

    @Override
    public synchronized void setReady() {
        ProcessBuilder pb = new ProcessBuilder(launcher.commandLine(strategy.pipeline()));
        pb.environment().putAll(launcher.environment());
        pb.redirectErrorStream(false);
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new ConnectionAttemptException("Cannot start launcher for " + deviceId + ": " + e.getMessage(), e);
        }
        streamToLogger(process.getInputStream(), "pipeline-" + deviceId + "-stdout");
        streamToLogger(process.getErrorStream(), "pipeline-" + deviceId + "-stderr");

        try {
            if (process.waitFor(launcher.probeWindow().toMillis(), TimeUnit.MILLISECONDS)) {
                throw new ConnectionAttemptException(
                        "Pipeline for " + deviceId + " exited with code " + process.exitValue());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stop();
            throw new ConnectionAttemptException("Interrupted while probing pipeline for " + deviceId, e);
        }
        log.info("Pipeline for {} running (pid={})", deviceId, process.pid());
    }

    @Override
    public synchronized void setActive() {
        if (process == null || !process.isAlive()) {
            throw new ConnectionAttemptException("Pipeline for " + deviceId + " is not running");
        }
        process.onExit().thenAccept(p -> {
            if (stopping) return;
            ConnectionErrorListener l = errorListener;
            String msg = "Pipeline exited with code " + p.exitValue();
            log.warn("{} for {}", msg, deviceId);
            if (l != null) l.onError(this, msg, true);
        });
    }

    @Override
    public Optional<DisplaySurface> extractDisplaySurface() {
        String sink = strategy.sinkName();
        if (sink == null || !strategy.pipeline().contains("name=" + sink)) {
            return Optional.empty();
        }
        return Optional.of(new SinkSurface(sink));
    }

    @Override
    public void setErrorListener(ConnectionErrorListener listener) {
        this.errorListener = listener;
    }

    @Override
    public synchronized void stop() {
        stopping = true;
        if (process == null || !process.isAlive()) return;
        process.destroy();
        try {
            if (!process.waitFor(launcher.stopTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                process.waitFor();
                log.warn("Pipeline for {} force-killed", deviceId);
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
        }
        log.info("Pipeline for {} stopped", deviceId);
    }

    @Override
    public String describe() {
        return strategy.pipeline();
    }

    public boolean isAlive() {
        Process p = process;
        return p != null && p.isAlive();
    }

    private void streamToLogger(InputStream stream, String threadName) {
        Thread t = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    log.debug("[{}] {}", deviceId, line);
                }
            } catch (IOException e) {
                log.debug("[{}] output stream closed: {}", deviceId, e.getMessage());
            }
        }, threadName);
        t.setDaemon(true);
        t.start();
    }
}
