/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.web.lifecycle;

import com.camlink.server.shutdown.ShutdownCoordinator;
import com.camlink.server.shutdown.ShutdownState;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import sun.misc.Signal;
import sun.misc.SignalHandler;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntConsumer;

/**
 * Connects process-level shutdown to the {@link ShutdownCoordinator}.
 *
 * <p>The first SIGINT/SIGTERM closes the Spring context through the JVM shutdown
 * hook, which lands in {@link #onContextClosed}. A REST shutdown request runs the
 * teardown on its own thread, then closes the context and exits the JVM.</p>
 *
 * <p>INT and TERM handlers are installed in front of the JVM's own. While a
 * teardown is in progress a signal goes straight to the coordinator as a second
 * call, which forces termination; the JVM handler would only block behind the
 * running shutdown hooks. Otherwise the signal is passed on to the previous
 * handler.</p>
 */
@Component
public class ShutdownOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ShutdownOrchestrator.class);
    private static final String[] SIGNALS = {"INT", "TERM"};

    private final ShutdownCoordinator coordinator;
    private final ApplicationContext context;
    private final AtomicBoolean requested = new AtomicBoolean(false);
    private IntConsumer jvmExit = System::exit;

    public ShutdownOrchestrator(ShutdownCoordinator coordinator, ApplicationContext context) {
        this.coordinator = coordinator;
        this.context = context;
    }

    @PostConstruct
    public void installSignalHandlers() {
        for (String name : SIGNALS) {
            try {
                Signal signal = new Signal(name);
                SignalHandler[] previous = new SignalHandler[1];
                previous[0] = Signal.handle(signal, sig -> onSignal(sig.getName(), () -> chain(previous[0], sig)));
                log.debug("Installed SIG{} handler", name);
            } catch (IllegalArgumentException e) {
                log.warn("SIG{} handler not installed: {}", name, e.getMessage());
            }
        }
    }

    /**
     * Forces termination while a teardown is running, otherwise hands the
     * signal to {@code passOn}.
     */
    void onSignal(String name, Runnable passOn) {
        if (coordinator.state() == ShutdownState.IN_PROGRESS) {
            log.warn("SIG{} received during teardown", name);
            coordinator.shutdown();
            return;
        }
        passOn.run();
    }

    private void chain(SignalHandler previous, Signal sig) {
        if (previous == SignalHandler.SIG_IGN) return;
        if (previous == null || previous == SignalHandler.SIG_DFL) {
            jvmExit.accept(128 + sig.getNumber());
            return;
        }
        previous.handle(sig);
    }

    @EventListener(ContextClosedEvent.class)
    public void onContextClosed(ContextClosedEvent event) {
        if (event.getApplicationContext() != context) return;
        log.info("Application context closing, running pipeline teardown");
        coordinator.shutdown();
    }

    /** @return false when a shutdown request was already accepted */
    public boolean requestShutdown() {
        if (!requested.compareAndSet(false, true)) {
            log.info("Shutdown already requested");
            return false;
        }
        Thread t = new Thread(() -> {
            coordinator.shutdown();
            int code = SpringApplication.exit(context, () -> 0);
            jvmExit.accept(code);
        }, "rest-shutdown");
        t.start();
        return true;
    }

    public ShutdownState state() {
        return coordinator.state();
    }

    void setJvmExit(IntConsumer jvmExit) {
        this.jvmExit = jvmExit;
    }
}
