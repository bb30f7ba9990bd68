/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.web.lifecycle;

import com.camlink.server.shutdown.ProcessTerminator;
import com.camlink.server.shutdown.ShutdownCoordinator;
import com.camlink.server.shutdown.ShutdownPhase;
import com.camlink.server.shutdown.ShutdownState;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationContext;
import org.springframework.context.event.ContextClosedEvent;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ShutdownOrchestratorTest {

    @Test
    void restShutdownShouldTearDownThenExitOnce() {
        ShutdownCoordinator coordinator = mock(ShutdownCoordinator.class);
        ApplicationContext context = mock(ApplicationContext.class);
        ShutdownOrchestrator orchestrator = new ShutdownOrchestrator(coordinator, context);
        AtomicReference<Integer> exitCode = new AtomicReference<>();
        orchestrator.setJvmExit(exitCode::set);

        assertTrue(orchestrator.requestShutdown());
        assertFalse(orchestrator.requestShutdown());

        await().atMost(Duration.ofSeconds(2)).until(() -> exitCode.get() != null);
        assertEquals(0, exitCode.get());
        verify(coordinator, times(1)).shutdown();
    }

    @Test
    void contextCloseShouldRunTeardownForOwnContextOnly() {
        ShutdownCoordinator coordinator = mock(ShutdownCoordinator.class);
        ApplicationContext context = mock(ApplicationContext.class);
        ShutdownOrchestrator orchestrator = new ShutdownOrchestrator(coordinator, context);

        orchestrator.onContextClosed(new ContextClosedEvent(mock(ApplicationContext.class)));
        verify(coordinator, never()).shutdown();

        orchestrator.onContextClosed(new ContextClosedEvent(context));
        verify(coordinator).shutdown();
    }

    @Test
    void signalDuringTeardownShouldForceTermination() throws Exception {
        ProcessTerminator terminator = mock(ProcessTerminator.class);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ShutdownCoordinator coordinator = new ShutdownCoordinator(List.of(
                new ShutdownPhase("join", "blocks like a stuck worker join", () -> {
                    entered.countDown();
                    release.await(5, TimeUnit.SECONDS);
                })), Duration.ofSeconds(30), terminator);
        ApplicationContext context = mock(ApplicationContext.class);
        ShutdownOrchestrator orchestrator = new ShutdownOrchestrator(coordinator, context);

        Thread hook = new Thread(() -> orchestrator.onContextClosed(new ContextClosedEvent(context)),
                "test-shutdown-hook");
        hook.start();
        assertTrue(entered.await(2, TimeUnit.SECONDS));
        assertEquals(ShutdownState.IN_PROGRESS, coordinator.state());

        AtomicBoolean passedOn = new AtomicBoolean(false);
        orchestrator.onSignal("INT", () -> passedOn.set(true));

        verify(terminator).terminate(ShutdownCoordinator.FORCED_EXIT_STATUS);
        assertFalse(passedOn.get());

        release.countDown();
        hook.join(2000);
        assertEquals(ShutdownState.COMPLETED, coordinator.state());
    }

    @Test
    void signalOutsideTeardownShouldPassToPreviousHandler() {
        ProcessTerminator terminator = mock(ProcessTerminator.class);
        ShutdownCoordinator coordinator = new ShutdownCoordinator(List.of(), Duration.ofSeconds(5), terminator);
        ShutdownOrchestrator orchestrator = new ShutdownOrchestrator(coordinator, mock(ApplicationContext.class));

        AtomicBoolean passedOn = new AtomicBoolean(false);
        orchestrator.onSignal("TERM", () -> passedOn.set(true));

        assertTrue(passedOn.get());
        assertEquals(ShutdownState.IDLE, coordinator.state());
        verifyNoInteractions(terminator);
    }
}
