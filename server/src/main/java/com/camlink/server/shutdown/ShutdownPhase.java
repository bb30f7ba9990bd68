/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.shutdown;

/**
 * One named step of the teardown sequence.
 */
public record ShutdownPhase(String title, String description, Action action) {

    @FunctionalInterface
    public interface Action {
        void run() throws Exception;
    }
}
