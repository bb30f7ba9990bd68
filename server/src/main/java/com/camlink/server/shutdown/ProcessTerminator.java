/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.shutdown;

/**
 * Ends the process when graceful teardown cannot finish.
 */
@FunctionalInterface
public interface ProcessTerminator {

    /** Halts the JVM immediately, skipping shutdown hooks. */
    ProcessTerminator HALT = status -> Runtime.getRuntime().halt(status);

    void terminate(int status);
}
