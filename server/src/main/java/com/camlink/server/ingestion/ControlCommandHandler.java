/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.ingestion;

/**
 * Executes control commands received over pub/sub.
 */
@FunctionalInterface
public interface ControlCommandHandler {
    void onCommand(ControlCommand command, String deviceId);
}
