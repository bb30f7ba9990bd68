/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.shutdown;

public enum ShutdownState {
    IDLE,
    IN_PROGRESS,
    COMPLETED
}
