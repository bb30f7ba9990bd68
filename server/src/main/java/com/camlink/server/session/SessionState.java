/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.session;

/**
 * IDLE, then TRYING each candidate in order, then ACTIVE on the first success
 * or back to IDLE when all fail. ACTIVE returns to IDLE on disconnect or a fatal error.
 */
public enum SessionState {
    IDLE,
    TRYING,
    ACTIVE
}
