/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.common.exception;

/**
 * Thrown when a single candidate connection strategy cannot be constructed
 * or cannot reach the requested state. Recovered by trying the next candidate.
 */
public class ConnectionAttemptException extends CamLinkException {

    public ConnectionAttemptException(String message) {
        super("CAM_CONNECT", message);
    }

    public ConnectionAttemptException(String message, Throwable cause) {
        super("CAM_CONNECT", message, cause);
    }
}
