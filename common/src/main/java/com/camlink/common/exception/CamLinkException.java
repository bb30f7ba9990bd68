/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.common.exception;

/**
 * Base exception for all CamLink errors.
 */
public class CamLinkException extends RuntimeException {
    private final String errorCode;

    public CamLinkException(String message) {
        super(message);
        this.errorCode = "CAM_GENERIC";
    }

    public CamLinkException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public CamLinkException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() { return errorCode; }
}
