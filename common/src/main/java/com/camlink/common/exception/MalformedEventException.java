/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.common.exception;

/**
 * Inbound event payload that cannot be turned into a {@code DeviceEvent}.
 */
public class MalformedEventException extends CamLinkException {

    public MalformedEventException(String message) {
        super("CAM_MALFORMED", message);
    }

    public MalformedEventException(String message, Throwable cause) {
        super("CAM_MALFORMED", message, cause);
    }
}
