/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.common.exception;

/**
 * The durable event store could not be opened, initialized or read.
 */
public class EventStoreException extends CamLinkException {

    public EventStoreException(String message, Throwable cause) {
        super("CAM_STORE", message, cause);
    }
}
