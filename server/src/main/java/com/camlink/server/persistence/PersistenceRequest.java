/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.persistence;

import com.camlink.common.model.DeviceEvent;

/**
 * One unit of work for the batch writer.
 */
public record PersistenceRequest(Kind kind, DeviceEvent event) {

    public enum Kind { INSERT, MARK_VIEWED }

    public static PersistenceRequest insert(DeviceEvent event) {
        return new PersistenceRequest(Kind.INSERT, event);
    }

    public static PersistenceRequest markViewed(DeviceEvent event) {
        return new PersistenceRequest(Kind.MARK_VIEWED, event);
    }
}
