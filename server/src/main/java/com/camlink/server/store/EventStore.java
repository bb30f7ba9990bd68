/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.store;

import com.camlink.common.model.DeviceEvent;

import java.util.List;

/**
 * Durable system of record for device events.
 * Failures of individual operations are reported through the return value and logged.
 */
public interface EventStore extends AutoCloseable {

    /** @return true when the event was committed */
    boolean append(DeviceEvent event);

    /** All stored events, newest timestamp first. */
    List<DeviceEvent> findAllNewestFirst();

    /** @return true when at least one matching row was updated */
    boolean markViewed(String deviceId, String timestamp, String artifactReference);

    long count();

    @Override
    void close();
}
