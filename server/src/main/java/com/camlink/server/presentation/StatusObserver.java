/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.presentation;

import com.camlink.common.model.StatusUpdate;

/**
 * Receives human-readable connection and device status.
 */
@FunctionalInterface
public interface StatusObserver {
    void onStatus(StatusUpdate update);
}
