/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.messaging.core;

/**
 * Notified when an established broker connection drops unexpectedly.
 */
@FunctionalInterface
public interface ConnectionLossListener {
    void onConnectionLost(String brokerId, Throwable cause);
}
