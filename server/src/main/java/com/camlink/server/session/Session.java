/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.session;

import com.camlink.common.model.CandidateStrategy;

import java.time.Instant;

/**
 * The single active stream.
 *
 * @param strategyIndex zero-based index of the candidate that succeeded
 */
public record Session(String deviceId,
                      int strategyIndex,
                      CandidateStrategy strategy,
                      Connection connection,
                      DisplaySurface surface,
                      Instant connectedAt) {
}
