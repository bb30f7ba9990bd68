/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.session;

import com.camlink.common.model.CandidateStrategy;

/**
 * Builds a connection for one candidate. May throw
 * {@link com.camlink.common.exception.ConnectionAttemptException} when the
 * candidate cannot even be constructed.
 */
@FunctionalInterface
public interface ConnectionFactory {
    Connection create(String deviceId, CandidateStrategy strategy);
}
