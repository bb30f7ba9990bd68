/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.session;

import com.camlink.common.model.CandidateStrategy;

public class ProcessPipelineConnectionFactory implements ConnectionFactory {

    private final PipelineLauncher launcher;

    public ProcessPipelineConnectionFactory(PipelineLauncher launcher) {
        this.launcher = launcher;
    }

    @Override
    public Connection create(String deviceId, CandidateStrategy strategy) {
        return new ProcessPipelineConnection(deviceId, strategy, launcher);
    }
}
