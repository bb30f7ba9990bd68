/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.session;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Surface provided by a named sink element of a pipeline.
 */
public class SinkSurface implements DisplaySurface {

    private final String sinkName;
    private final AtomicBoolean released = new AtomicBoolean();

    public SinkSurface(String sinkName) {
        this.sinkName = sinkName;
    }

    @Override
    public String name() { return sinkName; }

    @Override
    public boolean isPlaceholder() { return false; }

    @Override
    public void release() { released.set(true); }

    public boolean isReleased() { return released.get(); }
}
