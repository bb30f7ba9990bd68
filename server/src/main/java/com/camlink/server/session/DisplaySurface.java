/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.session;

/**
 * Where an active stream is shown.
 */
public interface DisplaySurface {

    String name();

    /** True when the stream renders elsewhere (external window) and this is just a stand-in. */
    boolean isPlaceholder();

    void release();
}
