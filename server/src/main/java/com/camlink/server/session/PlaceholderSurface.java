/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.session;

/**
 * Stand-in used when a connection offers no embeddable surface,
 * e.g. a pipeline that opens its own window.
 */
public final class PlaceholderSurface implements DisplaySurface {

    public static final String MESSAGE = "Video playing in external window";

    @Override
    public String name() { return MESSAGE; }

    @Override
    public boolean isPlaceholder() { return true; }

    @Override
    public void release() {
        // nothing held
    }
}
