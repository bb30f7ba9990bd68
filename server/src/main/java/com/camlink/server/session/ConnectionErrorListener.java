/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.session;

/**
 * Asynchronous notification from a connection. Called on an arbitrary thread.
 */
@FunctionalInterface
public interface ConnectionErrorListener {

    /**
     * @param fatal true when the stream has ended and will not recover
     */
    void onError(Connection source, String message, boolean fatal);
}
