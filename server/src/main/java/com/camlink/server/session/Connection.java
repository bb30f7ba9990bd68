/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.session;

import com.camlink.common.exception.ConnectionAttemptException;

import java.util.Optional;

/**
 * One attempt at opening a stream with a single candidate strategy.
 * What happens inside is opaque to the session manager: it only sees success or failure.
 */
public interface Connection {

    /** Prepare the stream. Throws when this candidate cannot be used. */
    void setReady() throws ConnectionAttemptException;

    /** Start streaming. Throws when this candidate cannot be used. */
    void setActive() throws ConnectionAttemptException;

    /** The surface the stream renders into, if this connection provides one. */
    Optional<DisplaySurface> extractDisplaySurface();

    /** Register for asynchronous errors reported after activation. */
    void setErrorListener(ConnectionErrorListener listener);

    /** Stop synchronously and release resources. Safe to call more than once. */
    void stop();

    String describe();
}
