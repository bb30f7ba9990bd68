/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.ingestion;

/**
 * Entry point for the pub/sub delivery thread. Must not block or parse.
 */
@FunctionalInterface
public interface InboundSink {
    void enqueue(byte[] payload, String topic);
}
