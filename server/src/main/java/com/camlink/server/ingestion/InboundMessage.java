/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.ingestion;

import java.time.Instant;

/**
 * Raw pub/sub delivery as queued by the delivery thread. Nothing is parsed yet.
 */
public record InboundMessage(byte[] payload, String topic, Instant receivedAt) {
}
