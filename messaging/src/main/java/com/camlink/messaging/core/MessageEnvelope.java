/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.messaging.core;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.UUID;

/**
 * Raw message as it traverses the pub/sub layer: the concrete topic it was
 * published on plus the undecoded payload bytes.
 */
public class MessageEnvelope {

    private String messageId;
    private final String topic;
    private final byte[] payload;
    private Map<String, String> headers = Collections.emptyMap();
    private final Instant timestamp;

    public MessageEnvelope(String topic, byte[] payload) {
        this.timestamp = Instant.now();
        this.messageId = UUID.randomUUID().toString();
        this.topic = topic;
        this.payload = payload;
    }

    public static MessageEnvelope ofText(String topic, String text) {
        return new MessageEnvelope(topic, text == null ? new byte[0] : text.getBytes(StandardCharsets.UTF_8));
    }

    public String getMessageId() { return messageId; }
    public void setMessageId(String messageId) { this.messageId = messageId; }
    public String getTopic() { return topic; }
    public byte[] getPayload() { return payload; }
    public Map<String, String> getHeaders() { return headers; }
    public void setHeaders(Map<String, String> headers) { this.headers = headers == null ? Collections.emptyMap() : headers; }
    public Instant getTimestamp() { return timestamp; }

    public String getPayloadText() {
        return payload == null ? "" : new String(payload, StandardCharsets.UTF_8);
    }

    public int getPayloadSize() { return payload == null ? 0 : payload.length; }
}
