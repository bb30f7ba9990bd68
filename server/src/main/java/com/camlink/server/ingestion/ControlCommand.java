/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.ingestion;

import com.camlink.common.util.JsonUtil;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;
import java.util.Optional;

/**
 * Commands accepted on the control topic, either as plain text
 * ({@code connect}) or JSON ({@code {"command":"connect"}}).
 */
public enum ControlCommand {
    CONNECT,
    DISCONNECT,
    SNAPSHOT;

    public static Optional<ControlCommand> parse(String payload) {
        if (payload == null) return Optional.empty();
        String text = payload.trim();
        JsonNode node = text.startsWith("{") ? JsonUtil.readTreeOrNull(text) : null;
        if (node != null) {
            JsonNode cmd = node.has("command") ? node.get("command") : node.get("action");
            text = cmd != null && cmd.isTextual() ? cmd.asText() : "";
        }
        return switch (text.trim().toLowerCase(Locale.ROOT)) {
            case "connect" -> Optional.of(CONNECT);
            case "disconnect" -> Optional.of(DISCONNECT);
            case "snapshot" -> Optional.of(SNAPSHOT);
            default -> Optional.empty();
        };
    }
}
