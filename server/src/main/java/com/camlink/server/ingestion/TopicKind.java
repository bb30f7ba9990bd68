/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.ingestion;

import java.util.Locale;

/**
 * What an inbound message is, judged by the shape of its topic.
 */
public enum TopicKind {
    EVENT,
    STATUS,
    ALERT,
    CONTROL,
    UNKNOWN;

    public static TopicKind classify(String topic) {
        if (topic == null || topic.isBlank()) return UNKNOWN;
        String[] levels = topic.toLowerCase(Locale.ROOT).split("/");
        for (String level : levels) {
            if ("control".equals(level)) return CONTROL;
        }
        return switch (levels[levels.length - 1]) {
            case "events", "event" -> EVENT;
            case "status" -> STATUS;
            case "alert", "alerts" -> ALERT;
            default -> UNKNOWN;
        };
    }
}
