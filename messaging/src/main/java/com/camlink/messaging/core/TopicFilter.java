/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.messaging.core;

/**
 * MQTT-style topic filter matching. Levels are separated by {@code /},
 * {@code +} matches exactly one level and a trailing {@code #} matches the rest.
 */
public final class TopicFilter {

    private TopicFilter() {}

    public static boolean matches(String filter, String topic) {
        if (filter == null || topic == null) return false;
        String[] f = filter.split("/", -1);
        String[] t = topic.split("/", -1);
        for (int i = 0; i < f.length; i++) {
            if ("#".equals(f[i])) {
                return i == f.length - 1;
            }
            if (i >= t.length) return false;
            if (!"+".equals(f[i]) && !f[i].equals(t[i])) return false;
        }
        return f.length == t.length;
    }

    /** Returns the level at {@code index}, negative indexes counting from the end, or null. */
    public static String level(String topic, int index) {
        if (topic == null) return null;
        String[] parts = topic.split("/", -1);
        int i = index < 0 ? parts.length + index : index;
        return i >= 0 && i < parts.length ? parts[i] : null;
    }
}
