/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.common.config;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Application-wide property accessor for non-Spring POJOs.
 *
 * <p>Initialized once from the Spring environment at startup (via
 * {@code CamLinkPropertiesInitializer}) and then readable from any thread,
 * including pipeline connections and workers that Spring does not manage.</p>
 *
 * <pre>{@code
 *   Duration probe = CamLinkProperties.get().getDuration("camlink.pipeline.ready-probe", Duration.ofSeconds(2));
 *   Map<String, String> env = CamLinkProperties.get().getSubProperties("camlink.pipeline.env.");
 * }</pre>
 */
public final class CamLinkProperties {

    private static volatile CamLinkProperties INSTANCE;

    private final Map<String, String> properties;

    private CamLinkProperties(Map<String, String> properties) {
        this.properties = new ConcurrentHashMap<>(properties);
    }

    /**
     * Initialize the singleton. A second call merges the new values into the existing map.
     */
    public static synchronized void init(Map<String, String> props) {
        if (INSTANCE != null) {
            INSTANCE.properties.putAll(props);
            return;
        }
        INSTANCE = new CamLinkProperties(props);
    }

    /**
     * @throws IllegalStateException if Spring has not initialized the properties yet
     */
    public static CamLinkProperties get() {
        if (INSTANCE == null) {
            throw new IllegalStateException(
                "CamLinkProperties not initialized: Spring context has not started yet.");
        }
        return INSTANCE;
    }

    public static boolean isInitialized() {
        return INSTANCE != null;
    }

    // ─── Typed Getters ──────────────────────────────────────────────

    public String getString(String key, String defaultValue) {
        return properties.getOrDefault(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        String val = properties.get(key);
        if (val == null || val.isBlank()) return defaultValue;
        try { return Integer.parseInt(val.trim()); }
        catch (NumberFormatException e) { return defaultValue; }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String val = properties.get(key);
        if (val == null || val.isBlank()) return defaultValue;
        return "true".equalsIgnoreCase(val.trim());
    }

    /**
     * Parse a duration string: plain millis, {@code 500ms}, {@code 30s}, {@code 5m}, {@code 2h}
     * or ISO-8601 ({@code PT30S}).
     */
    public Duration getDuration(String key, Duration defaultValue) {
        String val = properties.get(key);
        if (val == null || val.isBlank()) return defaultValue;
        return parseDuration(val, defaultValue);
    }

    public static Duration parseDuration(String text, Duration defaultValue) {
        String val = text.trim().toLowerCase();
        try {
            if (val.startsWith("pt")) return Duration.parse(val.toUpperCase());
            if (val.endsWith("ms")) return Duration.ofMillis(Long.parseLong(val.replace("ms", "").trim()));
            if (val.endsWith("s"))  return Duration.ofSeconds(Long.parseLong(val.replace("s", "").trim()));
            if (val.endsWith("m"))  return Duration.ofMinutes(Long.parseLong(val.replace("m", "").trim()));
            if (val.endsWith("h"))  return Duration.ofHours(Long.parseLong(val.replace("h", "").trim()));
            return Duration.ofMillis(Long.parseLong(val));
        } catch (Exception e) {
            return defaultValue;
        }
    }

    /**
     * All properties under a prefix, prefix stripped.
     * <p>Example: {@code getSubProperties("camlink.pipeline.env.")} →
     * {@code {"GST_DEBUG" → "rtspsrc:4,rtsp:3"}}</p>
     */
    public Map<String, String> getSubProperties(String prefix) {
        return properties.entrySet().stream()
                .filter(e -> e.getKey().startsWith(prefix))
                .collect(Collectors.toMap(
                        e -> e.getKey().substring(prefix.length()),
                        Map.Entry::getValue,
                        (a, b) -> b,
                        LinkedHashMap::new
                ));
    }

    public int size() {
        return properties.size();
    }

    @Override
    public String toString() {
        return "CamLinkProperties{count=" + properties.size() + "}";
    }

    /**
     * Reset the singleton. <b>Only for unit tests.</b>
     */
    public static synchronized void reset() {
        INSTANCE = null;
    }
}
