/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.ingestion;

import com.camlink.common.exception.MalformedEventException;
import com.camlink.common.model.DeviceEvent;
import com.camlink.common.util.JsonUtil;
import com.camlink.messaging.core.TopicFilter;
import com.fasterxml.jackson.databind.JsonNode;

import java.nio.charset.StandardCharsets;

/**
 * Turns an event payload into a {@link DeviceEvent}.
 *
 * <p>Accepted shape, unknown fields ignored:</p>
 * <pre>
 * {"type":"motion_detected","camera_type":"piir","camera_name":"piir - Shed",
 *  "timestamp":"2025-01-31 14:02:11","video_path":"/videos/piir_20250131_140211.mp4",
 *  "viewed":false}
 * </pre>
 * <p>Device id comes from {@code device_id}, {@code camera_type} or {@code camera_name},
 * else from the topic level before {@code events}. The artifact comes from
 * {@code artifact_reference} or {@code video_path}.</p>
 */
public final class EventPayloadParser {

    private static final String[] DEVICE_FIELDS = {"device_id", "camera_type", "camera_name"};
    private static final String[] ARTIFACT_FIELDS = {"artifact_reference", "video_path"};

    private EventPayloadParser() {}

    public static DeviceEvent parse(byte[] payload, String topic) {
        String text = payload == null ? "" : new String(payload, StandardCharsets.UTF_8);
        JsonNode node = JsonUtil.readTreeOrNull(text);
        if (node == null || !node.isObject()) {
            throw new MalformedEventException("Payload is not a JSON object");
        }

        String deviceId = firstText(node, DEVICE_FIELDS);
        if (deviceId == null) deviceId = deviceFromTopic(topic);
        if (deviceId == null) {
            throw new MalformedEventException("No device id in payload or topic '" + topic + "'");
        }

        JsonNode ts = node.get("timestamp");
        String timestamp = ts == null || ts.isNull() ? null
                : ts.isNumber() ? ts.asText() : ts.asText().trim();
        if (timestamp == null || timestamp.isEmpty()) {
            throw new MalformedEventException("Missing timestamp");
        }

        String artifact = firstText(node, ARTIFACT_FIELDS);
        if (artifact == null) {
            throw new MalformedEventException("Missing artifact reference");
        }

        return new DeviceEvent(deviceId, timestamp, artifact, viewedFlag(node.get("viewed")));
    }

    private static String firstText(JsonNode node, String[] fields) {
        for (String f : fields) {
            JsonNode v = node.get(f);
            if (v != null && v.isValueNode() && !v.isNull()) {
                String s = v.asText().trim();
                if (!s.isEmpty()) return s;
            }
        }
        return null;
    }

    private static boolean viewedFlag(JsonNode v) {
        if (v == null || v.isNull()) return false;
        if (v.isBoolean()) return v.booleanValue();
        if (v.isNumber()) return v.intValue() != 0;
        return "true".equalsIgnoreCase(v.asText().trim());
    }

    static String deviceFromTopic(String topic) {
        String device = TopicFilter.level(topic, -2);
        return device == null || device.isBlank() ? null : device;
    }
}
