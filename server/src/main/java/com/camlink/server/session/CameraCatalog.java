/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.session;

import com.camlink.common.model.CameraConfig;
import com.camlink.common.model.CandidateStrategy;
import com.camlink.common.util.JsonUtil;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Known cameras and the ordered candidate strategies for each.
 *
 * <p>A camera either lists its own strategies or gets the default templates
 * with its {@code url} substituted, followed by the same templates for its
 * {@code fallback_url} when one is set. The pseudo-device {@value #TEST_PATTERN_ID}
 * always resolves to a local test-pattern source.</p>
 */
public class CameraCatalog {

    private static final Logger log = LoggerFactory.getLogger(CameraCatalog.class);

    public static final String TEST_PATTERN_ID = "test";

    /** Most robust first: TCP with embedded sink, UDP with embedded sink, auto-decoding in its own window. */
    public static final List<CandidateStrategy> DEFAULT_TEMPLATES = List.of(
            new CandidateStrategy("rtspsrc location={url} protocols=tcp latency=200 ! rtph264depay ! h264parse"
                    + " ! avdec_h264 ! videoconvert ! gtksink name=videosink sync=false", "videosink"),
            new CandidateStrategy("rtspsrc location={url} protocols=udp latency=200 ! rtph264depay ! h264parse"
                    + " ! avdec_h264 ! videoconvert ! gtksink name=videosink sync=false", "videosink"),
            new CandidateStrategy("uridecodebin uri={url} ! videoconvert ! autovideosink sync=false", null));

    public static final List<CandidateStrategy> TEST_PATTERN = List.of(
            new CandidateStrategy("videotestsrc pattern=smpte ! video/x-raw,width=320,height=240,framerate=30/1"
                    + " ! videoconvert ! gtksink name=videosink", "videosink"),
            new CandidateStrategy("videotestsrc pattern=smpte ! videoconvert ! autovideosink", null));

    private final Map<String, CameraConfig> cameras = new LinkedHashMap<>();
    private final List<CandidateStrategy> templates;

    public CameraCatalog(Collection<CameraConfig> cameras, List<CandidateStrategy> templates) {
        for (CameraConfig c : cameras) {
            this.cameras.put(c.getId(), c);
        }
        this.templates = List.copyOf(templates);
    }

    public CameraCatalog(Collection<CameraConfig> cameras) {
        this(cameras, DEFAULT_TEMPLATES);
    }

    /**
     * Load {@code {"cameras": {"<id>": {...}}}} (or the older {@code "streams"} key).
     * Entries without a url and without strategies are skipped. A top-level
     * {@code "templates"} array replaces {@code templates}.
     */
    public static CameraCatalog load(Path file, List<CandidateStrategy> templates) throws IOException {
        return fromJson(Files.readString(file), templates, file.toString());
    }

    /** Same as {@link #load(Path, List)} for content that did not come from a file. */
    public static CameraCatalog fromJson(String json, List<CandidateStrategy> templates, String source)
            throws IOException {
        JsonNode root = JsonUtil.mapper().readTree(json);
        JsonNode section = root.has("cameras") ? root.get("cameras") : root.get("streams");
        JsonNode templateNode = root.get("templates");
        if (templateNode != null && templateNode.isArray() && templateNode.size() > 0) {
            templates = List.of(JsonUtil.mapper().treeToValue(templateNode, CandidateStrategy[].class));
            log.info("Using {} strategy template(s) from {}", templates.size(), source);
        }
        List<CameraConfig> list = new ArrayList<>();
        if (section != null && section.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = section.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                CameraConfig cfg = JsonUtil.mapper().treeToValue(entry.getValue(), CameraConfig.class);
                if (cfg.getId() == null) cfg.setId(entry.getKey());
                if (cfg.getUrl() == null && cfg.getStrategies().isEmpty()) {
                    log.warn("Camera '{}' has neither url nor strategies; skipped", entry.getKey());
                    continue;
                }
                list.add(cfg);
            }
        }
        log.info("Loaded {} camera(s) from {}", list.size(), source);
        return new CameraCatalog(list, templates);
    }

    public Optional<CameraConfig> find(String deviceId) {
        return Optional.ofNullable(cameras.get(deviceId));
    }

    public Collection<CameraConfig> all() {
        return Collections.unmodifiableCollection(cameras.values());
    }

    public boolean contains(String deviceId) {
        return cameras.containsKey(deviceId) || TEST_PATTERN_ID.equals(deviceId);
    }

    public String displayName(String deviceId) {
        if (TEST_PATTERN_ID.equals(deviceId) && !cameras.containsKey(deviceId)) return "Test Pattern";
        return find(deviceId).map(CameraConfig::getName).orElse(deviceId);
    }

    /** Ordered candidates for a device; empty when the device is unknown. */
    public List<CandidateStrategy> candidatesFor(String deviceId) {
        CameraConfig cfg = cameras.get(deviceId);
        if (cfg == null) {
            return TEST_PATTERN_ID.equals(deviceId) ? TEST_PATTERN : List.of();
        }
        List<CandidateStrategy> result = new ArrayList<>();
        if (!cfg.getStrategies().isEmpty()) {
            for (CandidateStrategy s : cfg.getStrategies()) {
                result.add(cfg.getUrl() != null ? s.forUrl(cfg.getUrl()) : s);
            }
            return List.copyOf(result);
        }
        templates.forEach(t -> result.add(t.forUrl(cfg.getUrl())));
        if (cfg.getFallbackUrl() != null && !cfg.getFallbackUrl().isBlank()) {
            templates.forEach(t -> result.add(t.forUrl(cfg.getFallbackUrl())));
        }
        return List.copyOf(result);
    }

    public int size() { return cameras.size(); }
}
