/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.session;

import com.camlink.common.model.CandidateStrategy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CameraCatalogTest {

    private static final List<CandidateStrategy> TEMPLATES = List.of(
            new CandidateStrategy("tcp {url}", "videosink"),
            new CandidateStrategy("auto {url}", null));

    @TempDir
    Path dir;

    private CameraCatalog load(String json) throws Exception {
        Path file = dir.resolve("cameras.json");
        Files.writeString(file, json);
        return CameraCatalog.load(file, TEMPLATES);
    }

    @Test
    void shouldExpandTemplatesThenFallback() throws Exception {
        CameraCatalog catalog = load("""
                {"cameras": {
                  "piir": {"name": "Shed", "url": "rtsp://a/1", "fallback_url": "rtsp://a/2"}
                }}
                """);

        List<String> pipelines = catalog.candidatesFor("piir").stream().map(CandidateStrategy::pipeline).toList();
        assertEquals(List.of("tcp rtsp://a/1", "auto rtsp://a/1", "tcp rtsp://a/2", "auto rtsp://a/2"), pipelines);
        assertEquals("Shed", catalog.displayName("piir"));
    }

    @Test
    void explicitStrategiesShouldReplaceTemplates() throws Exception {
        CameraCatalog catalog = load("""
                {"cameras": {
                  "door": {"url": "rtsp://door",
                           "strategies": [{"pipeline": "custom {url}", "sink_name": "s"}]}
                }}
                """);

        List<CandidateStrategy> candidates = catalog.candidatesFor("door");
        assertEquals(1, candidates.size());
        assertEquals("custom rtsp://door", candidates.get(0).pipeline());
        assertEquals("s", candidates.get(0).sinkName());
        assertEquals("door", catalog.displayName("door"));
    }

    @Test
    void templatesInFileShouldReplaceDefaults() throws Exception {
        CameraCatalog catalog = load("""
                {"templates": [{"pipeline": "only {url}", "sink_name": null}],
                 "cameras": {"piir": {"url": "rtsp://shed"}}}
                """);

        List<CandidateStrategy> candidates = catalog.candidatesFor("piir");
        assertEquals(List.of(new CandidateStrategy("only rtsp://shed", null)), candidates);
    }

    @Test
    void legacyStreamsKeyAndUnusableEntries() throws Exception {
        CameraCatalog catalog = load("""
                {"streams": {
                  "garage": {"url": "rtsp://garage"},
                  "broken": {"name": "No URL"}
                }}
                """);

        assertEquals(1, catalog.size());
        assertTrue(catalog.contains("garage"));
        assertFalse(catalog.contains("broken"));
    }

    @Test
    void testPatternAndUnknownDevices() {
        CameraCatalog catalog = new CameraCatalog(List.of(), TEMPLATES);

        assertTrue(catalog.contains(CameraCatalog.TEST_PATTERN_ID));
        assertEquals(CameraCatalog.TEST_PATTERN, catalog.candidatesFor(CameraCatalog.TEST_PATTERN_ID));
        assertEquals("Test Pattern", catalog.displayName(CameraCatalog.TEST_PATTERN_ID));
        assertTrue(catalog.candidatesFor("nope").isEmpty());
    }
}
