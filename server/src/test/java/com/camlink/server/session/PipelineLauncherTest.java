/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.session;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class PipelineLauncherTest {

    @Test
    void shouldSplitPipelineIntoArguments() {
        assertEquals(List.of("rtspsrc", "location=rtsp://cam/1", "!", "autovideosink"),
                PipelineLauncher.tokenize("rtspsrc  location=rtsp://cam/1 ! autovideosink"));
    }

    @Test
    void quotesShouldGroupValues() {
        assertEquals(List.of("textoverlay", "text=hello world", "!", "x", "a=b c"),
                PipelineLauncher.tokenize("textoverlay text=\"hello world\" ! x 'a=b c'"));
        assertEquals(List.of(""), PipelineLauncher.tokenize("\"\""));
    }

    @Test
    void commandLineShouldPrefixLauncher() {
        PipelineLauncher launcher = new PipelineLauncher(List.of("launch", "-v"), Map.of(),
                Duration.ofMillis(10), Duration.ofMillis(10));

        assertEquals(List.of("launch", "-v", "videotestsrc", "!", "fakesink"),
                launcher.commandLine("videotestsrc ! fakesink"));
        assertEquals(PipelineLauncher.DEFAULT_COMMAND, PipelineLauncher.defaults().command());
    }
}
