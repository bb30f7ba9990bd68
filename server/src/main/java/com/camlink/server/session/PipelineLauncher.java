/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.session;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * How pipeline text becomes a process: the launcher command, extra environment
 * and the timing used to decide whether a pipeline came up.
 *
 * @param command     launcher and its options, e.g. {@code gst-launch-1.0 -q}
 * @param environment added to the child's environment, e.g. {@code GST_DEBUG}
 * @param probeWindow how long the process must stay alive to count as ready
 * @param stopTimeout grace period after a polite stop before the process is killed
 */
public record PipelineLauncher(List<String> command,
                               Map<String, String> environment,
                               Duration probeWindow,
                               Duration stopTimeout) {

    public static final List<String> DEFAULT_COMMAND = List.of("gst-launch-1.0", "-q");

    public PipelineLauncher {
        command = List.copyOf(command);
        environment = Map.copyOf(environment);
    }

    public static PipelineLauncher defaults() {
        return new PipelineLauncher(DEFAULT_COMMAND, Map.of("GST_DEBUG", "rtspsrc:4,rtsp:3"),
                Duration.ofSeconds(2), Duration.ofSeconds(3));
    }

    /** Launcher command followed by the pipeline split into arguments. */
    public List<String> commandLine(String pipeline) {
        List<String> cmd = new ArrayList<>(command);
        cmd.addAll(tokenize(pipeline));
        return cmd;
    }

    /** Split on whitespace; single or double quotes group a value that contains spaces. */
    static List<String> tokenize(String pipeline) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;
        boolean inToken = false;
        for (char c : pipeline.toCharArray()) {
            if (quote != 0) {
                if (c == quote) quote = 0;
                else current.append(c);
            } else if (c == '"' || c == '\'') {
                quote = c;
                inToken = true;
            } else if (Character.isWhitespace(c)) {
                if (inToken) {
                    tokens.add(current.toString());
                    current.setLength(0);
                    inToken = false;
                }
            } else {
                current.append(c);
                inToken = true;
            }
        }
        if (inToken) tokens.add(current.toString());
        return tokens;
    }
}
