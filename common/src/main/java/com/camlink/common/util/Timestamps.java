/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.common.util;

import java.time.*;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Parses the timestamp text cameras put into their event payloads.
 *
 * <p>Accepted shapes, tried in order:</p>
 * <ul>
 *   <li>{@code 2025-01-31 14:02:11}: local wall-clock time (what the cameras send)</li>
 *   <li>{@code 2025-01-31T14:02:11Z}, {@code 2025-01-31T14:02:11+01:00}: ISO-8601 with offset</li>
 *   <li>{@code 2025-01-31T14:02:11}: ISO-8601 local</li>
 *   <li>{@code 20250131_140211}: the clip file-name stamp</li>
 *   <li>{@code 1738332131} / {@code 1738332131000}: epoch seconds or millis</li>
 * </ul>
 */
public final class Timestamps {

    public static final DateTimeFormatter EVENT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final DateTimeFormatter CLIP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final List<DateTimeFormatter> LOCAL_FORMATS = List.of(
            EVENT_FORMAT, DateTimeFormatter.ISO_LOCAL_DATE_TIME, CLIP_FORMAT);

    private Timestamps() {}

    /**
     * @return the instant, or empty when the text matches none of the accepted shapes
     */
    public static Optional<Instant> parse(String text, ZoneId zone) {
        if (text == null) return Optional.empty();
        String value = text.trim();
        if (value.isEmpty()) return Optional.empty();

        if (value.chars().allMatch(Character::isDigit)) {
            try {
                long epoch = Long.parseLong(value);
                return Optional.of(value.length() > 10 ? Instant.ofEpochMilli(epoch) : Instant.ofEpochSecond(epoch));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }

        Optional<Instant> withOffset = attempt(() -> OffsetDateTime.parse(value).toInstant());
        if (withOffset.isPresent()) return withOffset;

        for (DateTimeFormatter format : LOCAL_FORMATS) {
            Optional<Instant> local = attempt(() -> LocalDateTime.parse(value, format).atZone(zone).toInstant());
            if (local.isPresent()) return local;
        }
        return Optional.empty();
    }

    private static Optional<Instant> attempt(Supplier<Instant> parser) {
        try {
            return Optional.of(parser.get());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /** Format an instant the way cameras stamp their events. */
    public static String format(Instant instant, ZoneId zone) {
        return EVENT_FORMAT.format(instant.atZone(zone));
    }
}
