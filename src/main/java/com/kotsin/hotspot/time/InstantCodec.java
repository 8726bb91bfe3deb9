package com.kotsin.hotspot.time;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * The single parse/format pair for instants on the wire.
 *
 * Formats as ISO-8601 UTC ("2026-01-30T09:45:00Z"). Parses ISO instants and
 * offset date-times; anything else is reported as empty rather than thrown.
 */
public final class InstantCodec {

    private InstantCodec() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static String format(Instant instant) {
        return instant == null ? null : DateTimeFormatter.ISO_INSTANT.format(instant);
    }

    public static Optional<Instant> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(OffsetDateTime.parse(text.trim()).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
