package com.kotsin.hotspot.time;

import com.kotsin.hotspot.model.DetectionPoint;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * TemporalWindow - Turns sensor acquisition date/time pairs into instants and
 * computes the observation window of a group of detections.
 *
 * Time tokens are 1-4 digits with no separator, zero-padded to HHmm:
 * "945" → 09:45, "5" → 00:05, "1230" → 12:30. A missing token means UTC midnight.
 */
public final class TemporalWindow {

    private static final Pattern TIME_TOKEN = Pattern.compile("\\d{1,4}");

    private TemporalWindow() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Parse one detection's acquisition instant.
     *
     * @return empty when the date is missing or either part is malformed
     */
    public static Optional<Instant> acquisitionInstant(String date, String time) {
        if (date == null || date.isBlank()) {
            return Optional.empty();
        }

        LocalDate day;
        try {
            day = LocalDate.parse(date.trim());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }

        if (time == null || time.isBlank()) {
            return Optional.of(day.atStartOfDay(ZoneOffset.UTC).toInstant());
        }

        String token = time.trim();
        if (!TIME_TOKEN.matcher(token).matches()) {
            return Optional.empty();
        }

        String padded = "0".repeat(4 - token.length()) + token;
        int hour = Integer.parseInt(padded.substring(0, 2));
        int minute = Integer.parseInt(padded.substring(2, 4));
        if (hour > 23 || minute > 59) {
            return Optional.empty();
        }

        return Optional.of(day.atTime(LocalTime.of(hour, minute)).toInstant(ZoneOffset.UTC));
    }

    public static Optional<Instant> acquisitionInstant(DetectionPoint point) {
        if (point == null) {
            return Optional.empty();
        }
        return acquisitionInstant(point.getAcqDate(), point.getAcqTime());
    }

    /**
     * Observation window of a set of detections. Members that do not parse are
     * ignored; if none parses the window is undefined.
     */
    public static Window of(Collection<DetectionPoint> members) {
        Instant first = null;
        Instant last = null;
        if (members != null) {
            for (DetectionPoint member : members) {
                Optional<Instant> parsed = acquisitionInstant(member);
                if (parsed.isEmpty()) {
                    continue;
                }
                Instant t = parsed.get();
                if (first == null || t.isBefore(first)) {
                    first = t;
                }
                if (last == null || t.isAfter(last)) {
                    last = t;
                }
            }
        }
        return new Window(first, last);
    }

    /**
     * First/last observation instants; both null when undefined.
     */
    public record Window(Instant firstSeen, Instant lastSeen) {

        public boolean isDefined() {
            return firstSeen != null && lastSeen != null;
        }
    }
}
