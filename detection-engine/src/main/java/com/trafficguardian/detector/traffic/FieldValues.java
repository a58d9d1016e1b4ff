package com.trafficguardian.detector.traffic;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.Set;
import java.util.function.Function;

/**
 * Lenient coercion of raw source values into canonical field types.
 *
 * <p>
 * Every method returns {@code null} when the value is absent or cannot be
 * interpreted, leaving the record default to apply.
 * </p>
 *
 * @author Naveed Gung
 */
public final class FieldValues {

    /** Placeholders used by Zeek logs and dataframe exports for "no value". */
    private static final Set<String> ABSENT_MARKERS = Set.of(
            "-", "(empty)", "nan", "null", "none", "n/a");

    private static final DateTimeFormatter SPACED_DATE_TIME = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
            .optionalEnd()
            .toFormatter();

    private FieldValues() {
    }

    public static String toText(Object raw) {
        Object value = unwrap(raw);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() || isAbsentMarker(text) ? null : text;
    }

    public static Double toDouble(Object raw) {
        Object value = unwrap(raw);
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return Double.isFinite(d) ? d : null;
        }
        String text = toText(value);
        if (text == null) {
            return null;
        }
        try {
            double d = Double.parseDouble(text);
            return Double.isFinite(d) ? d : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static Long toLong(Object raw) {
        Object value = unwrap(raw);
        if (value instanceof Long || value instanceof Integer || value instanceof Short) {
            return ((Number) value).longValue();
        }
        String text = toText(value);
        if (text != null && isIntegral(text)) {
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        Double d = toDouble(value);
        return d != null ? Math.round(d) : null;
    }

    public static Integer toInteger(Object raw) {
        Long l = toLong(raw);
        if (l == null || l > Integer.MAX_VALUE || l < Integer.MIN_VALUE) {
            return null;
        }
        return l.intValue();
    }

    /**
     * Interpret a timestamp given as epoch seconds (or millis, micros, nanos by
     * magnitude), an ISO-8601 instant or local date-time, a
     * {@code yyyy-MM-dd HH:mm:ss[.fraction]} string or a bare date. Local
     * values are taken as UTC.
     */
    public static Instant toInstant(Object raw) {
        Object value = unwrap(raw);
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof Number number) {
            return fromEpoch(number.doubleValue());
        }
        String text = toText(value);
        if (text == null) {
            return null;
        }
        Double numeric = toDouble(text);
        if (numeric != null) {
            return fromEpoch(numeric);
        }
        Instant parsed = parseOrNull(text, t -> OffsetDateTime.parse(t).toInstant());
        if (parsed == null) {
            parsed = parseOrNull(text, t -> LocalDateTime.parse(t).toInstant(ZoneOffset.UTC));
        }
        if (parsed == null) {
            parsed = parseOrNull(text, t -> LocalDateTime.parse(t, SPACED_DATE_TIME).toInstant(ZoneOffset.UTC));
        }
        if (parsed == null) {
            parsed = parseOrNull(text, t -> LocalDate.parse(t).atStartOfDay().toInstant(ZoneOffset.UTC));
        }
        return parsed;
    }

    private static Instant parseOrNull(String text, Function<String, Instant> parser) {
        try {
            return parser.apply(text);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static boolean isIntegral(String text) {
        int start = text.startsWith("-") || text.startsWith("+") ? 1 : 0;
        if (start == text.length()) {
            return false;
        }
        for (int i = start; i < text.length(); i++) {
            if (!Character.isDigit(text.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    static Instant fromEpoch(double value) {
        if (!Double.isFinite(value) || value < 0) {
            return null;
        }
        double seconds;
        if (value > 1e17) {
            seconds = value / 1e9;
        } else if (value > 1e14) {
            seconds = value / 1e6;
        } else if (value > 1e11) {
            seconds = value / 1e3;
        } else {
            seconds = value;
        }
        long whole = (long) Math.floor(seconds);
        long nanos = Math.round((seconds - whole) * 1e9);
        return Instant.ofEpochSecond(whole, Math.min(nanos, 999_999_999L));
    }

    private static Object unwrap(Object raw) {
        if (raw instanceof JsonNode node) {
            if (node.isNull() || node.isMissingNode()) {
                return null;
            }
            if (node.isNumber()) {
                return node.numberValue();
            }
            if (node.isValueNode()) {
                return node.asText();
            }
            return node.toString();
        }
        return raw;
    }

    private static boolean isAbsentMarker(String text) {
        return ABSENT_MARKERS.contains(text.toLowerCase());
    }
}
