package com.insightreport.generator.service.profile;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Date;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classification helpers for raw record values.
 */
public final class ValueTypes {

    // YYYY-M-D or YYYY/M/D, optional time and offset
    private static final Pattern DATE_PATTERN = Pattern.compile(
            "^(\\d{4})[-/](\\d{1,2})[-/](\\d{1,2})"
                    + "(?:[T ](\\d{1,2}):(\\d{2})(?::(\\d{2})(?:\\.(\\d{1,9}))?)?)?"
                    + "\\s*(Z|[+-]\\d{2}:?\\d{2})?$");

    private ValueTypes() {
    }

    /**
     * null and the empty string count as missing
     */
    public static boolean isMissing(Object value) {
        return value == null || (value instanceof String s && s.isEmpty());
    }

    public static boolean isBoolean(Object value) {
        if (value instanceof Boolean) {
            return true;
        }
        return value instanceof String s && ("true".equalsIgnoreCase(s) || "false".equalsIgnoreCase(s));
    }

    public static boolean isNumeric(Object value) {
        return toDouble(value).isPresent();
    }

    public static boolean isDate(Object value) {
        return toDateTime(value).isPresent();
    }

    /**
     * Native numbers, or non-blank strings holding a finite decimal number
     */
    public static Optional<Double> toDouble(Object value) {
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return Double.isFinite(d) ? Optional.of(d) : Optional.empty();
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                double d = new BigDecimal(s.trim()).doubleValue();
                return Double.isFinite(d) ? Optional.of(d) : Optional.empty();
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * Native temporal values, or strings shaped like {@code YYYY-M-D} that denote a real date.
     * Offsets are normalized to UTC.
     */
    public static Optional<LocalDateTime> toDateTime(Object value) {
        if (value instanceof LocalDateTime ldt) {
            return Optional.of(ldt);
        }
        if (value instanceof LocalDate ld) {
            return Optional.of(ld.atStartOfDay());
        }
        if (value instanceof OffsetDateTime odt) {
            return Optional.of(odt.withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime());
        }
        if (value instanceof ZonedDateTime zdt) {
            return Optional.of(zdt.withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime());
        }
        if (value instanceof Instant instant) {
            return Optional.of(LocalDateTime.ofInstant(instant, ZoneOffset.UTC));
        }
        if (value instanceof Date date) {
            return Optional.of(LocalDateTime.ofInstant(date.toInstant(), ZoneOffset.UTC));
        }
        if (value instanceof String s) {
            return parseDateString(s.trim());
        }
        return Optional.empty();
    }

    public static String toIsoString(LocalDateTime dateTime) {
        return dateTime.toInstant(ZoneOffset.UTC).toString();
    }

    private static Optional<LocalDateTime> parseDateString(String s) {
        Matcher m = DATE_PATTERN.matcher(s);
        if (!m.matches()) {
            return Optional.empty();
        }
        try {
            LocalDateTime dateTime = LocalDateTime.of(
                    Integer.parseInt(m.group(1)),
                    Integer.parseInt(m.group(2)),
                    Integer.parseInt(m.group(3)),
                    m.group(4) != null ? Integer.parseInt(m.group(4)) : 0,
                    m.group(5) != null ? Integer.parseInt(m.group(5)) : 0,
                    m.group(6) != null ? Integer.parseInt(m.group(6)) : 0,
                    m.group(7) != null ? nanos(m.group(7)) : 0);
            if (m.group(8) != null) {
                ZoneOffset offset = ZoneOffset.of(normalizeOffset(m.group(8)));
                dateTime = dateTime.atOffset(offset).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
            }
            return Optional.of(dateTime);
        } catch (java.time.DateTimeException e) {
            return Optional.empty();
        }
    }

    private static int nanos(String fraction) {
        StringBuilder padded = new StringBuilder(fraction);
        while (padded.length() < 9) {
            padded.append('0');
        }
        return Integer.parseInt(padded.toString());
    }

    private static String normalizeOffset(String offset) {
        if ("Z".equals(offset) || offset.contains(":")) {
            return offset;
        }
        return offset.substring(0, 3) + ":" + offset.substring(3);
    }
}
