package io.github.riemr.voucher.application.util;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.List;
import java.util.Optional;

/**
 * Parse-or-absent conversions for spreadsheet cell values. Nothing here throws
 * on malformed input; an unusable value comes back as {@link Optional#empty()}.
 */
public final class CellValues {

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("dd/MM/yyyy"),
            DateTimeFormatter.ofPattern("d/M/yyyy"));

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"));

    private CellValues() {}

    /** Integral identifier from a number or numeric text ({@code "123"}, {@code 123.0}). */
    public static Optional<Long> toLong(Object value) {
        return toDecimal(value).flatMap(d -> {
            try {
                return Optional.of(d.stripTrailingZeros().longValueExact());
            } catch (ArithmeticException e) {
                return Optional.empty();
            }
        });
    }

    /**
     * Whole number of days. Numbers must be integral; text must be a plain
     * integer literal.
     */
    public static Optional<Integer> toInteger(Object value) {
        if (value == null) return Optional.empty();
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d) || d != Math.rint(d)) return Optional.empty();
            if (d > Integer.MAX_VALUE || d < Integer.MIN_VALUE) return Optional.empty();
            return Optional.of((int) d);
        }
        String s = value.toString().trim();
        if (s.isEmpty()) return Optional.empty();
        try {
            return Optional.of(Integer.parseInt(s));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /** Amount from a number or text; a lone comma is read as the decimal separator. */
    public static Optional<BigDecimal> toDecimal(Object value) {
        if (value == null || value instanceof Boolean) return Optional.empty();
        if (value instanceof BigDecimal b) return Optional.of(b);
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) return Optional.empty();
            if (n instanceof Long || n instanceof Integer || n instanceof Short) {
                return Optional.of(BigDecimal.valueOf(n.longValue()));
            }
            return Optional.of(BigDecimal.valueOf(d));
        }
        String s = value.toString().trim();
        if (s.isEmpty()) return Optional.empty();
        if (s.indexOf(',') >= 0 && s.indexOf('.') < 0) {
            s = s.replace(',', '.');
        }
        try {
            return Optional.of(new BigDecimal(s));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public static Optional<LocalDate> toDate(Object value) {
        if (value == null) return Optional.empty();
        if (value instanceof LocalDate d) return Optional.of(d);
        if (value instanceof LocalDateTime dt) return Optional.of(dt.toLocalDate());
        if (value instanceof Date date) {
            return Optional.of(date.toInstant().atZone(ZoneId.systemDefault()).toLocalDate());
        }
        String s = value.toString().trim();
        if (s.isEmpty()) return Optional.empty();
        for (DateTimeFormatter f : DATE_FORMATS) {
            try {
                return Optional.of(LocalDate.parse(s, f));
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        for (DateTimeFormatter f : DATE_TIME_FORMATS) {
            try {
                return Optional.of(LocalDateTime.parse(s, f).toLocalDate());
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        return Optional.empty();
    }

    /** Display text of a cell; integral numbers lose their {@code .0}. Never null. */
    public static String toText(Object value) {
        if (value == null) return "";
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (!Double.isInfinite(d) && d == Math.rint(d)) {
                return Long.toString((long) d);
            }
        }
        return value.toString();
    }
}
