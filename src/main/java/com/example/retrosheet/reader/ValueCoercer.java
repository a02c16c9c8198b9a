package com.example.retrosheet.reader;

import com.example.retrosheet.schema.FieldSpec;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Converts one text field to the Java value of its column type. Rejections are reported as
 * {@link IllegalArgumentException} carrying the reason.
 */
public final class ValueCoercer {

    /** Date forms in matching order: compact, ISO, month/day/year, ISO date-time. */
    static final List<DateForm> DATE_FORMS = List.of(
            new DateForm("\\d{8}", "uuuuMMdd", false),
            new DateForm("\\d{4}-\\d{2}-\\d{2}", "uuuu-MM-dd", false),
            new DateForm("\\d{1,2}/\\d{1,2}/\\d{4}", "M/d/uuuu", false),
            new DateForm("\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2}", "uuuu-MM-dd HH:mm:ss", true));

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private ValueCoercer() {}

    /**
     * @param literal the field text, {@code null} for an empty field
     * @return Short, Integer, Double, String, Boolean, Long (epoch millis, UTC) or null
     */
    public static Object coerce(String literal, FieldSpec field) {
        if (literal == null || literal.isEmpty()) {
            if (field.isNullable()) {
                return null;
            }
            throw new IllegalArgumentException("empty value in non-null column");
        }
        switch (field.getType()) {
            case INT16:
                return Short.valueOf(parseShort(literal));
            case INT32:
                return Integer.valueOf(parseInt(literal));
            case FLOAT64:
                if (!DECIMAL.matcher(literal).matches()) {
                    throw new IllegalArgumentException("not a decimal number");
                }
                return Double.valueOf(literal);
            case UTF8:
                return literal;
            case BOOLEAN:
                return parseBoolean(literal);
            case TIMESTAMP_MILLIS:
                return parseTimestampMillis(literal);
            default:
                throw new IllegalStateException("Unhandled field type " + field.getType());
        }
    }

    static Boolean parseBoolean(String literal) {
        switch (literal) {
            case "1":
            case "T":
                return Boolean.TRUE;
            case "0":
            case "F":
                return Boolean.FALSE;
            default:
                throw new IllegalArgumentException("not a boolean literal, expected 1/T or 0/F");
        }
    }

    static long parseTimestampMillis(String literal) {
        for (DateForm form : DATE_FORMS) {
            if (form.shape.matcher(literal).matches()) {
                try {
                    return form.toEpochMillis(literal);
                } catch (DateTimeParseException e) {
                    throw new IllegalArgumentException("not a valid " + form.pattern + " date", e);
                }
            }
        }
        throw new IllegalArgumentException("matches none of the date forms yyyyMMdd, yyyy-MM-dd, M/d/yyyy, yyyy-MM-dd HH:mm:ss");
    }

    private static short parseShort(String literal) {
        try {
            return Short.parseShort(literal);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not a 16-bit integer", e);
        }
    }

    private static int parseInt(String literal) {
        try {
            return Integer.parseInt(literal);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not a 32-bit integer", e);
        }
    }

    static final class DateForm {
        private final Pattern shape;
        private final String pattern;
        private final DateTimeFormatter formatter;
        private final boolean withTime;

        DateForm(String shape, String pattern, boolean withTime) {
            this.shape = Pattern.compile(shape);
            this.pattern = pattern;
            this.formatter = DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
            this.withTime = withTime;
        }

        long toEpochMillis(String literal) {
            if (withTime) {
                return formatter.parse(literal, LocalDateTime::from).toInstant(ZoneOffset.UTC).toEpochMilli();
            }
            return formatter.parse(literal, LocalDate::from).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
        }
    }
}
