package com.example.retrosheet.reader;

import com.example.retrosheet.schema.FieldSpec;
import com.example.retrosheet.schema.FieldType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ValueCoercerTest {

    private static FieldSpec nullable(FieldType type) {
        return new FieldSpec("value", type, true);
    }

    private static long utcMidnight(int year, int month, int day) {
        return LocalDate.of(year, month, day).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
    }

    @ParameterizedTest
    @CsvSource({"T,true", "1,true", "F,false", "0,false"})
    void coercesBooleanLiterals(String literal, boolean expected) {
        assertThat(ValueCoercer.coerce(literal, nullable(FieldType.BOOLEAN))).isEqualTo(expected);
    }

    @Test
    void rejectsOtherBooleanSpellings() {
        assertThatThrownBy(() -> ValueCoercer.coerce("true", nullable(FieldType.BOOLEAN)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ValueCoercer.coerce("Y", nullable(FieldType.BOOLEAN)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void parsesEveryDateFormAsUtcMidnight() {
        FieldSpec date = nullable(FieldType.TIMESTAMP_MILLIS);

        assertThat(ValueCoercer.coerce("19010415", date)).isEqualTo(utcMidnight(1901, 4, 15));
        assertThat(ValueCoercer.coerce("1901-04-15", date)).isEqualTo(utcMidnight(1901, 4, 15));
        assertThat(ValueCoercer.coerce("4/15/1901", date)).isEqualTo(utcMidnight(1901, 4, 15));
        assertThat(ValueCoercer.coerce("04/05/1901", date)).isEqualTo(utcMidnight(1901, 4, 5));
        assertThat(ValueCoercer.coerce("1901-04-15 13:30:00", date))
                .isEqualTo(LocalDateTime.of(1901, 4, 15, 13, 30).toInstant(ZoneOffset.UTC).toEpochMilli());
    }

    @Test
    void rejectsImpossibleAndUnknownDates() {
        FieldSpec date = nullable(FieldType.TIMESTAMP_MILLIS);

        assertThatThrownBy(() -> ValueCoercer.coerce("19010230", date))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("uuuuMMdd");
        assertThatThrownBy(() -> ValueCoercer.coerce("April 15, 1901", date))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void coercesNumbers() {
        assertThat(ValueCoercer.coerce("2", nullable(FieldType.INT16))).isEqualTo((short) 2);
        assertThat(ValueCoercer.coerce("38712", nullable(FieldType.INT32))).isEqualTo(38712);
        assertThat(ValueCoercer.coerce("-0.5", nullable(FieldType.FLOAT64))).isEqualTo(-0.5);
        assertThatThrownBy(() -> ValueCoercer.coerce("40000", nullable(FieldType.INT16)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ValueCoercer.coerce("NaN", nullable(FieldType.FLOAT64)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void emptyIsNullOnlyForNullableColumns() {
        assertThat(ValueCoercer.coerce(null, nullable(FieldType.INT32))).isNull();
        assertThat(ValueCoercer.coerce("", nullable(FieldType.UTF8))).isNull();
        assertThatThrownBy(() -> ValueCoercer.coerce("", new FieldSpec("date", FieldType.TIMESTAMP_MILLIS, false)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
