package com.tpcc.gateway.repository.sql;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Test;

class ValueCoercionTest {

    private enum Carrier { FAST }

    @Test
    void coerce_Null_ShouldBeNullString() {
        TypedValue value = ValueCoercion.coerce(null);

        assertThat(value.isNull()).isTrue();
        assertThat(value.type()).isEqualTo(ParamType.STRING);
    }

    @Test
    void coerce_Boolean_ShouldBeBoolNotNumber() {
        assertThat(ValueCoercion.coerce(Boolean.TRUE)).isEqualTo(new TypedValue(true, ParamType.BOOL));
    }

    @Test
    void coerce_IntegralTypes_ShouldWidenToInt64() {
        assertThat(ValueCoercion.coerce(7)).isEqualTo(new TypedValue(7L, ParamType.INT64));
        assertThat(ValueCoercion.coerce((short) 3)).isEqualTo(new TypedValue(3L, ParamType.INT64));
        assertThat(ValueCoercion.coerce(BigInteger.TEN)).isEqualTo(new TypedValue(10L, ParamType.INT64));
    }

    @Test
    void coerce_BigIntegerOutOfRange_ShouldThrow() {
        BigInteger tooBig = BigInteger.valueOf(Long.MAX_VALUE).add(BigInteger.ONE);

        assertThatThrownBy(() -> ValueCoercion.coerce(tooBig))
            .isInstanceOf(TranslationException.class)
            .hasMessageContaining("INT64");
    }

    @Test
    void coerce_FloatingPoint_ShouldBeFloat64() {
        assertThat(ValueCoercion.coerce(1.5f)).isEqualTo(new TypedValue(1.5d, ParamType.FLOAT64));
    }

    @Test
    void coerce_BigDecimal_ShouldKeepExactValue() {
        TypedValue value = ValueCoercion.coerce(new BigDecimal("150.00"));

        assertThat(value.type()).isEqualTo(ParamType.NUMERIC);
        assertThat(value.value()).isEqualTo(new BigDecimal("150.00"));
    }

    @Test
    void coerce_TemporalValues_ShouldNormalizeToUtcInstant() {
        Instant expected = Instant.parse("2024-03-01T10:00:00Z");

        assertThat(ValueCoercion.coerce(LocalDateTime.of(2024, 3, 1, 10, 0)).value()).isEqualTo(expected);
        assertThat(ValueCoercion.coerce(OffsetDateTime.of(2024, 3, 1, 12, 0, 0, 0, ZoneOffset.ofHours(2))).value())
            .isEqualTo(expected);
        assertThat(ValueCoercion.coerce(LocalDate.of(2024, 3, 1)))
            .isEqualTo(new TypedValue(Instant.parse("2024-03-01T00:00:00Z"), ParamType.TIMESTAMP));
    }

    @Test
    void coerce_EnumAndOtherObjects_ShouldBecomeStrings() {
        assertThat(ValueCoercion.coerce(Carrier.FAST)).isEqualTo(new TypedValue("FAST", ParamType.STRING));
        assertThat(ValueCoercion.coerce(new StringBuilder("abc"))).isEqualTo(new TypedValue("abc", ParamType.STRING));
    }
}
