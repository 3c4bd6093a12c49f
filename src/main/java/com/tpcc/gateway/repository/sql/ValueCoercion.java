package com.tpcc.gateway.repository.sql;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Date;

/**
 * Maps application scalars to backend-native typed parameters.
 *
 * Checks run in a fixed order:
 * - null binds as a nullable STRING. Real null typing needs the column schema,
 *   which is not available from the value alone.
 * - Boolean before any numeric check
 * - integral types as INT64, floating point as FLOAT64, BigDecimal as NUMERIC
 * - text as STRING
 * - temporal values as TIMESTAMP, normalized to a UTC {@link Instant}
 * - enums by name, anything else through {@code toString()}
 */
public final class ValueCoercion {

    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private ValueCoercion() {
    }

    public static TypedValue coerce(Object value) {
        if (value == null) {
            return new TypedValue(null, ParamType.STRING);
        }
        if (value instanceof Boolean bool) {
            return new TypedValue(bool, ParamType.BOOL);
        }
        if (value instanceof Long || value instanceof Integer
                || value instanceof Short || value instanceof Byte) {
            return new TypedValue(((Number) value).longValue(), ParamType.INT64);
        }
        if (value instanceof BigInteger big) {
            if (big.compareTo(LONG_MIN) < 0 || big.compareTo(LONG_MAX) > 0) {
                throw new TranslationException("Integer parameter out of INT64 range: " + big);
            }
            return new TypedValue(big.longValue(), ParamType.INT64);
        }
        if (value instanceof Double || value instanceof Float) {
            return new TypedValue(((Number) value).doubleValue(), ParamType.FLOAT64);
        }
        if (value instanceof BigDecimal decimal) {
            return new TypedValue(decimal, ParamType.NUMERIC);
        }
        if (value instanceof CharSequence text) {
            return new TypedValue(text.toString(), ParamType.STRING);
        }
        Instant instant = toInstant(value);
        if (instant != null) {
            return new TypedValue(instant, ParamType.TIMESTAMP);
        }
        if (value instanceof Enum<?> constant) {
            return new TypedValue(constant.name(), ParamType.STRING);
        }
        return new TypedValue(value.toString(), ParamType.STRING);
    }

    private static Instant toInstant(Object value) {
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof OffsetDateTime offset) {
            return offset.toInstant();
        }
        if (value instanceof ZonedDateTime zoned) {
            return zoned.toInstant();
        }
        if (value instanceof LocalDateTime local) {
            return local.toInstant(ZoneOffset.UTC);
        }
        if (value instanceof LocalDate date) {
            return date.atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        if (value instanceof java.sql.Date sqlDate) {
            return sqlDate.toLocalDate().atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        if (value instanceof Date date) {
            return date.toInstant();
        }
        return null;
    }
}
