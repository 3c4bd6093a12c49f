package com.tpcc.gateway.domain;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * One result row: column names in projection order mapped to normalized values.
 *
 * Values are limited to null, Boolean, Long, Double and String (timestamps
 * arrive as ISO-8601 strings). Typed getters fail on unknown columns so a
 * misspelled alias surfaces immediately.
 */
public final class ResultRow {

    private final Map<String, Object> values;

    public ResultRow(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static ResultRow of(Map<String, Object> values) {
        return new ResultRow(values);
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return values;
    }

    public List<String> columns() {
        return List.copyOf(values.keySet());
    }

    public boolean has(String column) {
        return values.containsKey(column);
    }

    public Object get(String column) {
        if (!values.containsKey(column)) {
            throw new IllegalArgumentException("Unknown column '" + column + "', row has " + values.keySet());
        }
        return values.get(column);
    }

    public boolean isNull(String column) {
        return get(column) == null;
    }

    public Long getLong(String column) {
        Object value = get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        return Long.parseLong(value.toString());
    }

    public long getLong(String column, long defaultValue) {
        Long value = getLong(column);
        return value != null ? value : defaultValue;
    }

    public Double getDouble(String column) {
        Object value = get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        return Double.parseDouble(value.toString());
    }

    /** Decimal view of a numeric column; money is carried as Double in rows. */
    public BigDecimal getDecimal(String column) {
        Object value = get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof Long longValue) {
            return BigDecimal.valueOf(longValue);
        }
        if (value instanceof Double doubleValue) {
            return BigDecimal.valueOf(doubleValue);
        }
        return new BigDecimal(value.toString());
    }

    public BigDecimal getDecimal(String column, BigDecimal defaultValue) {
        BigDecimal value = getDecimal(column);
        return value != null ? value : defaultValue;
    }

    public String getString(String column) {
        Object value = get(column);
        return value == null ? null : value.toString();
    }

    public Boolean getBoolean(String column) {
        Object value = get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        return Boolean.parseBoolean(value.toString());
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof ResultRow row && values.equals(row.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
