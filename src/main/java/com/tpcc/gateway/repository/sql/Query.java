package com.tpcc.gateway.repository.sql;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable SQL template plus the parameters that fill its placeholders.
 *
 * <pre>
 * {@code
 * Query query = Query.builder("SELECT c.c_balance AS c_balance FROM customer c WHERE c.c_id = @c_id")
 *     .bind("c_id", 5)
 *     .build();
 * }
 * </pre>
 */
public record Query(String sql, QueryParameters parameters) {

    public Query {
        Objects.requireNonNull(sql, "sql");
        Objects.requireNonNull(parameters, "parameters");
    }

    /** Query without placeholders. */
    public static Query of(String sql) {
        return new Query(sql, QueryParameters.none());
    }

    public static Query named(String sql, Map<String, Object> values) {
        return new Query(sql, new QueryParameters.Named(values));
    }

    public static Query positional(String sql, Object... values) {
        return new Query(sql, new QueryParameters.Positional(Arrays.asList(values)));
    }

    public static Builder builder(String sql) {
        return new Builder(sql);
    }

    /**
     * Collects named bindings; accepts null values, which {@link Map#of} does not.
     */
    public static final class Builder {

        private final String sql;
        private final Map<String, Object> values = new LinkedHashMap<>();

        private Builder(String sql) {
            this.sql = sql;
        }

        public Builder bind(String name, Object value) {
            values.put(name, value);
            return this;
        }

        public Builder bindAll(Map<String, Object> more) {
            values.putAll(more);
            return this;
        }

        public Query build() {
            return Query.named(sql, values);
        }
    }
}
