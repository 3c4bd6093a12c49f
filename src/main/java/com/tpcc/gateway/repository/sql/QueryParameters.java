package com.tpcc.gateway.repository.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parameter source of a {@link Query}, tagged with the placeholder style it feeds.
 *
 * NAMED sources pair with {@code @name} placeholders, POSITIONAL sources with
 * {@code %s} markers consumed left to right.
 */
public interface QueryParameters {

    enum Style {
        NAMED,
        POSITIONAL
    }

    Style style();

    int size();

    static QueryParameters none() {
        return new Positional(List.of());
    }

    /**
     * Name-to-value mapping. Null values are allowed and keep insertion order.
     */
    record Named(Map<String, Object> values) implements QueryParameters {

        public Named {
            values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        }

        @Override
        public Style style() {
            return Style.NAMED;
        }

        @Override
        public int size() {
            return values.size();
        }
    }

    /**
     * Ordered values for ordinal markers.
     */
    record Positional(List<Object> values) implements QueryParameters {

        public Positional {
            values = Collections.unmodifiableList(new ArrayList<>(values));
        }

        @Override
        public Style style() {
            return Style.POSITIONAL;
        }

        @Override
        public int size() {
            return values.size();
        }
    }
}
