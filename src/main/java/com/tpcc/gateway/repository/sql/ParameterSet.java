package com.tpcc.gateway.repository.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered mapping from 1-based position to typed value.
 *
 * Position {@code n} corresponds to the {@code $n} marker in the translated SQL;
 * its native key is {@code p<n>}. Built once per query invocation.
 */
public final class ParameterSet {

    private static final ParameterSet EMPTY = new ParameterSet(List.of());

    private final List<TypedValue> values;

    ParameterSet(List<TypedValue> values) {
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static ParameterSet empty() {
        return EMPTY;
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * @param position 1-based position
     */
    public TypedValue get(int position) {
        if (position < 1 || position > values.size()) {
            throw new TranslationException("No parameter at position " + position
                + " (parameter count " + values.size() + ")");
        }
        return values.get(position - 1);
    }

    public static String keyOf(int position) {
        return "p" + position;
    }

    /** Native keys ({@code p1..pn}) to values, in position order. */
    public Map<String, TypedValue> asMap() {
        Map<String, TypedValue> map = new LinkedHashMap<>();
        for (int i = 0; i < values.size(); i++) {
            map.put(keyOf(i + 1), values.get(i));
        }
        return map;
    }

    public List<TypedValue> values() {
        return values;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof ParameterSet set && values.equals(set.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return asMap().toString();
    }
}
