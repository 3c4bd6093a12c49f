package com.tpcc.gateway.repository.sql;

/**
 * One WHERE fragment with at most one bound value.
 *
 * @param fragment predicate text, referencing {@code @name} when bound
 * @param name placeholder name, or null for a fixed predicate
 * @param value bound value, or null for a fixed predicate
 */
public record FilterCriterion(String fragment, String name, Object value) {

    public static FilterCriterion bound(String fragment, String name, Object value) {
        return new FilterCriterion(fragment, name, value);
    }

    public static FilterCriterion fixed(String fragment) {
        return new FilterCriterion(fragment, null, null);
    }

    public boolean isBound() {
        return name != null;
    }
}
