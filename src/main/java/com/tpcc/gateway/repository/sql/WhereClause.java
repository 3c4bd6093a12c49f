package com.tpcc.gateway.repository.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulates optional predicates into a WHERE clause and its bindings.
 *
 * Two flavours:
 * - {@link #filtered()} renders nothing when no predicate applies, used by listings
 * - {@link #vacuous()} always starts with {@code WHERE 1=1}, so statistics queries
 *   can append {@code AND ...} without checking whether a filter was present
 *
 * Optional criteria whose value is null are skipped.
 */
public final class WhereClause {

    private final boolean vacuous;
    private final List<FilterCriterion> criteria = new ArrayList<>();

    private WhereClause(boolean vacuous) {
        this.vacuous = vacuous;
    }

    public static WhereClause filtered() {
        return new WhereClause(false);
    }

    public static WhereClause vacuous() {
        return new WhereClause(true);
    }

    /** Adds {@code fragment} when {@code value} is not null. */
    public WhereClause and(String fragment, String name, Object value) {
        if (value != null) {
            criteria.add(FilterCriterion.bound(fragment, name, value));
        }
        return this;
    }

    public WhereClause and(FilterCriterion criterion) {
        if (criterion != null && (!criterion.isBound() || criterion.value() != null)) {
            criteria.add(criterion);
        }
        return this;
    }

    public boolean isEmpty() {
        return criteria.isEmpty();
    }

    public List<FilterCriterion> criteria() {
        return Collections.unmodifiableList(criteria);
    }

    public String render() {
        StringBuilder sql = new StringBuilder();
        if (vacuous) {
            sql.append("WHERE 1=1");
            for (FilterCriterion criterion : criteria) {
                sql.append(" AND ").append(criterion.fragment());
            }
            return sql.toString();
        }
        for (FilterCriterion criterion : criteria) {
            sql.append(sql.length() == 0 ? "WHERE " : " AND ").append(criterion.fragment());
        }
        return sql.toString();
    }

    public Map<String, Object> parameters() {
        Map<String, Object> parameters = new LinkedHashMap<>();
        for (FilterCriterion criterion : criteria) {
            if (criterion.isBound()) {
                parameters.put(criterion.name(), criterion.value());
            }
        }
        return parameters;
    }

    /**
     * Builds {@code prefix + WHERE ... + suffix} with this clause's bindings.
     * Extra bindings referenced only by the suffix go in {@code extra}.
     */
    public Query toQuery(String prefix, String suffix, Map<String, Object> extra) {
        StringBuilder sql = new StringBuilder(prefix);
        String where = render();
        if (!where.isEmpty()) {
            sql.append(' ').append(where);
        }
        if (suffix != null && !suffix.isEmpty()) {
            sql.append(' ').append(suffix);
        }
        return Query.builder(sql.toString())
            .bindAll(parameters())
            .bindAll(extra)
            .build();
    }

    public Query toQuery(String prefix, String suffix) {
        return toQuery(prefix, suffix, Map.of());
    }

    public Query toQuery(String prefix) {
        return toQuery(prefix, null, Map.of());
    }
}
