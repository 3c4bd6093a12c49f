package com.tpcc.gateway.repository.sql;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the paired COUNT and page queries of a filtered listing.
 *
 * Both queries are rendered from the same {@link WhereClause}, so their
 * predicates and bindings are identical and the reported total matches the
 * rows that paging can reach. With no filters the WHERE clause is omitted.
 *
 * <pre>
 * {@code
 * PagedQuery query = FilterQueryBuilder
 *     .select("SELECT h.h_amount AS h_amount FROM history h")
 *     .count("SELECT COUNT(*) AS total_count FROM history h")
 *     .where("h.h_w_id = @w_id", "w_id", warehouseId)
 *     .orderBy("h.h_date DESC")
 *     .build(PageRequest.of(50, 0));
 * }
 * </pre>
 */
public final class FilterQueryBuilder {

    static final String LIMIT_PARAM = "page_limit";
    static final String OFFSET_PARAM = "page_offset";

    private final String selectSql;
    private String countSql;
    private String orderBy;
    private final WhereClause where = WhereClause.filtered();

    private FilterQueryBuilder(String selectSql) {
        this.selectSql = Objects.requireNonNull(selectSql, "selectSql");
    }

    /** Projection and joins of the page query, without WHERE/ORDER BY/LIMIT. */
    public static FilterQueryBuilder select(String selectSql) {
        return new FilterQueryBuilder(selectSql);
    }

    /** COUNT projection over the same tables; must alias the count column. */
    public FilterQueryBuilder count(String countSql) {
        this.countSql = countSql;
        return this;
    }

    /** Statistics-style clause that always renders {@code WHERE 1=1}. */
    public static WhereClause vacuousWhere() {
        return WhereClause.vacuous();
    }

    public FilterQueryBuilder where(String fragment, String name, Object value) {
        where.and(fragment, name, value);
        return this;
    }

    public FilterQueryBuilder where(FilterCriterion criterion) {
        where.and(criterion);
        return this;
    }

    public FilterQueryBuilder orderBy(String orderBy) {
        this.orderBy = orderBy;
        return this;
    }

    public PagedQuery build(PageRequest page) {
        if (countSql == null) {
            throw new IllegalStateException("A count query is required for a paged listing");
        }
        Query countQuery = where.toQuery(countSql);

        StringBuilder suffix = new StringBuilder();
        if (orderBy != null && !orderBy.isEmpty()) {
            suffix.append("ORDER BY ").append(orderBy).append(' ');
        }
        suffix.append("LIMIT @").append(LIMIT_PARAM).append(" OFFSET @").append(OFFSET_PARAM);

        Map<String, Object> paging = new LinkedHashMap<>();
        paging.put(LIMIT_PARAM, page.limit());
        paging.put(OFFSET_PARAM, page.offset());
        Query pageQuery = where.toQuery(selectSql, suffix.toString(), paging);

        return new PagedQuery(countQuery, pageQuery, page);
    }
}
