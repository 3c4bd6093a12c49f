package com.tpcc.gateway.repository.sql;

/**
 * The COUNT query and the page query of one listing, sharing the same filters.
 */
public record PagedQuery(Query countQuery, Query pageQuery, PageRequest page) {
}
