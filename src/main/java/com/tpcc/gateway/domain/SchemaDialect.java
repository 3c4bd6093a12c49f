package com.tpcc.gateway.domain;

/**
 * DDL flavour accepted by the configured backend.
 */
public enum SchemaDialect {

    /** PostgreSQL and PostgreSQL-compatible JDBC targets. */
    POSTGRESQL,

    /** Spanner database created with the PostgreSQL dialect. */
    SPANNER_POSTGRESQL,

    /** Spanner database using GoogleSQL. */
    GOOGLE_STANDARD_SQL
}
