package com.tpcc.gateway.repository;

import java.util.List;
import java.util.function.Function;

import com.tpcc.gateway.domain.ResultRow;
import com.tpcc.gateway.domain.SchemaDialect;
import com.tpcc.gateway.repository.sql.TranslatedQuery;

/**
 * Driver-facing side of the execution contract.
 *
 * Each operation maps onto a distinct backend primitive:
 * - {@link #read}: read-only snapshot
 * - {@link #write}: one statement in its own read-write transaction
 * - {@link #readWrite}: several statements committed atomically
 * - {@link #updateSchema}: administrative schema change, blocking until done
 *
 * Implementations raise {@link BackendException} (or
 * {@link TransientBackendException}) and must return fully materialized rows.
 */
public interface QueryBackend {

    String providerName();

    SchemaDialect schemaDialect();

    List<ResultRow> read(TranslatedQuery query);

    long write(TranslatedQuery query);

    <T> T readWrite(Function<BackendTransaction, T> body);

    void updateSchema(List<String> statements);
}
