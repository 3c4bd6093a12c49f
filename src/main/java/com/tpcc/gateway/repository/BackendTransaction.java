package com.tpcc.gateway.repository;

import java.util.List;

import com.tpcc.gateway.domain.ResultRow;
import com.tpcc.gateway.repository.sql.TranslatedQuery;

/**
 * Statement access inside an open backend read-write transaction.
 *
 * Failures surface as {@link BackendException} and roll the transaction back.
 */
public interface BackendTransaction {

    List<ResultRow> query(TranslatedQuery query);

    long update(TranslatedQuery query);
}
