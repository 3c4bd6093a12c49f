package com.tpcc.gateway.repository;

import java.util.List;
import java.util.Optional;

import com.tpcc.gateway.domain.ResultRow;
import com.tpcc.gateway.repository.sql.ParameterTranslator;
import com.tpcc.gateway.repository.sql.Query;

/**
 * What a transaction body sees: queries and updates that translate their
 * templates and share one atomic backend transaction.
 */
public final class ReadWriteTransaction {

    private final BackendTransaction delegate;
    private final ParameterTranslator translator;

    ReadWriteTransaction(BackendTransaction delegate, ParameterTranslator translator) {
        this.delegate = delegate;
        this.translator = translator;
    }

    public List<ResultRow> query(Query query) {
        return delegate.query(translator.translate(query));
    }

    public Optional<ResultRow> queryForRow(Query query) {
        List<ResultRow> rows = query(query);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /**
     * Reads a row the plan cannot continue without.
     *
     * @throws PlanAbortedException with NOT_FOUND naming the entity when absent
     */
    public ResultRow requireRow(Query query, String entity, String key) {
        return queryForRow(query)
            .orElseThrow(() -> PlanAbortedException.notFound(entity + " not found: " + key));
    }

    /** @return affected row count */
    public long update(Query query) {
        return delegate.update(translator.translate(query));
    }
}
