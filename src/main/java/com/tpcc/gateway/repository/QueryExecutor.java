package com.tpcc.gateway.repository;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import com.tpcc.gateway.domain.ErrorKind;
import com.tpcc.gateway.domain.MutationResult;
import com.tpcc.gateway.domain.Page;
import com.tpcc.gateway.domain.QueryResult;
import com.tpcc.gateway.domain.ResultRow;
import com.tpcc.gateway.domain.SchemaDialect;
import com.tpcc.gateway.domain.TransactionResult;
import com.tpcc.gateway.repository.StatementEvent.Kind;
import com.tpcc.gateway.repository.sql.PagedQuery;
import com.tpcc.gateway.repository.sql.ParameterTranslator;
import com.tpcc.gateway.repository.sql.Query;
import com.tpcc.gateway.repository.sql.TranslatedQuery;
import com.tpcc.gateway.repository.sql.TranslationException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Single entry point between services and the configured {@link QueryBackend}.
 *
 * Execution contract:
 * - {@link #executeQuery}: read-only snapshot, returns rows or an error, never both
 * - {@link #executeDml}: one statement in its own read-write transaction
 * - {@link #executeDdl}: blocks until the schema change completes
 * - {@link #executeInTransaction}: several statements committed atomically
 * - {@link #executeGrouped}: a list of mutations committed atomically
 *
 * Backend failures become result objects and are reported to the
 * {@link QueryEventListener}. {@link TranslationException} is a programming
 * error and propagates. Transient failures are retried with exponential
 * backoff by the injected {@link RetryTemplate}; schema changes are not.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QueryExecutor {

    private static final Query CONNECTION_CHECK = Query.of("SELECT 1 AS ok");

    private final QueryBackend backend;
    private final ParameterTranslator translator;
    private final RetryTemplate backendRetryTemplate;
    private final QueryEventListener listener;

    private final AtomicBoolean connectivityLost = new AtomicBoolean(false);

    public String providerName() {
        return backend.providerName();
    }

    public SchemaDialect schemaDialect() {
        return backend.schemaDialect();
    }

    // =========================================================================
    // Reads
    // =========================================================================

    /**
     * Runs a read in a read-only snapshot.
     *
     * An empty row list means the query matched nothing; a backend failure
     * yields {@link QueryResult#failure} instead.
     */
    public QueryResult executeQuery(Query query) {
        TranslatedQuery translated = translator.translate(query);
        long start = System.currentTimeMillis();
        try {
            List<ResultRow> rows = withRetry(() -> backend.read(translated));
            reportSuccess(Kind.READ, translated, rows.size(), start);
            return QueryResult.success(rows);
        } catch (BackendException e) {
            reportFailure(Kind.READ, translated.sql(), translated.parameters().size(), start, e.getKind(), e);
            return QueryResult.failure(e.getKind(), e.getMessage());
        }
    }

    /**
     * Runs the COUNT query, then the page query, of a filtered listing.
     */
    public Page<ResultRow> executePage(PagedQuery pagedQuery) {
        int limit = pagedQuery.page().limit();
        int offset = pagedQuery.page().offset();

        QueryResult count = executeQuery(pagedQuery.countQuery());
        if (!count.isSuccess()) {
            return Page.failed(limit, offset, count.error());
        }
        long total = count.firstRow()
            .map(row -> row.getLong(row.columns().get(0), 0L))
            .orElse(0L);

        QueryResult page = executeQuery(pagedQuery.pageQuery());
        if (!page.isSuccess()) {
            return Page.failed(limit, offset, page.error());
        }
        return Page.of(page.rows(), total, limit, offset);
    }

    // =========================================================================
    // Writes
    // =========================================================================

    /**
     * Runs one DML statement in its own read-write transaction.
     */
    public MutationResult executeDml(Query query) {
        TranslatedQuery translated = translator.translate(query);
        long start = System.currentTimeMillis();
        try {
            long affected = withRetry(() -> backend.write(translated));
            reportSuccess(Kind.DML, translated, affected, start);
            return MutationResult.ok();
        } catch (BackendException e) {
            reportFailure(Kind.DML, translated.sql(), translated.parameters().size(), start, e.getKind(), e);
            return MutationResult.failure(e.getKind(), e.getMessage());
        }
    }

    /**
     * Applies schema statements as one administrative change and waits for it.
     */
    public MutationResult executeDdl(List<String> statements) {
        String label = "DDL x" + statements.size();
        long start = System.currentTimeMillis();
        try {
            backend.updateSchema(statements);
            markReachable();
            listener.onStatement(StatementEvent.succeeded(Kind.DDL, label, 0, statements.size(),
                System.currentTimeMillis() - start));
            return MutationResult.ok();
        } catch (BackendException e) {
            reportFailure(Kind.DDL, String.join("; ", statements), 0, start, e.getKind(), e);
            return MutationResult.failure(e.getKind(), e.getMessage());
        }
    }

    /**
     * Runs {@code work} inside one atomic read-write transaction.
     *
     * Any exception thrown by the body rolls back every statement of the
     * transaction. {@link PlanAbortedException} carries its own error kind;
     * transient conflicts re-run the whole body.
     */
    public <T> TransactionResult<T> executeInTransaction(TransactionWork<T> work) {
        long start = System.currentTimeMillis();
        try {
            T value = withRetry(() -> backend.readWrite(
                tx -> work.execute(new ReadWriteTransaction(tx, translator))));
            markReachable();
            listener.onStatement(StatementEvent.succeeded(Kind.TRANSACTION, "TRANSACTION", 0, -1,
                System.currentTimeMillis() - start));
            return TransactionResult.committed(value);
        } catch (PlanAbortedException e) {
            listener.onStatement(StatementEvent.failed(Kind.TRANSACTION, "TRANSACTION", 0,
                System.currentTimeMillis() - start, e.getKind(), e.getMessage()));
            return TransactionResult.rolledBack(e.getKind(), e.getMessage());
        } catch (BackendException e) {
            reportFailure(Kind.TRANSACTION, "TRANSACTION", 0, start, e.getKind(), e);
            return TransactionResult.rolledBack(e.getKind(), e.getMessage());
        } catch (TranslationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Transaction body failed unexpectedly", e);
            reportFailure(Kind.TRANSACTION, "TRANSACTION", 0, start, ErrorKind.BACKEND, e);
            return TransactionResult.rolledBack(ErrorKind.BACKEND, e.getMessage());
        }
    }

    /**
     * Commits all {@code mutations} together, or none of them.
     */
    public MutationResult executeGrouped(List<Query> mutations) {
        TransactionResult<Integer> result = executeInTransaction(tx -> {
            for (Query mutation : mutations) {
                tx.update(mutation);
            }
            return mutations.size();
        });
        return result.toMutationResult();
    }

    // =========================================================================
    // Connectivity
    // =========================================================================

    public MutationResult checkConnection() {
        QueryResult check = executeQuery(CONNECTION_CHECK);
        return check.isSuccess() ? MutationResult.ok() : MutationResult.failure(check.errorKind(), check.error());
    }

    public boolean isConnectivityLost() {
        return connectivityLost.get();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void verifyConnectivityOnStartup() {
        MutationResult result = checkConnection();
        if (result.success()) {
            log.info("Connected to backend: provider={}, dialect={}", providerName(), schemaDialect());
        } else {
            log.error("Backend not reachable at startup: provider={}, error={}", providerName(), result.error());
        }
    }

    // =========================================================================
    // Internals
    // =========================================================================

    private <T> T withRetry(Supplier<T> call) {
        return backendRetryTemplate.execute(context -> {
            if (context.getRetryCount() > 0) {
                log.debug("Retrying backend call, attempt {}", context.getRetryCount() + 1);
            }
            return call.get();
        });
    }

    private void reportSuccess(Kind kind, TranslatedQuery translated, long rows, long start) {
        markReachable();
        listener.onStatement(StatementEvent.succeeded(kind, translated.sql(), translated.parameters().size(),
            rows, System.currentTimeMillis() - start));
    }

    private void reportFailure(Kind kind, String sql, int parameterCount, long start,
                               ErrorKind errorKind, RuntimeException cause) {
        if (errorKind == ErrorKind.CONNECTIVITY) {
            connectivityLost.set(true);
            log.error("Backend connectivity failure ({}): {}", providerName(), cause.getMessage());
        }
        listener.onStatement(StatementEvent.failed(kind, sql, parameterCount,
            System.currentTimeMillis() - start, errorKind, cause.getMessage()));
    }

    private void markReachable() {
        if (connectivityLost.compareAndSet(true, false)) {
            log.info("Backend connectivity restored ({})", providerName());
        }
    }
}
