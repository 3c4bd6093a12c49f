package com.tpcc.gateway.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.retry.support.RetryTemplate;

import com.tpcc.gateway.domain.ErrorKind;
import com.tpcc.gateway.domain.MutationResult;
import com.tpcc.gateway.domain.Page;
import com.tpcc.gateway.domain.QueryResult;
import com.tpcc.gateway.domain.ResultRow;
import com.tpcc.gateway.domain.TransactionResult;
import com.tpcc.gateway.repository.sql.FilterQueryBuilder;
import com.tpcc.gateway.repository.sql.PageRequest;
import com.tpcc.gateway.repository.sql.ParameterTranslator;
import com.tpcc.gateway.repository.sql.Query;
import com.tpcc.gateway.repository.sql.TranslatedQuery;
import com.tpcc.gateway.repository.sql.TranslationException;

/**
 * Unit tests for the execution contract against a mocked backend.
 *
 * Verifies:
 * - failures become result objects instead of exceptions
 * - transient failures are retried, others are not
 * - translation errors propagate
 * - every statement is reported to the listener
 */
class QueryExecutorTest {

    private QueryBackend backend;
    private List<StatementEvent> events;
    private QueryExecutor executor;

    @BeforeEach
    void setUp() {
        backend = mock(QueryBackend.class);
        when(backend.providerName()).thenReturn("Mock");
        events = new ArrayList<>();
        RetryTemplate retryTemplate = RetryTemplate.builder()
            .maxAttempts(3)
            .noBackoff()
            .retryOn(TransientBackendException.class)
            .build();
        executor = new QueryExecutor(backend, new ParameterTranslator(), retryTemplate, events::add);
    }

    @Test
    void executeQuery_ShouldReturnRowsAndReportEvent() {
        // Given
        ResultRow row = ResultRow.of(Map.of("c_balance", 100.0));
        when(backend.read(any(TranslatedQuery.class))).thenReturn(List.of(row));

        // When
        QueryResult result = executor.executeQuery(Query.builder(
                "SELECT c.c_balance AS c_balance FROM customer c WHERE c.c_id = @c_id")
            .bind("c_id", 1)
            .build());

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.rows()).containsExactly(row);
        assertThat(events).hasSize(1);
        assertThat(events.get(0).sql()).endsWith("c.c_id = $1");
        assertThat(events.get(0).rows()).isEqualTo(1);
    }

    @Test
    void executeQuery_BackendFailure_ShouldReturnFailureAndFlagConnectivity() {
        // Given
        when(backend.read(any(TranslatedQuery.class)))
            .thenThrow(new BackendException(ErrorKind.CONNECTIVITY, "connection refused"));

        // When
        QueryResult result = executor.executeQuery(Query.of("SELECT 1 AS ok"));

        // Then
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.errorKind()).isEqualTo(ErrorKind.CONNECTIVITY);
        assertThat(result.rows()).isEmpty();
        assertThat(executor.isConnectivityLost()).isTrue();
        assertThat(events.get(0).success()).isFalse();
    }

    @Test
    void executeQuery_ReachableAgain_ShouldClearConnectivityFlag() {
        // Given
        when(backend.read(any(TranslatedQuery.class)))
            .thenThrow(new BackendException(ErrorKind.CONNECTIVITY, "down"))
            .thenReturn(List.of());

        // When
        executor.executeQuery(Query.of("SELECT 1 AS ok"));
        MutationResult second = executor.checkConnection();

        // Then
        assertThat(second.success()).isTrue();
        assertThat(executor.isConnectivityLost()).isFalse();
    }

    @Test
    void executeDml_TransientFailure_ShouldRetry() {
        // Given
        when(backend.write(any(TranslatedQuery.class)))
            .thenThrow(new TransientBackendException("serialization failure", null))
            .thenReturn(1L);

        // When
        MutationResult result = executor.executeDml(Query.positional("DELETE FROM new_order WHERE no_o_id = %s", 4));

        // Then
        assertThat(result.success()).isTrue();
        verify(backend, times(2)).write(any(TranslatedQuery.class));
    }

    @Test
    void executeDml_ConstraintViolation_ShouldNotRetry() {
        // Given
        when(backend.write(any(TranslatedQuery.class)))
            .thenThrow(new BackendException(ErrorKind.CONSTRAINT_VIOLATION, "duplicate key"));

        // When
        MutationResult result = executor.executeDml(Query.of("INSERT INTO item VALUES (1)"));

        // Then
        assertThat(result.success()).isFalse();
        assertThat(result.errorKind()).isEqualTo(ErrorKind.CONSTRAINT_VIOLATION);
        verify(backend, times(1)).write(any(TranslatedQuery.class));
    }

    @Test
    void executeDml_TranslationError_ShouldPropagateWithoutBackendCall() {
        // Given
        Query broken = Query.builder("UPDATE item SET i_price = @price").build();

        // When/Then
        assertThatThrownBy(() -> executor.executeDml(broken)).isInstanceOf(TranslationException.class);
        verify(backend, never()).write(any(TranslatedQuery.class));
    }

    @Test
    void executeInTransaction_PlanAborted_ShouldRollBackWithItsKind() {
        // Given
        givenTransactionRunsBody(mock(BackendTransaction.class));

        // When
        TransactionResult<Object> result = executor.executeInTransaction(tx -> {
            throw PlanAbortedException.notFound("Customer not found: 1/1/99");
        });

        // Then
        assertThat(result.committed()).isFalse();
        assertThat(result.errorKind()).isEqualTo(ErrorKind.NOT_FOUND);
        assertThat(result.error()).isEqualTo("Customer not found: 1/1/99");
    }

    @Test
    void executeInTransaction_ShouldTranslateStatementsOfTheBody() {
        // Given
        BackendTransaction tx = mock(BackendTransaction.class);
        when(tx.update(any(TranslatedQuery.class))).thenReturn(1L);
        givenTransactionRunsBody(tx);

        // When
        TransactionResult<Long> result = executor.executeInTransaction(work -> work.update(
            Query.builder("UPDATE district SET d_next_o_id = @next WHERE d_id = @d_id")
                .bind("next", 7)
                .bind("d_id", 1)
                .build()));

        // Then
        assertThat(result.committed()).isTrue();
        assertThat(result.value()).isEqualTo(1L);
        verify(tx).update(any(TranslatedQuery.class));
    }

    @Test
    void executeGrouped_FailingMutation_ShouldReportFailure() {
        // Given
        BackendTransaction tx = mock(BackendTransaction.class);
        when(tx.update(any(TranslatedQuery.class)))
            .thenReturn(1L)
            .thenThrow(new BackendException(ErrorKind.CONSTRAINT_VIOLATION, "duplicate key"));
        givenTransactionRunsBody(tx);

        // When
        MutationResult result = executor.executeGrouped(List.of(
            Query.of("UPDATE accounts SET balance = balance - 200 WHERE id = 1"),
            Query.of("INSERT INTO accounts (id, balance) VALUES (1, 0)")));

        // Then
        assertThat(result.success()).isFalse();
        assertThat(result.errorKind()).isEqualTo(ErrorKind.CONSTRAINT_VIOLATION);
    }

    @Test
    void executePage_ShouldCombineCountAndRows() {
        // Given
        when(backend.read(any(TranslatedQuery.class)))
            .thenReturn(List.of(ResultRow.of(Map.of("total_count", 12L))))
            .thenReturn(List.of(ResultRow.of(Map.of("o_id", 1L)), ResultRow.of(Map.of("o_id", 2L))));

        // When
        Page<ResultRow> page = executor.executePage(FilterQueryBuilder
            .select("SELECT o.o_id AS o_id FROM orders o")
            .count("SELECT COUNT(*) AS total_count FROM orders o")
            .build(PageRequest.of(2, 4)));

        // Then
        assertThat(page.isSuccess()).isTrue();
        assertThat(page.totalCount()).isEqualTo(12);
        assertThat(page.items()).hasSize(2);
        assertThat(page.hasNext()).isTrue();
        assertThat(page.hasPrev()).isTrue();
    }

    @Test
    void executePage_CountFailure_ShouldReturnFailedPage() {
        // Given
        when(backend.read(any(TranslatedQuery.class)))
            .thenThrow(new BackendException(ErrorKind.BACKEND, "relation does not exist"));

        // When
        Page<ResultRow> page = executor.executePage(FilterQueryBuilder
            .select("SELECT o.o_id AS o_id FROM orders o")
            .count("SELECT COUNT(*) AS total_count FROM orders o")
            .build(PageRequest.of(10, 0)));

        // Then
        assertThat(page.isSuccess()).isFalse();
        assertThat(page.items()).isEmpty();
        assertThat(page.hasNext()).isFalse();
    }

    @SuppressWarnings("unchecked")
    private void givenTransactionRunsBody(BackendTransaction tx) {
        when(backend.readWrite(any())).thenAnswer(invocation ->
            ((Function<BackendTransaction, Object>) invocation.getArgument(0)).apply(tx));
    }
}
