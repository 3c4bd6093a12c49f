package com.tpcc.gateway.service.tpcc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.tpcc.gateway.config.TpccProperties;
import com.tpcc.gateway.domain.ErrorKind;
import com.tpcc.gateway.domain.QueryResult;
import com.tpcc.gateway.domain.ResultRow;
import com.tpcc.gateway.repository.QueryExecutor;
import com.tpcc.gateway.repository.sql.Query;
import com.tpcc.gateway.util.MetricsHelper;

/**
 * Unit tests for payment reporting against a mocked executor.
 *
 * Verifies that a failed sub-query turns the whole report into a failure
 * carrying the sub-query's error kind.
 */
class PaymentServiceTest {

    private QueryExecutor queryExecutor;
    private PaymentService paymentService;

    @BeforeEach
    void setUp() {
        queryExecutor = mock(QueryExecutor.class);
        paymentService = new PaymentService(queryExecutor, new TpccProperties(), mock(MetricsHelper.class));
    }

    @Test
    void getPaymentTrends_DistributionFails_ShouldReportFailure() {
        // Given
        when(queryExecutor.executeQuery(any(Query.class))).thenReturn(
            QueryResult.success(List.of(ResultRow.of(Map.of("payment_count", 3L)))),
            QueryResult.failure(ErrorKind.TRANSIENT, "could not serialize access"));

        // When
        PaymentService.PaymentTrends trends = paymentService.getPaymentTrends(1, 30);

        // Then
        assertThat(trends.success()).isFalse();
        assertThat(trends.errorKind()).isEqualTo(ErrorKind.TRANSIENT);
        assertThat(trends.error()).isEqualTo("could not serialize access");
        assertThat(trends.dailyTrends()).isEmpty();
        assertThat(trends.periodDays()).isEqualTo(30);
    }

    @Test
    void getPaymentTrends_NoPayments_ShouldSucceedWithEmptyTrends() {
        // Given
        when(queryExecutor.executeQuery(any(Query.class))).thenReturn(
            QueryResult.success(List.of()),
            QueryResult.success(List.of(ResultRow.of(Map.of("under_100", 0L)))));

        // When
        PaymentService.PaymentTrends trends = paymentService.getPaymentTrends(null, 7);

        // Then
        assertThat(trends.success()).isTrue();
        assertThat(trends.errorKind()).isNull();
        assertThat(trends.dailyTrends()).isEmpty();
        assertThat(trends.amountDistribution().getLong("under_100")).isZero();
    }

    @Test
    void getPaymentStatistics_TopCustomersFail_ShouldReportFailure() {
        // Given
        when(queryExecutor.executeQuery(any(Query.class))).thenReturn(
            QueryResult.success(List.of(ResultRow.of(Map.of("total_payments", 4L)))),
            QueryResult.success(List.of(ResultRow.of(Map.of("payment_count", 0L)))),
            QueryResult.failure(ErrorKind.BACKEND, "relation \"customer\" does not exist"));

        // When
        PaymentService.PaymentStatistics statistics = paymentService.getPaymentStatistics(1);

        // Then
        assertThat(statistics.success()).isFalse();
        assertThat(statistics.errorKind()).isEqualTo(ErrorKind.BACKEND);
        assertThat(statistics.topCustomers()).isEmpty();
    }
}
