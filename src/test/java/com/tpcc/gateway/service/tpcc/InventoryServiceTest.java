package com.tpcc.gateway.service.tpcc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.tpcc.gateway.domain.ErrorKind;
import com.tpcc.gateway.domain.QueryResult;
import com.tpcc.gateway.domain.ResultRow;
import com.tpcc.gateway.repository.QueryExecutor;
import com.tpcc.gateway.repository.sql.Query;

class InventoryServiceTest {

    @Test
    void searchPattern_ShouldWrapTrimmedLowercaseTerm() {
        assertThat(InventoryService.searchPattern("  GiZmo ")).isEqualTo("%gizmo%");
    }

    @Test
    void searchPattern_ShouldBeNullForBlankTerm() {
        assertThat(InventoryService.searchPattern(null)).isNull();
        assertThat(InventoryService.searchPattern("")).isNull();
        assertThat(InventoryService.searchPattern("   ")).isNull();
    }

    @Test
    void getInventoryStatistics_TopItemsFail_ShouldReportFailure() {
        // Given
        QueryExecutor queryExecutor = mock(QueryExecutor.class);
        when(queryExecutor.executeQuery(any(Query.class))).thenReturn(
            QueryResult.success(List.of(ResultRow.of(Map.of("total_stock_records", 12L)))),
            QueryResult.failure(ErrorKind.CONNECTIVITY, "connection reset"));

        // When
        InventoryService.InventoryStatistics statistics =
            new InventoryService(queryExecutor).getInventoryStatistics(null);

        // Then
        assertThat(statistics.success()).isFalse();
        assertThat(statistics.errorKind()).isEqualTo(ErrorKind.CONNECTIVITY);
        assertThat(statistics.error()).isEqualTo("connection reset");
        assertThat(statistics.totalStockRecords()).isZero();
    }
}
