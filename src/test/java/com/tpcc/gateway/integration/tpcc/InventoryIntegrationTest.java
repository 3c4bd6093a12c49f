package com.tpcc.gateway.integration.tpcc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import com.tpcc.gateway.domain.Page;
import com.tpcc.gateway.domain.QueryResult;
import com.tpcc.gateway.domain.ResultRow;
import com.tpcc.gateway.integration.BaseIntegrationTest;
import com.tpcc.gateway.service.tpcc.InventoryService;

class InventoryIntegrationTest extends BaseIntegrationTest {

    @Autowired
    private InventoryService inventoryService;

    @Test
    void getInventory_LowStockFilter_ShouldListLowestFirst() {
        // When
        Page<ResultRow> page = inventoryService.getInventory(1, 10, null, 50, 0);

        // Then
        assertThat(page.totalCount()).isEqualTo(4);
        assertThat(page.items()).extracting(row -> row.getLong("s_i_id")).containsExactly(7L, 4L, 2L, 10L);
    }

    @Test
    void getInventory_Search_ShouldMatchNameCaseInsensitively() {
        Page<ResultRow> page = inventoryService.getInventory(null, null, "GIZMO", 50, 0);

        assertThat(page.totalCount()).isEqualTo(2);
        assertThat(page.items()).extracting(row -> row.getString("i_name"))
            .containsExactlyInAnyOrder("Gizmo Small", "Gizmo Large");
    }

    @Test
    void getLowStockItems_ShouldApplyThresholdAndLimit() {
        QueryResult result = inventoryService.getLowStockItems(1, 6, 10);

        assertThat(result.rows()).extracting(row -> row.getLong("s_i_id")).containsExactly(7L, 4L);
    }

    @Test
    void getItemDetails_ShouldAggregateStock() {
        // When
        InventoryService.ItemDetails details = inventoryService.getItemDetails(5);

        // Then
        assertThat(details.success()).isTrue();
        assertThat(details.item().getString("i_name")).isEqualTo("Sprocket");
        assertThat(details.item().getLong("warehouse_count")).isEqualTo(1L);
        assertThat(details.stockByWarehouse()).hasSize(1);
        assertThat(details.stockByWarehouse().get(0).getLong("s_quantity")).isEqualTo(100L);
    }

    @Test
    void getItemDetails_UnknownItem_ShouldFail() {
        InventoryService.ItemDetails details = inventoryService.getItemDetails(999);

        assertThat(details.success()).isFalse();
        assertThat(details.error()).isEqualTo("Item not found");
    }

    @Test
    void getInventoryStatistics_ShouldCountLowAndOutOfStock() {
        // When
        InventoryService.InventoryStatistics statistics = inventoryService.getInventoryStatistics(1);

        // Then
        assertThat(statistics.success()).isTrue();
        assertThat(statistics.totalStockRecords()).isEqualTo(10);
        assertThat(statistics.lowStockItems()).isEqualTo(4);
        assertThat(statistics.outOfStockItems()).isZero();
        assertThat(statistics.topOrderedItems()).hasSize(5);
    }

    @Test
    void getWarehouseSummary_UnknownWarehouse_ShouldFail() {
        InventoryService.WarehouseSummary summary = inventoryService.getWarehouseSummary(42);

        assertThat(summary.success()).isFalse();
        assertThat(summary.error()).isEqualTo("Warehouse not found");
    }

    @Test
    void getWarehouseSummary_ShouldSumStock() {
        InventoryService.WarehouseSummary summary = inventoryService.getWarehouseSummary(1);

        assertThat(summary.success()).isTrue();
        assertThat(summary.warehouseInfo().getString("w_name")).isEqualTo("W-ONE");
        assertThat(summary.summary().getLong("total_quantity")).isEqualTo(287L);
    }

    @Test
    void searchItems_BlankTerm_ShouldBeRejected() {
        assertThatThrownBy(() -> inventoryService.searchItems("  ", 10))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void searchItems_ShouldMatchItemData() {
        QueryResult result = inventoryService.searchItems("original", 10);

        assertThat(result.rows()).extracting(row -> row.getLong("i_id")).containsExactlyInAnyOrder(1L, 4L);
    }
}
