package com.tpcc.gateway.integration.tpcc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import com.tpcc.gateway.domain.Page;
import com.tpcc.gateway.domain.QueryResult;
import com.tpcc.gateway.domain.ResultRow;
import com.tpcc.gateway.integration.BaseIntegrationTest;
import com.tpcc.gateway.service.tpcc.OrderQueryService;

class OrderQueryIntegrationTest extends BaseIntegrationTest {

    @Autowired
    private OrderQueryService orderQueryService;

    @Test
    void getOrders_ShouldPageNewestFirst() {
        // When
        Page<ResultRow> first = orderQueryService.getOrders(1, null, null, null, 2, 0);
        Page<ResultRow> last = orderQueryService.getOrders(1, null, null, null, 2, 4);

        // Then
        assertThat(first.totalCount()).isEqualTo(5);
        assertThat(first.items()).extracting(row -> row.getLong("o_id")).containsExactly(5L, 4L);
        assertThat(first.hasNext()).isTrue();
        assertThat(first.hasPrev()).isFalse();
        assertThat(last.items()).extracting(row -> row.getLong("o_id")).containsExactly(1L);
        assertThat(last.hasNext()).isFalse();
        assertThat(last.hasPrev()).isTrue();
    }

    @Test
    void getOrders_StatusFilter_ShouldMatchCountAndRows() {
        // When
        Page<ResultRow> pending = orderQueryService.getOrders(1, 1, null, "New", 50, 0);
        Page<ResultRow> delivered = orderQueryService.getOrders(1, 1, null, "delivered", 50, 0);

        // Then
        assertThat(pending.totalCount()).isEqualTo(2);
        assertThat(pending.items()).allMatch(row -> "New".equals(row.getString("status")));
        assertThat(delivered.totalCount()).isEqualTo(3);
        assertThat(delivered.items()).hasSize(3);
    }

    @Test
    void getOrders_CustomerFilter_ShouldNarrowResults() {
        Page<ResultRow> page = orderQueryService.getOrders(1, 1, 5, null, 50, 0);

        assertThat(page.totalCount()).isEqualTo(2);
        assertThat(page.items()).extracting(row -> row.getString("c_last")).containsOnly("OUGHTPRES");
    }

    @Test
    void getOrders_UnknownStatus_ShouldBeRejected() {
        assertThatThrownBy(() -> orderQueryService.getOrders(1, null, null, "shipped", 10, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("shipped");
    }

    @Test
    void getOrderDetails_ShouldIncludeLinesAndTotal() {
        // When
        OrderQueryService.OrderDetails details = orderQueryService.getOrderDetails(1, 1, 1);

        // Then
        assertThat(details.success()).isTrue();
        assertThat(details.order().getString("status")).isEqualTo("Delivered");
        assertThat(details.orderLines()).extracting(row -> row.getString("i_name"))
            .containsExactly("Widget Alpha", "Widget Beta");
        assertThat(details.totalAmount()).isEqualByComparingTo("110.00");
    }

    @Test
    void getOrderDetails_UnknownOrder_ShouldFail() {
        OrderQueryService.OrderDetails details = orderQueryService.getOrderDetails(1, 1, 42);

        assertThat(details.success()).isFalse();
        assertThat(details.error()).isEqualTo("Order not found");
    }

    @Test
    void getRecentOrders_ShouldRespectLimit() {
        QueryResult recent = orderQueryService.getRecentOrders(3);

        assertThat(recent.isSuccess()).isTrue();
        assertThat(recent.rows()).extracting(row -> row.getLong("o_id")).containsExactly(5L, 4L, 3L);
    }

    @Test
    void getOrderStatistics_ShouldSplitNewAndDelivered() {
        // When
        OrderQueryService.OrderStatistics statistics = orderQueryService.getOrderStatistics(null);

        // Then
        assertThat(statistics.success()).isTrue();
        assertThat(statistics.totalOrders()).isEqualTo(5);
        assertThat(statistics.newOrders()).isEqualTo(2);
        assertThat(statistics.deliveredOrders()).isEqualTo(3);
        assertThat(statistics.ordersToday()).isZero();
        // (110 + 111 + 39 + 34 + 220) / 5
        assertThat(statistics.avgOrderValue()).isCloseTo(102.8, within(0.001));
    }
}
