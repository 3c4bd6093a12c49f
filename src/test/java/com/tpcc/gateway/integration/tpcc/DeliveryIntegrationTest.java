package com.tpcc.gateway.integration.tpcc;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import com.tpcc.gateway.domain.ErrorKind;
import com.tpcc.gateway.domain.QueryResult;
import com.tpcc.gateway.domain.ResultRow;
import com.tpcc.gateway.integration.BaseIntegrationTest;
import com.tpcc.gateway.repository.QueryExecutor;
import com.tpcc.gateway.repository.sql.Query;
import com.tpcc.gateway.service.tpcc.DeliveryService;
import com.tpcc.gateway.service.tpcc.DeliveryService.DeliveryOutcome;

/**
 * Integration tests for Delivery.
 *
 * Tests verify that:
 * - the oldest pending order is delivered first
 * - the customer is credited with the order's line total
 * - an empty queue yields NOT_FOUND without side effects
 */
class DeliveryIntegrationTest extends BaseIntegrationTest {

    @Autowired
    private DeliveryService deliveryService;

    @Autowired
    private QueryExecutor queryExecutor;

    @Test
    void executeDelivery_ShouldDeliverOldestPendingOrder() {
        // When
        DeliveryOutcome outcome = deliveryService.executeDelivery(1, 7);

        // Then
        assertThat(outcome.success()).isTrue();
        assertThat(outcome.delivered().orderId()).isEqualTo(4L);
        assertThat(outcome.delivered().customerId()).isEqualTo(5L);
        assertThat(outcome.delivered().lineCount()).isEqualTo(2L);
        assertThat(outcome.delivered().amount()).isEqualByComparingTo("34.00");
        assertThat(outcome.delivered().newCustomerBalance()).isEqualByComparingTo("534.00");

        ResultRow order = single("SELECT o_carrier_id FROM orders WHERE o_w_id = 1 AND o_d_id = 1 AND o_id = 4");
        assertThat(order.getLong("o_carrier_id")).isEqualTo(7L);
        ResultRow customer = single("SELECT c_balance, c_delivery_cnt FROM customer "
            + "WHERE c_w_id = 1 AND c_d_id = 1 AND c_id = 5");
        assertThat(customer.getDecimal("c_balance")).isEqualByComparingTo("534.00");
        assertThat(customer.getLong("c_delivery_cnt")).isEqualTo(1L);
        assertThat(single("SELECT COUNT(*) AS n FROM order_line "
            + "WHERE ol_w_id = 1 AND ol_d_id = 1 AND ol_o_id = 4 AND ol_delivery_d IS NULL").getLong("n"))
            .isZero();

        QueryResult pending = queryExecutor.executeQuery(Query.of("SELECT no_o_id FROM new_order ORDER BY no_o_id"));
        assertThat(pending.rows()).extracting(row -> row.getLong("no_o_id")).containsExactly(5L);
    }

    @Test
    void executeDelivery_EmptyQueue_ShouldBeNotFound() {
        // Given
        assertThat(deliveryService.executeDelivery(1, 1).success()).isTrue();
        assertThat(deliveryService.executeDelivery(1, 1).delivered().orderId()).isEqualTo(5L);

        // When
        DeliveryOutcome outcome = deliveryService.executeDelivery(1, 1);

        // Then
        assertThat(outcome.success()).isFalse();
        assertThat(outcome.errorKind()).isEqualTo(ErrorKind.NOT_FOUND);
        assertThat(outcome.delivered()).isNull();
    }

    @Test
    void executeDelivery_InvalidCarrier_ShouldFailValidation() {
        // When
        DeliveryOutcome outcome = deliveryService.executeDelivery(1, 11);

        // Then
        assertThat(outcome.success()).isFalse();
        assertThat(outcome.errorKind()).isEqualTo(ErrorKind.VALIDATION);
        assertThat(single("SELECT COUNT(*) AS n FROM new_order").getLong("n")).isEqualTo(2L);
    }

    private ResultRow single(String sql) {
        return queryExecutor.executeQuery(Query.of(sql)).firstRow().orElseThrow();
    }
}
