package com.tpcc.gateway.service.tpcc;

import java.math.BigDecimal;
import java.util.List;

import org.springframework.stereotype.Service;

import com.tpcc.gateway.domain.ErrorKind;
import com.tpcc.gateway.domain.QueryResult;
import com.tpcc.gateway.domain.ResultRow;
import com.tpcc.gateway.domain.TransactionPhase;
import com.tpcc.gateway.domain.TransactionPlan;
import com.tpcc.gateway.repository.QueryExecutor;
import com.tpcc.gateway.repository.sql.Query;
import com.tpcc.gateway.util.MetricsHelper;

import io.micrometer.core.annotation.Timed;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.instrumentation.annotations.WithSpan;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * TPC-C Order-Status protocol (read-only).
 *
 * Read 1: the customer's most recent order, joined with the customer's name and balance.
 * Read 2: the lines of that order.
 *
 * Both reads go through the snapshot path, so calling it twice without
 * intervening writes returns the same outcome.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderStatusService {

    private final QueryExecutor queryExecutor;
    private final MetricsHelper metricsHelper;

    @Timed(value = "tpcc.order_status", description = "TPC-C Order-Status protocol")
    @WithSpan("tpcc.order_status")
    public OrderStatusOutcome getOrderStatus(int warehouseId, int districtId, int customerId) {
        long startTime = System.currentTimeMillis();
        Span span = Span.current();
        span.setAttribute("tpcc.warehouse_id", warehouseId);
        span.setAttribute("tpcc.district_id", districtId);
        span.setAttribute("tpcc.customer_id", customerId);

        TransactionPlan plan = TransactionPlan.start("order-status");

        QueryResult latest = queryExecutor.executeQuery(Query.builder(
                "SELECT o.o_id AS o_id, o.o_entry_d AS o_entry_d, o.o_carrier_id AS o_carrier_id, "
                    + "o.o_ol_cnt AS o_ol_cnt, c.c_first AS c_first, c.c_middle AS c_middle, "
                    + "c.c_last AS c_last, c.c_balance AS c_balance "
                    + "FROM orders o "
                    + "JOIN customer c ON c.c_w_id = o.o_w_id AND c.c_d_id = o.o_d_id AND c.c_id = o.o_c_id "
                    + "WHERE o.o_w_id = @w_id AND o.o_d_id = @d_id AND o.o_c_id = @c_id "
                    + "ORDER BY o.o_entry_d DESC, o.o_id DESC LIMIT 1")
            .bind("w_id", warehouseId).bind("d_id", districtId).bind("c_id", customerId)
            .build());
        if (!latest.isSuccess()) {
            plan.abort(latest.error());
            return finish(OrderStatusOutcome.failure(plan.phase(), latest.errorKind(), latest.error()), startTime);
        }
        if (latest.isEmpty()) {
            String error = "No orders found for customer " + warehouseId + "/" + districtId + "/" + customerId;
            plan.abort(error);
            return finish(OrderStatusOutcome.failure(plan.phase(), ErrorKind.NOT_FOUND, error), startTime);
        }
        ResultRow order = latest.rows().get(0);
        long orderId = order.getLong("o_id");
        plan.step("read latest order");

        QueryResult lines = queryExecutor.executeQuery(Query.builder(
                "SELECT ol.ol_number AS ol_number, ol.ol_i_id AS ol_i_id, ol.ol_supply_w_id AS ol_supply_w_id, "
                    + "ol.ol_quantity AS ol_quantity, ol.ol_amount AS ol_amount, "
                    + "ol.ol_delivery_d AS ol_delivery_d "
                    + "FROM order_line ol "
                    + "WHERE ol.ol_w_id = @w_id AND ol.ol_d_id = @d_id AND ol.ol_o_id = @o_id "
                    + "ORDER BY ol.ol_number")
            .bind("w_id", warehouseId).bind("d_id", districtId).bind("o_id", orderId)
            .build());
        if (!lines.isSuccess()) {
            plan.abort(lines.error());
            return finish(OrderStatusOutcome.failure(plan.phase(), lines.errorKind(), lines.error()), startTime);
        }
        plan.step("read order lines");
        plan.readsComplete();
        plan.validated();
        plan.writesComplete();

        log.debug("Order-Status: w={}, d={}, c={}, o_id={}, lines={}",
            warehouseId, districtId, customerId, orderId, lines.size());

        return finish(new OrderStatusOutcome(true, plan.phase(), warehouseId, districtId, customerId,
            PaymentService.fullName(order), order.getDecimal("c_balance"),
            orderId, order.get("o_entry_d"), order.getLong("o_carrier_id"),
            lines.rows(), 0, null, null), startTime);
    }

    private OrderStatusOutcome finish(OrderStatusOutcome outcome, long startTime) {
        long duration = System.currentTimeMillis() - startTime;
        metricsHelper.recordProtocol("order-status", outcome.success(), duration);
        return outcome.withDuration(duration);
    }

    public record OrderStatusOutcome(
        boolean success,
        TransactionPhase phase,
        Integer warehouseId,
        Integer districtId,
        Integer customerId,
        String customerName,
        BigDecimal customerBalance,
        Long orderId,
        Object entryDate,
        Long carrierId,
        List<ResultRow> orderLines,
        long durationMs,
        ErrorKind errorKind,
        String error
    ) implements ProtocolOutcome {
        static OrderStatusOutcome failure(TransactionPhase phase, ErrorKind errorKind, String error) {
            return new OrderStatusOutcome(false, phase, null, null, null, null, null, null, null, null,
                List.of(), 0, errorKind, error);
        }

        OrderStatusOutcome withDuration(long durationMs) {
            return new OrderStatusOutcome(success, phase, warehouseId, districtId, customerId, customerName,
                customerBalance, orderId, entryDate, carrierId, orderLines, durationMs, errorKind, error);
        }
    }
}
