package com.tpcc.gateway.service.tpcc;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

import org.springframework.stereotype.Service;

import com.tpcc.gateway.domain.ErrorKind;
import com.tpcc.gateway.domain.ResultRow;
import com.tpcc.gateway.domain.TransactionPhase;
import com.tpcc.gateway.domain.TransactionPlan;
import com.tpcc.gateway.domain.TransactionResult;
import com.tpcc.gateway.repository.PlanAbortedException;
import com.tpcc.gateway.repository.QueryExecutor;
import com.tpcc.gateway.repository.sql.Query;
import com.tpcc.gateway.util.MetricsHelper;

import io.micrometer.core.annotation.Timed;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.instrumentation.annotations.WithSpan;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * TPC-C Delivery protocol.
 *
 * Delivers the oldest pending order of a warehouse in one read-write transaction:
 * 1. Find the oldest {@code new_order} row (by entry date, then order id)
 * 2. Sum the order's line amounts and read the customer
 * 3. Delete the {@code new_order} row, set the carrier, stamp the delivery date
 *    on every line, credit the customer with the line total and bump
 *    {@code c_delivery_cnt}
 *
 * A warehouse with nothing pending yields a NOT_FOUND outcome.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeliveryService {

    private static final int MIN_CARRIER_ID = 1;
    private static final int MAX_CARRIER_ID = 10;

    private final QueryExecutor queryExecutor;
    private final MetricsHelper metricsHelper;

    @Timed(value = "tpcc.delivery", description = "TPC-C Delivery protocol")
    @WithSpan("tpcc.delivery")
    public DeliveryOutcome executeDelivery(int warehouseId, int carrierId) {
        long startTime = System.currentTimeMillis();
        Span span = Span.current();
        span.setAttribute("tpcc.warehouse_id", warehouseId);
        span.setAttribute("tpcc.carrier_id", carrierId);

        TransactionPlan plan = TransactionPlan.start("delivery");
        if (carrierId < MIN_CARRIER_ID || carrierId > MAX_CARRIER_ID) {
            String error = "Carrier id must be between " + MIN_CARRIER_ID + " and " + MAX_CARRIER_ID
                + ": " + carrierId;
            plan.abort(error);
            return finish(DeliveryOutcome.failure(plan.phase(), warehouseId, carrierId, ErrorKind.VALIDATION, error),
                startTime);
        }

        TransactionResult<DeliveredOrder> result = queryExecutor.executeInTransaction(tx -> {
            plan.restart();

            ResultRow pending = tx.queryForRow(Query.builder(
                    "SELECT nw.no_o_id AS o_id, nw.no_d_id AS d_id, o.o_c_id AS c_id "
                        + "FROM new_order nw "
                        + "JOIN orders o ON o.o_w_id = nw.no_w_id AND o.o_d_id = nw.no_d_id AND o.o_id = nw.no_o_id "
                        + "WHERE nw.no_w_id = @w_id "
                        + "ORDER BY o.o_entry_d, o.o_id LIMIT 1")
                    .bind("w_id", warehouseId).build())
                .orElseThrow(() -> PlanAbortedException.notFound("No pending order for warehouse " + warehouseId));
            long orderId = pending.getLong("o_id");
            long districtId = pending.getLong("d_id");
            long customerId = pending.getLong("c_id");
            plan.step("read oldest pending order");

            ResultRow lines = tx.requireRow(Query.builder(
                    "SELECT COALESCE(SUM(ol.ol_amount), 0) AS total_amount, COUNT(*) AS line_count "
                        + "FROM order_line ol WHERE ol.ol_w_id = @w_id AND ol.ol_d_id = @d_id AND ol.ol_o_id = @o_id")
                    .bind("w_id", warehouseId).bind("d_id", districtId).bind("o_id", orderId).build(),
                "Order lines", warehouseId + "/" + districtId + "/" + orderId);
            BigDecimal total = lines.getDecimal("total_amount", BigDecimal.ZERO).setScale(2, RoundingMode.HALF_UP);
            long lineCount = lines.getLong("line_count", 0L);
            plan.step("sum order lines");

            ResultRow customer = tx.requireRow(Query.builder(
                    "SELECT c.c_balance AS c_balance, c.c_delivery_cnt AS c_delivery_cnt FROM customer c "
                        + "WHERE c.c_w_id = @w_id AND c.c_d_id = @d_id AND c.c_id = @c_id")
                    .bind("w_id", warehouseId).bind("d_id", districtId).bind("c_id", customerId).build(),
                "Customer", warehouseId + "/" + districtId + "/" + customerId);
            plan.step("read customer");
            plan.readsComplete();

            BigDecimal newBalance = customer.getDecimal("c_balance", BigDecimal.ZERO).add(total)
                .setScale(2, RoundingMode.HALF_UP);
            long newDeliveryCount = customer.getLong("c_delivery_cnt", 0L) + 1;
            plan.validated();

            tx.update(Query.builder(
                    "DELETE FROM new_order WHERE no_w_id = @w_id AND no_d_id = @d_id AND no_o_id = @o_id")
                .bind("w_id", warehouseId).bind("d_id", districtId).bind("o_id", orderId).build());
            plan.step("delete new_order");

            tx.update(Query.builder(
                    "UPDATE orders SET o_carrier_id = @carrier "
                        + "WHERE o_w_id = @w_id AND o_d_id = @d_id AND o_id = @o_id")
                .bind("carrier", carrierId)
                .bind("w_id", warehouseId).bind("d_id", districtId).bind("o_id", orderId).build());
            plan.step("set carrier");

            tx.update(Query.builder(
                    "UPDATE order_line SET ol_delivery_d = @delivered "
                        + "WHERE ol_w_id = @w_id AND ol_d_id = @d_id AND ol_o_id = @o_id")
                .bind("delivered", Instant.now())
                .bind("w_id", warehouseId).bind("d_id", districtId).bind("o_id", orderId).build());
            plan.step("stamp delivery date");

            tx.update(Query.builder(
                    "UPDATE customer SET c_balance = @balance, c_delivery_cnt = @cnt "
                        + "WHERE c_w_id = @w_id AND c_d_id = @d_id AND c_id = @c_id")
                .bind("balance", newBalance).bind("cnt", newDeliveryCount)
                .bind("w_id", warehouseId).bind("d_id", districtId).bind("c_id", customerId).build());
            plan.step("credit customer");
            plan.writesComplete();

            return new DeliveredOrder(districtId, orderId, customerId, lineCount, total, newBalance);
        });

        if (!result.committed()) {
            plan.abort(result.error());
            if (result.errorKind() == ErrorKind.NOT_FOUND) {
                log.info("Delivery: nothing pending for warehouse {}", warehouseId);
            } else {
                log.warn("Delivery rolled back: w={}, error={}", warehouseId, result.error());
            }
            return finish(DeliveryOutcome.failure(plan.phase(), warehouseId, carrierId,
                result.errorKind(), result.error()), startTime);
        }

        DeliveredOrder delivered = result.value();
        log.info("Delivery committed: w={}, d={}, o_id={}, c={}, amount={}",
            warehouseId, delivered.districtId(), delivered.orderId(), delivered.customerId(), delivered.amount());

        return finish(new DeliveryOutcome(true, plan.phase(), warehouseId, carrierId, delivered, 0, null, null),
            startTime);
    }

    private DeliveryOutcome finish(DeliveryOutcome outcome, long startTime) {
        long duration = System.currentTimeMillis() - startTime;
        metricsHelper.recordProtocol("delivery", outcome.success(), duration);
        return outcome.withDuration(duration);
    }

    public record DeliveredOrder(
        long districtId,
        long orderId,
        long customerId,
        long lineCount,
        BigDecimal amount,
        BigDecimal newCustomerBalance
    ) {
    }

    public record DeliveryOutcome(
        boolean success,
        TransactionPhase phase,
        int warehouseId,
        int carrierId,
        DeliveredOrder delivered,
        long durationMs,
        ErrorKind errorKind,
        String error
    ) implements ProtocolOutcome {
        static DeliveryOutcome failure(TransactionPhase phase, int warehouseId, int carrierId,
                                       ErrorKind errorKind, String error) {
            return new DeliveryOutcome(false, phase, warehouseId, carrierId, null, 0, errorKind, error);
        }

        DeliveryOutcome withDuration(long durationMs) {
            return new DeliveryOutcome(success, phase, warehouseId, carrierId, delivered, durationMs,
                errorKind, error);
        }
    }
}
