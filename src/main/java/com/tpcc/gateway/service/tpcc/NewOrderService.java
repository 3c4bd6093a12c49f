package com.tpcc.gateway.service.tpcc;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.tpcc.gateway.config.TpccProperties;
import com.tpcc.gateway.domain.ErrorKind;
import com.tpcc.gateway.domain.MutationResult;
import com.tpcc.gateway.domain.ResultRow;
import com.tpcc.gateway.domain.TransactionPhase;
import com.tpcc.gateway.domain.TransactionPlan;
import com.tpcc.gateway.domain.TransactionResult;
import com.tpcc.gateway.repository.QueryExecutor;
import com.tpcc.gateway.repository.ReadWriteTransaction;
import com.tpcc.gateway.repository.sql.Query;
import com.tpcc.gateway.util.MetricsHelper;

import io.micrometer.core.annotation.Timed;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.instrumentation.annotations.WithSpan;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * TPC-C New-Order protocol.
 *
 * The whole order is created in ONE read-write transaction:
 * - reads: customer, warehouse, district, then item and stock for every line
 * - writes: {@code d_next_o_id + 1}, orders, new_order, per-line stock update and order_line
 *
 * An unknown item aborts the plan with NOT_FOUND and nothing is written.
 * Stock is decremented by the ordered quantity while more than that remains,
 * otherwise replenished ({@code quantity - ordered + 91}).
 *
 * After commit the order is tagged with {@code tpcc.region-name}; that update
 * is best-effort and never changes the outcome.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NewOrderService {

    static final int MAX_LINES = 15;
    static final int MAX_QUANTITY = 10;
    private static final int REPLENISH_AMOUNT = 91;

    private final QueryExecutor queryExecutor;
    private final TpccProperties properties;
    private final MetricsHelper metricsHelper;

    /** One requested line. */
    public record OrderLineRequest(int itemId, int supplyWarehouseId, int quantity) {
    }

    @Timed(value = "tpcc.new_order", description = "TPC-C New-Order protocol")
    @WithSpan("tpcc.new_order")
    public NewOrderOutcome executeNewOrder(int warehouseId, int districtId, int customerId,
                                           List<OrderLineRequest> lines) {
        long startTime = System.currentTimeMillis();
        Span span = Span.current();
        span.setAttribute("tpcc.warehouse_id", warehouseId);
        span.setAttribute("tpcc.district_id", districtId);
        span.setAttribute("tpcc.customer_id", customerId);

        TransactionPlan plan = TransactionPlan.start("new-order");
        String validationError = validate(lines);
        if (validationError != null) {
            plan.abort(validationError);
            return finish(NewOrderOutcome.failure(plan.phase(), ErrorKind.VALIDATION, validationError), startTime);
        }
        span.setAttribute("tpcc.line_count", lines.size());

        TransactionResult<CreatedOrder> result = queryExecutor.executeInTransaction(tx -> {
            plan.restart();
            return createOrder(tx, plan, warehouseId, districtId, customerId, lines);
        });

        if (!result.committed()) {
            plan.abort(result.error());
            log.warn("New-Order rolled back: w={}, d={}, c={}, error={}", warehouseId, districtId, customerId,
                result.error());
            return finish(NewOrderOutcome.failure(plan.phase(), result.errorKind(), result.error()), startTime);
        }

        CreatedOrder order = result.value();
        boolean regionTagged = tagRegion(warehouseId, districtId, order.orderId());

        log.info("New-Order committed: w={}, d={}, c={}, o_id={}, lines={}, total={}",
            warehouseId, districtId, customerId, order.orderId(), order.lines().size(), order.totalAmount());

        return finish(new NewOrderOutcome(true, plan.phase(), warehouseId, districtId, customerId,
            order.orderId(), order.customerLast(), order.customerCredit(), order.discount(),
            order.warehouseTax(), order.districtTax(), order.totalAmount(), order.entryDate().toString(),
            order.lines(), regionTagged ? properties.getRegionName() : null, 0, null, null), startTime);
    }

    private static String validate(List<OrderLineRequest> lines) {
        if (lines == null || lines.isEmpty() || lines.size() > MAX_LINES) {
            return "An order needs between 1 and " + MAX_LINES + " lines";
        }
        for (OrderLineRequest line : lines) {
            if (line.quantity() < 1 || line.quantity() > MAX_QUANTITY) {
                return "Line quantity must be between 1 and " + MAX_QUANTITY + ": item " + line.itemId();
            }
        }
        return null;
    }

    private CreatedOrder createOrder(ReadWriteTransaction tx, TransactionPlan plan,
                                     int warehouseId, int districtId, int customerId,
                                     List<OrderLineRequest> lines) {
        // =====================================================================
        // Reads
        // =====================================================================

        ResultRow customer = tx.requireRow(Query.builder(
                "SELECT c.c_discount AS c_discount, c.c_last AS c_last, c.c_credit AS c_credit "
                    + "FROM customer c WHERE c.c_w_id = @w_id AND c.c_d_id = @d_id AND c.c_id = @c_id")
                .bind("w_id", warehouseId).bind("d_id", districtId).bind("c_id", customerId).build(),
            "Customer", warehouseId + "/" + districtId + "/" + customerId);
        ResultRow warehouse = tx.requireRow(Query.builder(
                "SELECT w.w_tax AS w_tax FROM warehouse w WHERE w.w_id = @w_id")
                .bind("w_id", warehouseId).build(),
            "Warehouse", String.valueOf(warehouseId));
        plan.step("read customer and warehouse");

        ResultRow district = tx.requireRow(Query.builder(
                "SELECT d.d_tax AS d_tax, d.d_next_o_id AS d_next_o_id FROM district d "
                    + "WHERE d.d_w_id = @w_id AND d.d_id = @d_id")
                .bind("w_id", warehouseId).bind("d_id", districtId).build(),
            "District", warehouseId + "/" + districtId);
        long orderId = district.getLong("d_next_o_id");
        plan.step("read district");

        String distColumn = String.format("s_dist_%02d", districtId);
        Map<String, StockState> stockByKey = new LinkedHashMap<>();
        List<ResultRow> items = new ArrayList<>();
        for (OrderLineRequest line : lines) {
            ResultRow item = tx.requireRow(Query.builder(
                    "SELECT i.i_price AS i_price, i.i_name AS i_name, i.i_data AS i_data FROM item i "
                        + "WHERE i.i_id = @i_id")
                    .bind("i_id", line.itemId()).build(),
                "Item", String.valueOf(line.itemId()));
            items.add(item);

            String stockKey = line.supplyWarehouseId() + "/" + line.itemId();
            if (!stockByKey.containsKey(stockKey)) {
                ResultRow stock = tx.requireRow(Query.builder(
                        "SELECT s.s_w_id AS s_w_id, s.s_i_id AS s_i_id, s.s_quantity AS s_quantity, "
                            + "s.s_ytd AS s_ytd, s.s_order_cnt AS s_order_cnt, s.s_remote_cnt AS s_remote_cnt, "
                            + "s.s_data AS s_data, s." + distColumn + " AS dist_info "
                            + "FROM stock s WHERE s.s_w_id = @w_id AND s.s_i_id = @i_id")
                        .bind("w_id", line.supplyWarehouseId()).bind("i_id", line.itemId()).build(),
                    "Stock", stockKey);
                stockByKey.put(stockKey, StockState.from(stock));
            }
        }
        plan.step("read " + lines.size() + " items and stock");
        plan.readsComplete();

        // =====================================================================
        // Computation
        // =====================================================================

        BigDecimal discount = customer.getDecimal("c_discount", BigDecimal.ZERO);
        BigDecimal warehouseTax = warehouse.getDecimal("w_tax", BigDecimal.ZERO);
        BigDecimal districtTax = district.getDecimal("d_tax", BigDecimal.ZERO);
        boolean allLocal = lines.stream().allMatch(line -> line.supplyWarehouseId() == warehouseId);

        List<OrderedLine> ordered = new ArrayList<>();
        BigDecimal subtotal = BigDecimal.ZERO;
        for (int i = 0; i < lines.size(); i++) {
            OrderLineRequest line = lines.get(i);
            ResultRow item = items.get(i);
            StockState stock = stockByKey.get(line.supplyWarehouseId() + "/" + line.itemId());
            stock.apply(line.quantity(), line.supplyWarehouseId() != warehouseId);

            BigDecimal amount = item.getDecimal("i_price", BigDecimal.ZERO)
                .multiply(BigDecimal.valueOf(line.quantity()))
                .setScale(2, RoundingMode.HALF_UP);
            subtotal = subtotal.add(amount);
            ordered.add(new OrderedLine(i + 1, line.itemId(), item.getString("i_name"), line.supplyWarehouseId(),
                line.quantity(), stock.quantity, amount, brandGeneric(item.getString("i_data"), stock.data),
                stock.distInfo));
        }
        BigDecimal total = subtotal
            .multiply(BigDecimal.ONE.subtract(discount))
            .multiply(BigDecimal.ONE.add(warehouseTax).add(districtTax))
            .setScale(2, RoundingMode.HALF_UP);
        plan.validated();

        // =====================================================================
        // Writes
        // =====================================================================

        Instant entryDate = Instant.now();
        tx.update(Query.builder("UPDATE district SET d_next_o_id = @next WHERE d_w_id = @w_id AND d_id = @d_id")
            .bind("next", orderId + 1).bind("w_id", warehouseId).bind("d_id", districtId).build());
        plan.step("advance d_next_o_id");

        tx.update(Query.builder(
                "INSERT INTO orders (o_id, o_d_id, o_w_id, o_c_id, o_entry_d, o_carrier_id, o_ol_cnt, o_all_local) "
                    + "VALUES (@o_id, @d_id, @w_id, @c_id, @entry_d, NULL, @ol_cnt, @all_local)")
            .bind("o_id", orderId).bind("d_id", districtId).bind("w_id", warehouseId).bind("c_id", customerId)
            .bind("entry_d", entryDate).bind("ol_cnt", lines.size()).bind("all_local", allLocal ? 1 : 0)
            .build());
        tx.update(Query.builder("INSERT INTO new_order (no_o_id, no_d_id, no_w_id) VALUES (@o_id, @d_id, @w_id)")
            .bind("o_id", orderId).bind("d_id", districtId).bind("w_id", warehouseId).build());
        plan.step("insert orders and new_order");

        for (Map.Entry<String, StockState> entry : stockByKey.entrySet()) {
            StockState stock = entry.getValue();
            tx.update(Query.builder(
                    "UPDATE stock SET s_quantity = @quantity, s_ytd = @ytd, s_order_cnt = @order_cnt, "
                        + "s_remote_cnt = @remote_cnt WHERE s_w_id = @w_id AND s_i_id = @i_id")
                .bind("quantity", stock.quantity).bind("ytd", stock.ytd)
                .bind("order_cnt", stock.orderCount).bind("remote_cnt", stock.remoteCount)
                .bind("w_id", stock.warehouseId).bind("i_id", stock.itemId)
                .build());
        }
        plan.step("update stock");

        for (OrderedLine line : ordered) {
            tx.update(Query.builder(
                    "INSERT INTO order_line (ol_o_id, ol_d_id, ol_w_id, ol_number, ol_i_id, ol_supply_w_id, "
                        + "ol_delivery_d, ol_quantity, ol_amount, ol_dist_info) "
                        + "VALUES (@o_id, @d_id, @w_id, @number, @i_id, @supply_w_id, NULL, @quantity, @amount, "
                        + "@dist_info)")
                .bind("o_id", orderId).bind("d_id", districtId).bind("w_id", warehouseId)
                .bind("number", line.lineNumber()).bind("i_id", line.itemId())
                .bind("supply_w_id", line.supplyWarehouseId()).bind("quantity", line.quantity())
                .bind("amount", line.amount()).bind("dist_info", line.distInfo())
                .build());
        }
        plan.step("insert order lines");
        plan.writesComplete();

        return new CreatedOrder(orderId, customer.getString("c_last"), customer.getString("c_credit"),
            discount, warehouseTax, districtTax, total, entryDate, ordered);
    }

    private boolean tagRegion(int warehouseId, int districtId, long orderId) {
        MutationResult tagged = queryExecutor.executeDml(Query.builder(
                "UPDATE orders SET region_created = @region WHERE o_w_id = @w_id AND o_d_id = @d_id AND o_id = @o_id")
            .bind("region", properties.getRegionName())
            .bind("w_id", warehouseId).bind("d_id", districtId).bind("o_id", orderId)
            .build());
        if (!tagged.success()) {
            log.warn("Order {}/{}/{} committed but region tagging failed: {}",
                warehouseId, districtId, orderId, tagged.error());
            metricsHelper.recordBestEffortFailure("new_order.region");
        }
        return tagged.success();
    }

    static String brandGeneric(String itemData, String stockData) {
        boolean original = itemData != null && itemData.contains("ORIGINAL")
            && stockData != null && stockData.contains("ORIGINAL");
        return original ? "B" : "G";
    }

    private NewOrderOutcome finish(NewOrderOutcome outcome, long startTime) {
        long duration = System.currentTimeMillis() - startTime;
        metricsHelper.recordProtocol("new-order", outcome.success(), duration);
        return outcome.withDuration(duration);
    }

    // =========================================================================
    // Working state and results
    // =========================================================================

    /** Stock row as it will be written; repeated items on one order accumulate here. */
    private static final class StockState {
        private final long warehouseId;
        private final long itemId;
        private final String data;
        private final String distInfo;
        private long quantity;
        private long ytd;
        private long orderCount;
        private long remoteCount;

        private StockState(long warehouseId, long itemId, String data, String distInfo,
                           long quantity, long ytd, long orderCount, long remoteCount) {
            this.warehouseId = warehouseId;
            this.itemId = itemId;
            this.data = data;
            this.distInfo = distInfo;
            this.quantity = quantity;
            this.ytd = ytd;
            this.orderCount = orderCount;
            this.remoteCount = remoteCount;
        }

        static StockState from(ResultRow row) {
            return new StockState(row.getLong("s_w_id"), row.getLong("s_i_id"),
                row.getString("s_data"), row.getString("dist_info"),
                row.getLong("s_quantity", 0L), row.getLong("s_ytd", 0L),
                row.getLong("s_order_cnt", 0L), row.getLong("s_remote_cnt", 0L));
        }

        void apply(int ordered, boolean remote) {
            quantity = quantity > ordered ? quantity - ordered : quantity - ordered + REPLENISH_AMOUNT;
            ytd += ordered;
            orderCount++;
            if (remote) {
                remoteCount++;
            }
        }
    }

    private record CreatedOrder(
        long orderId,
        String customerLast,
        String customerCredit,
        BigDecimal discount,
        BigDecimal warehouseTax,
        BigDecimal districtTax,
        BigDecimal totalAmount,
        Instant entryDate,
        List<OrderedLine> lines
    ) {
    }

    public record OrderedLine(
        int lineNumber,
        int itemId,
        String itemName,
        int supplyWarehouseId,
        int quantity,
        long stockQuantity,
        BigDecimal amount,
        String brandGeneric,
        String distInfo
    ) {
    }

    public record NewOrderOutcome(
        boolean success,
        TransactionPhase phase,
        Integer warehouseId,
        Integer districtId,
        Integer customerId,
        Long orderId,
        String customerLast,
        String customerCredit,
        BigDecimal discount,
        BigDecimal warehouseTax,
        BigDecimal districtTax,
        BigDecimal totalAmount,
        String entryDate,
        List<OrderedLine> lines,
        String regionCreated,
        long durationMs,
        ErrorKind errorKind,
        String error
    ) implements ProtocolOutcome {
        static NewOrderOutcome failure(TransactionPhase phase, ErrorKind errorKind, String error) {
            return new NewOrderOutcome(false, phase, null, null, null, null, null, null, null, null, null, null,
                null, List.of(), null, 0, errorKind, error);
        }

        NewOrderOutcome withDuration(long durationMs) {
            return new NewOrderOutcome(success, phase, warehouseId, districtId, customerId, orderId, customerLast,
                customerCredit, discount, warehouseTax, districtTax, totalAmount, entryDate, lines, regionCreated,
                durationMs, errorKind, error);
        }
    }
}
