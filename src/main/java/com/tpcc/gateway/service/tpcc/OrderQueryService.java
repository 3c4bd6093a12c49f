package com.tpcc.gateway.service.tpcc;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.tpcc.gateway.domain.ErrorKind;
import com.tpcc.gateway.domain.Page;
import com.tpcc.gateway.domain.QueryResult;
import com.tpcc.gateway.domain.ResultRow;
import com.tpcc.gateway.repository.QueryExecutor;
import com.tpcc.gateway.repository.sql.FilterCriterion;
import com.tpcc.gateway.repository.sql.FilterQueryBuilder;
import com.tpcc.gateway.repository.sql.PageRequest;
import com.tpcc.gateway.repository.sql.Query;
import com.tpcc.gateway.repository.sql.WhereClause;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Order listings and statistics.
 *
 * An order is "New" while it still has a {@code new_order} row and
 * "Delivered" afterwards.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderQueryService {

    private static final String STATUS_COLUMN =
        "CASE WHEN nw.no_o_id IS NOT NULL THEN 'New' ELSE 'Delivered' END AS status";

    private static final String NEW_ORDER_JOIN =
        "LEFT JOIN new_order nw ON nw.no_w_id = o.o_w_id AND nw.no_d_id = o.o_d_id AND nw.no_o_id = o.o_id";

    private final QueryExecutor queryExecutor;

    /**
     * Paginated orders, newest first.
     *
     * @param status "New", "Delivered" (case-insensitive) or null for both
     * @throws IllegalArgumentException for any other status, or page bounds out of range
     */
    public Page<ResultRow> getOrders(Integer warehouseId, Integer districtId, Integer customerId, String status,
                                     int limit, int offset) {
        return queryExecutor.executePage(FilterQueryBuilder
            .select("SELECT o.o_id AS o_id, o.o_w_id AS o_w_id, o.o_d_id AS o_d_id, o.o_c_id AS o_c_id, "
                + "o.o_entry_d AS o_entry_d, o.o_carrier_id AS o_carrier_id, o.o_ol_cnt AS o_ol_cnt, "
                + "c.c_first AS c_first, c.c_middle AS c_middle, c.c_last AS c_last, " + STATUS_COLUMN + " "
                + "FROM orders o "
                + "JOIN customer c ON c.c_w_id = o.o_w_id AND c.c_d_id = o.o_d_id AND c.c_id = o.o_c_id "
                + NEW_ORDER_JOIN)
            .count("SELECT COUNT(*) AS total_count FROM orders o " + NEW_ORDER_JOIN)
            .where("o.o_w_id = @w_id", "w_id", warehouseId)
            .where("o.o_d_id = @d_id", "d_id", districtId)
            .where("o.o_c_id = @c_id", "c_id", customerId)
            .where(statusCriterion(status))
            .orderBy("o.o_entry_d DESC, o.o_id DESC")
            .build(PageRequest.of(limit, offset)));
    }

    static FilterCriterion statusCriterion(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        switch (status.trim().toLowerCase(Locale.ROOT)) {
            case "new":
                return FilterCriterion.fixed("nw.no_o_id IS NOT NULL");
            case "delivered":
                return FilterCriterion.fixed("nw.no_o_id IS NULL");
            default:
                throw new IllegalArgumentException("Unknown order status: " + status);
        }
    }

    /**
     * Order header with customer name and status, its lines with item names, and the line total.
     */
    public OrderDetails getOrderDetails(int warehouseId, int districtId, int orderId) {
        QueryResult order = queryExecutor.executeQuery(Query.builder(
                "SELECT o.o_id AS o_id, o.o_w_id AS o_w_id, o.o_d_id AS o_d_id, o.o_c_id AS o_c_id, "
                    + "o.o_entry_d AS o_entry_d, o.o_carrier_id AS o_carrier_id, o.o_ol_cnt AS o_ol_cnt, "
                    + "o.o_all_local AS o_all_local, o.region_created AS region_created, "
                    + "c.c_first AS c_first, c.c_middle AS c_middle, c.c_last AS c_last, " + STATUS_COLUMN + " "
                    + "FROM orders o "
                    + "JOIN customer c ON c.c_w_id = o.o_w_id AND c.c_d_id = o.o_d_id AND c.c_id = o.o_c_id "
                    + NEW_ORDER_JOIN + " "
                    + "WHERE o.o_w_id = @w_id AND o.o_d_id = @d_id AND o.o_id = @o_id")
            .bind("w_id", warehouseId).bind("d_id", districtId).bind("o_id", orderId)
            .build());
        if (!order.isSuccess()) {
            return OrderDetails.failure(order.error());
        }
        if (order.isEmpty()) {
            return OrderDetails.failure("Order not found");
        }

        QueryResult lines = queryExecutor.executeQuery(Query.builder(
                "SELECT ol.ol_number AS ol_number, ol.ol_i_id AS ol_i_id, ol.ol_supply_w_id AS ol_supply_w_id, "
                    + "ol.ol_quantity AS ol_quantity, ol.ol_amount AS ol_amount, ol.ol_delivery_d AS ol_delivery_d, "
                    + "ol.ol_dist_info AS ol_dist_info, i.i_name AS i_name, i.i_price AS i_price "
                    + "FROM order_line ol JOIN item i ON i.i_id = ol.ol_i_id "
                    + "WHERE ol.ol_w_id = @w_id AND ol.ol_d_id = @d_id AND ol.ol_o_id = @o_id "
                    + "ORDER BY ol.ol_number")
            .bind("w_id", warehouseId).bind("d_id", districtId).bind("o_id", orderId)
            .build());
        if (!lines.isSuccess()) {
            return OrderDetails.failure(lines.error());
        }

        BigDecimal total = BigDecimal.ZERO;
        for (ResultRow line : lines.rows()) {
            total = total.add(line.getDecimal("ol_amount", BigDecimal.ZERO));
        }
        return new OrderDetails(true, order.rows().get(0), lines.rows(), total, null);
    }

    public QueryResult getRecentOrders(int limit) {
        return queryExecutor.executeQuery(Query.builder(
                "SELECT o.o_id AS o_id, o.o_w_id AS o_w_id, o.o_d_id AS o_d_id, o.o_c_id AS o_c_id, "
                    + "o.o_entry_d AS o_entry_d, c.c_first AS c_first, c.c_middle AS c_middle, "
                    + "c.c_last AS c_last, w.w_name AS w_name, " + STATUS_COLUMN + " "
                    + "FROM orders o "
                    + "JOIN customer c ON c.c_w_id = o.o_w_id AND c.c_d_id = o.o_d_id AND c.c_id = o.o_c_id "
                    + "JOIN warehouse w ON w.w_id = o.o_w_id "
                    + NEW_ORDER_JOIN + " "
                    + "ORDER BY o.o_entry_d DESC, o.o_id DESC LIMIT @limit")
            .bind("limit", PageRequest.of(limit, 0).limit())
            .build());
    }

    /**
     * Totals, new versus delivered, today's orders and average order value.
     */
    public OrderStatistics getOrderStatistics(Integer warehouseId) {
        WhereClause where = FilterQueryBuilder.vacuousWhere().and("o.o_w_id = @w_id", "w_id", warehouseId);

        QueryResult total = queryExecutor.executeQuery(where.toQuery(
            "SELECT COUNT(*) AS total_orders FROM orders o"));
        QueryResult pending = queryExecutor.executeQuery(where.toQuery(
            "SELECT COUNT(*) AS new_orders FROM orders o "
                + "JOIN new_order nw ON nw.no_w_id = o.o_w_id AND nw.no_d_id = o.o_d_id AND nw.no_o_id = o.o_id"));
        QueryResult today = queryExecutor.executeQuery(where.toQuery(
            "SELECT COUNT(*) AS orders_today FROM orders o",
            "AND o.o_entry_d >= @day_start", Map.of("day_start", PaymentService.startOfTodayUtc())));
        QueryResult average = queryExecutor.executeQuery(where.toQuery(
            "SELECT AVG(order_totals.total_amount) AS avg_order_value FROM ("
                + "SELECT SUM(ol.ol_amount) AS total_amount FROM order_line ol "
                + "JOIN orders o ON o.o_w_id = ol.ol_w_id AND o.o_d_id = ol.ol_d_id AND o.o_id = ol.ol_o_id",
            "GROUP BY ol.ol_w_id, ol.ol_d_id, ol.ol_o_id) order_totals"));

        for (QueryResult part : List.of(total, pending, today, average)) {
            if (!part.isSuccess()) {
                log.warn("Order statistics unavailable: {}", part.error());
                return OrderStatistics.failure(part.errorKind(), part.error());
            }
        }

        long totalOrders = firstLong(total, "total_orders");
        long newOrders = firstLong(pending, "new_orders");
        Double avg = average.firstRow().map(row -> row.getDouble("avg_order_value")).orElse(null);

        return new OrderStatistics(true, totalOrders, newOrders, totalOrders - newOrders,
            firstLong(today, "orders_today"), avg == null ? 0.0 : avg, null, null);
    }

    private static long firstLong(QueryResult result, String column) {
        return result.firstRow().map(row -> row.getLong(column, 0L)).orElse(0L);
    }

    public record OrderDetails(
        boolean success,
        ResultRow order,
        List<ResultRow> orderLines,
        BigDecimal totalAmount,
        String error
    ) {
        static OrderDetails failure(String error) {
            return new OrderDetails(false, null, List.of(), null, error);
        }
    }

    public record OrderStatistics(
        boolean success,
        long totalOrders,
        long newOrders,
        long deliveredOrders,
        long ordersToday,
        double avgOrderValue,
        ErrorKind errorKind,
        String error
    ) {
        static OrderStatistics failure(ErrorKind errorKind, String error) {
            return new OrderStatistics(false, 0, 0, 0, 0, 0.0, errorKind, error);
        }
    }
}
