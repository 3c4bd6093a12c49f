package com.tpcc.gateway.service.tpcc;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.tpcc.gateway.domain.ErrorKind;
import com.tpcc.gateway.domain.MutationResult;
import com.tpcc.gateway.domain.QueryResult;
import com.tpcc.gateway.repository.QueryExecutor;
import com.tpcc.gateway.repository.sql.Query;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Connection test and entity counts for the landing page.
 *
 * Each metric is read independently; one failing count is logged and reported
 * as zero. When the backend is unreachable all metrics are zero and the
 * response carries the connection error.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DashboardService {

    private final QueryExecutor queryExecutor;

    public ConnectionTest testConnection() {
        MutationResult connection = queryExecutor.checkConnection();
        if (!connection.success()) {
            log.warn("Connection test failed: {}", connection.error());
        }
        return new ConnectionTest(connection.success(), queryExecutor.providerName(),
            connection.success() ? "Connection successful" : "Connection failed",
            connection.errorKind(), connection.error());
    }

    public DashboardMetrics getMetrics() {
        MutationResult connection = queryExecutor.checkConnection();
        if (!connection.success()) {
            return new DashboardMetrics(false, queryExecutor.providerName(), defaultMetrics(),
                "Database connection failed: " + connection.error());
        }

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("total_warehouses", count("SELECT COUNT(*) AS total FROM warehouse"));
        metrics.put("total_customers", count("SELECT COUNT(*) AS total FROM customer"));
        metrics.put("total_orders", count("SELECT COUNT(*) AS total FROM orders"));
        metrics.put("total_items", count("SELECT COUNT(*) AS total FROM item"));
        metrics.put("new_orders", count("SELECT COUNT(*) AS total FROM new_order"));
        metrics.put("low_stock_items", count(Query.builder(
                "SELECT COUNT(*) AS total FROM stock s WHERE s.s_quantity < @threshold")
            .bind("threshold", InventoryService.LOW_STOCK_QUANTITY)
            .build()));
        metrics.put("orders_last_24h", count(Query.builder(
                "SELECT COUNT(*) AS total FROM orders o WHERE o.o_entry_d >= @since")
            .bind("since", Instant.now().minus(Duration.ofHours(24)))
            .build()));
        metrics.put("avg_order_value", averageOrderValue());

        return new DashboardMetrics(true, queryExecutor.providerName(), metrics, null);
    }

    private long count(String sql) {
        return count(Query.of(sql));
    }

    private long count(Query query) {
        QueryResult result = queryExecutor.executeQuery(query);
        if (!result.isSuccess()) {
            log.warn("Dashboard count failed: {}", result.error());
            return 0L;
        }
        return result.firstRow().map(row -> row.getLong("total", 0L)).orElse(0L);
    }

    private double averageOrderValue() {
        QueryResult result = queryExecutor.executeQuery(Query.of(
            "SELECT AVG(order_totals.total_amount) AS avg_order_value FROM ("
                + "SELECT SUM(ol.ol_amount) AS total_amount FROM order_line ol "
                + "GROUP BY ol.ol_w_id, ol.ol_d_id, ol.ol_o_id) order_totals"));
        if (!result.isSuccess()) {
            log.warn("Dashboard average order value failed: {}", result.error());
            return 0.0;
        }
        Double avg = result.firstRow().map(row -> row.getDouble("avg_order_value")).orElse(null);
        return avg == null ? 0.0 : avg;
    }

    static Map<String, Object> defaultMetrics() {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("total_warehouses", 0L);
        metrics.put("total_customers", 0L);
        metrics.put("total_orders", 0L);
        metrics.put("total_items", 0L);
        metrics.put("new_orders", 0L);
        metrics.put("low_stock_items", 0L);
        metrics.put("orders_last_24h", 0L);
        metrics.put("avg_order_value", 0.0);
        return metrics;
    }

    public record ConnectionTest(boolean success, String provider, String message, ErrorKind errorKind,
                                 String error) {
    }

    public record DashboardMetrics(boolean success, String provider, Map<String, Object> metrics, String error) {
    }
}
