package com.tpcc.gateway.service.tpcc;

import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.tpcc.gateway.domain.ErrorKind;
import com.tpcc.gateway.domain.Page;
import com.tpcc.gateway.domain.QueryResult;
import com.tpcc.gateway.domain.ResultRow;
import com.tpcc.gateway.repository.QueryExecutor;
import com.tpcc.gateway.repository.sql.FilterQueryBuilder;
import com.tpcc.gateway.repository.sql.PageRequest;
import com.tpcc.gateway.repository.sql.Query;
import com.tpcc.gateway.repository.sql.WhereClause;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Stock and item reporting.
 *
 * Item search is a case-insensitive substring match on name or data.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InventoryService {

    /** Quantity below which a stock row counts as low in the statistics. */
    static final int LOW_STOCK_QUANTITY = 10;

    private final QueryExecutor queryExecutor;

    /**
     * Paginated stock rows, lowest quantity first.
     *
     * @param warehouseId optional warehouse filter
     * @param lowStockThreshold optional; keeps rows with {@code s_quantity < threshold}
     * @param itemSearch optional name/data search term
     */
    public Page<ResultRow> getInventory(Integer warehouseId, Integer lowStockThreshold, String itemSearch,
                                        int limit, int offset) {
        return queryExecutor.executePage(FilterQueryBuilder
            .select("SELECT s.s_i_id AS s_i_id, s.s_w_id AS s_w_id, s.s_quantity AS s_quantity, "
                + "s.s_ytd AS s_ytd, s.s_order_cnt AS s_order_cnt, s.s_remote_cnt AS s_remote_cnt, "
                + "i.i_name AS i_name, i.i_price AS i_price, w.w_name AS w_name "
                + "FROM stock s "
                + "JOIN item i ON i.i_id = s.s_i_id "
                + "JOIN warehouse w ON w.w_id = s.s_w_id")
            .count("SELECT COUNT(*) AS total_count FROM stock s JOIN item i ON i.i_id = s.s_i_id")
            .where("s.s_w_id = @w_id", "w_id", warehouseId)
            .where("s.s_quantity < @threshold", "threshold", lowStockThreshold)
            .where("(LOWER(i.i_name) LIKE @search OR LOWER(i.i_data) LIKE @search)", "search",
                searchPattern(itemSearch))
            .orderBy("s.s_quantity ASC, s.s_w_id, s.s_i_id")
            .build(PageRequest.of(limit, offset)));
    }

    public QueryResult getLowStockItems(Integer warehouseId, int threshold, int limit) {
        WhereClause where = WhereClause.filtered()
            .and("s.s_quantity < @threshold", "threshold", threshold)
            .and("s.s_w_id = @w_id", "w_id", warehouseId);
        return queryExecutor.executeQuery(where.toQuery(
            "SELECT s.s_i_id AS s_i_id, s.s_w_id AS s_w_id, s.s_quantity AS s_quantity, s.s_ytd AS s_ytd, "
                + "s.s_order_cnt AS s_order_cnt, i.i_name AS i_name, i.i_price AS i_price, i.i_data AS i_data, "
                + "w.w_name AS w_name "
                + "FROM stock s JOIN item i ON i.i_id = s.s_i_id JOIN warehouse w ON w.w_id = s.s_w_id",
            "ORDER BY s.s_quantity ASC, s.s_w_id, s.s_i_id LIMIT @limit",
            Map.of("limit", PageRequest.of(limit, 0).limit())));
    }

    /**
     * Item with aggregate stock figures and its stock in every warehouse.
     */
    public ItemDetails getItemDetails(int itemId) {
        QueryResult item = queryExecutor.executeQuery(Query.builder(
                "SELECT i.i_id AS i_id, i.i_im_id AS i_im_id, i.i_name AS i_name, i.i_price AS i_price, "
                    + "i.i_data AS i_data, COUNT(s.s_w_id) AS warehouse_count, AVG(s.s_quantity) AS avg_stock, "
                    + "MIN(s.s_quantity) AS min_stock, MAX(s.s_quantity) AS max_stock, "
                    + "SUM(s.s_ytd) AS total_ytd, SUM(s.s_order_cnt) AS total_orders "
                    + "FROM item i LEFT JOIN stock s ON s.s_i_id = i.i_id "
                    + "WHERE i.i_id = @i_id "
                    + "GROUP BY i.i_id, i.i_im_id, i.i_name, i.i_price, i.i_data")
            .bind("i_id", itemId)
            .build());
        if (!item.isSuccess()) {
            return ItemDetails.failure(item.error());
        }
        if (item.isEmpty()) {
            return ItemDetails.failure("Item not found");
        }

        QueryResult stock = queryExecutor.executeQuery(Query.builder(
                "SELECT s.s_w_id AS s_w_id, s.s_quantity AS s_quantity, s.s_ytd AS s_ytd, "
                    + "s.s_order_cnt AS s_order_cnt, s.s_remote_cnt AS s_remote_cnt, "
                    + "w.w_name AS w_name, w.w_city AS w_city, w.w_state AS w_state "
                    + "FROM stock s JOIN warehouse w ON w.w_id = s.s_w_id "
                    + "WHERE s.s_i_id = @i_id ORDER BY s.s_w_id")
            .bind("i_id", itemId)
            .build());
        if (!stock.isSuccess()) {
            return ItemDetails.failure(stock.error());
        }
        return new ItemDetails(true, item.rows().get(0), stock.rows(), null);
    }

    public InventoryStatistics getInventoryStatistics(Integer warehouseId) {
        WhereClause where = FilterQueryBuilder.vacuousWhere().and("s.s_w_id = @w_id", "w_id", warehouseId);

        QueryResult totals = queryExecutor.executeQuery(where.toQuery(
            "SELECT COUNT(*) AS total_stock_records, "
                + "COUNT(CASE WHEN s.s_quantity < " + LOW_STOCK_QUANTITY + " THEN 1 END) AS low_stock_items, "
                + "COUNT(CASE WHEN s.s_quantity = 0 THEN 1 END) AS out_of_stock_items, "
                + "AVG(s.s_quantity) AS avg_stock_quantity, "
                + "SUM(s.s_quantity * i.i_price) AS total_inventory_value "
                + "FROM stock s JOIN item i ON i.i_id = s.s_i_id"));
        if (!totals.isSuccess()) {
            return InventoryStatistics.failure(totals.errorKind(), totals.error());
        }

        QueryResult topItems = queryExecutor.executeQuery(where.toQuery(
            "SELECT s.s_i_id AS s_i_id, i.i_name AS i_name, s.s_order_cnt AS s_order_cnt, "
                + "s.s_quantity AS s_quantity FROM stock s JOIN item i ON i.i_id = s.s_i_id",
            "ORDER BY s.s_order_cnt DESC, s.s_i_id LIMIT 5"));
        if (!topItems.isSuccess()) {
            return InventoryStatistics.failure(topItems.errorKind(), topItems.error());
        }

        ResultRow row = totals.rows().get(0);
        Double avg = row.getDouble("avg_stock_quantity");
        Double value = row.getDouble("total_inventory_value");
        return new InventoryStatistics(true,
            row.getLong("total_stock_records", 0L),
            row.getLong("low_stock_items", 0L),
            row.getLong("out_of_stock_items", 0L),
            avg == null ? 0.0 : avg,
            value == null ? 0.0 : value,
            topItems.rows(),
            null,
            null);
    }

    public WarehouseSummary getWarehouseSummary(int warehouseId) {
        QueryResult warehouse = queryExecutor.executeQuery(Query.builder(
                "SELECT w.w_name AS w_name, w.w_city AS w_city, w.w_state AS w_state FROM warehouse w "
                    + "WHERE w.w_id = @w_id")
            .bind("w_id", warehouseId)
            .build());
        if (!warehouse.isSuccess()) {
            return WarehouseSummary.failure(warehouseId, warehouse.error());
        }
        if (warehouse.isEmpty()) {
            return WarehouseSummary.failure(warehouseId, "Warehouse not found");
        }

        QueryResult summary = queryExecutor.executeQuery(Query.builder(
                "SELECT COUNT(*) AS total_items, SUM(s.s_quantity) AS total_quantity, "
                    + "AVG(s.s_quantity) AS avg_quantity, "
                    + "COUNT(CASE WHEN s.s_quantity < " + LOW_STOCK_QUANTITY + " THEN 1 END) AS low_stock_count, "
                    + "COUNT(CASE WHEN s.s_quantity = 0 THEN 1 END) AS out_of_stock_count, "
                    + "SUM(s.s_ytd) AS total_ytd, SUM(s.s_order_cnt) AS total_orders, "
                    + "SUM(s.s_quantity * i.i_price) AS total_value "
                    + "FROM stock s JOIN item i ON i.i_id = s.s_i_id WHERE s.s_w_id = @w_id")
            .bind("w_id", warehouseId)
            .build());
        if (!summary.isSuccess()) {
            return WarehouseSummary.failure(warehouseId, summary.error());
        }
        return new WarehouseSummary(true, warehouseId, warehouse.rows().get(0), summary.rows().get(0), null);
    }

    public QueryResult searchItems(String term, int limit) {
        String pattern = searchPattern(term);
        if (pattern == null) {
            throw new IllegalArgumentException("Search term must not be blank");
        }
        return queryExecutor.executeQuery(Query.builder(
                "SELECT i.i_id AS i_id, i.i_name AS i_name, i.i_price AS i_price, i.i_data AS i_data, "
                    + "COUNT(s.s_w_id) AS warehouse_count, AVG(s.s_quantity) AS avg_stock, "
                    + "MIN(s.s_quantity) AS min_stock "
                    + "FROM item i LEFT JOIN stock s ON s.s_i_id = i.i_id "
                    + "WHERE LOWER(i.i_name) LIKE @search OR LOWER(i.i_data) LIKE @search "
                    + "GROUP BY i.i_id, i.i_name, i.i_price, i.i_data "
                    + "ORDER BY i.i_name LIMIT @limit")
            .bind("search", pattern)
            .bind("limit", PageRequest.of(limit, 0).limit())
            .build());
    }

    static String searchPattern(String term) {
        if (term == null || term.isBlank()) {
            return null;
        }
        return "%" + term.trim().toLowerCase(Locale.ROOT) + "%";
    }

    public record ItemDetails(boolean success, ResultRow item, List<ResultRow> stockByWarehouse, String error) {
        static ItemDetails failure(String error) {
            return new ItemDetails(false, null, List.of(), error);
        }
    }

    public record InventoryStatistics(
        boolean success,
        long totalStockRecords,
        long lowStockItems,
        long outOfStockItems,
        double avgStockQuantity,
        double totalInventoryValue,
        List<ResultRow> topOrderedItems,
        ErrorKind errorKind,
        String error
    ) {
        static InventoryStatistics failure(ErrorKind errorKind, String error) {
            return new InventoryStatistics(false, 0, 0, 0, 0.0, 0.0, List.of(), errorKind, error);
        }
    }

    public record WarehouseSummary(
        boolean success,
        int warehouseId,
        ResultRow warehouseInfo,
        ResultRow summary,
        String error
    ) {
        static WarehouseSummary failure(int warehouseId, String error) {
            return new WarehouseSummary(false, warehouseId, null, null, error);
        }
    }
}
