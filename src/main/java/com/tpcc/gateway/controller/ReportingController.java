package com.tpcc.gateway.controller;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.tpcc.gateway.domain.Page;
import com.tpcc.gateway.domain.QueryResult;
import com.tpcc.gateway.domain.ResultRow;
import com.tpcc.gateway.service.tpcc.DashboardService;
import com.tpcc.gateway.service.tpcc.InventoryService;
import com.tpcc.gateway.service.tpcc.OrderQueryService;
import com.tpcc.gateway.service.tpcc.PaymentService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;

/**
 * Read-only reporting endpoints: payments, orders, inventory and the dashboard.
 *
 * Listings answer 200 with the page, or 503 with an empty page and its error
 * when the backend could not be read. Single-entity lookups answer 404 when
 * the entity is missing.
 */
@Validated
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Reporting", description = "Payment, order and inventory reporting plus dashboard metrics")
public class ReportingController {

    private final PaymentService paymentService;
    private final OrderQueryService orderQueryService;
    private final InventoryService inventoryService;
    private final DashboardService dashboardService;

    // =========================================================================
    // Payments
    // =========================================================================

    @GetMapping("/payments")
    @Operation(summary = "Payment history", description = "Paginated history, newest first")
    public ResponseEntity<Page<ResultRow>> paymentHistory(
            @RequestParam(value = "warehouse_id", required = false) Integer warehouseId,
            @RequestParam(value = "district_id", required = false) Integer districtId,
            @RequestParam(value = "customer_id", required = false) Integer customerId,
            @RequestParam(value = "limit", defaultValue = "50") int limit,
            @RequestParam(value = "offset", defaultValue = "0") int offset) {
        return page(paymentService.getPaymentHistory(warehouseId, districtId, customerId, limit, offset));
    }

    @GetMapping("/payments/customers/{warehouseId}/{districtId}/{customerId}")
    @Operation(summary = "Customer payment summary")
    public ResponseEntity<PaymentService.CustomerPaymentSummary> customerPaymentSummary(
            @PathVariable int warehouseId, @PathVariable int districtId, @PathVariable int customerId) {
        PaymentService.CustomerPaymentSummary summary =
            paymentService.getCustomerPaymentSummary(warehouseId, districtId, customerId);
        return found(summary.success(), summary);
    }

    @GetMapping("/payments/statistics")
    @Operation(summary = "Payment statistics")
    public PaymentService.PaymentStatistics paymentStatistics(
            @RequestParam(value = "warehouse_id", required = false) Integer warehouseId) {
        return paymentService.getPaymentStatistics(warehouseId);
    }

    @GetMapping("/payments/recent")
    @Operation(summary = "Most recent payments")
    public QueryResult recentPayments(@RequestParam(value = "limit", defaultValue = "10") int limit) {
        return paymentService.getRecentPayments(limit);
    }

    @GetMapping("/payments/trends")
    @Operation(summary = "Daily payment trends")
    public PaymentService.PaymentTrends paymentTrends(
            @RequestParam(value = "warehouse_id", required = false) Integer warehouseId,
            @RequestParam(value = "days", defaultValue = "30") @Min(1) @Max(366) int days) {
        return paymentService.getPaymentTrends(warehouseId, days);
    }

    // =========================================================================
    // Orders
    // =========================================================================

    @GetMapping("/orders")
    @Operation(summary = "Orders", description = "Paginated orders; status is New or Delivered")
    public ResponseEntity<Page<ResultRow>> orders(
            @RequestParam(value = "warehouse_id", required = false) Integer warehouseId,
            @RequestParam(value = "district_id", required = false) Integer districtId,
            @RequestParam(value = "customer_id", required = false) Integer customerId,
            @RequestParam(value = "status", required = false) String status,
            @RequestParam(value = "limit", defaultValue = "50") int limit,
            @RequestParam(value = "offset", defaultValue = "0") int offset) {
        return page(orderQueryService.getOrders(warehouseId, districtId, customerId, status, limit, offset));
    }

    @GetMapping("/orders/{warehouseId}/{districtId}/{orderId}")
    @Operation(summary = "Order details")
    public ResponseEntity<OrderQueryService.OrderDetails> orderDetails(
            @PathVariable int warehouseId, @PathVariable int districtId, @PathVariable int orderId) {
        OrderQueryService.OrderDetails details = orderQueryService.getOrderDetails(warehouseId, districtId, orderId);
        return found(details.success(), details);
    }

    @GetMapping("/orders/recent")
    @Operation(summary = "Most recent orders")
    public QueryResult recentOrders(@RequestParam(value = "limit", defaultValue = "10") int limit) {
        return orderQueryService.getRecentOrders(limit);
    }

    @GetMapping("/orders/statistics")
    @Operation(summary = "Order statistics")
    public OrderQueryService.OrderStatistics orderStatistics(
            @RequestParam(value = "warehouse_id", required = false) Integer warehouseId) {
        return orderQueryService.getOrderStatistics(warehouseId);
    }

    // =========================================================================
    // Inventory
    // =========================================================================

    @GetMapping("/inventory")
    @Operation(summary = "Inventory", description = "Paginated stock rows, lowest quantity first")
    public ResponseEntity<Page<ResultRow>> inventory(
            @RequestParam(value = "warehouse_id", required = false) Integer warehouseId,
            @RequestParam(value = "low_stock_threshold", required = false) Integer lowStockThreshold,
            @RequestParam(value = "search", required = false) String search,
            @RequestParam(value = "limit", defaultValue = "100") int limit,
            @RequestParam(value = "offset", defaultValue = "0") int offset) {
        return page(inventoryService.getInventory(warehouseId, lowStockThreshold, search, limit, offset));
    }

    @GetMapping("/inventory/low-stock")
    @Operation(summary = "Low-stock items")
    public QueryResult lowStockItems(
            @RequestParam(value = "warehouse_id", required = false) Integer warehouseId,
            @RequestParam(value = "threshold", defaultValue = "10") @Min(1) int threshold,
            @RequestParam(value = "limit", defaultValue = "50") int limit) {
        return inventoryService.getLowStockItems(warehouseId, threshold, limit);
    }

    @GetMapping("/inventory/items/{itemId}")
    @Operation(summary = "Item details", description = "Item with stock in every warehouse")
    public ResponseEntity<InventoryService.ItemDetails> itemDetails(@PathVariable int itemId) {
        InventoryService.ItemDetails details = inventoryService.getItemDetails(itemId);
        return found(details.success(), details);
    }

    @GetMapping("/inventory/statistics")
    @Operation(summary = "Inventory statistics")
    public InventoryService.InventoryStatistics inventoryStatistics(
            @RequestParam(value = "warehouse_id", required = false) Integer warehouseId) {
        return inventoryService.getInventoryStatistics(warehouseId);
    }

    @GetMapping("/inventory/warehouses/{warehouseId}/summary")
    @Operation(summary = "Warehouse inventory summary")
    public ResponseEntity<InventoryService.WarehouseSummary> warehouseSummary(@PathVariable int warehouseId) {
        InventoryService.WarehouseSummary summary = inventoryService.getWarehouseSummary(warehouseId);
        return found(summary.success(), summary);
    }

    @GetMapping("/inventory/search")
    @Operation(summary = "Search items", description = "Case-insensitive match on item name or data")
    public QueryResult searchItems(
            @RequestParam("q") String term,
            @RequestParam(value = "limit", defaultValue = "20") int limit) {
        return inventoryService.searchItems(term, limit);
    }

    // =========================================================================
    // Dashboard
    // =========================================================================

    @GetMapping("/dashboard")
    @Operation(summary = "Dashboard metrics", description = "Entity counts; zeros when the backend is unreachable")
    public DashboardService.DashboardMetrics dashboard() {
        return dashboardService.getMetrics();
    }

    @GetMapping("/connection-test")
    @Operation(summary = "Connection test")
    public ResponseEntity<DashboardService.ConnectionTest> connectionTest() {
        DashboardService.ConnectionTest test = dashboardService.testConnection();
        return test.success()
            ? ResponseEntity.ok(test)
            : ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(test);
    }

    private static ResponseEntity<Page<ResultRow>> page(Page<ResultRow> page) {
        return page.isSuccess()
            ? ResponseEntity.ok(page)
            : ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(page);
    }

    private static <T> ResponseEntity<T> found(boolean success, T body) {
        return success ? ResponseEntity.ok(body) : ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
    }
}
