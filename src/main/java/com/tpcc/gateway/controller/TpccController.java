package com.tpcc.gateway.controller;

import java.math.BigDecimal;
import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.tpcc.gateway.domain.ErrorKind;
import com.tpcc.gateway.service.tpcc.DeliveryService;
import com.tpcc.gateway.service.tpcc.NewOrderService;
import com.tpcc.gateway.service.tpcc.OrderStatusService;
import com.tpcc.gateway.service.tpcc.PaymentService;
import com.tpcc.gateway.service.tpcc.ProtocolOutcome;
import com.tpcc.gateway.service.tpcc.StockLevelService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST controller for the five TPC-C protocols.
 *
 * Status codes:
 * - 200: protocol succeeded
 * - 404: a required row was missing (unknown customer, nothing to deliver, ...)
 * - 400: anything else; the outcome body carries the error and its kind
 */
@Slf4j
@Validated
@RestController
@RequestMapping("/api/tpcc")
@RequiredArgsConstructor
@Tag(name = "TPC-C Protocols", description = "Payment, Order-Status, Stock-Level, Delivery and New-Order")
public class TpccController {

    private final PaymentService paymentService;
    private final OrderStatusService orderStatusService;
    private final StockLevelService stockLevelService;
    private final DeliveryService deliveryService;
    private final NewOrderService newOrderService;

    // =========================================================================
    // Payment
    // =========================================================================

    @PostMapping("/payment")
    @Operation(summary = "Execute Payment",
               description = "Debits the customer and credits warehouse and district year-to-date in one transaction")
    public ResponseEntity<PaymentService.PaymentOutcome> payment(@Valid @RequestBody PaymentRequest request) {
        log.info("API: Payment - w={}, d={}, c={}, amount={}",
            request.warehouseId(), request.districtId(), request.customerId(), request.amount());
        return respond(paymentService.executePayment(
            request.warehouseId(), request.districtId(), request.customerId(), request.amount()));
    }

    @PostMapping("/payment/validate")
    @Operation(summary = "Validate Payment", description = "Checks a payment without executing it")
    public ResponseEntity<PaymentService.PaymentValidation> validatePayment(
            @Valid @RequestBody PaymentRequest request) {
        return ResponseEntity.ok(paymentService.validatePayment(
            request.warehouseId(), request.districtId(), request.customerId(), request.amount()));
    }

    // =========================================================================
    // Read-only protocols
    // =========================================================================

    @GetMapping("/order-status")
    @Operation(summary = "Order-Status", description = "Customer's most recent order and its lines")
    public ResponseEntity<OrderStatusService.OrderStatusOutcome> orderStatus(
            @RequestParam("warehouse_id") @Min(1) int warehouseId,
            @RequestParam("district_id") @Min(1) int districtId,
            @RequestParam("customer_id") @Min(1) int customerId) {
        return respond(orderStatusService.getOrderStatus(warehouseId, districtId, customerId));
    }

    @GetMapping("/stock-level")
    @Operation(summary = "Stock-Level",
               description = "Distinct items below the threshold among the district's recent order lines")
    public ResponseEntity<StockLevelService.StockLevelOutcome> stockLevel(
            @RequestParam("warehouse_id") @Min(1) int warehouseId,
            @RequestParam("district_id") @Min(1) int districtId,
            @RequestParam(value = "threshold", defaultValue = "10") @Min(1) int threshold) {
        return respond(stockLevelService.getStockLevel(warehouseId, districtId, threshold));
    }

    // =========================================================================
    // Write protocols
    // =========================================================================

    @PostMapping("/delivery")
    @Operation(summary = "Delivery", description = "Delivers the warehouse's oldest pending order")
    public ResponseEntity<DeliveryService.DeliveryOutcome> delivery(@Valid @RequestBody DeliveryRequest request) {
        log.info("API: Delivery - w={}, carrier={}", request.warehouseId(), request.carrierId());
        return respond(deliveryService.executeDelivery(request.warehouseId(), request.carrierId()));
    }

    @PostMapping("/new-order")
    @Operation(summary = "New-Order", description = "Creates an order with 1 to 15 lines in one transaction")
    public ResponseEntity<NewOrderService.NewOrderOutcome> newOrder(@Valid @RequestBody NewOrderRequest request) {
        log.info("API: New-Order - w={}, d={}, c={}, lines={}",
            request.warehouseId(), request.districtId(), request.customerId(), request.items().size());
        List<NewOrderService.OrderLineRequest> lines = request.items().stream()
            .map(item -> new NewOrderService.OrderLineRequest(item.itemId(),
                item.supplyWarehouseId() != null ? item.supplyWarehouseId() : request.warehouseId(),
                item.quantity()))
            .toList();
        return respond(newOrderService.executeNewOrder(
            request.warehouseId(), request.districtId(), request.customerId(), lines));
    }

    static <T extends ProtocolOutcome> ResponseEntity<T> respond(T outcome) {
        if (outcome.success()) {
            return ResponseEntity.ok(outcome);
        }
        HttpStatus status = outcome.errorKind() == ErrorKind.NOT_FOUND ? HttpStatus.NOT_FOUND : HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status).body(outcome);
    }

    // =========================================================================
    // Request DTOs
    // =========================================================================

    public record PaymentRequest(
        @NotNull @Min(1) Integer warehouseId,
        @NotNull @Min(1) Integer districtId,
        @NotNull @Min(1) Integer customerId,
        @NotNull @DecimalMin(value = "0.00", inclusive = false) BigDecimal amount
    ) {}

    public record DeliveryRequest(
        @NotNull @Min(1) Integer warehouseId,
        @NotNull @Min(1) @Max(10) Integer carrierId
    ) {}

    public record NewOrderRequest(
        @NotNull @Min(1) Integer warehouseId,
        @NotNull @Min(1) Integer districtId,
        @NotNull @Min(1) Integer customerId,
        @NotEmpty @Size(max = 15) List<@Valid NewOrderItem> items
    ) {}

    public record NewOrderItem(
        @NotNull @Min(1) Integer itemId,
        @Min(1) Integer supplyWarehouseId,
        @NotNull @Min(1) @Max(10) Integer quantity
    ) {}
}
