package com.tpcc.gateway.service.tpcc;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.tpcc.gateway.config.TpccProperties;
import com.tpcc.gateway.domain.ErrorKind;
import com.tpcc.gateway.domain.MutationResult;
import com.tpcc.gateway.domain.Page;
import com.tpcc.gateway.domain.QueryResult;
import com.tpcc.gateway.domain.ResultRow;
import com.tpcc.gateway.domain.TransactionPhase;
import com.tpcc.gateway.domain.TransactionPlan;
import com.tpcc.gateway.domain.TransactionResult;
import com.tpcc.gateway.repository.QueryExecutor;
import com.tpcc.gateway.repository.sql.FilterQueryBuilder;
import com.tpcc.gateway.repository.sql.PageRequest;
import com.tpcc.gateway.repository.sql.Query;
import com.tpcc.gateway.repository.sql.WhereClause;
import com.tpcc.gateway.util.MetricsHelper;

import io.micrometer.core.annotation.Timed;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.instrumentation.annotations.WithSpan;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * TPC-C Payment protocol plus payment reporting.
 *
 * Payment runs as ONE read-write transaction:
 * 1. Read customer, warehouse and district (missing row aborts the plan)
 * 2. Compute new balance (balance - amount), ytd (+ amount), payment count (+ 1)
 *    and warehouse/district ytd (+ amount)
 * 3. Write customer, warehouse and district
 * 4. Commit
 *
 * The history row is inserted afterwards as a best-effort step: a failure
 * there is logged and reported as {@code historyRecorded=false} but never
 * undoes the committed payment.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentService {

    private static final int MONEY_SCALE = 2;
    private static final int HISTORY_DATA_LENGTH = 24;
    private static final String HISTORY_SEPARATOR = "    ";

    private final QueryExecutor queryExecutor;
    private final TpccProperties properties;
    private final MetricsHelper metricsHelper;

    // =========================================================================
    // Payment protocol
    // =========================================================================

    /**
     * Executes the Payment protocol.
     *
     * @param warehouseId customer's warehouse
     * @param districtId customer's district
     * @param customerId customer
     * @param amount payment amount, must be positive and within the configured maximum
     * @return outcome with the new customer balance, or success=false with the error
     */
    @Timed(value = "tpcc.payment", description = "TPC-C Payment protocol")
    @WithSpan("tpcc.payment")
    public PaymentOutcome executePayment(int warehouseId, int districtId, int customerId, BigDecimal amount) {
        long startTime = System.currentTimeMillis();
        Span span = Span.current();
        span.setAttribute("tpcc.warehouse_id", warehouseId);
        span.setAttribute("tpcc.district_id", districtId);
        span.setAttribute("tpcc.customer_id", customerId);

        TransactionPlan plan = TransactionPlan.start("payment");
        String amountError = checkAmount(amount);
        if (amountError != null) {
            plan.abort(amountError);
            return finish(PaymentOutcome.failure(plan.phase(), ErrorKind.VALIDATION, amountError), startTime);
        }
        BigDecimal payment = amount.setScale(MONEY_SCALE, RoundingMode.HALF_UP);

        log.info("Payment: w={}, d={}, c={}, amount={}", warehouseId, districtId, customerId, payment);

        TransactionResult<AppliedPayment> result = queryExecutor.executeInTransaction(tx -> {
            plan.restart();

            ResultRow customer = tx.requireRow(Query.builder(
                    "SELECT c.c_first AS c_first, c.c_middle AS c_middle, c.c_last AS c_last, "
                        + "c.c_balance AS c_balance, c.c_ytd_payment AS c_ytd_payment, "
                        + "c.c_payment_cnt AS c_payment_cnt "
                        + "FROM customer c "
                        + "WHERE c.c_w_id = @w_id AND c.c_d_id = @d_id AND c.c_id = @c_id")
                    .bind("w_id", warehouseId).bind("d_id", districtId).bind("c_id", customerId).build(),
                "Customer", warehouseId + "/" + districtId + "/" + customerId);
            plan.step("read customer");

            ResultRow warehouse = tx.requireRow(Query.builder(
                    "SELECT w.w_name AS w_name, w.w_ytd AS w_ytd FROM warehouse w WHERE w.w_id = @w_id")
                    .bind("w_id", warehouseId).build(),
                "Warehouse", String.valueOf(warehouseId));
            plan.step("read warehouse");

            ResultRow district = tx.requireRow(Query.builder(
                    "SELECT d.d_name AS d_name, d.d_ytd AS d_ytd FROM district d "
                        + "WHERE d.d_w_id = @w_id AND d.d_id = @d_id")
                    .bind("w_id", warehouseId).bind("d_id", districtId).build(),
                "District", warehouseId + "/" + districtId);
            plan.step("read district");
            plan.readsComplete();

            BigDecimal newBalance = money(customer.getDecimal("c_balance", BigDecimal.ZERO).subtract(payment));
            BigDecimal newYtdPayment = money(customer.getDecimal("c_ytd_payment", BigDecimal.ZERO).add(payment));
            long newPaymentCount = customer.getLong("c_payment_cnt", 0L) + 1;
            BigDecimal newWarehouseYtd = money(warehouse.getDecimal("w_ytd", BigDecimal.ZERO).add(payment));
            BigDecimal newDistrictYtd = money(district.getDecimal("d_ytd", BigDecimal.ZERO).add(payment));
            plan.validated();

            tx.update(Query.builder(
                    "UPDATE customer SET c_balance = @balance, c_ytd_payment = @ytd, c_payment_cnt = @cnt "
                        + "WHERE c_w_id = @w_id AND c_d_id = @d_id AND c_id = @c_id")
                .bind("balance", newBalance).bind("ytd", newYtdPayment).bind("cnt", newPaymentCount)
                .bind("w_id", warehouseId).bind("d_id", districtId).bind("c_id", customerId).build());
            plan.step("update customer");

            tx.update(Query.builder("UPDATE warehouse SET w_ytd = @ytd WHERE w_id = @w_id")
                .bind("ytd", newWarehouseYtd).bind("w_id", warehouseId).build());
            plan.step("update warehouse");

            tx.update(Query.builder("UPDATE district SET d_ytd = @ytd WHERE d_w_id = @w_id AND d_id = @d_id")
                .bind("ytd", newDistrictYtd).bind("w_id", warehouseId).bind("d_id", districtId).build());
            plan.step("update district");
            plan.writesComplete();

            return new AppliedPayment(
                fullName(customer), newBalance, newYtdPayment, newPaymentCount,
                warehouse.getString("w_name"), district.getString("d_name"));
        });

        if (!result.committed()) {
            plan.abort(result.error());
            log.warn("Payment rolled back: w={}, d={}, c={}, error={}", warehouseId, districtId, customerId,
                result.error());
            return finish(PaymentOutcome.failure(plan.phase(), result.errorKind(), result.error()), startTime);
        }

        AppliedPayment applied = result.value();
        boolean historyRecorded = recordHistory(warehouseId, districtId, customerId, payment, applied);

        log.info("Payment committed: w={}, d={}, c={}, newBalance={}, historyRecorded={}",
            warehouseId, districtId, customerId, applied.newBalance(), historyRecorded);

        return finish(new PaymentOutcome(true, plan.phase(), warehouseId, districtId, customerId, payment,
            applied.customerName(), applied.newBalance(), applied.newYtdPayment(), applied.newPaymentCount(),
            historyRecorded, 0, null, null), startTime);
    }

    private boolean recordHistory(int warehouseId, int districtId, int customerId, BigDecimal payment,
                                  AppliedPayment applied) {
        String data = nullToEmpty(applied.warehouseName()) + HISTORY_SEPARATOR + nullToEmpty(applied.districtName());
        if (data.length() > HISTORY_DATA_LENGTH) {
            data = data.substring(0, HISTORY_DATA_LENGTH);
        }
        MutationResult history = queryExecutor.executeDml(Query.builder(
                "INSERT INTO history (h_c_id, h_c_d_id, h_c_w_id, h_d_id, h_w_id, h_date, h_amount, h_data) "
                    + "VALUES (@c_id, @d_id, @w_id, @d_id, @w_id, @h_date, @amount, @h_data)")
            .bind("c_id", customerId).bind("d_id", districtId).bind("w_id", warehouseId)
            .bind("h_date", Instant.now()).bind("amount", payment).bind("h_data", data)
            .build());
        if (!history.success()) {
            log.warn("Payment committed but history insert failed: w={}, d={}, c={}, error={}",
                warehouseId, districtId, customerId, history.error());
            metricsHelper.recordBestEffortFailure("payment.history");
        }
        return history.success();
    }

    private PaymentOutcome finish(PaymentOutcome outcome, long startTime) {
        long duration = System.currentTimeMillis() - startTime;
        metricsHelper.recordProtocol("payment", outcome.success(), duration);
        return outcome.withDuration(duration);
    }

    // =========================================================================
    // Validation
    // =========================================================================

    /**
     * Checks a payment without executing it.
     *
     * Rules:
     * - amount positive and not above the configured maximum
     * - customer exists
     * - balance after payment stays above {@code -c_credit_lim}
     * - warehouse and district exist
     */
    public PaymentValidation validatePayment(int warehouseId, int districtId, int customerId, BigDecimal amount) {
        List<String> errors = new ArrayList<>();
        String amountError = checkAmount(amount);
        if (amountError != null) {
            errors.add(amountError);
        }

        QueryResult customerResult = queryExecutor.executeQuery(Query.builder(
                "SELECT c.c_id AS c_id, c.c_first AS c_first, c.c_last AS c_last, "
                    + "c.c_balance AS c_balance, c.c_credit_lim AS c_credit_lim "
                    + "FROM customer c WHERE c.c_w_id = @w_id AND c.c_d_id = @d_id AND c.c_id = @c_id")
            .bind("w_id", warehouseId).bind("d_id", districtId).bind("c_id", customerId).build());
        ResultRow customer = null;
        if (!customerResult.isSuccess()) {
            errors.add("Customer lookup failed: " + customerResult.error());
        } else if (customerResult.isEmpty()) {
            errors.add("Customer not found");
        } else {
            customer = customerResult.rows().get(0);
            if (amount != null) {
                BigDecimal newBalance = customer.getDecimal("c_balance", BigDecimal.ZERO).subtract(amount);
                BigDecimal creditLimit = customer.getDecimal("c_credit_lim", BigDecimal.ZERO);
                if (newBalance.compareTo(creditLimit.negate()) < 0) {
                    errors.add("Payment would exceed customer credit limit");
                }
            }
        }

        QueryResult districtResult = queryExecutor.executeQuery(Query.builder(
                "SELECT d.d_id AS d_id, d.d_name AS d_name, w.w_name AS w_name "
                    + "FROM district d JOIN warehouse w ON w.w_id = d.d_w_id "
                    + "WHERE d.d_w_id = @w_id AND d.d_id = @d_id")
            .bind("w_id", warehouseId).bind("d_id", districtId).build());
        ResultRow district = null;
        if (!districtResult.isSuccess()) {
            errors.add("District lookup failed: " + districtResult.error());
        } else if (districtResult.isEmpty()) {
            errors.add("Warehouse or district not found");
        } else {
            district = districtResult.rows().get(0);
        }

        return new PaymentValidation(errors.isEmpty(), errors, customer, district);
    }

    private String checkAmount(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            return "Payment amount must be positive";
        }
        if (amount.compareTo(properties.getPaymentMaxAmount()) > 0) {
            return "Payment amount exceeds maximum allowed";
        }
        return null;
    }

    // =========================================================================
    // Reporting
    // =========================================================================

    /**
     * Paginated payment history, newest first; every filter is optional.
     */
    public Page<ResultRow> getPaymentHistory(Integer warehouseId, Integer districtId, Integer customerId,
                                             int limit, int offset) {
        return queryExecutor.executePage(FilterQueryBuilder
            .select("SELECT h.h_c_id AS h_c_id, h.h_c_d_id AS h_c_d_id, h.h_c_w_id AS h_c_w_id, "
                + "h.h_d_id AS h_d_id, h.h_w_id AS h_w_id, h.h_date AS h_date, h.h_amount AS h_amount, "
                + "h.h_data AS h_data, c.c_first AS c_first, c.c_middle AS c_middle, c.c_last AS c_last "
                + "FROM history h "
                + "JOIN customer c ON c.c_w_id = h.h_c_w_id AND c.c_d_id = h.h_c_d_id AND c.c_id = h.h_c_id")
            .count("SELECT COUNT(*) AS total_count FROM history h")
            .where("h.h_c_w_id = @w_id", "w_id", warehouseId)
            .where("h.h_c_d_id = @d_id", "d_id", districtId)
            .where("h.h_c_id = @c_id", "c_id", customerId)
            .orderBy("h.h_date DESC")
            .build(PageRequest.of(limit, offset)));
    }

    /**
     * Customer profile, last ten payments and payment statistics.
     */
    public CustomerPaymentSummary getCustomerPaymentSummary(int warehouseId, int districtId, int customerId) {
        Map<String, Object> key = customerKey(warehouseId, districtId, customerId);

        QueryResult customer = queryExecutor.executeQuery(Query.named(
            "SELECT c.c_first AS c_first, c.c_middle AS c_middle, c.c_last AS c_last, c.c_balance AS c_balance, "
                + "c.c_ytd_payment AS c_ytd_payment, c.c_payment_cnt AS c_payment_cnt, c.c_credit AS c_credit, "
                + "c.c_credit_lim AS c_credit_lim, c.c_discount AS c_discount, c.c_since AS c_since "
                + "FROM customer c WHERE c.c_w_id = @w_id AND c.c_d_id = @d_id AND c.c_id = @c_id", key));
        if (!customer.isSuccess()) {
            return CustomerPaymentSummary.failure(customer.error());
        }
        if (customer.isEmpty()) {
            return CustomerPaymentSummary.failure("Customer not found");
        }

        QueryResult history = queryExecutor.executeQuery(Query.named(
            "SELECT h.h_date AS h_date, h.h_amount AS h_amount, h.h_data AS h_data "
                + "FROM history h WHERE h.h_c_w_id = @w_id AND h.h_c_d_id = @d_id AND h.h_c_id = @c_id "
                + "ORDER BY h.h_date DESC LIMIT 10", key));

        QueryResult stats = queryExecutor.executeQuery(Query.named(
            "SELECT COUNT(*) AS total_payments, SUM(h.h_amount) AS total_amount, AVG(h.h_amount) AS avg_amount, "
                + "MIN(h.h_amount) AS min_amount, MAX(h.h_amount) AS max_amount, "
                + "MIN(h.h_date) AS first_payment, MAX(h.h_date) AS last_payment "
                + "FROM history h WHERE h.h_c_w_id = @w_id AND h.h_c_d_id = @d_id AND h.h_c_id = @c_id", key));

        if (!history.isSuccess() || !stats.isSuccess()) {
            return CustomerPaymentSummary.failure(!history.isSuccess() ? history.error() : stats.error());
        }
        return new CustomerPaymentSummary(true, customer.rows().get(0), history.rows(),
            stats.firstRow().orElse(null), null);
    }

    /**
     * Payment totals, averages, today's payments and the top customers by ytd.
     */
    public PaymentStatistics getPaymentStatistics(Integer warehouseId) {
        WhereClause historyWhere = FilterQueryBuilder.vacuousWhere().and("h.h_w_id = @w_id", "w_id", warehouseId);
        WhereClause customerWhere = FilterQueryBuilder.vacuousWhere().and("c.c_w_id = @w_id", "w_id", warehouseId);

        QueryResult totals = queryExecutor.executeQuery(historyWhere.toQuery(
            "SELECT COUNT(*) AS total_payments, COALESCE(SUM(h.h_amount), 0) AS total_amount, "
                + "COALESCE(AVG(h.h_amount), 0) AS avg_amount FROM history h"));
        if (!totals.isSuccess()) {
            return PaymentStatistics.failure(totals.errorKind(), totals.error());
        }

        QueryResult today = queryExecutor.executeQuery(historyWhere.toQuery(
            "SELECT COUNT(*) AS payment_count, COALESCE(SUM(h.h_amount), 0) AS payment_amount FROM history h",
            "AND h.h_date >= @day_start", Map.of("day_start", startOfTodayUtc())));
        if (!today.isSuccess()) {
            return PaymentStatistics.failure(today.errorKind(), today.error());
        }

        QueryResult top = queryExecutor.executeQuery(customerWhere.toQuery(
            "SELECT c.c_id AS c_id, c.c_w_id AS c_w_id, c.c_d_id AS c_d_id, c.c_first AS c_first, "
                + "c.c_middle AS c_middle, c.c_last AS c_last, c.c_ytd_payment AS c_ytd_payment, "
                + "c.c_payment_cnt AS c_payment_cnt FROM customer c",
            "ORDER BY c.c_ytd_payment DESC LIMIT 5"));
        if (!top.isSuccess()) {
            return PaymentStatistics.failure(top.errorKind(), top.error());
        }

        ResultRow totalsRow = totals.rows().get(0);
        ResultRow todayRow = today.firstRow().orElse(null);
        return new PaymentStatistics(true,
            totalsRow.getLong("total_payments", 0L),
            totalsRow.getDecimal("total_amount", BigDecimal.ZERO).doubleValue(),
            totalsRow.getDecimal("avg_amount", BigDecimal.ZERO).doubleValue(),
            todayRow == null ? 0L : todayRow.getLong("payment_count", 0L),
            todayRow == null ? 0.0 : todayRow.getDecimal("payment_amount", BigDecimal.ZERO).doubleValue(),
            top.rows(),
            null,
            null);
    }

    /**
     * Daily payment counts and an amount distribution over the last {@code days} days.
     */
    public PaymentTrends getPaymentTrends(Integer warehouseId, int days) {
        if (days < 1) {
            throw new IllegalArgumentException("days must be positive: " + days);
        }
        Instant since = LocalDate.now(ZoneOffset.UTC).minusDays(days).atStartOfDay().toInstant(ZoneOffset.UTC);
        WhereClause where = WhereClause.filtered()
            .and("h.h_date >= @since", "since", since)
            .and("h.h_w_id = @w_id", "w_id", warehouseId);

        QueryResult daily = queryExecutor.executeQuery(where.toQuery(
            "SELECT CAST(h.h_date AS DATE) AS payment_date, COUNT(*) AS payment_count, "
                + "SUM(h.h_amount) AS total_amount, AVG(h.h_amount) AS avg_amount FROM history h",
            "GROUP BY CAST(h.h_date AS DATE) ORDER BY payment_date DESC"));
        if (!daily.isSuccess()) {
            return PaymentTrends.failure(days, daily.errorKind(), daily.error());
        }

        QueryResult distribution = queryExecutor.executeQuery(where.toQuery(
            "SELECT COUNT(CASE WHEN h.h_amount < 100 THEN 1 END) AS under_100, "
                + "COUNT(CASE WHEN h.h_amount >= 100 AND h.h_amount < 500 THEN 1 END) AS between_100_500, "
                + "COUNT(CASE WHEN h.h_amount >= 500 AND h.h_amount < 1000 THEN 1 END) AS between_500_1000, "
                + "COUNT(CASE WHEN h.h_amount >= 1000 THEN 1 END) AS over_1000 FROM history h"));
        if (!distribution.isSuccess()) {
            return PaymentTrends.failure(days, distribution.errorKind(), distribution.error());
        }

        return new PaymentTrends(true, days, daily.rows(), distribution.firstRow().orElse(null), null, null);
    }

    public QueryResult getRecentPayments(int limit) {
        PageRequest page = PageRequest.of(limit, 0);
        return queryExecutor.executeQuery(Query.builder(
                "SELECT h.h_date AS h_date, h.h_amount AS h_amount, h.h_data AS h_data, "
                    + "h.h_c_id AS h_c_id, h.h_c_w_id AS h_c_w_id, h.h_c_d_id AS h_c_d_id, "
                    + "c.c_first AS c_first, c.c_middle AS c_middle, c.c_last AS c_last, w.w_name AS w_name "
                    + "FROM history h "
                    + "JOIN customer c ON c.c_w_id = h.h_c_w_id AND c.c_d_id = h.h_c_d_id AND c.c_id = h.h_c_id "
                    + "JOIN warehouse w ON w.w_id = h.h_c_w_id "
                    + "ORDER BY h.h_date DESC LIMIT @limit")
            .bind("limit", page.limit())
            .build());
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    static Map<String, Object> customerKey(int warehouseId, int districtId, int customerId) {
        Map<String, Object> key = new LinkedHashMap<>();
        key.put("w_id", warehouseId);
        key.put("d_id", districtId);
        key.put("c_id", customerId);
        return key;
    }

    static Instant startOfTodayUtc() {
        return LocalDate.now(ZoneOffset.UTC).atStartOfDay().toInstant(ZoneOffset.UTC);
    }

    static String fullName(ResultRow customer) {
        StringBuilder name = new StringBuilder();
        for (String column : new String[] {"c_first", "c_middle", "c_last"}) {
            String part = customer.has(column) ? customer.getString(column) : null;
            if (part != null && !part.isBlank()) {
                if (name.length() > 0) {
                    name.append(' ');
                }
                name.append(part.trim());
            }
        }
        return name.toString();
    }

    private static BigDecimal money(BigDecimal value) {
        return value.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    // =========================================================================
    // Results
    // =========================================================================

    private record AppliedPayment(
        String customerName,
        BigDecimal newBalance,
        BigDecimal newYtdPayment,
        long newPaymentCount,
        String warehouseName,
        String districtName
    ) {
    }

    public record PaymentOutcome(
        boolean success,
        TransactionPhase phase,
        Integer warehouseId,
        Integer districtId,
        Integer customerId,
        BigDecimal amount,
        String customerName,
        BigDecimal newBalance,
        BigDecimal newYtdPayment,
        Long newPaymentCount,
        boolean historyRecorded,
        long durationMs,
        ErrorKind errorKind,
        String error
    ) implements ProtocolOutcome {
        static PaymentOutcome failure(TransactionPhase phase, ErrorKind errorKind, String error) {
            return new PaymentOutcome(false, phase, null, null, null, null, null, null, null, null,
                false, 0, errorKind, error);
        }

        PaymentOutcome withDuration(long durationMs) {
            return new PaymentOutcome(success, phase, warehouseId, districtId, customerId, amount, customerName,
                newBalance, newYtdPayment, newPaymentCount, historyRecorded, durationMs, errorKind, error);
        }
    }

    public record PaymentValidation(boolean valid, List<String> errors, ResultRow customer, ResultRow district) {
    }

    public record CustomerPaymentSummary(
        boolean success,
        ResultRow customer,
        List<ResultRow> paymentHistory,
        ResultRow paymentStats,
        String error
    ) {
        static CustomerPaymentSummary failure(String error) {
            return new CustomerPaymentSummary(false, null, List.of(), null, error);
        }
    }

    public record PaymentStatistics(
        boolean success,
        long totalPayments,
        double totalPaymentAmount,
        double avgPaymentAmount,
        long paymentsToday,
        double paymentAmountToday,
        List<ResultRow> topCustomers,
        ErrorKind errorKind,
        String error
    ) {
        static PaymentStatistics failure(ErrorKind errorKind, String error) {
            return new PaymentStatistics(false, 0, 0.0, 0.0, 0, 0.0, List.of(), errorKind, error);
        }
    }

    public record PaymentTrends(
        boolean success,
        int periodDays,
        List<ResultRow> dailyTrends,
        ResultRow amountDistribution,
        ErrorKind errorKind,
        String error
    ) {
        static PaymentTrends failure(int periodDays, ErrorKind errorKind, String error) {
            return new PaymentTrends(false, periodDays, List.of(), null, errorKind, error);
        }
    }
}
