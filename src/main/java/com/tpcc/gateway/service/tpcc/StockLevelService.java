package com.tpcc.gateway.service.tpcc;

import org.springframework.stereotype.Service;

import com.tpcc.gateway.config.TpccProperties;
import com.tpcc.gateway.domain.ErrorKind;
import com.tpcc.gateway.domain.QueryResult;
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
 * TPC-C Stock-Level protocol (read-only).
 *
 * Counts distinct items below {@code threshold} among the lines of the
 * district's most recent orders ({@code tpcc.stock-level-window}, 20 by default).
 * When the district cannot be read, or the windowed count fails, it falls back
 * to counting low-stock items across the whole warehouse and labels the
 * outcome {@link CountMethod#WAREHOUSE_FALLBACK}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StockLevelService {

    public enum CountMethod {
        WINDOWED,
        WAREHOUSE_FALLBACK
    }

    private final QueryExecutor queryExecutor;
    private final TpccProperties properties;
    private final MetricsHelper metricsHelper;

    @Timed(value = "tpcc.stock_level", description = "TPC-C Stock-Level protocol")
    @WithSpan("tpcc.stock_level")
    public StockLevelOutcome getStockLevel(int warehouseId, int districtId, int threshold) {
        long startTime = System.currentTimeMillis();
        Span span = Span.current();
        span.setAttribute("tpcc.warehouse_id", warehouseId);
        span.setAttribute("tpcc.district_id", districtId);
        span.setAttribute("tpcc.threshold", threshold);

        TransactionPlan plan = TransactionPlan.start("stock-level");
        if (threshold < 1) {
            String error = "Threshold must be positive: " + threshold;
            plan.abort(error);
            return finish(StockLevelOutcome.failure(plan.phase(), warehouseId, districtId, threshold,
                ErrorKind.VALIDATION, error), startTime);
        }

        QueryResult district = queryExecutor.executeQuery(Query.builder(
                "SELECT d.d_next_o_id AS d_next_o_id FROM district d WHERE d.d_w_id = @w_id AND d.d_id = @d_id")
            .bind("w_id", warehouseId).bind("d_id", districtId)
            .build());

        Long lowStock = null;
        Long nextOrderId = null;
        if (district.isSuccess() && !district.isEmpty()) {
            nextOrderId = district.rows().get(0).getLong("d_next_o_id");
            plan.step("read district");
        }
        if (nextOrderId != null) {
            lowStock = windowedCount(warehouseId, districtId, threshold, nextOrderId);
        } else {
            log.warn("Stock-Level: district {}/{} unavailable ({}), using warehouse-wide count",
                warehouseId, districtId, districtProblem(district));
        }

        CountMethod method = CountMethod.WINDOWED;
        if (lowStock == null) {
            method = CountMethod.WAREHOUSE_FALLBACK;
            QueryResult fallback = queryExecutor.executeQuery(Query.builder(
                    "SELECT COUNT(*) AS low_stock FROM stock s WHERE s.s_w_id = @w_id AND s.s_quantity < @threshold")
                .bind("w_id", warehouseId).bind("threshold", threshold)
                .build());
            if (!fallback.isSuccess()) {
                plan.abort(fallback.error());
                return finish(StockLevelOutcome.failure(plan.phase(), warehouseId, districtId, threshold,
                    fallback.errorKind(), fallback.error()), startTime);
            }
            lowStock = fallback.firstRow().map(row -> row.getLong("low_stock", 0L)).orElse(0L);
            plan.step("warehouse-wide count");
        }
        plan.readsComplete();
        plan.validated();
        plan.writesComplete();

        span.setAttribute("tpcc.stock_level.method", method.name());
        log.debug("Stock-Level: w={}, d={}, threshold={}, lowStock={}, method={}",
            warehouseId, districtId, threshold, lowStock, method);

        return finish(new StockLevelOutcome(true, plan.phase(), warehouseId, districtId, threshold,
            lowStock, method, nextOrderId, 0, null, null), startTime);
    }

    private static String districtProblem(QueryResult district) {
        if (!district.isSuccess()) {
            return district.error();
        }
        return district.isEmpty() ? "not found" : "no next order id";
    }

    /** @return count, or null when the query failed */
    private Long windowedCount(int warehouseId, int districtId, int threshold, long nextOrderId) {
        QueryResult result = queryExecutor.executeQuery(Query.builder(
                "SELECT COUNT(DISTINCT s.s_i_id) AS low_stock "
                    + "FROM order_line ol "
                    + "JOIN stock s ON s.s_w_id = ol.ol_w_id AND s.s_i_id = ol.ol_i_id "
                    + "WHERE ol.ol_w_id = @w_id AND ol.ol_d_id = @d_id "
                    + "AND ol.ol_o_id >= @min_o_id AND ol.ol_o_id < @next_o_id "
                    + "AND s.s_quantity < @threshold")
            .bind("w_id", warehouseId).bind("d_id", districtId)
            .bind("min_o_id", nextOrderId - properties.getStockLevelWindow())
            .bind("next_o_id", nextOrderId)
            .bind("threshold", threshold)
            .build());
        if (!result.isSuccess()) {
            log.warn("Stock-Level windowed count failed for {}/{}: {}", warehouseId, districtId, result.error());
            return null;
        }
        return result.firstRow().map(row -> row.getLong("low_stock", 0L)).orElse(0L);
    }

    private StockLevelOutcome finish(StockLevelOutcome outcome, long startTime) {
        long duration = System.currentTimeMillis() - startTime;
        metricsHelper.recordProtocol("stock-level", outcome.success(), duration);
        return outcome.withDuration(duration);
    }

    public record StockLevelOutcome(
        boolean success,
        TransactionPhase phase,
        int warehouseId,
        int districtId,
        int threshold,
        Long lowStockCount,
        CountMethod method,
        Long nextOrderId,
        long durationMs,
        ErrorKind errorKind,
        String error
    ) implements ProtocolOutcome {
        static StockLevelOutcome failure(TransactionPhase phase, int warehouseId, int districtId, int threshold,
                                         ErrorKind errorKind, String error) {
            return new StockLevelOutcome(false, phase, warehouseId, districtId, threshold, null, null, null,
                0, errorKind, error);
        }

        StockLevelOutcome withDuration(long durationMs) {
            return new StockLevelOutcome(success, phase, warehouseId, districtId, threshold, lowStockCount,
                method, nextOrderId, durationMs, errorKind, error);
        }
    }
}
