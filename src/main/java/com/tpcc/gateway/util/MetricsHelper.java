package com.tpcc.gateway.util;

import java.util.concurrent.TimeUnit;

import org.springframework.stereotype.Component;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Helper for the gateway's custom metrics.
 *
 * Metrics exposed via Prometheus at /actuator/prometheus:
 * - tpcc.statement.duration (timer): every backend statement, by kind and status
 * - tpcc.protocol.count / tpcc.protocol.duration: TPC-C protocol outcomes
 * - tpcc.acid.test: harness results by property and status
 * - tpcc.backend.error: failures by error kind
 * - tpcc.slow_statement.count: statements over the configured threshold
 * - tpcc.best_effort.failure: post-commit steps that failed without failing the outcome
 *
 * Correlation IDs stay in the logs (MDC) rather than in metric tags.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MetricsHelper {

    private final MeterRegistry meterRegistry;

    private static final String PREFIX = "tpcc";

    /**
     * Records one backend statement.
     *
     * @param kind READ/DML/DDL/TRANSACTION
     * @param success whether the backend accepted it
     * @param durationMs wall-clock duration including retries
     */
    public void recordStatement(String kind, boolean success, long durationMs) {
        Timer.builder(PREFIX + ".statement.duration")
            .tag("kind", kind)
            .tag("status", status(success))
            .description("Backend statement duration")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(meterRegistry)
            .record(durationMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Records a TPC-C protocol outcome.
     *
     * @param protocol payment/order-status/stock-level/delivery/new-order
     * @param success outcome flag
     * @param durationMs end-to-end duration
     */
    public void recordProtocol(String protocol, boolean success, long durationMs) {
        String status = status(success);

        Counter.builder(PREFIX + ".protocol.count")
            .tag("protocol", protocol)
            .tag("status", status)
            .description("TPC-C protocol executions")
            .register(meterRegistry)
            .increment();

        Timer.builder(PREFIX + ".protocol.duration")
            .tag("protocol", protocol)
            .tag("status", status)
            .description("TPC-C protocol latency")
            .register(meterRegistry)
            .record(durationMs, TimeUnit.MILLISECONDS);

        log.debug("Protocol recorded: protocol={}, status={}, duration={}ms", protocol, status, durationMs);
    }

    public void recordAcidTest(String property, boolean passed, long durationMs) {
        Timer.builder(PREFIX + ".acid.test")
            .tag("property", property)
            .tag("status", passed ? "passed" : "failed")
            .description("ACID conformance test duration and outcome")
            .register(meterRegistry)
            .record(durationMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Counts backend failures.
     *
     * @param errorKind classification (CONNECTIVITY, CONSTRAINT_VIOLATION, ...)
     * @param statementKind READ/DML/DDL/TRANSACTION
     */
    public void recordBackendError(String errorKind, String statementKind) {
        Counter.builder(PREFIX + ".backend.error")
            .tag("error_kind", errorKind)
            .tag("statement_kind", statementKind)
            .description("Backend failures by classification")
            .register(meterRegistry)
            .increment();
    }

    public void recordSlowStatement(String statementKind, long durationMs, long thresholdMs) {
        Counter.builder(PREFIX + ".slow_statement.count")
            .tag("statement_kind", statementKind)
            .tag("threshold_ms", String.valueOf(thresholdMs))
            .description("Statements slower than the configured threshold")
            .register(meterRegistry)
            .increment();

        log.warn("Slow statement: kind={}, duration={}ms (threshold={}ms)", statementKind, durationMs, thresholdMs);
    }

    /**
     * Counts post-commit steps (history insert, region tag) that failed.
     */
    public void recordBestEffortFailure(String step) {
        Counter.builder(PREFIX + ".best_effort.failure")
            .tag("step", step)
            .description("Best-effort steps that failed after the main transaction committed")
            .register(meterRegistry)
            .increment();
    }

    private static String status(boolean success) {
        return success ? "success" : "failure";
    }
}
