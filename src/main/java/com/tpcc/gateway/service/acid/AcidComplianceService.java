package com.tpcc.gateway.service.acid;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.tpcc.gateway.domain.AcidProperty;
import com.tpcc.gateway.domain.AcidSuiteReport;
import com.tpcc.gateway.domain.AcidTestResult;
import com.tpcc.gateway.domain.AcidTestSession;
import com.tpcc.gateway.domain.MutationResult;
import com.tpcc.gateway.repository.QueryExecutor;
import com.tpcc.gateway.util.MetricsHelper;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.instrumentation.annotations.WithSpan;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs the ACID conformance harness against the configured backend.
 *
 * For every property:
 * 1. Provision the session tables and seed accounts
 * 2. Evaluate the property
 * 3. Tear the tables down, whatever happened in 1 and 2
 *
 * A property that cannot run to completion is reported as FAILED with its
 * error; it never stops the remaining properties.
 */
@Slf4j
@Service
public class AcidComplianceService {

    private final QueryExecutor queryExecutor;
    private final AcidSchemaService schemaService;
    private final MetricsHelper metricsHelper;
    private final Map<AcidProperty, AcidPropertyTest> tests;

    public AcidComplianceService(QueryExecutor queryExecutor, AcidSchemaService schemaService,
                                 MetricsHelper metricsHelper, List<AcidPropertyTest> propertyTests) {
        this.queryExecutor = queryExecutor;
        this.schemaService = schemaService;
        this.metricsHelper = metricsHelper;
        this.tests = new EnumMap<>(AcidProperty.class);
        propertyTests.forEach(test -> tests.put(test.property(), test));
    }

    /**
     * Runs atomicity, consistency, isolation and durability in that order.
     */
    @WithSpan("acid.run_all")
    public AcidSuiteReport runAll() {
        long startTime = System.currentTimeMillis();
        AcidTestSession session = AcidTestSession.begin(queryExecutor.providerName(), queryExecutor.schemaDialect());
        Span.current().setAttribute("acid.session_id", session.id());
        log.info("Running ACID suite: provider={}, session={}", session.provider(), session.id());

        Map<AcidProperty, AcidTestResult> results = new LinkedHashMap<>();
        for (AcidProperty property : AcidProperty.values()) {
            results.put(property, run(property, session));
        }

        AcidSuiteReport report = AcidSuiteReport.of(session.provider(), session.id(), results,
            System.currentTimeMillis() - startTime);
        log.info("ACID suite completed: {}/{} passed ({}%) in {}ms",
            report.summary().passed(), report.summary().total(),
            String.format("%.1f", report.summary().successRate()), report.summary().durationMs());
        return report;
    }

    @WithSpan("acid.run_single")
    public AcidTestResult runSingle(AcidProperty property) {
        AcidTestSession session = AcidTestSession.begin(queryExecutor.providerName(), queryExecutor.schemaDialect());
        Span.current().setAttribute("acid.session_id", session.id());
        return run(property, session);
    }

    private AcidTestResult run(AcidProperty property, AcidTestSession session) {
        long startTime = System.currentTimeMillis();
        AcidPropertyTest test = tests.get(property);
        AcidTestResult result;

        if (test == null) {
            result = AcidTestResult.errored(property, session.provider(), "No test registered for " + property, 0);
        } else {
            try {
                MutationResult provisioned = schemaService.provision(session);
                if (!provisioned.success()) {
                    result = AcidTestResult.errored(property, session.provider(),
                        "Failed to setup test environment: " + provisioned.error(),
                        System.currentTimeMillis() - startTime);
                } else {
                    AcidPropertyTest.Evaluation evaluation = test.evaluate(session);
                    result = AcidTestResult.evaluated(property, session.provider(), evaluation.checks(),
                        evaluation.details(), System.currentTimeMillis() - startTime);
                }
            } catch (RuntimeException e) {
                log.error("{} could not complete", property.testName(), e);
                result = AcidTestResult.errored(property, session.provider(), e.getMessage(),
                    System.currentTimeMillis() - startTime);
            } finally {
                schemaService.teardown(session);
            }
        }

        log.info("{} {}: {}ms", property.testName(), result.status(), result.durationMs());
        metricsHelper.recordAcidTest(property.key(), result.passed(), result.durationMs());
        return result;
    }
}
