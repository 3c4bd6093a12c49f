package com.tpcc.gateway.domain;

import java.util.List;

/**
 * Structured outcome of one ACID property test.
 *
 * @param testName human-readable test name
 * @param provider backend provider the test ran against
 * @param status PASSED or FAILED
 * @param description what the property means
 * @param details raw diagnostic text
 * @param checks individual checks that make up the verdict
 * @param durationMs elapsed wall time
 * @param error set when the test could not run to completion
 */
public record AcidTestResult(
        String testName,
        String provider,
        Status status,
        String description,
        String details,
        List<Check> checks,
        long durationMs,
        String error) {

    public enum Status {
        PASSED,
        FAILED
    }

    /** One assertion inside a property test. */
    public record Check(String name, boolean passed, String detail) {
    }

    public AcidTestResult {
        checks = checks == null ? List.of() : List.copyOf(checks);
    }

    public static AcidTestResult evaluated(AcidProperty property, String provider,
                                           List<Check> checks, String details, long durationMs) {
        boolean passed = !checks.isEmpty() && checks.stream().allMatch(Check::passed);
        return new AcidTestResult(property.testName(), provider,
            passed ? Status.PASSED : Status.FAILED,
            property.description(), details, checks, durationMs, null);
    }

    public static AcidTestResult errored(AcidProperty property, String provider,
                                         String error, long durationMs) {
        return new AcidTestResult(property.testName(), provider, Status.FAILED,
            property.description(), null, List.of(), durationMs, error);
    }

    public boolean passed() {
        return status == Status.PASSED;
    }
}
