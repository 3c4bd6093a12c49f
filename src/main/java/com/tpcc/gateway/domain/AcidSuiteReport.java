package com.tpcc.gateway.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregated report of a harness run, keyed by property name.
 */
public record AcidSuiteReport(
        String provider,
        long testSessionId,
        Map<String, AcidTestResult> tests,
        Summary summary) {

    /**
     * Run totals. The duration is in milliseconds and serializes as {@code duration}.
     */
    public record Summary(int total, int passed, int failed, double successRate,
                          @JsonProperty("duration") long durationMs) {
    }

    public AcidSuiteReport {
        tests = Collections.unmodifiableMap(new LinkedHashMap<>(tests));
    }

    public static AcidSuiteReport of(String provider, long sessionId,
                                     Map<AcidProperty, AcidTestResult> results, long durationMs) {
        Map<String, AcidTestResult> byKey = new LinkedHashMap<>();
        int passed = 0;
        for (Map.Entry<AcidProperty, AcidTestResult> entry : results.entrySet()) {
            byKey.put(entry.getKey().key(), entry.getValue());
            if (entry.getValue().passed()) {
                passed++;
            }
        }
        int total = results.size();
        double successRate = total > 0 ? (passed * 100.0) / total : 0.0;
        return new AcidSuiteReport(provider, sessionId, byKey,
            new Summary(total, passed, total - passed, successRate, durationMs));
    }
}
