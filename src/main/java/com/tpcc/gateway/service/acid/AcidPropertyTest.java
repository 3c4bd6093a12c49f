package com.tpcc.gateway.service.acid;

import java.util.List;

import com.tpcc.gateway.domain.AcidProperty;
import com.tpcc.gateway.domain.AcidTestResult.Check;
import com.tpcc.gateway.domain.AcidTestSession;

/**
 * One property of the conformance harness.
 *
 * Implementations run against a provisioned session (seed accounts present)
 * and report their checks; provisioning, teardown, timing and error handling
 * belong to {@link AcidComplianceService}.
 */
public interface AcidPropertyTest {

    AcidProperty property();

    Evaluation evaluate(AcidTestSession session);

    /**
     * @param checks individual verdicts; the property passes when all pass
     * @param details diagnostic text for the report
     */
    record Evaluation(List<Check> checks, String details) {
    }
}
