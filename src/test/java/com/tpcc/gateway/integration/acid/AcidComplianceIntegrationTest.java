package com.tpcc.gateway.integration.acid;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import com.tpcc.gateway.domain.AcidProperty;
import com.tpcc.gateway.domain.AcidSuiteReport;
import com.tpcc.gateway.domain.AcidTestResult;
import com.tpcc.gateway.domain.QueryResult;
import com.tpcc.gateway.integration.BaseIntegrationTest;
import com.tpcc.gateway.repository.QueryExecutor;
import com.tpcc.gateway.repository.sql.Query;
import com.tpcc.gateway.service.acid.AcidComplianceService;

/**
 * Integration tests for the ACID harness against PostgreSQL.
 *
 * Tests verify that:
 * - all four properties pass on a transactional backend
 * - each property reports its individual checks
 * - session tables are dropped after the run
 */
class AcidComplianceIntegrationTest extends BaseIntegrationTest {

    @Autowired
    private AcidComplianceService acidComplianceService;

    @Autowired
    private QueryExecutor queryExecutor;

    @Test
    void runAll_ShouldPassEveryProperty() {
        // When
        AcidSuiteReport report = acidComplianceService.runAll();

        // Then
        assertThat(report.provider()).isEqualTo("PostgreSQL");
        assertThat(report.tests()).containsOnlyKeys("atomicity", "consistency", "isolation", "durability");
        assertThat(report.tests().values())
            .allSatisfy(result -> assertThat(result.passed())
                .as("%s: %s", result.testName(), result.checks())
                .isTrue());
        assertThat(report.summary().total()).isEqualTo(4);
        assertThat(report.summary().passed()).isEqualTo(4);
        assertThat(report.summary().successRate()).isEqualTo(100.0);
    }

    @Test
    void runSingle_Consistency_ShouldReportEachConstraint() {
        // When
        AcidTestResult result = acidComplianceService.runSingle(AcidProperty.CONSISTENCY);

        // Then
        assertThat(result.passed()).isTrue();
        assertThat(result.testName()).isEqualTo("Consistency Test");
        assertThat(result.checks()).extracting(AcidTestResult.Check::name).containsExactly(
            "Primary Key Constraint", "NOT NULL Constraint", "Data Type Constraint", "Row count preserved");
    }

    @Test
    void runSingle_Atomicity_ShouldKeepBalancesAfterRejectedGroup() {
        AcidTestResult result = acidComplianceService.runSingle(AcidProperty.ATOMICITY);

        assertThat(result.passed()).isTrue();
        assertThat(result.error()).isNull();
        assertThat(result.checks()).extracting(AcidTestResult.Check::name)
            .containsExactly("Group rejected", "Balances unchanged");
    }

    @Test
    void runAll_ShouldDropSessionTables() {
        // When
        AcidSuiteReport report = acidComplianceService.runAll();

        // Then
        QueryResult leftover = queryExecutor.executeQuery(Query.of(
            "SELECT COUNT(*) AS n FROM acid_test_accounts_" + report.testSessionId()));
        assertThat(leftover.isSuccess()).isFalse();
    }
}
