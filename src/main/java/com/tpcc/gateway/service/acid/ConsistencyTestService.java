package com.tpcc.gateway.service.acid;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;

import com.tpcc.gateway.domain.AcidProperty;
import com.tpcc.gateway.domain.AcidTestResult.Check;
import com.tpcc.gateway.domain.AcidTestSession;
import com.tpcc.gateway.domain.MutationResult;
import com.tpcc.gateway.domain.QueryResult;
import com.tpcc.gateway.repository.QueryExecutor;
import com.tpcc.gateway.repository.sql.Query;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Consistency: the backend enforces its integrity rules.
 *
 * Three inserts that must each be rejected (duplicate primary key, NULL
 * primary key, text in a BIGINT column), after which the accounts table must
 * still hold exactly the seed rows.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConsistencyTestService implements AcidPropertyTest {

    static final long EXPECTED_ACCOUNTS = 3;

    private final QueryExecutor queryExecutor;

    @Override
    public AcidProperty property() {
        return AcidProperty.CONSISTENCY;
    }

    @Override
    public Evaluation evaluate(AcidTestSession session) {
        String accounts = session.accountsTable();
        List<Check> checks = new ArrayList<>();

        checks.add(expectRejected("Primary Key Constraint", "Duplicate key allowed",
            "INSERT INTO " + accounts + " (account_id, balance) VALUES (1, 999.99)"));
        checks.add(expectRejected("NOT NULL Constraint", "NULL value allowed",
            "INSERT INTO " + accounts + " (account_id, balance) VALUES (NULL, 100.00)"));
        checks.add(expectRejected("Data Type Constraint", "Invalid type allowed",
            "INSERT INTO " + accounts + " (account_id, balance) VALUES ('invalid', 100.00)"));

        QueryResult count = queryExecutor.executeQuery(Query.of(
            "SELECT COUNT(*) AS account_count FROM " + accounts));
        long finalCount = count.firstRow().map(row -> row.getLong("account_count", -1L)).orElse(-1L);
        checks.add(new Check("Row count preserved", finalCount == EXPECTED_ACCOUNTS,
            "Expected " + EXPECTED_ACCOUNTS + ", found " + finalCount));

        return new Evaluation(checks, "Constraint tests: " + checks.subList(0, 3) + ", Final count: " + finalCount);
    }

    private Check expectRejected(String name, String acceptedMessage, String sql) {
        MutationResult result = queryExecutor.executeDml(Query.of(sql));
        if (result.success()) {
            log.warn("Consistency: {} not enforced", name);
            return new Check(name, false, acceptedMessage);
        }
        log.info("Consistency: {} enforced ({})", name, result.errorKind());
        return new Check(name, true, result.error());
    }
}
