package com.tpcc.gateway.service.acid;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;

import com.tpcc.gateway.domain.AcidProperty;
import com.tpcc.gateway.domain.AcidTestResult.Check;
import com.tpcc.gateway.domain.AcidTestSession;
import com.tpcc.gateway.domain.MutationResult;
import com.tpcc.gateway.domain.QueryResult;
import com.tpcc.gateway.domain.ResultRow;
import com.tpcc.gateway.domain.TransactionResult;
import com.tpcc.gateway.repository.QueryExecutor;
import com.tpcc.gateway.repository.sql.Query;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Isolation, approximated sequentially.
 *
 * Checks:
 * 1. Read consistency: a committed +100.00 on account 1 is visible to the next read
 * 2. Version control: a conditional update on account 2 with the current
 *    version applies to exactly one row
 * 3. Stale version: repeating that update with the old version applies to none
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IsolationTestService implements AcidPropertyTest {

    static final BigDecimal INCREMENT = new BigDecimal("100.00");

    private final QueryExecutor queryExecutor;

    @Override
    public AcidProperty property() {
        return AcidProperty.ISOLATION;
    }

    @Override
    public Evaluation evaluate(AcidTestSession session) {
        String accounts = session.accountsTable();
        List<Check> checks = new ArrayList<>();

        // Read consistency
        BigDecimal initial = readAccount(accounts, 1).getDecimal("balance");
        MutationResult update = queryExecutor.executeDml(Query.builder(
                "UPDATE " + accounts + " SET balance = balance + @amount WHERE account_id = 1")
            .bind("amount", INCREMENT)
            .build());
        BigDecimal updated = readAccount(accounts, 1).getDecimal("balance");
        boolean visible = update.success() && updated != null && updated.compareTo(initial.add(INCREMENT)) == 0;
        checks.add(new Check("Read Consistency", visible, "Initial: " + initial + ", Updated: " + updated));

        // Optimistic version check
        long version = readAccount(accounts, 2).getLong("version", 0L);
        Long applied = versionedUpdate(accounts, version);
        checks.add(new Check("Version Control", applied != null && applied == 1,
            "Update at version " + version + " applied to " + applied + " row(s)"));

        Long stale = versionedUpdate(accounts, version);
        checks.add(new Check("Stale Version Rejected", stale != null && stale == 0,
            "Update at stale version " + version + " applied to " + stale + " row(s)"));

        return new Evaluation(checks, "Isolation tests: " + checks);
    }

    private ResultRow readAccount(String accounts, long accountId) {
        QueryResult result = queryExecutor.executeQuery(Query.builder(
                "SELECT a.balance AS balance, a.version AS version FROM " + accounts + " a WHERE a.account_id = @id")
            .bind("id", accountId)
            .build());
        if (!result.isSuccess() || result.isEmpty()) {
            throw new IllegalStateException("Could not read account " + accountId + ": " + result.error());
        }
        return result.rows().get(0);
    }

    /** @return rows affected, or null when the statement failed */
    private Long versionedUpdate(String accounts, long expectedVersion) {
        TransactionResult<Long> result = queryExecutor.executeInTransaction(tx -> tx.update(Query.builder(
                "UPDATE " + accounts + " SET balance = balance + 50, version = version + 1 "
                    + "WHERE account_id = 2 AND version = @version")
            .bind("version", expectedVersion)
            .build()));
        if (!result.committed()) {
            log.warn("Isolation: versioned update failed: {}", result.error());
            return null;
        }
        return result.value();
    }
}
