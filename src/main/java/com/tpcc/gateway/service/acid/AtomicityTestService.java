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
import com.tpcc.gateway.repository.QueryExecutor;
import com.tpcc.gateway.repository.sql.Query;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Atomicity: "All or Nothing".
 *
 * Runs a grouped mutation of three statements:
 * 1. Debit 200.00 from account 1
 * 2. Credit 200.00 to account 2
 * 3. Insert a duplicate account 1 (primary key violation)
 *
 * The group must be rejected and every balance must equal its value before the attempt.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AtomicityTestService implements AcidPropertyTest {

    static final BigDecimal TRANSFER_AMOUNT = new BigDecimal("200.00");

    private final QueryExecutor queryExecutor;

    @Override
    public AcidProperty property() {
        return AcidProperty.ATOMICITY;
    }

    @Override
    public Evaluation evaluate(AcidTestSession session) {
        String accounts = session.accountsTable();
        List<ResultRow> initial = balances(accounts);

        MutationResult group = queryExecutor.executeGrouped(List.of(
            Query.builder("UPDATE " + accounts + " SET balance = balance - @amount WHERE account_id = 1")
                .bind("amount", TRANSFER_AMOUNT).build(),
            Query.builder("UPDATE " + accounts + " SET balance = balance + @amount WHERE account_id = 2")
                .bind("amount", TRANSFER_AMOUNT).build(),
            Query.builder("INSERT INTO " + accounts + " (account_id, balance) VALUES (1, @balance)")
                .bind("balance", new BigDecimal("999.99")).build()));

        if (!group.success()) {
            log.info("Atomicity: grouped mutation rejected as expected: {}", group.error());
        }

        List<ResultRow> last = balances(accounts);

        List<Check> checks = new ArrayList<>();
        checks.add(new Check("Group rejected", !group.success(),
            group.success() ? "Transaction should have failed but didn't" : group.error()));
        checks.add(new Check("Balances unchanged", sameBalances(initial, last),
            "Initial: " + initial + ", Final: " + last));
        return new Evaluation(checks, "Initial: " + initial + ", Final: " + last);
    }

    private List<ResultRow> balances(String accounts) {
        QueryResult result = queryExecutor.executeQuery(Query.of(
            "SELECT a.account_id AS account_id, a.balance AS balance FROM " + accounts + " a ORDER BY a.account_id"));
        if (!result.isSuccess()) {
            throw new IllegalStateException("Could not read balances: " + result.error());
        }
        return result.rows();
    }

    static boolean sameBalances(List<ResultRow> before, List<ResultRow> after) {
        if (before.size() != after.size()) {
            return false;
        }
        for (int i = 0; i < before.size(); i++) {
            BigDecimal a = before.get(i).getDecimal("balance");
            BigDecimal b = after.get(i).getDecimal("balance");
            if (a == null || b == null || a.compareTo(b) != 0) {
                return false;
            }
        }
        return true;
    }
}
