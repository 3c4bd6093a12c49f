package com.tpcc.gateway.service.acid;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;

import com.tpcc.gateway.config.TpccProperties;
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
 * Durability: committed data is still there on a later read.
 *
 * Commits account 999 (12345.67) and an audit row, waits
 * {@code tpcc.acid.durability-delay-ms}, then reads both back through fresh
 * statements.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DurabilityTestService implements AcidPropertyTest {

    static final long TEST_ACCOUNT_ID = 999;
    static final BigDecimal TEST_BALANCE = new BigDecimal("12345.67");

    private final QueryExecutor queryExecutor;
    private final TpccProperties properties;

    @Override
    public AcidProperty property() {
        return AcidProperty.DURABILITY;
    }

    @Override
    public Evaluation evaluate(AcidTestSession session) {
        MutationResult inserted = queryExecutor.executeGrouped(List.of(
            Query.builder("INSERT INTO " + session.accountsTable() + " (account_id, balance) VALUES (@id, @balance)")
                .bind("id", TEST_ACCOUNT_ID).bind("balance", TEST_BALANCE).build(),
            Query.builder("INSERT INTO " + session.auditTable() + " (audit_id, table_name, operation, record_id) "
                    + "VALUES (@id, 'accounts', 'INSERT', @id)")
                .bind("id", TEST_ACCOUNT_ID).build()));
        if (!inserted.success()) {
            throw new IllegalStateException("Could not commit durability test data: " + inserted.error());
        }
        log.info("Durability: committed account {} with balance {}", TEST_ACCOUNT_ID, TEST_BALANCE);

        pause(properties.getAcid().getDurabilityDelayMs());

        QueryResult account = queryExecutor.executeQuery(Query.builder(
                "SELECT a.account_id AS account_id, a.balance AS balance FROM " + session.accountsTable() + " a "
                    + "WHERE a.account_id = @id")
            .bind("id", TEST_ACCOUNT_ID)
            .build());
        QueryResult audit = queryExecutor.executeQuery(Query.builder(
                "SELECT au.audit_id AS audit_id, au.operation AS operation FROM " + session.auditTable() + " au "
                    + "WHERE au.record_id = @id")
            .bind("id", TEST_ACCOUNT_ID)
            .build());

        boolean dataPersisted = account.isSuccess() && account.size() == 1
            && account.rows().get(0).getLong("account_id", -1L) == TEST_ACCOUNT_ID
            && TEST_BALANCE.compareTo(account.rows().get(0).getDecimal("balance", BigDecimal.ZERO)) == 0;
        boolean auditPersisted = audit.isSuccess() && audit.size() == 1
            && "INSERT".equals(audit.rows().get(0).getString("operation"));

        List<Check> checks = new ArrayList<>();
        checks.add(new Check("Account persisted", dataPersisted, String.valueOf(account.rows())));
        checks.add(new Check("Audit persisted", auditPersisted, String.valueOf(audit.rows())));
        return new Evaluation(checks, "Data persisted: " + dataPersisted + ", Audit persisted: " + auditPersisted);
    }

    private static void pause(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting before the durability re-read", e);
        }
    }
}
