package com.tpcc.gateway.service.acid;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;

import com.tpcc.gateway.domain.AcidTestSession;
import com.tpcc.gateway.domain.MutationResult;
import com.tpcc.gateway.domain.SchemaDialect;
import com.tpcc.gateway.repository.QueryExecutor;
import com.tpcc.gateway.repository.sql.Query;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Creates, seeds and drops the session tables of a harness run.
 *
 * Tables (suffixed with the session id):
 * - accounts: account_id, balance, version, created_at
 * - transactions: txn_id, from_account, to_account, amount, status, created_at
 * - audit: audit_id, table_name, operation, record_id, created_at
 *
 * DDL is rendered per {@link SchemaDialect}; seed rows are accounts
 * 1 = 1000.00, 2 = 500.00 and 3 = 750.00.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AcidSchemaService {

    private final QueryExecutor queryExecutor;

    /**
     * Creates the session tables and inserts the seed accounts.
     *
     * @return failure when either step is rejected; tables already created stay
     *         in place for {@link #teardown(AcidTestSession)}
     */
    public MutationResult provision(AcidTestSession session) {
        MutationResult created = queryExecutor.executeDdl(createStatements(session));
        if (!created.success()) {
            log.error("ACID session {}: table creation failed: {}", session.id(), created.error());
            return created;
        }

        MutationResult seeded = queryExecutor.executeGrouped(List.of(
            seedAccount(session, 1, "1000.00"),
            seedAccount(session, 2, "500.00"),
            seedAccount(session, 3, "750.00")));
        if (!seeded.success()) {
            log.error("ACID session {}: seeding failed: {}", session.id(), seeded.error());
        }
        return seeded;
    }

    /**
     * Drops the session tables in reverse creation order. Drop failures are
     * logged and never raised.
     */
    public void teardown(AcidTestSession session) {
        List<String> tables = new ArrayList<>(session.tables());
        for (int i = tables.size() - 1; i >= 0; i--) {
            String table = tables.get(i);
            MutationResult dropped = queryExecutor.executeDdl(List.of("DROP TABLE " + table));
            if (dropped.success()) {
                log.debug("ACID session {}: dropped {}", session.id(), table);
            } else {
                log.warn("ACID session {}: could not drop {}: {}", session.id(), table, dropped.error());
            }
        }
    }

    static List<String> createStatements(AcidTestSession session) {
        switch (session.dialect()) {
            case GOOGLE_STANDARD_SQL:
                return List.of(
                    "CREATE TABLE " + session.accountsTable() + " ("
                        + "account_id INT64 NOT NULL, "
                        + "balance NUMERIC NOT NULL, "
                        + "version INT64 NOT NULL DEFAULT (1), "
                        + "created_at TIMESTAMP NOT NULL DEFAULT (CURRENT_TIMESTAMP())"
                        + ") PRIMARY KEY (account_id)",
                    "CREATE TABLE " + session.transactionsTable() + " ("
                        + "txn_id INT64 NOT NULL, "
                        + "from_account INT64 NOT NULL, "
                        + "to_account INT64 NOT NULL, "
                        + "amount NUMERIC NOT NULL, "
                        + "status STRING(20) NOT NULL, "
                        + "created_at TIMESTAMP NOT NULL DEFAULT (CURRENT_TIMESTAMP())"
                        + ") PRIMARY KEY (txn_id)",
                    "CREATE TABLE " + session.auditTable() + " ("
                        + "audit_id INT64 NOT NULL, "
                        + "table_name STRING(50) NOT NULL, "
                        + "operation STRING(20) NOT NULL, "
                        + "record_id INT64 NOT NULL, "
                        + "created_at TIMESTAMP NOT NULL DEFAULT (CURRENT_TIMESTAMP())"
                        + ") PRIMARY KEY (audit_id)");
            case SPANNER_POSTGRESQL:
                return List.of(
                    "CREATE TABLE " + session.accountsTable() + " ("
                        + "account_id BIGINT NOT NULL PRIMARY KEY, "
                        + "balance NUMERIC NOT NULL, "
                        + "version BIGINT NOT NULL DEFAULT 1, "
                        + "created_at TIMESTAMPTZ NOT NULL DEFAULT CURRENT_TIMESTAMP)",
                    "CREATE TABLE " + session.transactionsTable() + " ("
                        + "txn_id BIGINT NOT NULL PRIMARY KEY, "
                        + "from_account BIGINT NOT NULL, "
                        + "to_account BIGINT NOT NULL, "
                        + "amount NUMERIC NOT NULL, "
                        + "status VARCHAR(20) NOT NULL, "
                        + "created_at TIMESTAMPTZ NOT NULL DEFAULT CURRENT_TIMESTAMP)",
                    "CREATE TABLE " + session.auditTable() + " ("
                        + "audit_id BIGINT NOT NULL PRIMARY KEY, "
                        + "table_name VARCHAR(50) NOT NULL, "
                        + "operation VARCHAR(20) NOT NULL, "
                        + "record_id BIGINT NOT NULL, "
                        + "created_at TIMESTAMPTZ NOT NULL DEFAULT CURRENT_TIMESTAMP)");
            case POSTGRESQL:
            default:
                return List.of(
                    "CREATE TABLE " + session.accountsTable() + " ("
                        + "account_id BIGINT NOT NULL PRIMARY KEY, "
                        + "balance NUMERIC(15, 2) NOT NULL, "
                        + "version BIGINT NOT NULL DEFAULT 1, "
                        + "created_at TIMESTAMP NOT NULL DEFAULT CURRENT_TIMESTAMP)",
                    "CREATE TABLE " + session.transactionsTable() + " ("
                        + "txn_id BIGINT NOT NULL PRIMARY KEY, "
                        + "from_account BIGINT NOT NULL, "
                        + "to_account BIGINT NOT NULL, "
                        + "amount NUMERIC(15, 2) NOT NULL, "
                        + "status VARCHAR(20) NOT NULL, "
                        + "created_at TIMESTAMP NOT NULL DEFAULT CURRENT_TIMESTAMP)",
                    "CREATE TABLE " + session.auditTable() + " ("
                        + "audit_id BIGINT NOT NULL PRIMARY KEY, "
                        + "table_name VARCHAR(50) NOT NULL, "
                        + "operation VARCHAR(20) NOT NULL, "
                        + "record_id BIGINT NOT NULL, "
                        + "created_at TIMESTAMP NOT NULL DEFAULT CURRENT_TIMESTAMP)");
        }
    }

    private static Query seedAccount(AcidTestSession session, long accountId, String balance) {
        return Query.builder(
                "INSERT INTO " + session.accountsTable() + " (account_id, balance) VALUES (@id, @balance)")
            .bind("id", accountId)
            .bind("balance", new BigDecimal(balance))
            .build();
    }
}
