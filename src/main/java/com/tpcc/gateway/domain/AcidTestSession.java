package com.tpcc.gateway.domain;

import java.util.List;

/**
 * Session namespace of one harness run: three tables suffixed with a
 * millisecond timestamp.
 */
public record AcidTestSession(long id, String provider, SchemaDialect dialect) {

    public static AcidTestSession begin(String provider, SchemaDialect dialect) {
        return new AcidTestSession(System.currentTimeMillis(), provider, dialect);
    }

    public String accountsTable() {
        return "acid_test_accounts_" + id;
    }

    public String transactionsTable() {
        return "acid_test_transactions_" + id;
    }

    public String auditTable() {
        return "acid_test_audit_" + id;
    }

    /** Creation order; teardown walks it in reverse. */
    public List<String> tables() {
        return List.of(accountsTable(), transactionsTable(), auditTable());
    }
}
