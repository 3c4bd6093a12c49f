package com.tpcc.gateway.domain;

import java.util.Locale;

/**
 * The four properties the conformance harness exercises, in run order.
 */
public enum AcidProperty {
    ATOMICITY("Atomicity Test", "Transaction rollback on failure"),
    CONSISTENCY("Consistency Test", "Database constraints are enforced"),
    ISOLATION("Isolation Test", "Concurrent transactions don't interfere"),
    DURABILITY("Durability Test", "Committed data persists after system restart");

    private final String testName;
    private final String description;

    AcidProperty(String testName, String description) {
        this.testName = testName;
        this.description = description;
    }

    public String testName() {
        return testName;
    }

    public String description() {
        return description;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AcidProperty fromKey(String key) {
        for (AcidProperty property : values()) {
            if (property.key().equalsIgnoreCase(key)) {
                return property;
            }
        }
        throw new IllegalArgumentException("Unknown ACID property: " + key);
    }
}
