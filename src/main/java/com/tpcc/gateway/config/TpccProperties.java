package com.tpcc.gateway.config;

import java.math.BigDecimal;

import org.jooq.SQLDialect;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Getter;
import lombok.Setter;

/**
 * Gateway settings bound from {@code tpcc.*} in application.yml.
 *
 * Backend selection:
 * - {@code tpcc.backend.provider=jdbc}: PostgreSQL-compatible database behind HikariCP
 * - {@code tpcc.backend.provider=spanner}: Cloud Spanner client (profile {@code spanner})
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "tpcc")
public class TpccProperties {

    private Backend backend = new Backend();
    private Retry retry = new Retry();
    private Acid acid = new Acid();

    /** Region stamped on new orders by best-effort tagging. */
    private String regionName = "default";

    /** Number of most recent orders examined by Stock-Level. */
    private int stockLevelWindow = 20;

    private BigDecimal paymentMaxAmount = new BigDecimal("10000.00");

    private long slowStatementThresholdMs = 200;

    @Getter
    @Setter
    public static class Backend {
        private String provider = "jdbc";
        private Jdbc jdbc = new Jdbc();
        private Spanner spanner = new Spanner();
    }

    @Getter
    @Setter
    public static class Jdbc {
        private String providerName = "PostgreSQL";
        private SQLDialect dialect = SQLDialect.POSTGRES;
        private String poolName = "TpccHikariPool";
        private int maximumPoolSize = 20;
        private int minimumIdle = 5;
        private long connectionTimeoutMs = 2000;
    }

    @Getter
    @Setter
    public static class Spanner {
        private String projectId;
        private String instanceId;
        private String databaseId;
        /** host:port of the Spanner emulator; blank for the real service. */
        private String emulatorHost;
    }

    @Getter
    @Setter
    public static class Retry {
        private int maxAttempts = 3;
        private long initialIntervalMs = 50;
        private double multiplier = 2.0;
        private long maxIntervalMs = 1000;
    }

    @Getter
    @Setter
    public static class Acid {
        private long durabilityDelayMs = 100;
    }
}
