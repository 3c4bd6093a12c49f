package com.tpcc.gateway.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.transaction.annotation.EnableTransactionManagement;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Connection pool for the JDBC backend.
 *
 * HikariCP settings for short OLTP transactions:
 * - auto-commit off, every statement runs inside an explicit transaction scope
 * - prepared statement caching for the PostgreSQL driver
 * - pool metrics published through Micrometer
 *
 * URL and credentials come from {@code spring.datasource.*}; pool sizing from
 * {@code tpcc.backend.jdbc.*}.
 */
@Slf4j
@Configuration
@EnableTransactionManagement
@ConditionalOnProperty(prefix = "tpcc.backend", name = "provider", havingValue = "jdbc", matchIfMissing = true)
public class DatabaseConfig {

    @Bean
    @Primary
    public HikariDataSource dataSource(
            DataSourceProperties dataSourceProperties,
            TpccProperties tpccProperties,
            MeterRegistry meterRegistry) {

        TpccProperties.Jdbc jdbc = tpccProperties.getBackend().getJdbc();
        log.info("Configuring HikariCP DataSource for TPC-C workload");

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(dataSourceProperties.determineUrl());
        config.setUsername(dataSourceProperties.determineUsername());
        config.setPassword(dataSourceProperties.determinePassword());
        config.setDriverClassName(dataSourceProperties.determineDriverClassName());

        config.setMaximumPoolSize(jdbc.getMaximumPoolSize());
        config.setMinimumIdle(jdbc.getMinimumIdle());

        config.setConnectionTimeout(jdbc.getConnectionTimeoutMs());
        config.setIdleTimeout(600000);     // 10 minutes
        config.setMaxLifetime(1800000);    // 30 minutes
        config.setLeakDetectionThreshold(60000);
        config.setValidationTimeout(3000);

        // Transaction boundaries are always explicit
        config.setAutoCommit(false);

        config.setPoolName(jdbc.getPoolName());

        config.addDataSourceProperty("cachePrepStmts", "true");
        config.addDataSourceProperty("prepStmtCacheSize", "250");
        config.addDataSourceProperty("prepStmtCacheSqlLimit", "2048");

        config.setMetricRegistry(meterRegistry);

        HikariDataSource dataSource = new HikariDataSource(config);

        log.info("HikariCP DataSource configured: pool={}, max={}, min={}",
                config.getPoolName(),
                config.getMaximumPoolSize(),
                config.getMinimumIdle());

        return dataSource;
    }
}
