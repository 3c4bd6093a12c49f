package com.tpcc.gateway.integration;

import org.junit.jupiter.api.BeforeAll;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.context.jdbc.Sql;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Base class for integration tests with Testcontainers.
 *
 * Provides:
 * - PostgreSQL container shared by every integration test class
 * - the full Spring Boot context with the {@code test} profile
 *   (schema from {@code db/tpcc-schema.sql} via spring.sql.init)
 * - a fresh TPC-C data set before every test method
 *
 * All integration tests extending this class run against:
 * - a real PostgreSQL server, so SERIALIZABLE conflicts and SQLState
 *   classification behave as in production
 * - the jOOQ POSTGRES dialect and the PostgreSQL harness DDL
 *
 * Seed data ({@code db/tpcc-data.sql}), warehouse 1:
 * - districts 1 (next order 6) and 2 (no orders yet)
 * - customers 1..10 in district 1; customer 5 has balance 500.00
 * - items 1..10 with stock; orders 1..5, of which 4 and 5 are still pending
 *
 * Skipped when no Docker daemon is available.
 *
 * @see <a href="https://www.testcontainers.org/">Testcontainers Documentation</a>
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
@Sql("/db/tpcc-data.sql")
public abstract class BaseIntegrationTest {

    /**
     * Started once and left to the Testcontainers reaper, so cached Spring
     * contexts keep pointing at a live server across test classes.
     */
    static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
        .withDatabaseName("tpcc")
        .withUsername("test")
        .withPassword("test");

    @BeforeAll
    static void beforeAll() {
        postgres.start();
    }

    /**
     * Points the pool at the container.
     *
     * @param registry Spring's dynamic property registry
     */
    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }
}
