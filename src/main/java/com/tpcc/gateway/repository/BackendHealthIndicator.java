package com.tpcc.gateway.repository;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import com.tpcc.gateway.domain.MutationResult;

import lombok.RequiredArgsConstructor;

/**
 * Actuator health contribution ({@code /actuator/health}, component "backend")
 * based on a one-row query through {@link QueryExecutor}.
 */
@Component("backend")
@RequiredArgsConstructor
public class BackendHealthIndicator implements HealthIndicator {

    private final QueryExecutor queryExecutor;

    @Override
    public Health health() {
        MutationResult connection = queryExecutor.checkConnection();
        Health.Builder builder = connection.success() ? Health.up() : Health.down();
        builder.withDetail("provider", queryExecutor.providerName())
            .withDetail("dialect", queryExecutor.schemaDialect().name());
        if (!connection.success()) {
            builder.withDetail("errorKind", connection.errorKind().name())
                .withDetail("error", connection.error());
        }
        return builder.build();
    }
}
