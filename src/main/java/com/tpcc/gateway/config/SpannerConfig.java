package com.tpcc.gateway.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.google.cloud.spanner.DatabaseClient;
import com.google.cloud.spanner.DatabaseId;
import com.google.cloud.spanner.Spanner;
import com.google.cloud.spanner.SpannerOptions;

import lombok.extern.slf4j.Slf4j;

/**
 * Cloud Spanner client for {@code tpcc.backend.provider=spanner}.
 *
 * Credentials follow Google application-default resolution. When
 * {@code tpcc.backend.spanner.emulator-host} is set the client talks to the
 * local emulator instead.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "tpcc.backend", name = "provider", havingValue = "spanner")
public class SpannerConfig {

    @Bean(destroyMethod = "close")
    public Spanner spanner(TpccProperties properties) {
        TpccProperties.Spanner settings = properties.getBackend().getSpanner();
        SpannerOptions.Builder options = SpannerOptions.newBuilder()
            .setProjectId(settings.getProjectId());
        if (settings.getEmulatorHost() != null && !settings.getEmulatorHost().isBlank()) {
            log.info("Using Spanner emulator at {}", settings.getEmulatorHost());
            options.setEmulatorHost(settings.getEmulatorHost());
        }
        return options.build().getService();
    }

    @Bean
    public DatabaseClient databaseClient(Spanner spanner, TpccProperties properties) {
        TpccProperties.Spanner settings = properties.getBackend().getSpanner();
        DatabaseId databaseId = DatabaseId.of(settings.getProjectId(), settings.getInstanceId(),
            settings.getDatabaseId());
        log.info("Opening Spanner database client for {}", databaseId);
        return spanner.getDatabaseClient(databaseId);
    }
}
