package com.tpcc.gateway.config;

import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Micrometer setup.
 *
 * Adds global tags to all metrics:
 * - application: tpcc-gateway
 * - environment: dev/prod/test
 * - backend: configured provider
 *
 * and enables {@code @Timed} on the TPC-C protocol methods. Metrics are
 * exposed at /actuator/prometheus.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class ObservabilityConfig {

    private final Environment environment;

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags(TpccProperties properties) {
        String appName = environment.getProperty("spring.application.name", "tpcc-gateway");
        String env = environment.getProperty("ENVIRONMENT", "dev");
        String backend = properties.getBackend().getProvider();

        log.info("Configuring metrics with tags: application={}, environment={}, backend={}", appName, env, backend);

        return registry -> registry.config()
            .commonTags(
                "application", appName,
                "environment", env,
                "backend", backend
            )
            .meterFilter(MeterFilter.maximumAllowableMetrics(10000));
    }

    @Bean
    public TimedAspect timedAspect(MeterRegistry registry) {
        log.info("Enabling @Timed annotation support for protocol metrics");
        return new TimedAspect(registry);
    }

    /**
     * Caps distinct URI tags on HTTP server metrics.
     */
    @Bean
    public MeterFilter httpUriCardinalityFilter() {
        return MeterFilter.maximumAllowableTags(
            "http.server.requests",
            "uri",
            100,
            MeterFilter.deny()
        );
    }
}
