package com.tpcc.gateway.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.support.RetryTemplate;

import com.tpcc.gateway.repository.TransientBackendException;

import lombok.extern.slf4j.Slf4j;

/**
 * Retry policy for transient backend failures (serialization conflicts,
 * deadlocks, Spanner ABORTED/UNAVAILABLE).
 *
 * Exponential backoff, bounded by {@code tpcc.retry.max-attempts}. Nothing
 * else is retried.
 */
@Slf4j
@Configuration
public class RetryConfig {

    @Bean
    public RetryTemplate backendRetryTemplate(TpccProperties properties) {
        TpccProperties.Retry retry = properties.getRetry();
        log.info("Backend retry policy: maxAttempts={}, backoff={}ms x{} (max {}ms)",
            retry.getMaxAttempts(), retry.getInitialIntervalMs(), retry.getMultiplier(), retry.getMaxIntervalMs());

        return RetryTemplate.builder()
            .maxAttempts(retry.getMaxAttempts())
            .exponentialBackoff(retry.getInitialIntervalMs(), retry.getMultiplier(), retry.getMaxIntervalMs())
            .retryOn(TransientBackendException.class)
            .traversingCauses()
            .withListener(new RetryListener() {
                @Override
                public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                             Throwable throwable) {
                    if (isTransient(throwable)) {
                        log.warn("Transient backend failure (attempt {}): {}",
                            context.getRetryCount(), throwable.getMessage());
                    }
                }
            })
            .build();
    }

    /** Same cause traversal as the retry policy. */
    static boolean isTransient(Throwable throwable) {
        for (Throwable cause = throwable; cause != null; cause = cause.getCause()) {
            if (cause instanceof TransientBackendException) {
                return true;
            }
        }
        return false;
    }
}
