package com.tpcc.gateway.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;
import org.springframework.retry.support.RetryTemplate;

import com.tpcc.gateway.repository.PlanAbortedException;
import com.tpcc.gateway.repository.TransientBackendException;

class RetryConfigTest {

    @Test
    void isTransient_ShouldFollowCauseChain() {
        TransientBackendException conflict = new TransientBackendException("could not serialize access", null);

        assertThat(RetryConfig.isTransient(conflict)).isTrue();
        assertThat(RetryConfig.isTransient(new IllegalStateException("wrapped", conflict))).isTrue();
    }

    @Test
    void isTransient_NotFoundAbort_ShouldBeFalse() {
        assertThat(RetryConfig.isTransient(PlanAbortedException.notFound("Customer not found: 1/1/99"))).isFalse();
    }

    @Test
    void backendRetryTemplate_ShouldRetryOnlyTransientFailures() {
        // Given
        TpccProperties properties = new TpccProperties();
        properties.getRetry().setMaxAttempts(3);
        properties.getRetry().setInitialIntervalMs(1);
        properties.getRetry().setMaxIntervalMs(2);
        RetryTemplate template = new RetryConfig().backendRetryTemplate(properties);
        AtomicInteger attempts = new AtomicInteger();

        // When
        String value = template.execute(context -> {
            if (attempts.incrementAndGet() < 3) {
                throw new TransientBackendException("deadlock detected", null);
            }
            return "done";
        });
        AtomicInteger abortAttempts = new AtomicInteger();
        assertThatThrownBy(() -> template.execute(context -> {
            abortAttempts.incrementAndGet();
            throw PlanAbortedException.notFound("Customer not found: 1/1/99");
        })).isInstanceOf(PlanAbortedException.class);

        // Then
        assertThat(value).isEqualTo("done");
        assertThat(attempts.get()).isEqualTo(3);
        assertThat(abortAttempts.get()).isEqualTo(1);
    }
}
