package com.tpcc.gateway.repository;

import org.springframework.stereotype.Component;

import com.tpcc.gateway.config.TpccProperties;
import com.tpcc.gateway.util.MetricsHelper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Default statement listener: debug log per statement, warn on failures and
 * slow statements, and Micrometer timers/counters through {@link MetricsHelper}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MeteredQueryEventListener implements QueryEventListener {

    private final MetricsHelper metricsHelper;
    private final TpccProperties properties;

    @Override
    public void onStatement(StatementEvent event) {
        String kind = event.kind().name();
        metricsHelper.recordStatement(kind, event.success(), event.durationMs());

        if (!event.success()) {
            log.warn("{} failed after {}ms [{}]: {} | sql={}", kind, event.durationMs(),
                event.errorKind(), event.error(), event.sql());
            metricsHelper.recordBackendError(event.errorKind().name(), kind);
            return;
        }

        log.debug("{} ok: rows={}, params={}, duration={}ms | sql={}", kind, event.rows(),
            event.parameterCount(), event.durationMs(), event.sql());

        long threshold = properties.getSlowStatementThresholdMs();
        if (event.durationMs() > threshold) {
            metricsHelper.recordSlowStatement(kind, event.durationMs(), threshold);
        }
    }
}
