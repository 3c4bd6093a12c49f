package com.tpcc.gateway.util;

import java.io.IOException;
import java.util.UUID;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import io.opentelemetry.api.trace.Span;

import lombok.extern.slf4j.Slf4j;

/**
 * Servlet filter for correlation ID management.
 *
 * Functionality:
 * 1. Takes the correlation ID from the X-Correlation-ID header when it is a UUID
 * 2. Generates a new UUID otherwise
 * 3. Puts it in the MDC so every log line of the request carries it
 * 4. Echoes it in the response header and on the current span
 * 5. Cleans up the MDC after the request
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter implements Filter {

    static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    /** Referenced by the logging pattern in logback-spring.xml. */
    private static final String CORRELATION_ID_MDC_KEY = "correlationId";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;

        try {
            String correlationId = extractOrGenerateCorrelationId(httpRequest);

            MDC.put(CORRELATION_ID_MDC_KEY, correlationId);
            httpResponse.setHeader(CORRELATION_ID_HEADER, correlationId);
            Span.current().setAttribute("correlation.id", correlationId);

            log.debug("{} {} correlationId={}", httpRequest.getMethod(), httpRequest.getRequestURI(), correlationId);

            chain.doFilter(request, response);
        } finally {
            MDC.remove(CORRELATION_ID_MDC_KEY);
        }
    }

    private String extractOrGenerateCorrelationId(HttpServletRequest request) {
        String correlationId = request.getHeader(CORRELATION_ID_HEADER);

        if (correlationId != null && !correlationId.trim().isEmpty()) {
            try {
                UUID.fromString(correlationId);
                return correlationId;
            } catch (IllegalArgumentException e) {
                log.warn("Invalid correlation ID in header: {}. Generating new one.", correlationId);
            }
        }

        return UUID.randomUUID().toString();
    }

    /**
     * @return correlation ID of the current request, or null outside a request
     */
    public static String getCurrentCorrelationId() {
        return MDC.get(CORRELATION_ID_MDC_KEY);
    }
}
