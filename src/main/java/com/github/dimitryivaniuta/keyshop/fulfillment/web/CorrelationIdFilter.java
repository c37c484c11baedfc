package com.github.dimitryivaniuta.keyshop.fulfillment.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Adds or propagates a correlation id for request tracing.
 *
 * <p>Header: {@code X-Correlation-Id}, else the {@code X-Request-Id} most payment providers put on their
 * webhook calls. Missing or malformed values are replaced by a new UUID.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";

    static final String REQUEST_ID_HEADER = "X-Request-Id";

    public static final String MDC_KEY = "correlationId";

    private static final Pattern SAFE = Pattern.compile("^[A-Za-z0-9._:-]{1,64}$");

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = safe(request.getHeader(CORRELATION_ID_HEADER))
                .or(() -> safe(request.getHeader(REQUEST_ID_HEADER)))
                .orElseGet(() -> UUID.randomUUID().toString());

        MDC.put(MDC_KEY, correlationId);
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_KEY);
        }
    }

    private static Optional<String> safe(String header) {
        return Optional.ofNullable(header)
                .map(String::trim)
                .filter(v -> SAFE.matcher(v).matches());
    }
}
