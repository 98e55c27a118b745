package com.plaetzchen.community.infrastructure.web;

import com.plaetzchen.observability.CorrelationContext;
import com.plaetzchen.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Servlet filter that propagates or generates a correlation ID for every HTTP request.
 *
 * <p>WHY: every request gets a correlation ID that flows through:
 *
 * <ol>
 *   <li>HTTP request header → this filter → {@link CorrelationContextHolder}
 *   <li>CorrelationContextHolder → SLF4J MDC → log output
 *   <li>CorrelationContextHolder → domain event envelopes → notification rows
 *   <li>This filter → HTTP response header (for client-side correlation)
 * </ol>
 *
 * <p>A client-supplied {@code X-Correlation-ID} is propagated when it is a short token of letters,
 * digits, dots, underscores and dashes. Anything else is replaced by a fresh UUID so header
 * content never reaches the logs verbatim. Each request also gets its own request ID.
 *
 * <p>Runs at {@link Ordered#HIGHEST_PRECEDENCE} so correlation is available to all subsequent
 * filters (authentication included) and handlers.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9._\\-]{1,64}");

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = resolveCorrelationId(request.getHeader(CORRELATION_ID_HEADER));
        CorrelationContextHolder.set(
                new CorrelationContext(correlationId, null, UUID.randomUUID().toString()));

        // WHY: Echo correlation ID back so clients can reference it in support requests.
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            // WHY: Tomcat reuses threads; a leftover context would leak into the next request.
            CorrelationContextHolder.clear();
        }
    }

    static String resolveCorrelationId(String header) {
        if (header != null && ACCEPTED_ID.matcher(header).matches()) {
            return header;
        }
        return UUID.randomUUID().toString();
    }
}
