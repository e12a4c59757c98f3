package com.flagship.expense_ledger.observability;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Takes the correlation id from the X-Correlation-ID header (or generates one), exposes it
 * through the MDC for the duration of the request and echoes it in the response.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {
        try {
            CorrelationContext.setCorrelationId(request.getHeader(CorrelationContext.CORRELATION_ID_HEADER));
            response.setHeader(CorrelationContext.CORRELATION_ID_HEADER, CorrelationContext.getCorrelationId());
            filterChain.doFilter(request, response);
        } finally {
            CorrelationContext.clear();
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return request.getRequestURI().startsWith("/actuator");
    }
}
