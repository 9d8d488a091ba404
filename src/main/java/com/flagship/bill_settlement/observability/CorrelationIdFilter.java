package com.flagship.bill_settlement.observability;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Tags every settlement request with a correlation id.
 *
 * The id is bound to the thread, added to the MDC and returned in the
 * X-Correlation-ID response header. Runs first so filters after it log with the id.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {

        String requested = request.getHeader(CorrelationContext.CORRELATION_ID_HEADER);
        String correlationId = CorrelationContext.bind(requested);
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, correlationId);
        if (requested != null && !requested.equals(correlationId)) {
            log.debug("Replaced malformed {} header", CorrelationContext.CORRELATION_ID_HEADER);
        }
        response.setHeader(CorrelationContext.CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            CorrelationContext.clear();
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
            MDC.remove(CorrelationContext.RECEIPT_ID_MDC_KEY);
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return request.getRequestURI().startsWith("/actuator");
    }
}
