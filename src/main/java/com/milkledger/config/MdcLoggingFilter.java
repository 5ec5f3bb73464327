package com.milkledger.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Adds a requestId to MDC (Mapped Diagnostic Context) so that every log line
 * within a request carries the same correlation ID.
 *
 * Usage in logback pattern: %X{requestId} %X{method} %X{path}
 *
 * A client-supplied X-Request-Id is reused when present (up to 64 chars);
 * otherwise a UUID is generated. Either way it is echoed in the response.
 * AccessTokenFilter adds userId once the bearer token is accepted.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcLoggingFilter extends OncePerRequestFilter {

    static final String REQUEST_ID_HEADER = "X-Request-Id";

    @Override
    protected void doFilterInternal(HttpServletRequest  request,
                                    HttpServletResponse response,
                                    FilterChain         chain)
            throws ServletException, IOException {
        String incoming  = request.getHeader(REQUEST_ID_HEADER);
        String requestId = StringUtils.hasText(incoming) && incoming.length() <= 64
                ? incoming
                : UUID.randomUUID().toString();
        try {
            MDC.put("requestId", requestId);
            MDC.put("method",    request.getMethod());
            MDC.put("path",      request.getRequestURI());
            response.setHeader(REQUEST_ID_HEADER, requestId);
            chain.doFilter(request, response);
        } finally {
            MDC.clear();
        }
    }
}
