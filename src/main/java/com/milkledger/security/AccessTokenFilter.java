package com.milkledger.security;

import com.milkledger.exception.UnauthorizedException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

/**
 * Per-request access token filter.
 *
 * FLOW:
 *   1. Extract "Authorization: Bearer <token>" header
 *   2. Verify it through TokenLifecycleService.verifyAccess (signature, expiry, kind)
 *   3. Put the user id into the SecurityContext as the principal
 *   4. Continue filter chain
 *
 * A missing or rejected token does not stop the request here. The request
 * simply stays anonymous, and Spring Security answers 401 through
 * JsonAuthenticationEntryPoint if the endpoint is protected.
 *
 * No database read: access tokens are stateless. A refresh token presented
 * as a bearer is rejected by the kind check.
 */
public class AccessTokenFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AccessTokenFilter.class);

    private final TokenLifecycleService tokenLifecycleService;

    public AccessTokenFilter(TokenLifecycleService tokenLifecycleService) {
        this.tokenLifecycleService = tokenLifecycleService;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest  request,
                                    HttpServletResponse response,
                                    FilterChain         chain)
            throws ServletException, IOException {

        log.debug("🔒 Authentication filter: {} {}", request.getMethod(), request.getRequestURI());

        String token = extractBearerToken(request);

        if (StringUtils.hasText(token)) {
            try {
                Long userId = tokenLifecycleService.verifyAccess(token);

                MDC.put("userId", userId.toString());

                var auth = new UsernamePasswordAuthenticationToken(
                        userId,
                        null,
                        List.of(new SimpleGrantedAuthority("ROLE_USER"))
                );
                SecurityContextHolder.getContext().setAuthentication(auth);
                log.debug("✓ Access token accepted - userId={}", userId);
            } catch (UnauthorizedException e) {
                // reason already logged by TokenLifecycleService
                SecurityContextHolder.clearContext();
            }
        } else {
            log.debug("No bearer token in request (public endpoint or unauthenticated)");
        }

        try {
            chain.doFilter(request, response);
        } finally {
            MDC.remove("userId");
        }
    }

    /**
     * Extract the raw token from "Authorization: Bearer <token>".
     * Returns null if the header is absent or malformed.
     */
    private String extractBearerToken(HttpServletRequest request) {
        String header = request.getHeader("Authorization");
        if (StringUtils.hasText(header) && header.startsWith("Bearer ")) {
            return header.substring(7).strip();
        }
        return null;
    }
}
