package com.milkledger.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.milkledger.dto.ApiResponses;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;

import java.io.IOException;

/**
 * Writes the standard ErrorResponse body for unauthenticated requests to
 * protected endpoints, so a 401 from the filter chain looks the same as a
 * 401 raised by a controller.
 */
public class JsonAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private static final Logger log = LoggerFactory.getLogger(JsonAuthenticationEntryPoint.class);

    private final ObjectMapper objectMapper;

    public JsonAuthenticationEntryPoint(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest      request,
                         HttpServletResponse     response,
                         AuthenticationException authException) throws IOException {
        if (response.isCommitted()) {
            return;
        }
        log.warn("Unauthenticated request rejected - {} {}", request.getMethod(), request.getRequestURI());

        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");
        objectMapper.writeValue(response.getOutputStream(),
                new ApiResponses.ErrorResponse("UNAUTHORIZED", TokenLifecycleService.UNAUTHORIZED_MESSAGE));
    }
}
