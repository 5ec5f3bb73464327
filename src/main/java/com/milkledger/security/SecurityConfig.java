package com.milkledger.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

/**
 * Spring Security configuration.
 *
 * ENDPOINT ACCESS RULES:
 *
 *   PUBLIC  (no token required):
 *     POST /api/auth/register    create account, returns a token pair
 *     POST /api/auth/login       exchange credentials for a token pair
 *     POST /api/auth/refresh     exchange a refresh token for a new pair
 *     GET  /api/actuator/health  health probe
 *     GET  /api/swagger-ui/**    Swagger UI
 *     GET  /api/v3/api-docs/**   OpenAPI document
 *
 *   PROTECTED (valid access token required):
 *     Everything else
 *
 * SESSION: Stateless. No HTTP session is created.
 * CSRF:    Disabled. API-only, no browser form submissions.
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    private final TokenLifecycleService tokenLifecycleService;
    private final ObjectMapper          objectMapper;

    public SecurityConfig(TokenLifecycleService tokenLifecycleService,
                          ObjectMapper          objectMapper) {
        this.tokenLifecycleService = tokenLifecycleService;
        this.objectMapper          = objectMapper;
    }

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http) throws Exception {
        http
            .csrf(csrf -> csrf.disable())
            .sessionManagement(sm ->
                sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .exceptionHandling(eh ->
                eh.authenticationEntryPoint(new JsonAuthenticationEntryPoint(objectMapper)))
            .authorizeHttpRequests(auth -> auth
                .requestMatchers(HttpMethod.POST,
                    "/auth/register",
                    "/auth/login",
                    "/auth/refresh").permitAll()
                .requestMatchers("/actuator/health", "/actuator/info").permitAll()
                .requestMatchers(
                    "/swagger-ui/**",
                    "/swagger-ui.html",
                    "/v3/api-docs/**").permitAll()
                // error dispatches must not be turned into 401s
                .requestMatchers("/error").permitAll()
                .anyRequest().authenticated()
            )
            .addFilterBefore(
                new AccessTokenFilter(tokenLifecycleService),
                UsernamePasswordAuthenticationFilter.class
            );

        return http.build();
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder(12);
    }
}
