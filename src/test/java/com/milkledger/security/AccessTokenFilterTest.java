package com.milkledger.security;

import com.milkledger.exception.UnauthorizedException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AccessTokenFilterTest {

    @Mock TokenLifecycleService tokenLifecycleService;

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test @DisplayName("valid bearer → principal is the user id, userId in MDC during the chain")
    void validToken() throws Exception {
        when(tokenLifecycleService.verifyAccess("abc")).thenReturn(7L);
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/milk/records");
        request.addHeader("Authorization", "Bearer abc");

        AtomicReference<String> mdcDuringChain = new AtomicReference<>();
        AtomicReference<Authentication> authDuringChain = new AtomicReference<>();
        MockFilterChain chain = new MockFilterChain() {
            @Override
            public void doFilter(jakarta.servlet.ServletRequest req, jakarta.servlet.ServletResponse res) {
                mdcDuringChain.set(MDC.get("userId"));
                authDuringChain.set(SecurityContextHolder.getContext().getAuthentication());
            }
        };

        new AccessTokenFilter(tokenLifecycleService).doFilter(request, new MockHttpServletResponse(), chain);

        assertThat(authDuringChain.get().getPrincipal()).isEqualTo(7L);
        assertThat(authDuringChain.get().getAuthorities()).extracting(Object::toString).containsExactly("ROLE_USER");
        assertThat(mdcDuringChain.get()).isEqualTo("7");
        assertThat(MDC.get("userId")).isNull();
    }

    @Test @DisplayName("rejected bearer → request continues unauthenticated")
    void rejectedToken() throws Exception {
        when(tokenLifecycleService.verifyAccess("bad"))
            .thenThrow(new UnauthorizedException(TokenLifecycleService.UNAUTHORIZED_MESSAGE));
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/milk/records");
        request.addHeader("Authorization", "Bearer bad");
        MockFilterChain chain = new MockFilterChain();

        new AccessTokenFilter(tokenLifecycleService).doFilter(request, new MockHttpServletResponse(), chain);

        assertThat(chain.getRequest()).isNotNull();
        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
    }

    @Test @DisplayName("no header or non-Bearer scheme → token service never called")
    void noBearer() throws Exception {
        MockHttpServletRequest basic = new MockHttpServletRequest("GET", "/milk/records");
        basic.addHeader("Authorization", "Basic dXNlcjpwYXNz");

        new AccessTokenFilter(tokenLifecycleService)
            .doFilter(new MockHttpServletRequest("GET", "/milk/records"), new MockHttpServletResponse(), new MockFilterChain());
        new AccessTokenFilter(tokenLifecycleService)
            .doFilter(basic, new MockHttpServletResponse(), new MockFilterChain());

        verifyNoInteractions(tokenLifecycleService);
    }
}
