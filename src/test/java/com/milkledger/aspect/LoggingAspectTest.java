package com.milkledger.aspect;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class LoggingAspectTest {

    @Test @DisplayName("parameters named like password, token or secret → [REDACTED]")
    void sensitiveNames() {
        assertThat(LoggingAspect.formatParameter("plainPassword", "hunter2")).isEqualTo(LoggingAspect.REDACTED);
        assertThat(LoggingAspect.formatParameter("refreshToken", "eyJ...")).isEqualTo(LoggingAspect.REDACTED);
        assertThat(LoggingAspect.formatParameter("clientSecret", "s")).isEqualTo(LoggingAspect.REDACTED);
    }

    @Test @DisplayName("ordinary parameter whose value mentions 'token' → logged as is")
    void redactionIsByNameNotValue() {
        assertThat(LoggingAspect.formatParameter("username", "tokenfan")).isEqualTo("tokenfan");
    }

    @Test @DisplayName("long values truncated to 100 chars, null → \"null\"")
    void truncationAndNull() {
        assertThat(LoggingAspect.formatParameter("note", "x".repeat(150))).hasSize(100).endsWith("...");
        assertThat(LoggingAspect.formatParameter("note", null)).isEqualTo("null");
    }
}
