package com.milkledger.security;

import java.time.Instant;

/**
 * Result of a login, registration or refresh: a fresh access token and the
 * refresh token that is now the only valid one for the user.
 */
public record TokenPair(
        String  accessToken,
        String  refreshToken,
        Instant accessExpiresAt,
        Instant refreshExpiresAt) {
}
