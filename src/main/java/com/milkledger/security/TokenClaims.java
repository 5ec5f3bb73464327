package com.milkledger.security;

import java.time.Instant;

/**
 * Claims embedded in a signed token.
 *
 * @param subjectId user id ({@code sub})
 * @param kind      access or refresh ({@code kind})
 * @param issuedAt  {@code iat}, second precision
 * @param expiresAt {@code exp}, second precision
 * @param nonce     random value ({@code jti}) so two tokens minted in the same second differ
 */
public record TokenClaims(
        Long      subjectId,
        TokenKind kind,
        Instant   issuedAt,
        Instant   expiresAt,
        String    nonce) {
}
