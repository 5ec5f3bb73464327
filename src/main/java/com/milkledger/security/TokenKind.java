package com.milkledger.security;

/**
 * Discriminator carried in every token's {@code kind} claim.
 * An access token is never accepted where a refresh token is expected, and vice versa.
 */
public enum TokenKind {
    ACCESS,
    REFRESH
}
