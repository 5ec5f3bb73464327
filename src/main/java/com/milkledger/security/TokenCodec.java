package com.milkledger.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SignatureException;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;

/**
 * Signs and verifies token claims as HS256 JWTs.
 *
 * Pure: no state besides the key and the clock, both supplied at
 * construction. A new key means a new codec instance, so tests (or a key
 * rotation) never touch global state.
 *
 * Token layout:
 *  - sub  : user id
 *  - kind : ACCESS | REFRESH
 *  - iat  : issued-at
 *  - exp  : expiry
 *  - jti  : random nonce
 *
 * decode() checks signature and expiry only. Kind and revocation are
 * TokenLifecycleService's concern.
 */
public class TokenCodec {

    static final String KIND_CLAIM = "kind";

    private final SecretKey secretKey;
    private final Clock     clock;
    private final JwtParser parser;

    public TokenCodec(String secret, Clock clock) {
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < 32) {
            throw new IllegalStateException(
                "milkledger.jwt.secret must be at least 32 bytes");
        }
        this.secretKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.clock     = clock;
        this.parser    = Jwts.parser()
                .verifyWith(secretKey)
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    /** Serialize and sign the claims. */
    public String encode(TokenClaims claims) {
        return Jwts.builder()
                .subject(String.valueOf(claims.subjectId()))
                .claim(KIND_CLAIM, claims.kind().name())
                .issuedAt(Date.from(claims.issuedAt()))
                .expiration(Date.from(claims.expiresAt()))
                .id(claims.nonce())
                .signWith(secretKey)
                .compact();
    }

    /**
     * Verify signature and expiry, then read the claims back.
     *
     * @throws TokenException MALFORMED if the string is not a complete token of ours,
     *                        SIGNATURE_INVALID if the signature does not match,
     *                        EXPIRED if the clock is at or past {@code exp}
     */
    public TokenClaims decode(String token) {
        if (token == null || token.isBlank()) {
            throw new TokenException(TokenException.Reason.MALFORMED, "Token is missing");
        }

        Claims claims;
        try {
            claims = parser.parseSignedClaims(token).getPayload();
        } catch (ExpiredJwtException e) {
            throw new TokenException(TokenException.Reason.EXPIRED, "Token expired at " + e.getClaims().getExpiration(), e);
        } catch (SignatureException e) {
            throw new TokenException(TokenException.Reason.SIGNATURE_INVALID, "Token signature does not match", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new TokenException(TokenException.Reason.MALFORMED, "Token could not be parsed: " + e.getMessage(), e);
        }

        Date expiration = claims.getExpiration();
        Date issuedAt   = claims.getIssuedAt();
        String kind     = claims.get(KIND_CLAIM, String.class);
        if (expiration == null || issuedAt == null || kind == null
                || claims.getSubject() == null || claims.getId() == null) {
            throw new TokenException(TokenException.Reason.MALFORMED, "Token is missing required claims");
        }

        // jjwt accepts a token whose exp equals now; we do not
        Instant expiresAt = expiration.toInstant();
        if (!clock.instant().isBefore(expiresAt)) {
            throw new TokenException(TokenException.Reason.EXPIRED, "Token expired at " + expiresAt);
        }

        try {
            return new TokenClaims(
                    Long.valueOf(claims.getSubject()),
                    TokenKind.valueOf(kind),
                    issuedAt.toInstant(),
                    expiresAt,
                    claims.getId());
        } catch (IllegalArgumentException e) {
            // NumberFormatException included
            throw new TokenException(TokenException.Reason.MALFORMED, "Token carries an invalid claim value", e);
        }
    }
}
