package com.milkledger.security;

import com.milkledger.exception.UnauthorizedException;
import com.milkledger.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.NoSuchElementException;
import java.util.UUID;

/**
 * Issues, verifies, rotates and revokes access/refresh token pairs.
 *
 * SESSION STATE (per user, held in users.refresh_token):
 *
 *   NO SESSION     refresh_token IS NULL      (after registration without login, after logout)
 *   ACTIVE SESSION refresh_token = <token>    (after login, registration or refresh)
 *
 *   issuePair  : any state    → ACTIVE (overwrites, so older refresh tokens die)
 *   refresh    : ACTIVE(R)    → ACTIVE(R') only when the presented token equals R
 *   revoke     : any state    → NO SESSION
 *
 * Access tokens are never persisted. verifyAccess() does not touch the
 * database, so it carries no @Transactional.
 *
 * Every rejection is surfaced as the same UnauthorizedException. The concrete
 * cause (malformed, bad signature, expired, wrong kind, stale) goes to the log only.
 */
@Service
public class TokenLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(TokenLifecycleService.class);

    public static final String UNAUTHORIZED_MESSAGE = "Invalid or expired token";

    private final TokenCodec     codec;
    private final UserRepository userRepository;
    private final Clock          clock;
    private final Duration       accessTtl;
    private final Duration       refreshTtl;

    public TokenLifecycleService(TokenCodec     codec,
                                 UserRepository userRepository,
                                 Clock          clock,
                                 @Value("${milkledger.jwt.access-ttl:PT24H}") Duration accessTtl,
                                 @Value("${milkledger.jwt.refresh-ttl:P30D}") Duration refreshTtl) {
        if (accessTtl.isNegative() || accessTtl.isZero() || refreshTtl.isNegative() || refreshTtl.isZero()) {
            throw new IllegalStateException("Token lifetimes must be positive");
        }
        this.codec          = codec;
        this.userRepository = userRepository;
        this.clock          = clock;
        this.accessTtl      = accessTtl;
        this.refreshTtl     = refreshTtl;
    }

    /**
     * Mint a new pair and make its refresh token the only valid one for the user.
     *
     * Called after password verification and at registration.
     *
     * @throws NoSuchElementException if the user does not exist
     */
    @Transactional
    public TokenPair issuePair(Long userId) {
        Instant now = now();
        String refresh = mint(userId, TokenKind.REFRESH, now, refreshTtl);

        if (userRepository.storeRefreshToken(userId, refresh) == 0) {
            throw new NoSuchElementException("User not found: " + userId);
        }
        log.info("Issued token pair - userId={}", userId);

        return new TokenPair(
                mint(userId, TokenKind.ACCESS, now, accessTtl),
                refresh,
                now.plus(accessTtl),
                now.plus(refreshTtl));
    }

    /**
     * Check an access token and return its subject.
     *
     * Stateless: signature, expiry and kind only.
     *
     * @throws UnauthorizedException on any failure
     */
    public Long verifyAccess(String accessToken) {
        return decodeExpecting(accessToken, TokenKind.ACCESS).subjectId();
    }

    /**
     * Exchange the current refresh token for a new pair.
     *
     * The swap is a single conditional UPDATE (see UserRepository#replaceRefreshToken),
     * so when two requests race with the same token exactly one wins and the
     * other observes zero updated rows.
     *
     * @throws UnauthorizedException if the token is invalid, not a refresh token,
     *                               or no longer the stored one
     */
    @Transactional
    public TokenPair refresh(String refreshToken) {
        TokenClaims claims = decodeExpecting(refreshToken, TokenKind.REFRESH);
        Long userId = claims.subjectId();

        Instant now = now();
        String nextRefresh = mint(userId, TokenKind.REFRESH, now, refreshTtl);

        int updated = userRepository.replaceRefreshToken(userId, refreshToken, nextRefresh);
        if (updated == 0) {
            log.warn("✗ Refresh rejected - token is not the current one (rotated, revoked or unknown user) - userId={}",
                    userId);
            throw new UnauthorizedException(UNAUTHORIZED_MESSAGE);
        }
        log.info("✓ Refresh token rotated - userId={}", userId);

        return new TokenPair(
                mint(userId, TokenKind.ACCESS, now, accessTtl),
                nextRefresh,
                now.plus(accessTtl),
                now.plus(refreshTtl));
    }

    /**
     * End the user's session. Idempotent.
     *
     * @throws NoSuchElementException if the user does not exist
     */
    @Transactional
    public void revoke(Long userId) {
        if (userRepository.clearRefreshToken(userId) == 0) {
            throw new NoSuchElementException("User not found: " + userId);
        }
        log.info("Refresh token revoked - userId={}", userId);
    }

    private TokenClaims decodeExpecting(String token, TokenKind expected) {
        TokenClaims claims;
        try {
            claims = codec.decode(token);
        } catch (TokenException e) {
            log.warn("✗ {} token rejected - reason={}, detail={}", expected, e.getReason(), e.getMessage());
            throw new UnauthorizedException(UNAUTHORIZED_MESSAGE);
        }
        if (claims.kind() != expected) {
            log.warn("✗ Token rejected - expected kind {} but got {} - userId={}",
                    expected, claims.kind(), claims.subjectId());
            throw new UnauthorizedException(UNAUTHORIZED_MESSAGE);
        }
        return claims;
    }

    private String mint(Long userId, TokenKind kind, Instant issuedAt, Duration ttl) {
        return codec.encode(new TokenClaims(
                userId,
                kind,
                issuedAt,
                issuedAt.plus(ttl),
                UUID.randomUUID().toString()));
    }

    // JWT timestamps have second precision
    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.SECONDS);
    }
}
