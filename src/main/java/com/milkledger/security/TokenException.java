package com.milkledger.security;

/**
 * Raised by {@link TokenCodec#decode(String)}.
 *
 * The reason is for logs only. TokenLifecycleService collapses every reason
 * into the same UnauthorizedException before anything reaches a client.
 */
public class TokenException extends RuntimeException {

    public enum Reason {
        MALFORMED,
        SIGNATURE_INVALID,
        EXPIRED
    }

    private final Reason reason;

    public TokenException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public TokenException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
