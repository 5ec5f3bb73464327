package com.milkledger.exception;

/**
 * Authentication failed: bad credentials, or any token problem.
 *
 * The message is always client-safe. Callers log the specific cause
 * themselves before throwing.
 */
public class UnauthorizedException extends RuntimeException {

    public UnauthorizedException(String message) {
        super(message);
    }
}
