package com.loyaltycard.common.exception;

/**
 * Thrown when a bearer token fails validation.
 */
public class InvalidTokenException extends AuthenticationFailedException {

    public enum Reason {
        EXPIRED,
        MALFORMED,
        MISSING_CLAIM
    }

    private final Reason reason;

    public InvalidTokenException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public InvalidTokenException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
