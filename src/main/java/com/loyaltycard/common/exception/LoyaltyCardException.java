package com.loyaltycard.common.exception;

/**
 * Base exception for all loyalty card engine exceptions.
 */
public abstract class LoyaltyCardException extends RuntimeException {

    private final ErrorKind kind;

    protected LoyaltyCardException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected LoyaltyCardException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
