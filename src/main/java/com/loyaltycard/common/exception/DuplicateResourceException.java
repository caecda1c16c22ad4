package com.loyaltycard.common.exception;

/**
 * Thrown when attempting to create a resource that already exists.
 */
public class DuplicateResourceException extends LoyaltyCardException {

    public DuplicateResourceException(String message) {
        super(ErrorKind.CONFLICT, message);
    }

    public DuplicateResourceException(String message, Throwable cause) {
        super(ErrorKind.CONFLICT, message, cause);
    }
}
