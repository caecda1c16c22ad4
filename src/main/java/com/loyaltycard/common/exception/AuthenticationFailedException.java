package com.loyaltycard.common.exception;

/**
 * Thrown when a request carries no usable bearer credential.
 */
public class AuthenticationFailedException extends LoyaltyCardException {

    public AuthenticationFailedException(String message) {
        super(ErrorKind.UNAUTHENTICATED, message);
    }

    protected AuthenticationFailedException(String message, Throwable cause) {
        super(ErrorKind.UNAUTHENTICATED, message, cause);
    }
}
