package com.loyaltycard.common.exception;

/**
 * Thrown on a failed login. The message never reveals whether the email exists.
 */
public class InvalidCredentialsException extends LoyaltyCardException {

    public InvalidCredentialsException() {
        super(ErrorKind.UNAUTHENTICATED, "Invalid email or password");
    }
}
