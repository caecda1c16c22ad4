package com.loyaltycard.common.exception;

/**
 * Thrown when a customer's enrollment QR code cannot be written or removed.
 */
public class EnrollmentCodeException extends LoyaltyCardException {

    public EnrollmentCodeException(String message, Throwable cause) {
        super(ErrorKind.INTERNAL, message, cause);
    }
}
