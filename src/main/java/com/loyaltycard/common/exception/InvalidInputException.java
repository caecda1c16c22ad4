package com.loyaltycard.common.exception;

/**
 * Thrown for malformed identifiers and unusable request payloads.
 */
public class InvalidInputException extends LoyaltyCardException {

    public InvalidInputException(String message) {
        super(ErrorKind.INVALID_INPUT, message);
    }
}
