package com.loyaltycard.common.exception;

/**
 * Thrown when a loyalty card is not found.
 */
public class LoyaltyCardNotFoundException extends LoyaltyCardException {

    public LoyaltyCardNotFoundException(String id) {
        super(ErrorKind.NOT_FOUND, "Loyalty card not found: " + id);
    }
}
