package com.loyaltycard.common.exception;

/**
 * Thrown when a vendor touches a resource owned by another vendor.
 */
public class ForbiddenAccessException extends LoyaltyCardException {

    public ForbiddenAccessException(String resource, String identifier) {
        super(ErrorKind.FORBIDDEN,
            String.format("Not authorized to access %s %s", resource, identifier));
    }

    public ForbiddenAccessException(String message) {
        super(ErrorKind.FORBIDDEN, message);
    }
}
