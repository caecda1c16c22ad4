package com.loyaltycard.common.exception;

/**
 * Thrown when a customer is not found.
 */
public class CustomerNotFoundException extends LoyaltyCardException {

    public CustomerNotFoundException(String id) {
        super(ErrorKind.NOT_FOUND, "Customer not found: " + id);
    }
}
