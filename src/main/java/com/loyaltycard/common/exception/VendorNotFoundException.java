package com.loyaltycard.common.exception;

/**
 * Thrown when a vendor is not found.
 */
public class VendorNotFoundException extends LoyaltyCardException {

    public VendorNotFoundException(String id) {
        super(ErrorKind.NOT_FOUND, "Vendor not found: " + id);
    }
}
