package com.loyaltycard.common;

/**
 * A resource that belongs to exactly one vendor.
 */
public interface TenantOwned {

    String getVendorId();
}
