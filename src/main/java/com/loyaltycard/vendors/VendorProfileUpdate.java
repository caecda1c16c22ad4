package com.loyaltycard.vendors;

import com.loyaltycard.common.FieldUpdate;
import lombok.Builder;
import lombok.Value;

/**
 * The mutable subset of a vendor profile. Email and password are not updatable.
 */
@Value
@Builder
public class VendorProfileUpdate {

    @Builder.Default
    FieldUpdate<String> name = FieldUpdate.absent();

    @Builder.Default
    FieldUpdate<String> businessName = FieldUpdate.absent();

    public static VendorProfileUpdate empty() {
        return VendorProfileUpdate.builder().build();
    }

    public boolean isEmpty() {
        return !name.isPresent() && !businessName.isPresent();
    }
}
