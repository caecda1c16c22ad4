package com.loyaltycard.api.dto;

import com.loyaltycard.vendors.Vendor;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Public view of a vendor. Never includes the password hash.
 */
@Data
@Builder
public class VendorProfileResponse {
    private String vendorId;
    private String name;
    private String email;
    private String businessName;
    private Instant createdAt;
    private Instant updatedAt;

    public static VendorProfileResponse from(Vendor vendor) {
        return VendorProfileResponse.builder()
            .vendorId(vendor.getVendorId())
            .name(vendor.getName())
            .email(vendor.getEmail())
            .businessName(vendor.getBusinessName())
            .createdAt(vendor.getCreatedAt())
            .updatedAt(vendor.getUpdatedAt())
            .build();
    }
}
