package com.loyaltycard.api.dto;

import com.loyaltycard.common.FieldUpdate;
import com.loyaltycard.vendors.VendorProfileUpdate;

import java.util.HashSet;
import java.util.Set;

/**
 * DTO for a partial vendor profile update.
 *
 * Only properties present in the JSON body are applied; unknown properties
 * such as {@code email} are ignored.
 */
public class UpdateVendorRequest {

    private String name;
    private String businessName;
    private final Set<String> suppliedFields = new HashSet<>();

    public void setName(String name) {
        this.name = name;
        suppliedFields.add("name");
    }

    public void setBusinessName(String businessName) {
        this.businessName = businessName;
        suppliedFields.add("businessName");
    }

    public VendorProfileUpdate toUpdate() {
        VendorProfileUpdate.VendorProfileUpdateBuilder update = VendorProfileUpdate.builder();
        if (suppliedFields.contains("name")) {
            update.name(FieldUpdate.of(name));
        }
        if (suppliedFields.contains("businessName")) {
            update.businessName(FieldUpdate.of(businessName));
        }
        return update.build();
    }
}
