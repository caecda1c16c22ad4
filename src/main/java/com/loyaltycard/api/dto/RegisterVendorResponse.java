package com.loyaltycard.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class RegisterVendorResponse {
    private String message;
    private String vendorId;
}
