package com.loyaltycard.api.dto;

import com.loyaltycard.customers.Customer;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class CustomerResponse {
    private String customerId;
    private String vendorId;
    private String name;
    private String email;
    private String phone;
    private String qrCode;
    private String qrPayload;
    private Instant createdAt;

    public static CustomerResponse from(Customer customer) {
        return CustomerResponse.builder()
            .customerId(customer.getCustomerId())
            .vendorId(customer.getVendorId())
            .name(customer.getName())
            .email(customer.getEmail())
            .phone(customer.getPhone())
            .qrCode(customer.getQrCode())
            .qrPayload(customer.getQrPayload())
            .createdAt(customer.getCreatedAt())
            .build();
    }
}
