package com.loyaltycard.api.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * DTO for enrolling a customer.
 */
@Data
public class RegisterCustomerRequest {

    @NotBlank(message = "Name is required")
    private String name;

    @Email(message = "Email must be a valid address")
    private String email;

    private String phone;
}
