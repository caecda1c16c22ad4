package com.loyaltycard.api.dto;

import com.loyaltycard.common.FieldUpdate;
import com.loyaltycard.customers.CustomerUpdate;
import jakarta.validation.constraints.Email;

import java.util.HashSet;
import java.util.Set;

/**
 * DTO for a partial customer update.
 *
 * A property sent as {@code null} clears the field; an omitted property is left unchanged.
 */
public class UpdateCustomerRequest {

    private String name;

    @Email(message = "Email must be a valid address")
    private String email;

    private String phone;

    private final Set<String> suppliedFields = new HashSet<>();

    public void setName(String name) {
        this.name = name;
        suppliedFields.add("name");
    }

    public void setEmail(String email) {
        this.email = email;
        suppliedFields.add("email");
    }

    public void setPhone(String phone) {
        this.phone = phone;
        suppliedFields.add("phone");
    }

    public CustomerUpdate toUpdate() {
        CustomerUpdate.CustomerUpdateBuilder update = CustomerUpdate.builder();
        if (suppliedFields.contains("name")) {
            update.name(FieldUpdate.of(name));
        }
        if (suppliedFields.contains("email")) {
            update.email(FieldUpdate.of(email));
        }
        if (suppliedFields.contains("phone")) {
            update.phone(FieldUpdate.of(phone));
        }
        return update.build();
    }
}
