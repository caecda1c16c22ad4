package com.loyaltycard.api.controller;

import com.loyaltycard.api.dto.CustomerResponse;
import com.loyaltycard.api.dto.RegisterCustomerRequest;
import com.loyaltycard.api.dto.UpdateCustomerRequest;
import com.loyaltycard.customers.Customer;
import com.loyaltycard.customers.CustomerService;
import com.loyaltycard.vendors.Vendor;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API for a vendor's customers.
 */
@RestController
@RequestMapping("/customer")
@RequiredArgsConstructor
@Tag(name = "Customers", description = "Customer enrollment and management")
public class CustomerController {

    private final CustomerService customerService;

    @PostMapping("/register")
    @Operation(summary = "Enroll a customer and generate its QR code")
    public ResponseEntity<CustomerResponse> register(@AuthenticationPrincipal Vendor vendor,
                                                     @Valid @RequestBody RegisterCustomerRequest request) {
        Customer customer = customerService.registerCustomer(
            vendor,
            request.getName(),
            request.getEmail(),
            request.getPhone()
        );
        return ResponseEntity.ok(CustomerResponse.from(customer));
    }

    @GetMapping("/all")
    @Operation(summary = "List the vendor's customers")
    public ResponseEntity<List<CustomerResponse>> list(@AuthenticationPrincipal Vendor vendor) {
        List<CustomerResponse> customers = customerService.listCustomers(vendor).stream()
            .map(CustomerResponse::from)
            .toList();
        return ResponseEntity.ok(customers);
    }

    @GetMapping("/{customerId}")
    @Operation(summary = "Get customer details")
    public ResponseEntity<CustomerResponse> get(@AuthenticationPrincipal Vendor vendor,
                                                @PathVariable String customerId) {
        return ResponseEntity.ok(CustomerResponse.from(customerService.getCustomer(vendor, customerId)));
    }

    @PutMapping("/{customerId}")
    @Operation(summary = "Update name, email and/or phone")
    public ResponseEntity<CustomerResponse> update(@AuthenticationPrincipal Vendor vendor,
                                                   @PathVariable String customerId,
                                                   @Valid @RequestBody UpdateCustomerRequest request) {
        Customer customer = customerService.updateCustomer(vendor, customerId, request.toUpdate());
        return ResponseEntity.ok(CustomerResponse.from(customer));
    }

    @DeleteMapping("/{customerId}")
    @Operation(summary = "Delete a customer, its loyalty cards and its QR code")
    public ResponseEntity<Map<String, String>> delete(@AuthenticationPrincipal Vendor vendor,
                                                      @PathVariable String customerId) {
        customerService.deleteCustomer(vendor, customerId);
        return ResponseEntity.ok(Map.of("message", "Customer " + customerId + " deleted successfully"));
    }
}
