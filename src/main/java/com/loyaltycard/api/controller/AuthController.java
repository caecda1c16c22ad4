package com.loyaltycard.api.controller;

import com.loyaltycard.api.dto.LoginRequest;
import com.loyaltycard.api.dto.RegisterVendorRequest;
import com.loyaltycard.api.dto.RegisterVendorResponse;
import com.loyaltycard.api.dto.TokenResponse;
import com.loyaltycard.api.dto.UpdateVendorRequest;
import com.loyaltycard.api.dto.VendorProfileResponse;
import com.loyaltycard.security.TokenService;
import com.loyaltycard.vendors.Vendor;
import com.loyaltycard.vendors.VendorService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for vendor registration, login and profile.
 */
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
@Tag(name = "Auth", description = "Vendor accounts and bearer tokens")
public class AuthController {

    private final VendorService vendorService;
    private final TokenService tokenService;

    @PostMapping("/register")
    @Operation(summary = "Register a new vendor")
    public ResponseEntity<RegisterVendorResponse> register(@Valid @RequestBody RegisterVendorRequest request) {
        String vendorId = vendorService.registerVendor(
            request.getName(),
            request.getEmail(),
            request.getPassword(),
            request.getBusinessName()
        );
        return ResponseEntity.ok(new RegisterVendorResponse("Vendor registered successfully", vendorId));
    }

    @PostMapping("/login")
    @Operation(summary = "Exchange email and password for a bearer token")
    public ResponseEntity<TokenResponse> login(@Valid @RequestBody LoginRequest request) {
        Vendor vendor = vendorService.authenticateVendor(request.getEmail(), request.getPassword());
        String token = tokenService.issue(vendor.getVendorId(), vendor.getEmail());
        return ResponseEntity.ok(TokenResponse.bearer(token));
    }

    @GetMapping("/me")
    @Operation(summary = "Get the authenticated vendor's profile")
    public ResponseEntity<VendorProfileResponse> me(@AuthenticationPrincipal Vendor vendor) {
        return ResponseEntity.ok(VendorProfileResponse.from(vendor));
    }

    @PutMapping("/me")
    @Operation(summary = "Update name and/or business name")
    public ResponseEntity<VendorProfileResponse> updateMe(@AuthenticationPrincipal Vendor vendor,
                                                          @RequestBody UpdateVendorRequest request) {
        Vendor updated = vendorService.updateVendor(vendor, request.toUpdate());
        return ResponseEntity.ok(VendorProfileResponse.from(updated));
    }
}
