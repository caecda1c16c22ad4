package com.loyaltycard.vendors;

import com.loyaltycard.common.FieldUpdate;
import com.loyaltycard.common.exception.DuplicateResourceException;
import com.loyaltycard.common.exception.InvalidCredentialsException;
import com.loyaltycard.common.exception.InvalidInputException;
import com.loyaltycard.common.exception.VendorNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;

/**
 * Service for vendor registration, login and profile management.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VendorService {

    private final VendorRepository vendorRepository;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    /**
     * Registers a new vendor.
     *
     * @return the new vendor's id
     * @throws DuplicateResourceException if the email is already registered
     */
    @Transactional
    public String registerVendor(String name, String email, String password, String businessName) {
        String normalizedEmail = normalizeEmail(email);
        if (vendorRepository.existsByEmail(normalizedEmail)) {
            throw new DuplicateResourceException("Email already registered");
        }

        Vendor vendor = new Vendor(name, normalizedEmail, passwordEncoder.encode(password),
            businessName, Instant.now(clock));
        try {
            vendorRepository.saveAndFlush(vendor);
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateResourceException("Email already registered", e);
        }

        log.info("Registered vendor {} for business {}", vendor.getVendorId(), businessName);
        return vendor.getVendorId();
    }

    /**
     * Checks a vendor's email and password.
     *
     * Unknown email and wrong password fail identically.
     */
    @Transactional(readOnly = true)
    public Vendor authenticateVendor(String email, String password) {
        Vendor vendor = vendorRepository.findByEmail(normalizeEmail(email))
            .orElseThrow(InvalidCredentialsException::new);
        if (password == null || !passwordEncoder.matches(password, vendor.getPasswordHash())) {
            throw new InvalidCredentialsException();
        }
        return vendor;
    }

    @Transactional(readOnly = true)
    public Vendor getVendor(String vendorId) {
        return vendorRepository.findByVendorId(vendorId)
            .orElseThrow(() -> new VendorNotFoundException(vendorId));
    }

    /**
     * Applies a partial profile update. An empty update leaves the vendor untouched.
     */
    @Transactional
    public Vendor updateVendor(Vendor actor, VendorProfileUpdate update) {
        Vendor vendor = getVendor(actor.getVendorId());
        if (update.isEmpty()) {
            return vendor;
        }

        requireNotBlank(update.getName(), "name");
        requireNotBlank(update.getBusinessName(), "business_name");

        vendor.applyUpdate(update, Instant.now(clock));
        vendorRepository.save(vendor);
        log.info("Updated profile of vendor {}", vendor.getVendorId());
        return vendor;
    }

    private static void requireNotBlank(FieldUpdate<String> field, String fieldName) {
        if (field.isPresent() && (field.getValue() == null || field.getValue().isBlank())) {
            throw new InvalidInputException(fieldName + " must not be blank");
        }
    }

    private static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }
}
