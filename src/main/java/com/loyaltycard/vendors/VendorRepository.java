package com.loyaltycard.vendors;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for vendor persistence.
 */
@Repository
public interface VendorRepository extends JpaRepository<Vendor, String> {

    Optional<Vendor> findByVendorId(String vendorId);

    Optional<Vendor> findByEmail(String email);

    boolean existsByEmail(String email);
}
