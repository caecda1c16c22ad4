package com.loyaltycard.customers;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for customer persistence.
 */
@Repository
public interface CustomerRepository extends JpaRepository<Customer, String> {

    Optional<Customer> findByCustomerId(String customerId);

    List<Customer> findByVendorIdOrderByCreatedAtAsc(String vendorId);
}
