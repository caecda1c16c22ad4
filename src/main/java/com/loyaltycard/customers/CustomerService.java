package com.loyaltycard.customers;

import com.loyaltycard.cards.LoyaltyCardRepository;
import com.loyaltycard.common.EntityId;
import com.loyaltycard.common.exception.CustomerNotFoundException;
import com.loyaltycard.common.exception.EnrollmentCodeException;
import com.loyaltycard.common.exception.InvalidInputException;
import com.loyaltycard.enrollment.EnrollmentCodeStore;
import com.loyaltycard.security.OwnershipPolicy;
import com.loyaltycard.vendors.Vendor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Service for enrolling and managing a vendor's customers.
 *
 * Every lookup by id resolves the customer first (404) and then checks
 * ownership (403), so the two failures stay distinguishable.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CustomerService {

    private static final String RESOURCE = "customer";

    private final CustomerRepository customerRepository;
    private final LoyaltyCardRepository loyaltyCardRepository;
    private final EnrollmentCodeStore enrollmentCodeStore;
    private final OwnershipPolicy ownershipPolicy;
    private final Clock clock;

    /**
     * Enrolls a customer and stores its QR code.
     *
     * The QR code is written before the row is inserted, so a failed QR
     * generation leaves nothing behind. If the transaction does not commit,
     * the QR file is removed once it has rolled back.
     */
    @Transactional
    public Customer registerCustomer(Vendor actor, String name, String email, String phone) {
        String customerId = EntityId.generate();
        String payload = Customer.enrollmentPayload(customerId, actor.getVendorId());
        String qrReference = enrollmentCodeStore.store(customerId, payload);

        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                if (status != STATUS_COMMITTED) {
                    discardEnrollmentCode(customerId, qrReference);
                }
            }
        });

        Customer customer = new Customer(customerId, actor.getVendorId(), name, email, phone,
            payload, qrReference, Instant.now(clock));
        customerRepository.saveAndFlush(customer);

        log.info("Registered customer {} for vendor {}", customerId, actor.getVendorId());
        return customer;
    }

    @Transactional(readOnly = true)
    public Customer getCustomer(Vendor actor, String customerId) {
        String id = EntityId.parse(customerId, RESOURCE);
        Customer customer = customerRepository.findByCustomerId(id)
            .orElseThrow(() -> new CustomerNotFoundException(id));
        ownershipPolicy.check(actor, customer, RESOURCE, id);
        return customer;
    }

    @Transactional(readOnly = true)
    public List<Customer> listCustomers(Vendor actor) {
        return customerRepository.findByVendorIdOrderByCreatedAtAsc(actor.getVendorId());
    }

    /**
     * @throws InvalidInputException if no field was supplied or the name is cleared
     */
    @Transactional
    public Customer updateCustomer(Vendor actor, String customerId, CustomerUpdate update) {
        Customer customer = getCustomer(actor, customerId);

        if (update.isEmpty()) {
            throw new InvalidInputException("No fields to update");
        }
        if (update.getName().isPresent()
                && (update.getName().getValue() == null || update.getName().getValue().isBlank())) {
            throw new InvalidInputException("name must not be blank");
        }

        customer.applyUpdate(update);
        customerRepository.save(customer);
        log.info("Updated customer {} for vendor {}", customer.getCustomerId(), actor.getVendorId());
        return customer;
    }

    /**
     * Deletes a customer together with its loyalty cards. The QR code is
     * removed only after the deletion has committed.
     */
    @Transactional
    public void deleteCustomer(Vendor actor, String customerId) {
        Customer customer = getCustomer(actor, customerId);

        int cards = loyaltyCardRepository.deleteByVendorIdAndCustomerId(
            customer.getVendorId(), customer.getCustomerId());
        customerRepository.delete(customer);
        log.info("Deleted customer {} and {} loyalty card(s) for vendor {}",
            customer.getCustomerId(), cards, actor.getVendorId());

        String id = customer.getCustomerId();
        String qrReference = customer.getQrCode();
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                discardEnrollmentCode(id, qrReference);
            }
        });
    }

    private void discardEnrollmentCode(String customerId, String qrReference) {
        try {
            enrollmentCodeStore.remove(qrReference);
        } catch (EnrollmentCodeException e) {
            log.warn("Could not remove QR code {} of customer {}: {}", qrReference, customerId, e.getMessage());
        }
    }
}
