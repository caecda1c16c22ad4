package com.loyaltycard.customers;

import com.loyaltycard.cards.LoyaltyCardRepository;
import com.loyaltycard.common.FieldUpdate;
import com.loyaltycard.common.exception.CustomerNotFoundException;
import com.loyaltycard.common.exception.EnrollmentCodeException;
import com.loyaltycard.common.exception.ForbiddenAccessException;
import com.loyaltycard.common.exception.InvalidInputException;
import com.loyaltycard.enrollment.EnrollmentCodeStore;
import com.loyaltycard.security.OwnershipPolicy;
import com.loyaltycard.vendors.Vendor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionSynchronizationUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for customer enrollment and ownership checks.
 *
 * The repositories and the QR store are mocked so the ordering of the
 * enrollment steps can be verified. Transaction synchronization is driven
 * by hand to check what happens to QR files on commit and rollback.
 */
@ExtendWith(MockitoExtension.class)
class CustomerServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");
    private static final String QR_PATH = "/tmp/qrcodes/customer.png";

    @Mock
    private CustomerRepository customerRepository;

    @Mock
    private LoyaltyCardRepository loyaltyCardRepository;

    @Mock
    private EnrollmentCodeStore enrollmentCodeStore;

    private CustomerService customerService;

    private Vendor vendor;
    private Vendor otherVendor;

    @BeforeEach
    void setUp() {
        customerService = new CustomerService(
            customerRepository,
            loyaltyCardRepository,
            enrollmentCodeStore,
            new OwnershipPolicy(),
            Clock.fixed(NOW, ZoneOffset.UTC)
        );
        vendor = new Vendor("Alice", "alice@shop.com", "hash", "Alice's Shop", NOW);
        otherVendor = new Vendor("Bob", "bob@shop.com", "hash", "Bob's Shop", NOW);
        TransactionSynchronizationManager.initSynchronization();
    }

    @AfterEach
    void tearDown() {
        TransactionSynchronizationManager.clearSynchronization();
    }

    private void completeTransaction(int status) {
        List<TransactionSynchronization> synchronizations = TransactionSynchronizationManager.getSynchronizations();
        if (status == TransactionSynchronization.STATUS_COMMITTED) {
            TransactionSynchronizationUtils.invokeAfterCommit(synchronizations);
        }
        TransactionSynchronizationUtils.invokeAfterCompletion(synchronizations, status);
    }

    private Customer existingCustomer(Vendor owner) {
        String id = UUID.randomUUID().toString();
        return new Customer(id, owner.getVendorId(), "Carol", "carol@x.com", "+1234567890",
            Customer.enrollmentPayload(id, owner.getVendorId()), QR_PATH, NOW);
    }

    @Test
    void testRegisterStoresQrCodeBeforeSaving() {
        when(enrollmentCodeStore.store(anyString(), anyString())).thenReturn(QR_PATH);
        when(customerRepository.saveAndFlush(any(Customer.class))).thenAnswer(i -> i.getArgument(0));

        Customer customer = customerService.registerCustomer(vendor, "Carol", "carol@x.com", null);

        assertEquals(vendor.getVendorId(), customer.getVendorId());
        assertEquals(customer.getCustomerId() + ":" + vendor.getVendorId(), customer.getQrPayload());
        assertEquals(QR_PATH, customer.getQrCode());
        assertEquals(NOW, customer.getCreatedAt());
        assertNull(customer.getPhone());

        InOrder inOrder = inOrder(enrollmentCodeStore, customerRepository);
        inOrder.verify(enrollmentCodeStore).store(customer.getCustomerId(), customer.getQrPayload());
        inOrder.verify(customerRepository).saveAndFlush(customer);

        completeTransaction(TransactionSynchronization.STATUS_COMMITTED);
        verify(enrollmentCodeStore, never()).remove(anyString());
    }

    @Test
    void testQrFailureLeavesNoCustomerBehind() {
        when(enrollmentCodeStore.store(anyString(), anyString()))
            .thenThrow(new EnrollmentCodeException("disk full", null));

        assertThrows(EnrollmentCodeException.class,
            () -> customerService.registerCustomer(vendor, "Carol", null, null));

        verifyNoInteractions(customerRepository);
    }

    @Test
    void testFailedInsertRemovesQrCode() {
        when(enrollmentCodeStore.store(anyString(), anyString())).thenReturn(QR_PATH);
        when(customerRepository.saveAndFlush(any(Customer.class)))
            .thenThrow(new DataIntegrityViolationException("boom"));

        assertThrows(DataIntegrityViolationException.class,
            () -> customerService.registerCustomer(vendor, "Carol", null, null));
        completeTransaction(TransactionSynchronization.STATUS_ROLLED_BACK);

        verify(enrollmentCodeStore).remove(QR_PATH);
    }

    @Test
    void testRollbackAfterInsertRemovesQrCode() {
        when(enrollmentCodeStore.store(anyString(), anyString())).thenReturn(QR_PATH);
        when(customerRepository.saveAndFlush(any(Customer.class))).thenAnswer(i -> i.getArgument(0));

        customerService.registerCustomer(vendor, "Carol", null, null);
        verify(enrollmentCodeStore, never()).remove(anyString());

        // commit failed after the row was flushed
        completeTransaction(TransactionSynchronization.STATUS_ROLLED_BACK);

        verify(enrollmentCodeStore).remove(QR_PATH);
    }

    @Test
    void testGetCustomerChecksExistenceThenOwnership() {
        Customer customer = existingCustomer(vendor);
        when(customerRepository.findByCustomerId(customer.getCustomerId())).thenReturn(Optional.of(customer));

        assertSame(customer, customerService.getCustomer(vendor, customer.getCustomerId()));
        assertThrows(ForbiddenAccessException.class,
            () -> customerService.getCustomer(otherVendor, customer.getCustomerId()));

        String missing = UUID.randomUUID().toString();
        when(customerRepository.findByCustomerId(missing)).thenReturn(Optional.empty());
        assertThrows(CustomerNotFoundException.class, () -> customerService.getCustomer(vendor, missing));
    }

    @Test
    void testMalformedIdIsInvalidInput() {
        assertThrows(InvalidInputException.class, () -> customerService.getCustomer(vendor, "not-an-id"));
        verifyNoInteractions(customerRepository);
    }

    @Test
    void testEmptyUpdateIsRejected() {
        Customer customer = existingCustomer(vendor);
        when(customerRepository.findByCustomerId(customer.getCustomerId())).thenReturn(Optional.of(customer));

        assertThrows(InvalidInputException.class, () -> customerService.updateCustomer(
            vendor, customer.getCustomerId(), CustomerUpdate.builder().build()));

        verify(customerRepository, never()).save(any());
    }

    @Test
    void testUpdateCanClearOptionalFields() {
        Customer customer = existingCustomer(vendor);
        when(customerRepository.findByCustomerId(customer.getCustomerId())).thenReturn(Optional.of(customer));

        Customer updated = customerService.updateCustomer(vendor, customer.getCustomerId(),
            CustomerUpdate.builder()
                .email(FieldUpdate.of(null))
                .phone(FieldUpdate.of("+1999"))
                .build());

        assertNull(updated.getEmail());
        assertEquals("+1999", updated.getPhone());
        assertEquals("Carol", updated.getName());
        verify(customerRepository).save(customer);
    }

    @Test
    void testNameCannotBeCleared() {
        Customer customer = existingCustomer(vendor);
        when(customerRepository.findByCustomerId(customer.getCustomerId())).thenReturn(Optional.of(customer));

        assertThrows(InvalidInputException.class, () -> customerService.updateCustomer(
            vendor, customer.getCustomerId(), CustomerUpdate.builder().name(FieldUpdate.of(null)).build()));
    }

    @Test
    void testUpdateByOtherVendorIsForbidden() {
        Customer customer = existingCustomer(vendor);
        when(customerRepository.findByCustomerId(customer.getCustomerId())).thenReturn(Optional.of(customer));

        assertThrows(ForbiddenAccessException.class, () -> customerService.updateCustomer(
            otherVendor, customer.getCustomerId(), CustomerUpdate.builder().name(FieldUpdate.of("Eve")).build()));

        assertEquals("Carol", customer.getName());
        verify(customerRepository, never()).save(any());
    }

    @Test
    void testDeleteCascadesToCardsAndRemovesQrCode() {
        Customer customer = existingCustomer(vendor);
        when(customerRepository.findByCustomerId(customer.getCustomerId())).thenReturn(Optional.of(customer));
        when(loyaltyCardRepository.deleteByVendorIdAndCustomerId(vendor.getVendorId(), customer.getCustomerId()))
            .thenReturn(1);

        customerService.deleteCustomer(vendor, customer.getCustomerId());

        verify(loyaltyCardRepository).deleteByVendorIdAndCustomerId(vendor.getVendorId(), customer.getCustomerId());
        verify(customerRepository).delete(customer);
        verify(enrollmentCodeStore, never()).remove(anyString());

        completeTransaction(TransactionSynchronization.STATUS_COMMITTED);
        verify(enrollmentCodeStore).remove(QR_PATH);
    }

    @Test
    void testRolledBackDeleteKeepsQrCode() {
        Customer customer = existingCustomer(vendor);
        when(customerRepository.findByCustomerId(customer.getCustomerId())).thenReturn(Optional.of(customer));

        customerService.deleteCustomer(vendor, customer.getCustomerId());
        completeTransaction(TransactionSynchronization.STATUS_ROLLED_BACK);

        verifyNoInteractions(enrollmentCodeStore);
    }

    @Test
    void testQrRemovalFailureDoesNotBlockDeletion() {
        Customer customer = existingCustomer(vendor);
        when(customerRepository.findByCustomerId(customer.getCustomerId())).thenReturn(Optional.of(customer));
        doThrow(new EnrollmentCodeException("permission denied", null)).when(enrollmentCodeStore).remove(QR_PATH);

        assertDoesNotThrow(() -> customerService.deleteCustomer(vendor, customer.getCustomerId()));
        assertDoesNotThrow(() -> completeTransaction(TransactionSynchronization.STATUS_COMMITTED));

        verify(customerRepository).delete(customer);
        verify(enrollmentCodeStore).remove(QR_PATH);
    }

    @Test
    void testDeleteByOtherVendorIsForbidden() {
        Customer customer = existingCustomer(vendor);
        when(customerRepository.findByCustomerId(customer.getCustomerId())).thenReturn(Optional.of(customer));

        assertThrows(ForbiddenAccessException.class,
            () -> customerService.deleteCustomer(otherVendor, customer.getCustomerId()));

        verify(customerRepository, never()).delete(any());
        verify(loyaltyCardRepository, never()).deleteByVendorIdAndCustomerId(anyString(), eq(customer.getCustomerId()));
        verifyNoInteractions(enrollmentCodeStore);
    }
}
