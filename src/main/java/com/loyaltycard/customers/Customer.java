package com.loyaltycard.customers;

import com.loyaltycard.common.TenantOwned;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Customer entity: an end user enrolled by exactly one vendor.
 */
@Entity
@Table(name = "customers", indexes = {
    @Index(name = "idx_customers_vendor_id", columnList = "vendor_id")
})
@Data
@NoArgsConstructor
public class Customer implements TenantOwned {

    @Id
    private String customerId;

    /**
     * Owning vendor. Never changes after enrollment.
     */
    @Column(name = "vendor_id", nullable = false, updatable = false)
    private String vendorId;

    @Column(nullable = false)
    private String name;

    private String email;

    private String phone;

    /**
     * Content encoded in the enrollment QR code.
     */
    @Column(name = "qr_payload")
    private String qrPayload;

    /**
     * Reference to the stored QR image.
     */
    @Column(name = "qr_code")
    private String qrCode;

    @Column(name = "created_at")
    private Instant createdAt;

    public Customer(String customerId, String vendorId, String name, String email, String phone,
                    String qrPayload, String qrCode, Instant createdAt) {
        this.customerId = customerId;
        this.vendorId = vendorId;
        this.name = name;
        this.email = email;
        this.phone = phone;
        this.qrPayload = qrPayload;
        this.qrCode = qrCode;
        this.createdAt = createdAt;
    }

    public static String enrollmentPayload(String customerId, String vendorId) {
        return customerId + ":" + vendorId;
    }

    public void applyUpdate(CustomerUpdate update) {
        update.getName().ifPresent(value -> this.name = value);
        update.getEmail().ifPresent(value -> this.email = value);
        update.getPhone().ifPresent(value -> this.phone = value);
    }
}
