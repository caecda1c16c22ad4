package com.loyaltycard.vendors;

import com.loyaltycard.common.EntityId;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Vendor entity: a merchant account and the root of tenant ownership.
 *
 * Customers and loyalty cards reference their vendor by id; a vendor only
 * ever operates on the resources carrying its own id.
 */
@Entity
@Table(name = "vendors", uniqueConstraints = {
    @UniqueConstraint(name = "uk_vendors_email", columnNames = "email")
})
@Data
@NoArgsConstructor
public class Vendor {

    @Id
    private String vendorId;

    @Column(nullable = false)
    private String email;

    /**
     * BCrypt hash. The plaintext password is never stored.
     */
    @Column(name = "password_hash", nullable = false)
    private String passwordHash;

    @Column(nullable = false)
    private String name;

    @Column(name = "business_name", nullable = false)
    private String businessName;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public Vendor(String name, String email, String passwordHash, String businessName, Instant now) {
        this.vendorId = EntityId.generate();
        this.name = name;
        this.email = email;
        this.passwordHash = passwordHash;
        this.businessName = businessName;
        this.createdAt = now;
        this.updatedAt = now;
    }

    /**
     * Applies the supplied profile fields.
     *
     * @return true if at least one field was applied
     */
    public boolean applyUpdate(VendorProfileUpdate update, Instant now) {
        if (update.isEmpty()) {
            return false;
        }
        update.getName().ifPresent(value -> this.name = value);
        update.getBusinessName().ifPresent(value -> this.businessName = value);
        this.updatedAt = now;
        return true;
    }
}
