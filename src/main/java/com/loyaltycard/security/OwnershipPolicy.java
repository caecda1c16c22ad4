package com.loyaltycard.security;

import com.loyaltycard.common.TenantOwned;
import com.loyaltycard.common.exception.ForbiddenAccessException;
import com.loyaltycard.vendors.Vendor;
import org.springframework.stereotype.Component;

/**
 * The single tenant-isolation rule: a vendor may only act on resources carrying its own id.
 */
@Component
public class OwnershipPolicy {

    public boolean permits(Vendor actor, TenantOwned resource) {
        return actor != null
            && resource != null
            && actor.getVendorId() != null
            && actor.getVendorId().equals(resource.getVendorId());
    }

    /**
     * @throws ForbiddenAccessException if {@code actor} does not own {@code resource}
     */
    public void check(Vendor actor, TenantOwned resource, String resourceType, String resourceId) {
        if (!permits(actor, resource)) {
            throw new ForbiddenAccessException(resourceType, resourceId);
        }
    }
}
