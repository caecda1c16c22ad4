package com.loyaltycard.enrollment;

import com.loyaltycard.common.exception.EnrollmentCodeException;

/**
 * Storage for the scannable codes handed to enrolled customers.
 */
public interface EnrollmentCodeStore {

    /**
     * Renders {@code payload} and stores it for the given customer.
     *
     * @return reference to the stored artifact, kept on the customer record
     * @throws EnrollmentCodeException if the code cannot be rendered or written
     */
    String store(String customerId, String payload);

    /**
     * Removes a stored artifact. Unknown references are ignored.
     *
     * @throws EnrollmentCodeException if the artifact exists but cannot be removed
     */
    void remove(String reference);
}
