package com.loyaltycard.customers;

import com.loyaltycard.common.FieldUpdate;
import lombok.Builder;
import lombok.Value;

/**
 * Partial customer update. Email and phone may be cleared with a null value.
 */
@Value
@Builder
public class CustomerUpdate {

    @Builder.Default
    FieldUpdate<String> name = FieldUpdate.absent();

    @Builder.Default
    FieldUpdate<String> email = FieldUpdate.absent();

    @Builder.Default
    FieldUpdate<String> phone = FieldUpdate.absent();

    public boolean isEmpty() {
        return !name.isPresent() && !email.isPresent() && !phone.isPresent();
    }
}
