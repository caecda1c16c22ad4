package com.loyaltycard.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

/**
 * DTO for issuing a loyalty card.
 */
@Data
public class CreateLoyaltyCardRequest {

    @NotBlank(message = "Customer ID is required")
    private String customerId;

    @NotNull(message = "Reward threshold is required")
    @Positive(message = "Reward threshold must be positive")
    private Integer rewardThreshold;
}
