package com.loyaltycard.api.dto;

import com.loyaltycard.cards.CardStatus;
import com.loyaltycard.cards.LoyaltyCard;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class LoyaltyCardResponse {
    private String cardId;
    private String vendorId;
    private String customerId;
    private int punches;
    private int rewardThreshold;
    private boolean rewardClaimed;
    private CardStatus status;
    private Instant createdAt;
    private Instant updatedAt;

    public static LoyaltyCardResponse from(LoyaltyCard card) {
        return LoyaltyCardResponse.builder()
            .cardId(card.getCardId())
            .vendorId(card.getVendorId())
            .customerId(card.getCustomerId())
            .punches(card.getPunches())
            .rewardThreshold(card.getRewardThreshold())
            .rewardClaimed(card.isRewardClaimed())
            .status(card.getStatus())
            .createdAt(card.getCreatedAt())
            .updatedAt(card.getUpdatedAt())
            .build();
    }
}
