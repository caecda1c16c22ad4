package com.loyaltycard.cards;

import com.loyaltycard.common.EntityId;
import com.loyaltycard.common.TenantOwned;
import com.loyaltycard.common.exception.CardStateException;
import com.loyaltycard.common.exception.InsufficientPunchesException;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Loyalty card entity: a vendor's punch card for one of its customers.
 *
 * Punches only grow, never past the reward threshold, and only while the
 * reward is unclaimed. Claiming the reward is terminal. Mutations go through
 * the conditional updates in {@link LoyaltyCardRepository}; the checks here
 * decide which error a caller sees.
 */
@Entity
@Table(name = "loyalty_cards",
    uniqueConstraints = {
        @UniqueConstraint(name = LoyaltyCard.VENDOR_CUSTOMER_CONSTRAINT, columnNames = {"vendor_id", "customer_id"})
    },
    indexes = {
        @Index(name = "idx_loyalty_cards_vendor_created", columnList = "vendor_id, created_at")
    })
@Data
@NoArgsConstructor
public class LoyaltyCard implements TenantOwned {

    public static final String VENDOR_CUSTOMER_CONSTRAINT = "uk_loyalty_cards_vendor_customer";

    @Id
    private String cardId;

    @Column(name = "vendor_id", nullable = false, updatable = false)
    private String vendorId;

    @Column(name = "customer_id", nullable = false, updatable = false)
    private String customerId;

    @Column(nullable = false)
    private int punches;

    @Column(name = "reward_threshold", nullable = false, updatable = false)
    private int rewardThreshold;

    @Column(name = "reward_claimed", nullable = false)
    private boolean rewardClaimed;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public LoyaltyCard(String vendorId, String customerId, int rewardThreshold, Instant now) {
        if (rewardThreshold <= 0) {
            throw new IllegalArgumentException("Reward threshold must be positive");
        }
        this.cardId = EntityId.generate();
        this.vendorId = vendorId;
        this.customerId = customerId;
        this.punches = 0;
        this.rewardThreshold = rewardThreshold;
        this.rewardClaimed = false;
        this.createdAt = now;
        this.updatedAt = now;
    }

    public CardStatus getStatus() {
        if (rewardClaimed) {
            return CardStatus.REDEEMED;
        }
        return punches >= rewardThreshold ? CardStatus.ELIGIBLE : CardStatus.ACTIVE;
    }

    public void ensurePunchable() {
        switch (getStatus()) {
            case REDEEMED -> throw new CardStateException(cardId, CardStatus.REDEEMED.name(), "punch",
                "reward already claimed, cannot add more punches");
            case ELIGIBLE -> throw new CardStateException(cardId, CardStatus.ELIGIBLE.name(), "punch",
                "reward threshold reached, redeem the reward first");
            default -> {
            }
        }
    }

    public void ensureRedeemable() {
        switch (getStatus()) {
            case REDEEMED -> throw new CardStateException(cardId, CardStatus.REDEEMED.name(), "redeem",
                "reward already claimed for this card");
            case ACTIVE -> throw new InsufficientPunchesException(cardId, punches, rewardThreshold);
            default -> {
            }
        }
    }
}
