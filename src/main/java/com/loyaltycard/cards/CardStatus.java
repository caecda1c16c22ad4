package com.loyaltycard.cards;

/**
 * Lifecycle states of a loyalty card, derived from its punches and claim flag.
 */
public enum CardStatus {
    /**
     * Collecting punches; threshold not yet reached.
     */
    ACTIVE,

    /**
     * Threshold reached, reward not yet claimed. No further punches.
     */
    ELIGIBLE,

    /**
     * Reward claimed. Terminal.
     */
    REDEEMED
}
