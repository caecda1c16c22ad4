package com.loyaltycard.common.exception;

/**
 * Thrown when a reward is redeemed before the card reached its threshold.
 */
public class InsufficientPunchesException extends LoyaltyCardException {

    public InsufficientPunchesException(String cardId, int punches, int threshold) {
        super(ErrorKind.INSUFFICIENT_STATE, String.format(
            "Not enough punches to redeem reward on card %s: %d of %d", cardId, punches, threshold));
    }
}
