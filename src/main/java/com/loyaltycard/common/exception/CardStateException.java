package com.loyaltycard.common.exception;

/**
 * Thrown when a card is no longer in a state that allows the requested transition.
 */
public class CardStateException extends LoyaltyCardException {

    public CardStateException(String cardId, String currentState, String operation, String detail) {
        super(ErrorKind.CONFLICT, String.format("Cannot %s card %s in state %s: %s",
            operation, cardId, currentState, detail));
    }
}
