package com.loyaltycard.cards;

import com.loyaltycard.common.EntityId;
import com.loyaltycard.common.exception.CardStateException;
import com.loyaltycard.common.exception.DuplicateResourceException;
import com.loyaltycard.common.exception.ForbiddenAccessException;
import com.loyaltycard.common.exception.InvalidInputException;
import com.loyaltycard.common.exception.LoyaltyCardNotFoundException;
import com.loyaltycard.customers.Customer;
import com.loyaltycard.customers.CustomerService;
import com.loyaltycard.security.OwnershipPolicy;
import com.loyaltycard.vendors.Vendor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Service for the loyalty card lifecycle.
 *
 * State machine:
 * ACTIVE --punch--> ACTIVE | ELIGIBLE --redeem--> REDEEMED
 *
 * Each operation resolves the card (404), checks ownership (403) and the
 * current state before the conditional update is attempted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LoyaltyCardService {

    private static final String RESOURCE = "loyalty card";

    private final LoyaltyCardRepository loyaltyCardRepository;
    private final CustomerService customerService;
    private final OwnershipPolicy ownershipPolicy;
    private final Clock clock;

    /**
     * Issues a card for one of the vendor's customers.
     *
     * @throws DuplicateResourceException if the customer already has a card with this vendor
     */
    @Transactional
    public LoyaltyCard createCard(Vendor actor, String customerId, int rewardThreshold) {
        if (rewardThreshold <= 0) {
            throw new InvalidInputException("reward_threshold must be a positive integer");
        }
        Customer customer = customerService.getCustomer(actor, customerId);

        if (loyaltyCardRepository.existsByVendorIdAndCustomerId(actor.getVendorId(), customer.getCustomerId())) {
            throw new DuplicateResourceException("Card already exists for customer " + customer.getCustomerId());
        }

        LoyaltyCard card = new LoyaltyCard(actor.getVendorId(), customer.getCustomerId(),
            rewardThreshold, Instant.now(clock));
        try {
            loyaltyCardRepository.saveAndFlush(card);
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateResourceException("Card already exists for customer " + customer.getCustomerId(), e);
        }

        log.info("Created loyalty card {} for customer {} of vendor {} (threshold {})",
            card.getCardId(), customer.getCustomerId(), actor.getVendorId(), rewardThreshold);
        return card;
    }

    @Transactional(readOnly = true)
    public LoyaltyCard getCard(Vendor actor, String cardId) {
        String id = EntityId.parse(cardId, RESOURCE);
        LoyaltyCard card = findCard(id);
        ownershipPolicy.check(actor, card, RESOURCE, id);
        return card;
    }

    /**
     * Lists the vendor's cards, newest first.
     *
     * @param vendorFilter optional; when given it must be the caller's own vendor id
     */
    @Transactional(readOnly = true)
    public List<LoyaltyCard> listCards(Vendor actor, String vendorFilter) {
        if (vendorFilter != null && !vendorFilter.isBlank()) {
            String filter = EntityId.parse(vendorFilter, "vendor");
            if (!filter.equals(actor.getVendorId())) {
                throw new ForbiddenAccessException("Not authorized to view this vendor's cards");
            }
        }
        return loyaltyCardRepository.findByVendorIdOrderByCreatedAtDesc(actor.getVendorId());
    }

    /**
     * Records one visit. Never redeems; reaching the threshold makes the card ELIGIBLE.
     *
     * @throws CardStateException if the card is ELIGIBLE or REDEEMED
     */
    @Transactional
    public LoyaltyCard punch(Vendor actor, String cardId) {
        LoyaltyCard card = getCard(actor, cardId);
        card.ensurePunchable();

        int updated = loyaltyCardRepository.punch(card.getCardId(), actor.getVendorId(), Instant.now(clock));
        LoyaltyCard current = findCard(card.getCardId());
        if (updated == 0) {
            // another request changed the card between the read and the update
            current.ensurePunchable();
            throw concurrentChange(current, "punch");
        }

        log.info("Punched loyalty card {}: {}/{}", current.getCardId(),
            current.getPunches(), current.getRewardThreshold());
        return current;
    }

    /**
     * Claims the reward. A second redeem always fails.
     *
     * @throws CardStateException if the reward was already claimed
     * @throws com.loyaltycard.common.exception.InsufficientPunchesException if the threshold is not reached
     */
    @Transactional
    public LoyaltyCard redeem(Vendor actor, String cardId) {
        LoyaltyCard card = getCard(actor, cardId);
        card.ensureRedeemable();

        int updated = loyaltyCardRepository.redeem(card.getCardId(), actor.getVendorId(), Instant.now(clock));
        LoyaltyCard current = findCard(card.getCardId());
        if (updated == 0) {
            current.ensureRedeemable();
            throw concurrentChange(current, "redeem");
        }

        log.info("Redeemed reward on loyalty card {} for customer {}", current.getCardId(), current.getCustomerId());
        return current;
    }

    private LoyaltyCard findCard(String cardId) {
        return loyaltyCardRepository.findByCardId(cardId)
            .orElseThrow(() -> new LoyaltyCardNotFoundException(cardId));
    }

    private static CardStateException concurrentChange(LoyaltyCard card, String operation) {
        return new CardStateException(card.getCardId(), card.getStatus().name(), operation,
            "card was modified concurrently");
    }
}
