package com.loyaltycard.cards;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for loyalty card persistence.
 *
 * Punch and redeem are single conditional UPDATE statements, so concurrent
 * requests can neither lose an increment nor punch a redeemed card.
 */
@Repository
public interface LoyaltyCardRepository extends JpaRepository<LoyaltyCard, String> {

    Optional<LoyaltyCard> findByCardId(String cardId);

    boolean existsByVendorIdAndCustomerId(String vendorId, String customerId);

    List<LoyaltyCard> findByVendorIdOrderByCreatedAtDesc(String vendorId);

    /**
     * Adds one punch if the card is unclaimed and below its threshold.
     *
     * @return number of rows updated, 0 if the card was not punchable
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE LoyaltyCard c SET c.punches = c.punches + 1, c.updatedAt = :now "
        + "WHERE c.cardId = :cardId AND c.vendorId = :vendorId "
        + "AND c.rewardClaimed = false AND c.punches < c.rewardThreshold")
    int punch(@Param("cardId") String cardId, @Param("vendorId") String vendorId, @Param("now") Instant now);

    /**
     * Claims the reward if the card is unclaimed and has reached its threshold.
     *
     * @return number of rows updated, 0 if the card was not redeemable
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE LoyaltyCard c SET c.rewardClaimed = true, c.updatedAt = :now "
        + "WHERE c.cardId = :cardId AND c.vendorId = :vendorId "
        + "AND c.rewardClaimed = false AND c.punches >= c.rewardThreshold")
    int redeem(@Param("cardId") String cardId, @Param("vendorId") String vendorId, @Param("now") Instant now);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM LoyaltyCard c WHERE c.vendorId = :vendorId AND c.customerId = :customerId")
    int deleteByVendorIdAndCustomerId(@Param("vendorId") String vendorId, @Param("customerId") String customerId);
}
