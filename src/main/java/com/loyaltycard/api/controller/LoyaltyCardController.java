package com.loyaltycard.api.controller;

import com.loyaltycard.api.dto.CreateLoyaltyCardRequest;
import com.loyaltycard.api.dto.LoyaltyCardResponse;
import com.loyaltycard.cards.LoyaltyCard;
import com.loyaltycard.cards.LoyaltyCardService;
import com.loyaltycard.vendors.Vendor;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for loyalty cards.
 */
@RestController
@RequestMapping("/loyaltyCard")
@RequiredArgsConstructor
@Tag(name = "Loyalty cards", description = "Card issuance, punches and redemption")
public class LoyaltyCardController {

    private final LoyaltyCardService loyaltyCardService;

    @PostMapping({"", "/"})
    @Operation(summary = "Issue a loyalty card for a customer")
    public ResponseEntity<LoyaltyCardResponse> create(@AuthenticationPrincipal Vendor vendor,
                                                      @Valid @RequestBody CreateLoyaltyCardRequest request) {
        LoyaltyCard card = loyaltyCardService.createCard(
            vendor,
            request.getCustomerId(),
            request.getRewardThreshold()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(LoyaltyCardResponse.from(card));
    }

    @GetMapping("/{cardId}")
    @Operation(summary = "Get loyalty card details")
    public ResponseEntity<LoyaltyCardResponse> get(@AuthenticationPrincipal Vendor vendor,
                                                   @PathVariable String cardId) {
        return ResponseEntity.ok(LoyaltyCardResponse.from(loyaltyCardService.getCard(vendor, cardId)));
    }

    @GetMapping({"", "/"})
    @Operation(summary = "List the vendor's loyalty cards, newest first")
    public ResponseEntity<List<LoyaltyCardResponse>> list(
            @AuthenticationPrincipal Vendor vendor,
            @RequestParam(name = "vendor_id", required = false) String vendorId) {
        List<LoyaltyCardResponse> cards = loyaltyCardService.listCards(vendor, vendorId).stream()
            .map(LoyaltyCardResponse::from)
            .toList();
        return ResponseEntity.ok(cards);
    }

    @PutMapping("/{cardId}/punch")
    @Operation(summary = "Add one punch to a card")
    public ResponseEntity<LoyaltyCardResponse> punch(@AuthenticationPrincipal Vendor vendor,
                                                     @PathVariable String cardId) {
        return ResponseEntity.ok(LoyaltyCardResponse.from(loyaltyCardService.punch(vendor, cardId)));
    }

    @PutMapping("/{cardId}/redeem")
    @Operation(summary = "Redeem the reward of a card that reached its threshold")
    public ResponseEntity<LoyaltyCardResponse> redeem(@AuthenticationPrincipal Vendor vendor,
                                                      @PathVariable String cardId) {
        return ResponseEntity.ok(LoyaltyCardResponse.from(loyaltyCardService.redeem(vendor, cardId)));
    }
}
