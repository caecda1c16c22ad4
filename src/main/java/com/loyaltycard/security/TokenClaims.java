package com.loyaltycard.security;

import lombok.Value;

import java.time.Instant;

/**
 * Identity proven by a validated bearer token.
 */
@Value
public class TokenClaims {
    String vendorId;
    String email;
    Instant expiresAt;
}
