package com.loyaltycard.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Bearer token returned by a successful login.
 */
@Data
@AllArgsConstructor
public class TokenResponse {
    private String accessToken;
    private String tokenType;

    public static TokenResponse bearer(String token) {
        return new TokenResponse(token, "bearer");
    }
}
