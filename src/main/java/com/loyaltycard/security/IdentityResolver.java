package com.loyaltycard.security;

import com.loyaltycard.common.exception.AuthenticationFailedException;
import com.loyaltycard.common.exception.InvalidTokenException;
import com.loyaltycard.common.exception.VendorNotFoundException;
import com.loyaltycard.vendors.Vendor;
import com.loyaltycard.vendors.VendorService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Resolves the acting vendor from an {@code Authorization} header value.
 */
@Component
@RequiredArgsConstructor
public class IdentityResolver {

    static final String BEARER_PREFIX = "Bearer ";

    private final TokenService tokenService;
    private final VendorService vendorService;

    /**
     * @param authorizationHeader raw header value, e.g. {@code Bearer eyJ...}
     * @return the vendor the token was issued to
     * @throws AuthenticationFailedException if the header is missing or not a bearer credential
     * @throws InvalidTokenException if the token does not validate
     * @throws VendorNotFoundException if the token is valid but the vendor no longer exists
     */
    public Vendor resolve(String authorizationHeader) {
        if (authorizationHeader == null
                || !authorizationHeader.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            throw new AuthenticationFailedException("Not authenticated");
        }
        String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();

        TokenClaims claims = tokenService.validate(token);
        return vendorService.getVendor(claims.getVendorId());
    }
}
