package com.loyaltycard.security;

import com.loyaltycard.common.exception.AuthenticationFailedException;
import com.loyaltycard.common.exception.ErrorKind;
import com.loyaltycard.common.exception.InvalidTokenException;
import com.loyaltycard.common.exception.VendorNotFoundException;
import com.loyaltycard.vendors.Vendor;
import com.loyaltycard.vendors.VendorService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IdentityResolverTest {

    @Mock
    private TokenService tokenService;

    @Mock
    private VendorService vendorService;

    private IdentityResolver resolver;

    private Vendor vendor;

    @BeforeEach
    void setUp() {
        resolver = new IdentityResolver(tokenService, vendorService);
        vendor = new Vendor("Jane", "jane@cafe.com", "hash", "Jane's Cafe", Instant.now());
    }

    @Test
    void testResolvesVendorFromBearerToken() {
        when(tokenService.validate("abc.def.ghi"))
            .thenReturn(new TokenClaims(vendor.getVendorId(), vendor.getEmail(), Instant.now()));
        when(vendorService.getVendor(vendor.getVendorId())).thenReturn(vendor);

        assertSame(vendor, resolver.resolve("Bearer abc.def.ghi"));
    }

    @Test
    void testSchemeIsCaseInsensitive() {
        when(tokenService.validate("abc.def.ghi"))
            .thenReturn(new TokenClaims(vendor.getVendorId(), vendor.getEmail(), Instant.now()));
        when(vendorService.getVendor(vendor.getVendorId())).thenReturn(vendor);

        assertSame(vendor, resolver.resolve("bearer abc.def.ghi"));
    }

    @Test
    void testMissingOrNonBearerHeaderIsUnauthenticated() {
        for (String header : new String[] {null, "", "Basic dXNlcjpwYXNz", "Token abc"}) {
            AuthenticationFailedException e = assertThrows(AuthenticationFailedException.class,
                () -> resolver.resolve(header));
            assertEquals(ErrorKind.UNAUTHENTICATED, e.getKind());
        }
        verifyNoInteractions(tokenService, vendorService);
    }

    @Test
    void testInvalidTokenNeverReachesVendorLookup() {
        when(tokenService.validate(anyString()))
            .thenThrow(new InvalidTokenException(InvalidTokenException.Reason.EXPIRED, "Token expired"));

        InvalidTokenException e = assertThrows(InvalidTokenException.class,
            () -> resolver.resolve("Bearer stale"));

        assertEquals(InvalidTokenException.Reason.EXPIRED, e.getReason());
        verifyNoInteractions(vendorService);
    }

    @Test
    void testValidTokenForDeletedVendorIsNotFound() {
        when(tokenService.validate("abc"))
            .thenReturn(new TokenClaims("gone", "gone@x.com", Instant.now()));
        when(vendorService.getVendor("gone")).thenThrow(new VendorNotFoundException("gone"));

        VendorNotFoundException e = assertThrows(VendorNotFoundException.class,
            () -> resolver.resolve("Bearer abc"));

        assertEquals(ErrorKind.NOT_FOUND, e.getKind());
    }
}
