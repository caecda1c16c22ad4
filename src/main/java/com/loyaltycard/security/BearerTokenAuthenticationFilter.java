package com.loyaltycard.security;

import com.loyaltycard.common.exception.LoyaltyCardException;
import com.loyaltycard.vendors.Vendor;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Collections;

/**
 * Filter for bearer token authentication.
 * Resolves the acting vendor and stores it as the authentication principal.
 *
 * Requests without an Authorization header pass through unauthenticated and
 * are rejected by the security entry point if the path is protected.
 */
@Slf4j
@RequiredArgsConstructor
public class BearerTokenAuthenticationFilter extends OncePerRequestFilter {

    private final IdentityResolver identityResolver;
    private final JsonErrorWriter errorWriter;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authHeader == null) {
            filterChain.doFilter(request, response);
            return;
        }

        Vendor vendor;
        try {
            vendor = identityResolver.resolve(authHeader);
        } catch (LoyaltyCardException e) {
            log.warn("Rejected {} {}: {}", request.getMethod(), request.getRequestURI(), e.getMessage());
            errorWriter.write(response, e.getKind(), e.getMessage());
            return;
        }

        UsernamePasswordAuthenticationToken authentication =
            new UsernamePasswordAuthenticationToken(vendor, null, Collections.emptyList());
        SecurityContext context = SecurityContextHolder.createEmptyContext();
        context.setAuthentication(authentication);
        SecurityContextHolder.setContext(context);

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return PublicEndpoints.matches(request.getMethod(), path);
    }
}
