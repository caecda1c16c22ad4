package com.loyaltycard.security;

import java.util.List;

/**
 * Paths reachable without a bearer token.
 */
public final class PublicEndpoints {

    public static final String[] AUTH_PATHS = {"/auth/register", "/auth/login"};

    public static final String[] DOC_PATHS = {"/v3/api-docs/**", "/swagger-ui/**", "/swagger-ui.html", "/error"};

    private static final List<String> DOC_PREFIXES = List.of("/v3/api-docs", "/swagger-ui", "/error");

    private PublicEndpoints() {
    }

    static boolean matches(String method, String path) {
        if ("POST".equals(method) && List.of(AUTH_PATHS).contains(path)) {
            return true;
        }
        return DOC_PREFIXES.stream().anyMatch(path::startsWith);
    }
}
