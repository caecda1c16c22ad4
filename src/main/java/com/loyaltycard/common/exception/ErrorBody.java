package com.loyaltycard.common.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the JSON error body shared by the exception handler and the authentication filter.
 */
public final class ErrorBody {

    private ErrorBody() {
    }

    public static Map<String, String> of(ErrorKind kind, String message) {
        Map<String, String> error = new LinkedHashMap<>();
        error.put("error", message);
        error.put("kind", kind.name());
        error.put("status", String.valueOf(kind.getHttpStatus().value()));
        return error;
    }
}
