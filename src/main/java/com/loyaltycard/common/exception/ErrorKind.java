package com.loyaltycard.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Failure categories surfaced to API callers.
 */
public enum ErrorKind {

    /**
     * Missing, invalid or expired credentials.
     */
    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED),

    /**
     * Valid identity acting on another vendor's data.
     */
    FORBIDDEN(HttpStatus.FORBIDDEN),

    NOT_FOUND(HttpStatus.NOT_FOUND),

    /**
     * Malformed identifier or missing/empty payload.
     */
    INVALID_INPUT(HttpStatus.BAD_REQUEST),

    /**
     * Duplicate email, duplicate card or a card that already left the punchable state.
     */
    CONFLICT(HttpStatus.BAD_REQUEST),

    /**
     * Redeem attempted before the reward threshold was reached.
     */
    INSUFFICIENT_STATE(HttpStatus.BAD_REQUEST),

    INTERNAL(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus httpStatus;

    ErrorKind(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
