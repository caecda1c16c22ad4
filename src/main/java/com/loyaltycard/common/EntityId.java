package com.loyaltycard.common;

import com.loyaltycard.common.exception.InvalidInputException;

import java.util.UUID;

/**
 * Utility class for generating and parsing entity identifiers.
 * Identifiers travel as strings but must always be well-formed UUIDs.
 */
public final class EntityId {

    private EntityId() {
    }

    public static String generate() {
        return UUID.randomUUID().toString();
    }

    public static boolean isValid(String id) {
        if (id == null || id.trim().isEmpty()) {
            return false;
        }
        try {
            UUID.fromString(id.trim());
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * Normalizes an identifier received from a caller.
     *
     * @param id raw identifier
     * @param kind what the identifier names, used in the error message
     * @return canonical lower-case form
     * @throws InvalidInputException if the identifier is not a UUID
     */
    public static String parse(String id, String kind) {
        if (!isValid(id)) {
            throw new InvalidInputException("Invalid " + kind + " ID format: " + id);
        }
        return UUID.fromString(id.trim()).toString();
    }
}
