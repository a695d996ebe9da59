package io.accounting.core;

import io.accounting.error.ValidationException;

/**
 * Rules for identifiers, meta keys/values, component and score names.
 */
public final class Names {
    public static final int MAX_LENGTH = 256;

    private Names() {}

    public static String requireValid(String what, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(what + " must not be empty or whitespace");
        }
        if (value.codePointCount(0, value.length()) > MAX_LENGTH) {
            throw new ValidationException(what + " is longer than " + MAX_LENGTH + " characters: " + value.substring(0, 32) + "...");
        }
        return value;
    }
}
