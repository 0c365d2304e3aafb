package com.example.itemlifecycle.requests;

import java.util.OptionalLong;
import java.util.regex.Pattern;

/**
 * Service-layer command for deleting an item. The id arrives as an opaque path token and may not
 * be a number at all.
 */
public record DeleteItemServiceRequest(String rawId) {

    private static final Pattern DIGITS = Pattern.compile("\\d+");

    /**
     * The id as a positive long, or empty when the token is not a positive decimal integer that
     * fits into a long.
     */
    public OptionalLong parsedId() {
        if (rawId == null || !DIGITS.matcher(rawId).matches()) {
            return OptionalLong.empty();
        }
        long id;
        try {
            id = Long.parseLong(rawId);
        } catch (NumberFormatException ex) {
            // Only reachable on overflow; such an id can never have been assigned.
            return OptionalLong.empty();
        }
        return id > 0 ? OptionalLong.of(id) : OptionalLong.empty();
    }
}
