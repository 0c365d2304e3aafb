package com.example.itemlifecycle.service;

import java.time.Duration;
import lombok.Getter;

/**
 * Failure raised by the item lifecycle operations. The message is always safe to show to a client;
 * internal detail of a store failure travels only in the cause.
 */
public class ItemLifecycleException extends RuntimeException {

    public enum Code {
        VALIDATION_ERROR,
        NOT_FOUND,
        DELETION_NOT_ALLOWED,
        STORE_FAILURE
    }

    @Getter
    private final Code code;

    private ItemLifecycleException(Code code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public static ItemLifecycleException nameRequired() {
        return new ItemLifecycleException(Code.VALIDATION_ERROR, "Item name is required", null);
    }

    public static ItemLifecycleException itemNotFound() {
        return new ItemLifecycleException(Code.NOT_FOUND, "Item not found", null);
    }

    public static ItemLifecycleException deletionNotAllowed(Duration minimumAge) {
        return new ItemLifecycleException(Code.DELETION_NOT_ALLOWED,
                "Items can only be deleted after " + describe(minimumAge), null);
    }

    public static ItemLifecycleException storeFailure(String message, Throwable cause) {
        return new ItemLifecycleException(Code.STORE_FAILURE, message, cause);
    }

    private static String describe(Duration age) {
        long days = age.toDays();
        if (age.equals(Duration.ofDays(days))) {
            return days == 1 ? "1 day" : days + " days";
        }
        long hours = age.toHours();
        if (age.equals(Duration.ofHours(hours))) {
            return hours == 1 ? "1 hour" : hours + " hours";
        }
        return age.toString();
    }
}
