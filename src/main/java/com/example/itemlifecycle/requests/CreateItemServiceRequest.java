package com.example.itemlifecycle.requests;

import com.example.itemlifecycle.service.ItemLifecycleException;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Service-layer command for creating an item. Construction fails with a validation error unless
 * {@code name} is non-blank; the name itself is kept exactly as supplied.
 */
public record CreateItemServiceRequest(String name) {

    public CreateItemServiceRequest {
        if (name == null || name.trim().isEmpty()) {
            throw ItemLifecycleException.nameRequired();
        }
    }

    /**
     * Builds the command from the raw HTTP payload. A missing body, a missing or null field and any
     * non-string JSON value are all treated as an absent name.
     */
    public static CreateItemServiceRequest from(CreateItemHttpRequest request) {
        JsonNode raw = request == null ? null : request.name();
        return new CreateItemServiceRequest(raw != null && raw.isTextual() ? raw.textValue() : null);
    }
}
