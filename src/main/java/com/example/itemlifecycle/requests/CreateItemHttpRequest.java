package com.example.itemlifecycle.requests;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * HTTP-layer payload captured from client POST /api/items requests. {@code name} is kept as a raw
 * JSON node so that numbers, booleans or objects are rejected instead of coerced into text.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreateItemHttpRequest(
        @JsonProperty("name") JsonNode name
) {}
