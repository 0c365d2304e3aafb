package com.example.itemlifecycle.http;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DeleteItemResponse(
        @JsonProperty("message") String message
) {
    static final DeleteItemResponse DELETED = new DeleteItemResponse("Item deleted successfully");
}
