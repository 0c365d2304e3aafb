package com.example.itemlifecycle.requests;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.example.itemlifecycle.service.ItemLifecycleException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CreateItemServiceRequestTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    @DisplayName("Accepts a non-blank string name")
    void acceptsName() throws Exception {
        CreateItemServiceRequest request = CreateItemServiceRequest.from(parse("{\"name\":\"Widget\"}"));

        assertEquals("Widget", request.name());
    }

    @Test
    @DisplayName("Rejects empty, blank, null, missing and non-string names")
    void rejectsInvalidNames() throws Exception {
        String[] bodies = {
                "{\"name\":\"\"}",
                "{\"name\":\"   \"}",
                "{\"name\":\"\\t\\n\"}",
                "{\"name\":null}",
                "{}",
                "{\"name\":42}",
                "{\"name\":true}",
                "{\"name\":[\"a\"]}",
                "{\"name\":{\"first\":\"a\"}}"
        };
        for (String body : bodies) {
            CreateItemHttpRequest http = parse(body);
            ItemLifecycleException ex = assertThrows(ItemLifecycleException.class,
                    () -> CreateItemServiceRequest.from(http), body);
            assertEquals(ItemLifecycleException.Code.VALIDATION_ERROR, ex.getCode(), body);
            assertEquals("Item name is required", ex.getMessage());
        }
    }

    @Test
    @DisplayName("Missing body is a missing name")
    void rejectsMissingBody() {
        assertThrows(ItemLifecycleException.class, () -> CreateItemServiceRequest.from(null));
    }

    @Test
    @DisplayName("Direct construction validates too")
    void constructorValidates() {
        assertThrows(ItemLifecycleException.class, () -> new CreateItemServiceRequest(null));
        assertThrows(ItemLifecycleException.class, () -> new CreateItemServiceRequest(" "));
    }

    private static CreateItemHttpRequest parse(String json) throws Exception {
        return MAPPER.readValue(json, CreateItemHttpRequest.class);
    }
}
