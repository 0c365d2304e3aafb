package com.example.itemlifecycle.requests;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.OptionalLong;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DeleteItemServiceRequestTest {

    @Test
    @DisplayName("Parses positive decimal ids")
    void parsesPositiveIds() {
        assertEquals(OptionalLong.of(1L), new DeleteItemServiceRequest("1").parsedId());
        assertEquals(OptionalLong.of(42L), new DeleteItemServiceRequest("0042").parsedId());
        assertEquals(OptionalLong.of(Long.MAX_VALUE),
                new DeleteItemServiceRequest(String.valueOf(Long.MAX_VALUE)).parsedId());
    }

    @Test
    @DisplayName("Anything else parses to empty")
    void rejectsOtherTokens() {
        for (String token : new String[] {null, "", "abc", "invalid-id", "0", "-3", "+3", " 3", "3.0", "1e3",
                "9223372036854775808"}) {
            assertTrue(new DeleteItemServiceRequest(token).parsedId().isEmpty(), String.valueOf(token));
        }
    }
}
