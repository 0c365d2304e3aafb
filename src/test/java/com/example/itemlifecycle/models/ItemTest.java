package com.example.itemlifecycle.models;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ItemTest {

    private static final Instant CREATED = Instant.parse("2024-09-01T10:15:30Z");

    @Test
    @DisplayName("Builder requires id, name and createdAt")
    void builderRequiresFields() {
        assertThrows(NullPointerException.class,
                () -> Item.builder().name("x").createdAt(CREATED).build());
        assertThrows(NullPointerException.class,
                () -> Item.builder().id(1L).createdAt(CREATED).build());
        assertThrows(NullPointerException.class,
                () -> Item.builder().id(1L).name("x").build());
    }

    @Test
    @DisplayName("ageAt measures time since creation")
    void ageAt() {
        Item item = Item.builder().id(1L).name("Widget").createdAt(CREATED).build();

        assertEquals(Duration.ofDays(6), item.ageAt(CREATED.plus(Duration.ofDays(6))));
        assertTrue(item.ageAt(CREATED.minusSeconds(1)).isNegative());
        assertEquals(CREATED.toEpochMilli(), item.createdAtMillis());
    }

    @Test
    @DisplayName("Items with equal fields are equal")
    void valueEquality() {
        Item a = Item.builder().id(5L).name("Widget").createdAt(CREATED).build();

        assertEquals(a, a.toBuilder().build());
    }
}
