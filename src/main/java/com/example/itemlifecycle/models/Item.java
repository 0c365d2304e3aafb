package com.example.itemlifecycle.models;

import java.time.Duration;
import java.time.Instant;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * A named item held by the store. Items are never updated: the store assigns {@code id} and
 * {@code createdAt} on insert and the row is later either kept or deleted outright.
 */
@Builder(toBuilder = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE) // used by Lombok @Builder
@Getter
@EqualsAndHashCode
@ToString
public class Item {

    @NonNull
    private final Long id;

    @NonNull
    private final String name;

    @NonNull
    private final Instant createdAt;

    // ----- Domain helpers -----

    /**
     * Age of the item at {@code now}. Negative when {@code createdAt} lies after {@code now}.
     */
    public Duration ageAt(Instant now) {
        return Duration.between(createdAt, now);
    }

    public long createdAtMillis() {
        return createdAt.toEpochMilli();
    }
}
