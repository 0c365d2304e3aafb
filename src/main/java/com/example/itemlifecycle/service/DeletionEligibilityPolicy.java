package com.example.itemlifecycle.service;

import com.example.itemlifecycle.config.ItemLifecycleProperties;
import com.example.itemlifecycle.models.Item;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Age gate for deletions: an item may be deleted once it is at least the configured minimum age
 * old (five days unless overridden by {@code items.deletion.min-age}).
 */
@Component
public class DeletionEligibilityPolicy {

    private final Duration minimumAge;
    private final Clock clock;

    @Autowired
    public DeletionEligibilityPolicy(ItemLifecycleProperties properties, Clock clock) {
        this(properties.getDeletion().getMinAge(), clock);
    }

    DeletionEligibilityPolicy(Duration minimumAge, Clock clock) {
        Objects.requireNonNull(minimumAge, "minimumAge");
        if (minimumAge.isNegative()) {
            throw new IllegalArgumentException("minimumAge must be >= 0");
        }
        this.minimumAge = minimumAge;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public boolean isEligible(Item item) {
        Objects.requireNonNull(item, "item");
        return item.ageAt(Instant.now(clock)).compareTo(minimumAge) >= 0;
    }

    public Instant eligibleAt(Item item) {
        return item.getCreatedAt().plus(minimumAge);
    }

    public Duration getMinimumAge() {
        return minimumAge;
    }
}
