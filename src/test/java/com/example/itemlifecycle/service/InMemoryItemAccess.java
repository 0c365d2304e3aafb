package com.example.itemlifecycle.service;

import com.example.itemlifecycle.access.ItemAccess;
import com.example.itemlifecycle.models.Item;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

class InMemoryItemAccess implements ItemAccess {

    private final ConcurrentHashMap<Long, Item> items = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Clock clock;

    InMemoryItemAccess(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Item insert(String name) {
        Item item = Item.builder()
                .id(sequence.incrementAndGet())
                .name(name)
                .createdAt(Instant.now(clock))
                .build();
        items.put(item.getId(), item);
        return item;
    }

    @Override
    public List<Item> findAll() {
        List<Item> all = new ArrayList<>(items.values());
        all.sort(Comparator.comparing(Item::getCreatedAt).thenComparing(Item::getId).reversed());
        return all;
    }

    @Override
    public Optional<Item> findById(long id) {
        return Optional.ofNullable(items.get(id));
    }

    @Override
    public int deleteById(long id) {
        return items.remove(id) != null ? 1 : 0;
    }

    @Override
    public long count() {
        return items.size();
    }
}
