package com.example.itemlifecycle.access;

import com.example.itemlifecycle.models.Item;
import java.util.List;
import java.util.Optional;

/**
 * Storage port for items. Implementations own id and timestamp assignment; callers are expected to
 * have validated input already. Any method may throw
 * {@link org.springframework.dao.DataAccessException} when the backing store is unusable.
 */
public interface ItemAccess {

    /**
     * Inserts a new item, assigning the next id and the current time.
     *
     * @param name an already validated, non-blank name
     * @return the stored item as read back from the table
     */
    Item insert(String name);

    /**
     * Finds all items, newest first. Items sharing a creation time are ordered by id descending,
     * so the later insert comes first.
     *
     * @return all items, empty when the table is empty
     */
    List<Item> findAll();

    Optional<Item> findById(long id);

    /**
     * Removes the item if present.
     *
     * @param id the item id
     * @return rows affected, 0 when no such item exists
     */
    int deleteById(long id);

    long count();
}
