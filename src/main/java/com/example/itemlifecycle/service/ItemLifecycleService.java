package com.example.itemlifecycle.service;

import com.example.itemlifecycle.access.ItemAccess;
import com.example.itemlifecycle.models.Item;
import com.example.itemlifecycle.requests.CreateItemServiceRequest;
import com.example.itemlifecycle.requests.DeleteItemServiceRequest;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Creates, lists and deletes items. Holds no item state of its own; every call goes straight to
 * the configured {@link ItemAccess}. Deletions are gated by {@link DeletionEligibilityPolicy}, and
 * store errors are reported as {@link ItemLifecycleException.Code#STORE_FAILURE} without retrying.
 */
@Service
@Slf4j
public class ItemLifecycleService {

    static final String CREATE_FAILED = "Failed to create item";
    static final String FETCH_FAILED = "Failed to fetch items";
    static final String DELETE_FAILED = "Failed to delete item";
    static final String COUNT_FAILED = "Failed to count items";

    private final ItemAccess itemAccess;
    private final DeletionEligibilityPolicy eligibilityPolicy;

    public ItemLifecycleService(ItemAccess itemAccess, DeletionEligibilityPolicy eligibilityPolicy) {
        this.itemAccess = itemAccess;
        this.eligibilityPolicy = eligibilityPolicy;
    }

    public Item createItem(CreateItemServiceRequest request) {
        Objects.requireNonNull(request, "request");

        Item item;
        try {
            item = itemAccess.insert(request.name());
        } catch (DataAccessException ex) {
            throw ItemLifecycleException.storeFailure(CREATE_FAILED, ex);
        }

        log.info("Created item id={} createdAt={}", item.getId(), item.getCreatedAt());
        return item;
    }

    public List<Item> listItems() {
        try {
            return itemAccess.findAll();
        } catch (DataAccessException ex) {
            throw ItemLifecycleException.storeFailure(FETCH_FAILED, ex);
        }
    }

    /**
     * Deletes an item that has reached the minimum age.
     *
     * @param request the delete request carrying the raw id token
     * @return the item as it was just before deletion
     * @throws ItemLifecycleException {@code NOT_FOUND} when the token is not a positive integer, the
     *         item does not exist or it disappeared before the delete ran; {@code DELETION_NOT_ALLOWED}
     *         when the item is too recent
     */
    public Item deleteItem(DeleteItemServiceRequest request) {
        Objects.requireNonNull(request, "request");

        long id = request.parsedId().orElseThrow(() -> {
            log.debug("Rejecting delete for malformed id token '{}'", request.rawId());
            return ItemLifecycleException.itemNotFound();
        });

        try {
            Item item = itemAccess.findById(id)
                    .orElseThrow(ItemLifecycleException::itemNotFound);

            if (!eligibilityPolicy.isEligible(item)) {
                log.warn("Refusing to delete item id={}: created at {}, deletable from {}",
                        id, item.getCreatedAt(), eligibilityPolicy.eligibleAt(item));
                throw ItemLifecycleException.deletionNotAllowed(eligibilityPolicy.getMinimumAge());
            }

            // A concurrent delete may have removed the row since the lookup above.
            if (itemAccess.deleteById(id) == 0) {
                log.info("Item id={} was deleted concurrently", id);
                throw ItemLifecycleException.itemNotFound();
            }

            log.info("Deleted item id={}", id);
            return item;
        } catch (DataAccessException ex) {
            throw ItemLifecycleException.storeFailure(DELETE_FAILED, ex);
        }
    }

    public long countItems() {
        try {
            return itemAccess.count();
        } catch (DataAccessException ex) {
            throw ItemLifecycleException.storeFailure(COUNT_FAILED, ex);
        }
    }
}
