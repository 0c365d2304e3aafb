package com.example.itemlifecycle.http;

import com.example.itemlifecycle.models.Item;
import com.example.itemlifecycle.requests.CreateItemHttpRequest;
import com.example.itemlifecycle.requests.CreateItemServiceRequest;
import com.example.itemlifecycle.requests.DeleteItemServiceRequest;
import com.example.itemlifecycle.service.ItemLifecycleService;
import java.net.URI;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST entry point for items. Converts HTTP payloads into service commands and maps the resulting
 * items onto the wire format; failures are rendered by {@link ApiExceptionHandler}.
 */
@RestController
@RequestMapping("/api/items")
public class ItemController {

    private final ItemLifecycleService itemService;

    public ItemController(ItemLifecycleService itemService) {
        this.itemService = itemService;
    }

    @GetMapping
    public ResponseEntity<List<ItemResponse>> listItems() {
        List<ItemResponse> response = itemService.listItems().stream()
                .map(this::map)
                .toList();
        return ResponseEntity.ok(response);
    }

    @PostMapping
    public ResponseEntity<ItemResponse> createItem(
            @RequestBody(required = false) CreateItemHttpRequest request
    ) {
        Item item = itemService.createItem(CreateItemServiceRequest.from(request));
        return ResponseEntity.created(URI.create("/api/items/" + item.getId()))
                .body(map(item));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<DeleteItemResponse> deleteItem(@PathVariable String id) {
        itemService.deleteItem(new DeleteItemServiceRequest(id));
        return ResponseEntity.ok(DeleteItemResponse.DELETED);
    }

    private ItemResponse map(Item item) {
        return new ItemResponse(item.getId(), item.getName(), item.createdAtMillis());
    }
}
