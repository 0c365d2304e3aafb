package com.example.itemlifecycle.config;

import com.example.itemlifecycle.requests.CreateItemServiceRequest;
import com.example.itemlifecycle.service.ItemLifecycleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Fills the freshly created in-memory table with placeholder items at start-up.
 * Disable with items.seed.enabled=false.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(value = "items.seed.enabled", havingValue = "true", matchIfMissing = true)
public class ItemSeeder implements ApplicationRunner {

    private final ItemLifecycleService itemService;
    private final ItemLifecycleProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        int seeded = 0;
        for (String name : properties.getSeed().getNames()) {
            itemService.createItem(new CreateItemServiceRequest(name));
            seeded++;
        }
        log.info("In-memory item store initialized with {} sample items", seeded);
    }
}
