package com.example.itemlifecycle.health;

import com.example.itemlifecycle.service.ItemLifecycleService;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

    private final ItemLifecycleService itemService;
    private final Clock clock;
    private final String env;
    private final String app;

    public HealthController(ItemLifecycleService itemService,
                            Clock clock,
                            @Value("${app.env:local}") String env,
                            @Value("${spring.application.name:item-lifecycle}") String app) {
        this.itemService = itemService;
        this.clock = clock;
        this.env = env;
        this.app = app;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "ts", Instant.now(clock).toString(),
                "env", env,
                "app", app,
                "items", itemService.countItems()
        ));
    }
}
