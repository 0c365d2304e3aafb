package com.example.itemlifecycle.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the item service, bound from application.yml (items.*).
 * The defaults below serve as fallbacks if properties are missing from YAML.
 */
@Component
@ConfigurationProperties(prefix = "items")
@Data
public class ItemLifecycleProperties {

    private Deletion deletion = new Deletion();
    private Seed seed = new Seed();
    private Cors cors = new Cors();

    @Data
    public static class Deletion {
        // Items younger than this cannot be deleted.
        private Duration minAge = Duration.ofDays(5);
    }

    @Data
    public static class Seed {
        private boolean enabled = true;
        private List<String> names = new ArrayList<>(List.of("Item 1", "Item 2", "Item 3"));
    }

    @Data
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
    }
}
