package com.example.itemlifecycle.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Lets the browser front end call the item API from another origin.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final ItemLifecycleProperties properties;

    public WebConfig(ItemLifecycleProperties properties) {
        this.properties = properties;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOriginPatterns(properties.getCors().getAllowedOrigins().toArray(String[]::new))
                .allowedMethods("GET", "POST", "DELETE")
                .exposedHeaders("X-Request-Id", "Location");
    }
}
