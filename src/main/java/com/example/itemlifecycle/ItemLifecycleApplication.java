package com.example.itemlifecycle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ItemLifecycleApplication {

    public static void main(String[] args) {
        SpringApplication.run(ItemLifecycleApplication.class, args);
    }
}
