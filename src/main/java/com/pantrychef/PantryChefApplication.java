package com.pantrychef;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;

/**
 * Main application class for PantryChef - pantry-driven recipe generation with nutrition enrichment.
 */
@SpringBootApplication(exclude = RedisAutoConfiguration.class)
public class PantryChefApplication {

    public static void main(String[] args) {
        SpringApplication.run(PantryChefApplication.class, args);
    }
}
