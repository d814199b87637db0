package com.lumen;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for Lumen - inference gateway with response caching,
 * request batching and a telemetry learning loop.
 */
@SpringBootApplication
public class LumenApplication {

    public static void main(String[] args) {
        SpringApplication.run(LumenApplication.class, args);
    }
}
