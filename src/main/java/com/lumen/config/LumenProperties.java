package com.lumen.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for Lumen.
 */
@Data
@Component
@ConfigurationProperties(prefix = "lumen")
public class LumenProperties {

    private RuntimeConfig runtime = new RuntimeConfig();
    private CacheConfig cache = new CacheConfig();
    private BatchConfig batch = new BatchConfig();
    private TelemetryConfig telemetry = new TelemetryConfig();

    @Data
    public static class RuntimeConfig {
        private String baseUrl = "http://localhost:11434";
        private Duration timeout = Duration.ofSeconds(30);
        private Duration pullTimeout = Duration.ofMinutes(10);
        private String defaultModel = "llama3:8b";
        private double temperature = 0.7;
        private int maxTokens = 1000;
        private boolean monitoringEnabled = true;
        private Duration healthCheckInterval = Duration.ofSeconds(30);
        private Duration healthCacheTtl = Duration.ofSeconds(30);
        private int failureThreshold = 3;
    }

    @Data
    public static class CacheConfig {
        private boolean enabled = true;
        private int maxSize = 1000;
        private Duration defaultTtl = Duration.ofMinutes(5);
    }

    @Data
    public static class BatchConfig {
        private boolean enabled = true;
        private Duration debounce = Duration.ofMillis(100);
        private int chunkSize = 10;
        private int maxRequestsPerDrain = 100;
    }

    @Data
    public static class TelemetryConfig {
        private boolean enabled = true;
        private Duration processingInterval = Duration.ofSeconds(5);
        private int batchSize = 100;
        private Duration trainingInterval = Duration.ofHours(1);
        private long slowOperationThresholdMs = 1000;
        private long anomalyDurationThresholdMs = 5000;
        private double highCpuThreshold = 80.0;
        private int patternFrequencyThreshold = 10;
        private int maxEvents = 10000;
        private int maxDerivedRecords = 1000;
        private int maxDeprecatedVersions = 3;
        private String version = "1.0.0";
        private String environment = "production";
        private String instanceId = "default";
        private StoreType store = StoreType.MEMORY;
    }

    public enum StoreType {
        MEMORY,
        REDIS
    }
}
