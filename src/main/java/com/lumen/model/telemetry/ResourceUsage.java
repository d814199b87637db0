package com.lumen.model.telemetry;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Resource figures sampled when an event is recorded.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ResourceUsage {

    /**
     * Process CPU load in percent (0-100).
     */
    private double cpu;

    private double memoryMb;

    private double diskMb;

    private double networkMbps;

    private int databaseConnections;

    /**
     * Response cache hit rate (0.0-1.0) when known.
     */
    private double cacheHitRate;

    public static ResourceUsage empty() {
        return new ResourceUsage();
    }
}
