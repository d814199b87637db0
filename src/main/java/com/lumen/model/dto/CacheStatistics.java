package com.lumen.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response cache statistics.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatistics {

    /**
     * Live entries (approximate; expired entries may linger until cleanup).
     */
    private long size;

    private long maxSize;

    private long hits;

    private long misses;

    /**
     * Cache hit rate (0.0-1.0).
     */
    private double hitRate;

    private long evictions;

    private long defaultTtlMs;
}
