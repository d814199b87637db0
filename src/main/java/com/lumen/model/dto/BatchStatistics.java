package com.lumen.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Batch scheduler counters.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchStatistics {

    private int pending;
    private boolean draining;
    private long drainCycles;
    private long dispatchedChunks;
    private long dispatchedRequests;
    private long failedRequests;
}
