package com.lumen.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of a drained batch request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchResponse {

    private String id;
    private String content;
    private String model;
    private long processingTimeMs;
    private boolean servedFromCache;

    /**
     * Size of the chunk this request was dispatched in.
     */
    private int batchSize;

    private TokenUsage tokenUsage;
}
