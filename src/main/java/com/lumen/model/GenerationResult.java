package com.lumen.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of one completed runtime generation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerationResult {

    private String content;
    private String model;
    private TokenUsage tokenUsage;
    private long durationMs;
}
