package com.lumen.service.batch;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Chunks dispatched by one drain cycle, in dispatch order per model.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DrainSummary {

    private List<DispatchedChunk> chunks;

    public static DrainSummary empty() {
        return new DrainSummary(List.of());
    }

    public int requestCount() {
        return chunks.stream().mapToInt(DispatchedChunk::getSize).sum();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DispatchedChunk {
        private String model;
        private List<String> requestIds;
        private int size;
    }
}
