package com.lumen.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of runtime health as seen by the last probe.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RuntimeHealth {

    private HealthStatus status;

    private List<RuntimeModel> models;

    /**
     * Resource figures derived from the runtime's process list
     * (running models, loaded bytes, VRAM bytes).
     */
    private Map<String, Object> resourceStats;

    private int consecutiveFailures;

    private Instant lastCheck;

    private String lastError;

    public static RuntimeHealth initial() {
        return RuntimeHealth.builder()
                .status(HealthStatus.UNHEALTHY)
                .models(List.of())
                .resourceStats(Map.of())
                .build();
    }
}
