package com.lumen.model.telemetry;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Payload of a telemetry event: the observed operation and its outcome.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TelemetryData {

    private String operation;

    private Map<String, Object> parameters;

    private Object result;

    /**
     * Error message when the operation failed.
     */
    private String error;

    private long durationMs;

    private ResourceUsage resourceUsage;

    private Map<String, Object> context;

    public boolean hasError() {
        return error != null && !error.isEmpty();
    }
}
