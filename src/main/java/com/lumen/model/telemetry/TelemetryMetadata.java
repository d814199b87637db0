package com.lumen.model.telemetry;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Deployment metadata attached to a telemetry event.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TelemetryMetadata {

    private String version;
    private String environment;
    private String region;
    private String instanceId;
    private String requestId;
    private String correlationId;
    private List<String> tags;

    /**
     * Free-form extension attributes.
     */
    private Map<String, String> attributes;
}
