package com.lumen.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Body of {@code POST /api/generate} on the inference runtime.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RuntimeGenerateRequest {

    @JsonProperty("model")
    private String model;

    @JsonProperty("prompt")
    private String prompt;

    @JsonProperty("system")
    private String system;

    @JsonProperty("template")
    private String template;

    @JsonProperty("context")
    private List<Integer> context;

    @JsonProperty("options")
    private Map<String, Object> options;

    @JsonProperty("stream")
    private Boolean stream;
}
