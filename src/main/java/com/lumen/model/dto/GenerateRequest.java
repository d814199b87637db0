package com.lumen.model.dto;

import com.lumen.model.GenerateOptions;
import com.lumen.model.Priority;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Body of {@code POST /v1/generate}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerateRequest {

    private String prompt;
    private String model;
    private String system;
    private String template;
    private List<Integer> context;
    private Map<String, Object> options;
    private Boolean stream;
    private Priority priority;
    private Boolean urgent;
    private String actorId;

    public GenerateOptions toOptions() {
        return GenerateOptions.builder()
                .model(model)
                .system(system)
                .template(template)
                .context(context)
                .options(options)
                .priority(priority)
                .urgent(urgent)
                .build();
    }
}
