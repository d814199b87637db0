package com.lumen.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Caller-supplied generation options.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GenerateOptions {

    /**
     * Model identifier; the configured default model when null.
     */
    private String model;

    private String system;

    private String template;

    private List<Integer> context;

    /**
     * Runtime sampling options (temperature, top_p, num_predict, stop, ...).
     */
    private Map<String, Object> options;

    /**
     * Scheduling priority when the request goes through the batch scheduler.
     */
    private Priority priority;

    /**
     * Urgent requests bypass the batch scheduler. Defaults to true.
     */
    private Boolean urgent;

    public static GenerateOptions defaults() {
        return GenerateOptions.builder().build();
    }

    @JsonIgnore
    public boolean isUrgent() {
        return urgent == null || urgent;
    }

    @JsonIgnore
    public Priority effectivePriority() {
        return priority != null ? priority : Priority.MEDIUM;
    }

    /**
     * The part of these options that changes the runtime's answer and therefore
     * belongs in the cache key. Scheduling hints are left out.
     */
    @JsonIgnore
    public Map<String, Object> cacheKeyOptions() {
        Map<String, Object> keyOptions = new LinkedHashMap<>();
        if (system != null) {
            keyOptions.put("system", system);
        }
        if (template != null) {
            keyOptions.put("template", template);
        }
        if (context != null && !context.isEmpty()) {
            keyOptions.put("context", context);
        }
        if (options != null && !options.isEmpty()) {
            keyOptions.put("options", options);
        }
        return keyOptions;
    }
}
