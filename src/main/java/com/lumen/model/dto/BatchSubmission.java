package com.lumen.model.dto;

import com.lumen.model.Priority;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Body of {@code POST /v1/batch}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchSubmission {

    private String prompt;
    private String model;
    private Priority priority;
    private Map<String, Object> options;
}
