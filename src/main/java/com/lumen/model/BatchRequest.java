package com.lumen.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Request waiting in the batch scheduler.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BatchRequest {

    private String id;
    private String prompt;
    private String model;
    private GenerateOptions options;
    private Instant submittedAt;

    @Builder.Default
    private Priority priority = Priority.MEDIUM;
}
