package com.lumen.model.telemetry;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Ground truth supplied for a prior prediction.
 * References its telemetry event by id only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LearningFeedback {

    private String id;
    private Instant timestamp;
    private String eventId;
    private double actualOutcome;
    private Double predictedOutcome;

    /**
     * 0.0-1.0
     */
    private double accuracy;

    private String feedback;

    /**
     * Optional rating, 1-5.
     */
    private Integer rating;

    private List<Correction> corrections;
    private List<String> improvements;
}
