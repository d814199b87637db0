package com.lumen.model.dto;

import com.lumen.model.telemetry.Correction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedbackRequest {

    private String eventId;
    private Double actualOutcome;

    /**
     * Overrides the prediction recorded on the event when present.
     */
    private Double predictedOutcome;

    private String feedback;
    private Integer rating;
    private List<Correction> corrections;
}
