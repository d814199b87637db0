package com.lumen.model.telemetry;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Anomaly {

    private String id;
    private AnalysisKind type;
    private Severity severity;
    private String description;
    private String eventId;
    private double threshold;
    private double actualValue;
    private double confidence;
    private List<String> recommendations;
}
