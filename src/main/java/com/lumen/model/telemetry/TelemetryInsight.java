package com.lumen.model.telemetry;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TelemetryInsight {

    private String id;
    private Instant timestamp;
    private AnalysisKind type;
    private String title;
    private String description;
    private Severity severity;
    private double confidence;
    private Map<String, Object> data;
    private List<String> recommendations;
    private List<String> actions;
}
