package com.lumen.model.telemetry;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Pattern {

    private String id;
    private AnalysisKind type;
    private String description;
    private long frequency;
    private double confidence;
    private Severity impact;
    private Map<String, Object> data;
}
