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
public class Prediction {

    private String id;
    private AnalysisKind type;
    private String metric;
    private double value;
    private double confidence;
    private String timeframe;
    private List<String> factors;
}
