package com.lumen.model.telemetry;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Correction {

    private String field;
    private Object originalValue;
    private Object correctedValue;
    private String reason;
    private double confidence;
}
