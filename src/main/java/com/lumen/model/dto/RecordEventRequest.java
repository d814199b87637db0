package com.lumen.model.dto;

import com.lumen.model.telemetry.TelemetryData;
import com.lumen.model.telemetry.TelemetryEventType;
import com.lumen.model.telemetry.TelemetryMetadata;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordEventRequest {

    private TelemetryEventType type;
    private String source;
    private List<String> actorIds;
    private TelemetryData data;
    private TelemetryMetadata metadata;
}
