package com.lumen.service.telemetry;

import com.lumen.model.telemetry.TelemetryData;
import com.lumen.model.telemetry.TelemetryEvent;
import com.lumen.model.telemetry.TelemetryEventType;
import com.lumen.model.telemetry.TelemetryMetadata;

import java.util.List;

/**
 * Append-only sink for telemetry events. Implementations must not block the caller.
 */
public interface TelemetryRecorder {

    TelemetryEvent recordEvent(TelemetryEventType type, String source, List<String> actorIds,
                               TelemetryData data, TelemetryMetadata metadata);

    default TelemetryEvent recordEvent(TelemetryEventType type, String source,
                                       TelemetryData data, TelemetryMetadata metadata) {
        return recordEvent(type, source, List.of(), data, metadata);
    }

    default TelemetryEvent record(TelemetryEventType type, String source, TelemetryData data) {
        return recordEvent(type, source, List.of(), data, null);
    }
}
