package com.lumen.model.telemetry;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.List;

/**
 * Structured record of one observed operation.
 * <p>
 * Immutable once recorded, except for {@code derivedAnalysis}, {@code confidence} and
 * {@code processed}, which the telemetry engine sets exactly once.
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TelemetryEvent {

    private final String id;
    private final Instant timestamp;
    private final TelemetryEventType type;
    private final String source;
    private final List<String> actorIds;
    private final TelemetryData data;
    private final TelemetryMetadata metadata;

    private DerivedAnalysis derivedAnalysis;

    @Builder.Default
    private double confidence = 1.0;

    private boolean processed;

    /**
     * Attach the per-event analysis result.
     *
     * @return false if an analysis was already attached
     */
    public synchronized boolean attachAnalysis(DerivedAnalysis analysis) {
        if (derivedAnalysis != null) {
            return false;
        }
        this.derivedAnalysis = analysis;
        this.confidence = analysis.getConfidence();
        return true;
    }

    /**
     * Flip {@code processed} from false to true.
     *
     * @return true only for the call that performed the flip
     */
    public synchronized boolean markProcessed() {
        if (processed) {
            return false;
        }
        processed = true;
        return true;
    }

    public synchronized boolean isProcessed() {
        return processed;
    }

    public synchronized DerivedAnalysis getDerivedAnalysis() {
        return derivedAnalysis;
    }

    public synchronized double getConfidence() {
        return confidence;
    }

    public long durationMs() {
        return data != null ? data.getDurationMs() : 0L;
    }

    public boolean hasError() {
        return data != null && data.hasError();
    }
}
