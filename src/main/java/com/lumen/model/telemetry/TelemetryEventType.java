package com.lumen.model.telemetry;

/**
 * Closed set of operational event types.
 * Success, policy rejection, timeout and runtime error are separate types so analysis
 * can tell infrastructure failures from policy decisions.
 */
public enum TelemetryEventType {
    GENERATION_SUCCESS(EventCategory.GENERATION),
    GENERATION_BLOCKED(EventCategory.GENERATION),
    GENERATION_TIMEOUT(EventCategory.GENERATION),
    GENERATION_ERROR(EventCategory.GENERATION),
    CACHE_HIT(EventCategory.CACHE),
    CACHE_MISS(EventCategory.CACHE),
    BATCH_RESPONSE(EventCategory.BATCH),
    HEALTH_PROBE(EventCategory.RUNTIME),
    AI_PREDICTION(EventCategory.LEARNING),
    AI_ACCURACY(EventCategory.LEARNING),
    LEARNING_FEEDBACK(EventCategory.LEARNING),
    MODEL_UPDATE(EventCategory.LEARNING),
    PERFORMANCE_METRIC(EventCategory.OPERATIONAL),
    ERROR_OCCURRENCE(EventCategory.OPERATIONAL),
    SECURITY_EVENT(EventCategory.OPERATIONAL),
    USER_INTERACTION(EventCategory.OPERATIONAL),
    ANALYSIS_FAILURE(EventCategory.OPERATIONAL);

    private final EventCategory category;

    TelemetryEventType(EventCategory category) {
        this.category = category;
    }

    public EventCategory getCategory() {
        return category;
    }
}
