package com.lumen.model.telemetry;

/**
 * Coarse grouping of telemetry event types.
 */
public enum EventCategory {
    GENERATION,
    CACHE,
    BATCH,
    RUNTIME,
    LEARNING,
    OPERATIONAL
}
