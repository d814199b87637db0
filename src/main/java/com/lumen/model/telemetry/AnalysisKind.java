package com.lumen.model.telemetry;

/**
 * Subject area of a derived analysis record.
 */
public enum AnalysisKind {
    PERFORMANCE,
    USAGE,
    ERROR,
    RESOURCE,
    SECURITY
}
