package com.lumen.model.telemetry;

public enum TrendDirection {
    INCREASING,
    DECREASING,
    STABLE
}
