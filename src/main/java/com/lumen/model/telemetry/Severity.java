package com.lumen.model.telemetry;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
