package com.lumen.model;

/**
 * Connection health of the inference runtime.
 */
public enum HealthStatus {
    HEALTHY,
    UNHEALTHY
}
