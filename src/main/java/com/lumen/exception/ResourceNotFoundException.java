package com.lumen.exception;

import org.springframework.http.HttpStatus;

/**
 * Lookup of a telemetry event, feedback record or learning model by id failed.
 */
public class ResourceNotFoundException extends GatewayException {

    public ResourceNotFoundException(String code, String message) {
        super(code, HttpStatus.NOT_FOUND, message);
    }

    public static ResourceNotFoundException event(String eventId) {
        return new ResourceNotFoundException("event_not_found", "Telemetry event not found: " + eventId);
    }

    public static ResourceNotFoundException model(String modelId) {
        return new ResourceNotFoundException("model_not_found", "Learning model not found: " + modelId);
    }
}
