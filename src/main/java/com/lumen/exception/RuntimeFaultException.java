package com.lumen.exception;

import org.springframework.http.HttpStatus;

/**
 * The inference runtime answered with a non-2xx status, returned a malformed body,
 * or could not be reached.
 */
public class RuntimeFaultException extends GatewayException {

    private final Integer runtimeStatus;

    public RuntimeFaultException(String message) {
        this(message, null, null);
    }

    public RuntimeFaultException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public RuntimeFaultException(String message, Integer runtimeStatus, Throwable cause) {
        super("runtime_error", HttpStatus.BAD_GATEWAY, message, cause);
        this.runtimeStatus = runtimeStatus;
    }

    /**
     * HTTP status reported by the runtime, or null when no response was received.
     */
    public Integer getRuntimeStatus() {
        return runtimeStatus;
    }
}
