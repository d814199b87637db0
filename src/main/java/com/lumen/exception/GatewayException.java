package com.lumen.exception;

import org.springframework.http.HttpStatus;

/**
 * Base class for failures surfaced to gateway callers.
 * Each subtype carries a stable error code so callers can tell a policy rejection
 * from a timeout from a runtime fault and decide whether to retry.
 */
public abstract class GatewayException extends RuntimeException {

    private final String code;
    private final HttpStatus status;

    protected GatewayException(String code, HttpStatus status, String message) {
        super(message);
        this.code = code;
        this.status = status;
    }

    protected GatewayException(String code, HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.status = status;
    }

    public String getCode() {
        return code;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
