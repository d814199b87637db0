package com.lumen.exception;

import org.springframework.http.HttpStatus;

import java.time.Duration;

/**
 * A runtime call exceeded its deadline.
 */
public class GatewayTimeoutException extends GatewayException {

    private final Duration deadline;

    public GatewayTimeoutException(String operation, Duration deadline, Throwable cause) {
        super("runtime_timeout", HttpStatus.GATEWAY_TIMEOUT,
                "Runtime call '" + operation + "' timed out after " + deadline.toMillis() + "ms", cause);
        this.deadline = deadline;
    }

    public Duration getDeadline() {
        return deadline;
    }
}
