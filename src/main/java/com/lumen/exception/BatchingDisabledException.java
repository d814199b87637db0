package com.lumen.exception;

import org.springframework.http.HttpStatus;

/**
 * A batch request arrived while batch scheduling is switched off.
 */
public class BatchingDisabledException extends GatewayException {

    public BatchingDisabledException() {
        super("batching_disabled", HttpStatus.SERVICE_UNAVAILABLE, "Batch scheduling is disabled");
    }
}
