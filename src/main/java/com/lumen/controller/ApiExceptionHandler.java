package com.lumen.controller;

import com.lumen.exception.GatewayException;
import com.lumen.exception.PolicyRejectedException;
import com.lumen.exception.RuntimeFaultException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps failures to RFC 7807 problem details. The {@code title} is a stable error code
 * callers can branch on.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<ProblemDetail> handleGateway(GatewayException e) {
        ProblemDetail pd = problem(e.getStatus(), e.getCode(), e.getMessage());
        if (e instanceof PolicyRejectedException) {
            pd.setProperty("policyEvents", ((PolicyRejectedException) e).getPolicyEvents());
        }
        if (e instanceof RuntimeFaultException && ((RuntimeFaultException) e).getRuntimeStatus() != null) {
            pd.setProperty("runtimeStatus", ((RuntimeFaultException) e).getRuntimeStatus());
        }

        if (e.getStatus().is5xxServerError()) {
            log.error("API error: status={}, code={}, {}", e.getStatus().value(), e.getCode(), e.getMessage());
        } else {
            log.info("API client error: status={}, code={}", e.getStatus().value(), e.getCode());
        }
        return ResponseEntity.status(e.getStatus()).body(pd);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleInvalid(IllegalArgumentException e) {
        log.info("API client error: status=400, code=invalid_request, {}", e.getMessage());
        return ResponseEntity.badRequest().body(problem(HttpStatus.BAD_REQUEST, "invalid_request", e.getMessage()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ProblemDetail> handleConflict(IllegalStateException e) {
        log.info("API client error: status=409, code=invalid_state, {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(problem(HttpStatus.CONFLICT, "invalid_state", e.getMessage()));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ProblemDetail> handleMalformed(ServerWebInputException e) {
        log.info("API client error: status=400, code=malformed_request, {}", e.getReason());
        return ResponseEntity.badRequest()
                .body(problem(HttpStatus.BAD_REQUEST, "malformed_request", "Malformed request: " + e.getReason()));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ProblemDetail> handleStatus(ResponseStatusException e) {
        ProblemDetail pd = e.getBody();
        pd.setTitle(pd.getTitle() != null ? pd.getTitle().toLowerCase().replace(' ', '_') : "error");
        return ResponseEntity.status(e.getStatusCode()).body(pd);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleUnexpected(Exception e) {
        log.error("API error: status=500, code=internal_error", e);
        return ResponseEntity.internalServerError()
                .body(problem(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Unexpected server error"));
    }

    private static ProblemDetail problem(HttpStatus status, String code, String detail) {
        ProblemDetail pd = ProblemDetail.forStatus(status);
        pd.setTitle(code);
        pd.setDetail(detail);
        return pd;
    }
}
