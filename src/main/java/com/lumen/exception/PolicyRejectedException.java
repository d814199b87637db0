package com.lumen.exception;

import org.springframework.http.HttpStatus;

import java.util.List;

/**
 * Request blocked by the prompt policy before reaching the runtime.
 */
public class PolicyRejectedException extends GatewayException {

    private final List<String> policyEvents;

    public PolicyRejectedException(List<String> policyEvents) {
        super("policy_rejected", HttpStatus.FORBIDDEN,
                "Request blocked by policy: " + String.join(", ", policyEvents));
        this.policyEvents = List.copyOf(policyEvents);
    }

    public List<String> getPolicyEvents() {
        return policyEvents;
    }
}
