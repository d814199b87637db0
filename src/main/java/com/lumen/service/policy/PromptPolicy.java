package com.lumen.service.policy;

import com.lumen.model.PolicyDecision;
import reactor.core.publisher.Mono;

/**
 * Decides whether a prompt may be sent to the runtime, and in what form.
 */
public interface PromptPolicy {

    /**
     * @param actorId caller identity, may be null
     * @return a decision carrying the sanitized prompt when allowed
     */
    Mono<PolicyDecision> evaluate(String prompt, String model, String actorId);
}
