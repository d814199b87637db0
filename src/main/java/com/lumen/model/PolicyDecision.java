package com.lumen.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Verdict of the prompt policy collaborator.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PolicyDecision {

    private boolean allowed;
    private String sanitizedPrompt;

    /**
     * Policy findings, e.g. "prompt_injection". Empty when nothing was flagged.
     */
    private List<String> events;

    public static PolicyDecision allow(String sanitizedPrompt) {
        return new PolicyDecision(true, sanitizedPrompt, List.of());
    }

    public static PolicyDecision deny(List<String> events) {
        return new PolicyDecision(false, null, events);
    }
}
