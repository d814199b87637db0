package com.lumen.service.policy;

import com.lumen.model.PolicyDecision;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.regex.Pattern;

/**
 * Default policy: allows every prompt after stripping control characters
 * (newlines and tabs are kept).
 */
@Slf4j
@Component
public class PermissivePromptPolicy implements PromptPolicy {

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\p{Cntrl}&&[^\\n\\t]]");

    @Override
    public Mono<PolicyDecision> evaluate(String prompt, String model, String actorId) {
        String sanitized = CONTROL_CHARS.matcher(prompt).replaceAll("");
        if (sanitized.length() != prompt.length()) {
            log.debug("Stripped {} control characters from prompt (actor={})",
                    prompt.length() - sanitized.length(), actorId);
        }
        return Mono.just(PolicyDecision.allow(sanitized));
    }
}
