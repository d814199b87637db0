package com.lumen.runtime;

import com.lumen.model.GenerateOptions;
import com.lumen.model.GenerationResult;
import com.lumen.model.RuntimeHealth;
import com.lumen.model.RuntimeModel;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Client for a local inference runtime.
 * <p>
 * Every call carries a deadline. Failures surface as
 * {@link com.lumen.exception.GatewayTimeoutException} when the deadline passes and as
 * {@link com.lumen.exception.RuntimeFaultException} for everything else. Calls are
 * never retried here.
 */
public interface InferenceRuntimeClient {

    /**
     * Single-shot generation.
     */
    Mono<GenerationResult> generate(String prompt, GenerateOptions options);

    /**
     * Streaming generation; emits non-empty text fragments and completes after the
     * runtime's final record.
     */
    Flux<String> generateStream(String prompt, GenerateOptions options);

    Mono<List<RuntimeModel>> listModels();

    /**
     * Query installed and running models. Errors propagate; the health monitor decides
     * what a failure means.
     */
    Mono<RuntimeHealth> probe();

    /**
     * Ask the runtime to download a model. Completes when the runtime reports the pull
     * finished.
     */
    Mono<Void> pullModel(String name);
}
