package com.lumen.service.batch;

import com.lumen.model.BatchRequest;
import com.lumen.model.GenerationResult;
import reactor.core.publisher.Mono;

/**
 * Executes one drained batch request against the runtime.
 */
public interface BatchDispatcher {

    Mono<GenerationResult> dispatch(BatchRequest request);
}
