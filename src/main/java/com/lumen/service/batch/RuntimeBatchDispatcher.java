package com.lumen.service.batch;

import com.lumen.exception.GatewayTimeoutException;
import com.lumen.model.BatchRequest;
import com.lumen.model.GenerateOptions;
import com.lumen.model.GenerationResult;
import com.lumen.model.telemetry.TelemetryData;
import com.lumen.model.telemetry.TelemetryEventType;
import com.lumen.runtime.InferenceRuntimeClient;
import com.lumen.service.telemetry.TelemetryRecorder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sends batch requests straight to the runtime client. Failures are recorded as
 * generation errors or timeouts and passed on to the request's handle.
 */
@Slf4j
@Component
public class RuntimeBatchDispatcher implements BatchDispatcher {

    private static final String SOURCE = "batch-dispatcher";

    private final InferenceRuntimeClient client;
    private final TelemetryRecorder telemetry;

    public RuntimeBatchDispatcher(InferenceRuntimeClient client, TelemetryRecorder telemetry) {
        this.client = client;
        this.telemetry = telemetry;
    }

    @Override
    public Mono<GenerationResult> dispatch(BatchRequest request) {
        GenerateOptions options = request.getOptions() != null
                ? request.getOptions().toBuilder().model(request.getModel()).build()
                : GenerateOptions.builder().model(request.getModel()).build();

        return Mono.defer(() -> {
            long start = System.nanoTime();
            return client.generate(request.getPrompt(), options)
                    .doOnError(error -> recordFailure(request, error, (System.nanoTime() - start) / 1_000_000));
        });
    }

    private void recordFailure(BatchRequest request, Throwable error, long durationMs) {
        TelemetryEventType type = error instanceof GatewayTimeoutException
                ? TelemetryEventType.GENERATION_TIMEOUT
                : TelemetryEventType.GENERATION_ERROR;
        log.error("Batch request {} failed for model {}: {}", request.getId(), request.getModel(), error.getMessage());

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("requestId", request.getId());
        parameters.put("model", request.getModel());
        parameters.put("priority", request.getPriority().name());
        telemetry.record(type, SOURCE, TelemetryData.builder()
                .operation("batch_generate")
                .parameters(parameters)
                .error(String.valueOf(error.getMessage()))
                .durationMs(durationMs)
                .build());
    }
}
