package com.lumen.service;

import com.lumen.config.LumenProperties;
import com.lumen.exception.GatewayTimeoutException;
import com.lumen.exception.PolicyRejectedException;
import com.lumen.model.BatchRequest;
import com.lumen.model.CacheEntry;
import com.lumen.model.GenerateOptions;
import com.lumen.model.GenerationResult;
import com.lumen.model.PolicyDecision;
import com.lumen.model.RuntimeHealth;
import com.lumen.model.RuntimeModel;
import com.lumen.model.dto.ConnectorStatus;
import com.lumen.model.telemetry.TelemetryData;
import com.lumen.model.telemetry.TelemetryEventType;
import com.lumen.runtime.InferenceRuntimeClient;
import com.lumen.runtime.RuntimeHealthMonitor;
import com.lumen.runtime.RuntimeRequestFactory;
import com.lumen.service.batch.BatchScheduler;
import com.lumen.service.cache.ResponseCacheStore;
import com.lumen.service.policy.PromptPolicy;
import com.lumen.service.telemetry.TelemetryRecorder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Caller-facing entry point that orchestrates policy, cache lookup and runtime forwarding.
 * <p>
 * Flow for {@link #generateText}:
 * 1. Validate and run the prompt policy
 * 2. Look up the cache with the sanitized prompt
 * 3. On a miss, make sure the runtime is healthy
 * 4. Forward directly (urgent) or through the batch scheduler
 * 5. Cache the response and record the outcome
 * <p>
 * Failed generations are never cached and never retried here.
 */
@Slf4j
@Service
public class InferenceGateway {

    private static final String SOURCE = "inference-gateway";

    private final PromptPolicy policy;
    private final ResponseCacheStore cache;
    private final InferenceRuntimeClient client;
    private final RuntimeHealthMonitor healthMonitor;
    private final BatchScheduler batchScheduler;
    private final RuntimeRequestFactory requestFactory;
    private final TelemetryRecorder telemetry;
    private final LumenProperties properties;

    public InferenceGateway(
            PromptPolicy policy,
            ResponseCacheStore cache,
            InferenceRuntimeClient client,
            RuntimeHealthMonitor healthMonitor,
            BatchScheduler batchScheduler,
            RuntimeRequestFactory requestFactory,
            TelemetryRecorder telemetry,
            LumenProperties properties) {
        this.policy = policy;
        this.cache = cache;
        this.client = client;
        this.healthMonitor = healthMonitor;
        this.batchScheduler = batchScheduler;
        this.requestFactory = requestFactory;
        this.telemetry = telemetry;
        this.properties = properties;
    }

    /**
     * Generate text for a prompt, serving from cache when possible.
     *
     * @param actorId caller identity for policy and telemetry, may be null
     */
    public Mono<String> generateText(String prompt, GenerateOptions options, String actorId) {
        if (prompt == null || prompt.isBlank()) {
            return Mono.error(new IllegalArgumentException("Prompt must not be empty"));
        }
        GenerateOptions effective = options != null ? options : GenerateOptions.defaults();
        String model = requestFactory.resolveModel(effective);

        return Mono.defer(() -> {
            long start = System.nanoTime();
            return policy.evaluate(prompt, model, actorId)
                    .flatMap(decision -> {
                        String sanitized = admit(decision);
                        Map<String, Object> keyOptions = effective.cacheKeyOptions();

                        Optional<CacheEntry> cached = cache.lookup(sanitized, model, keyOptions);
                        if (cached.isPresent()) {
                            log.info("Serving cached response for model {}", model);
                            recordSuccess(model, actorId, cached.get().getContent(), elapsedMs(start), true);
                            return Mono.just(cached.get().getContent());
                        }

                        log.debug("Cache miss - forwarding to runtime: model={}, urgent={}", model, effective.isUrgent());
                        return healthMonitor.ensureHealthy()
                                .then(Mono.defer(() -> forward(sanitized, model, effective)))
                                .map(result -> {
                                    cache.store(sanitized, model, keyOptions, result, null);
                                    recordSuccess(model, actorId, result.getContent(), elapsedMs(start), false);
                                    log.info("Generation completed: model={}, tokens={}, {}ms",
                                            model, result.getTokenUsage() != null
                                                    ? result.getTokenUsage().getTotalTokens() : 0,
                                            result.getDurationMs());
                                    return result.getContent();
                                });
                    })
                    .doOnError(error -> recordFailure(model, actorId, error, elapsedMs(start)));
        });
    }

    /**
     * Stream text fragments for a prompt. Streams bypass the cache and the batch scheduler.
     */
    public Flux<String> generateTextStream(String prompt, GenerateOptions options, String actorId) {
        if (prompt == null || prompt.isBlank()) {
            return Flux.error(new IllegalArgumentException("Prompt must not be empty"));
        }
        GenerateOptions effective = options != null ? options : GenerateOptions.defaults();
        String model = requestFactory.resolveModel(effective);

        return Flux.defer(() -> {
            long start = System.nanoTime();
            AtomicInteger length = new AtomicInteger();
            return policy.evaluate(prompt, model, actorId)
                    .map(this::admit)
                    .flatMapMany(sanitized -> healthMonitor.ensureHealthy()
                            .thenMany(Flux.defer(() -> client.generateStream(
                                    sanitized, effective.toBuilder().model(model).build()))))
                    .doOnNext(fragment -> length.addAndGet(fragment.length()))
                    .doOnComplete(() -> {
                        log.info("Streaming generation completed: model={}, {} chars", model, length.get());
                        recordStreamSuccess(model, actorId, length.get(), elapsedMs(start));
                    })
                    .doOnError(error -> recordFailure(model, actorId, error, elapsedMs(start)));
        });
    }

    public Mono<List<RuntimeModel>> listModels() {
        return client.listModels();
    }

    public Mono<RuntimeHealth> health() {
        return healthMonitor.health();
    }

    public Mono<Void> pullModel(String name) {
        if (name == null || name.isBlank()) {
            return Mono.error(new IllegalArgumentException("Model name must not be empty"));
        }
        return client.pullModel(name);
    }

    public ConnectorStatus status() {
        LumenProperties.RuntimeConfig runtime = properties.getRuntime();
        return ConnectorStatus.builder()
                .connected(healthMonitor.isConnected())
                .health(healthMonitor.snapshot())
                .baseUrl(runtime.getBaseUrl())
                .defaultModel(runtime.getDefaultModel())
                .timeoutMs(runtime.getTimeout().toMillis())
                .healthCheckIntervalMs(runtime.getHealthCheckInterval().toMillis())
                .build();
    }

    private String admit(PolicyDecision decision) {
        if (!decision.isAllowed()) {
            throw new PolicyRejectedException(decision.getEvents() != null ? decision.getEvents() : List.of());
        }
        return decision.getSanitizedPrompt();
    }

    private Mono<GenerationResult> forward(String prompt, String model, GenerateOptions options) {
        if (options.isUrgent() || !properties.getBatch().isEnabled()) {
            return client.generate(prompt, options.toBuilder().model(model).build());
        }

        BatchRequest request = BatchRequest.builder()
                .prompt(prompt)
                .model(model)
                .options(options)
                .priority(options.effectivePriority())
                .build();
        return batchScheduler.submit(request)
                .map(response -> GenerationResult.builder()
                        .content(response.getContent())
                        .model(response.getModel())
                        .tokenUsage(response.getTokenUsage())
                        .durationMs(response.getProcessingTimeMs())
                        .build());
    }

    private void recordSuccess(String model, String actorId, String content, long durationMs, boolean cached) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("cached", cached);
        result.put("contentLength", content != null ? content.length() : 0);
        telemetry.recordEvent(TelemetryEventType.GENERATION_SUCCESS, SOURCE, actorIds(actorId), TelemetryData.builder()
                .operation("generate_text")
                .parameters(Map.of("model", model))
                .result(result)
                .durationMs(durationMs)
                .build(), null);
    }

    private void recordStreamSuccess(String model, String actorId, int length, long durationMs) {
        telemetry.recordEvent(TelemetryEventType.GENERATION_SUCCESS, SOURCE, actorIds(actorId), TelemetryData.builder()
                .operation("generate_text_stream")
                .parameters(Map.of("model", model))
                .result(Map.of("contentLength", length))
                .durationMs(durationMs)
                .build(), null);
    }

    private void recordFailure(String model, String actorId, Throwable error, long durationMs) {
        TelemetryEventType type;
        if (error instanceof PolicyRejectedException) {
            type = TelemetryEventType.GENERATION_BLOCKED;
            log.warn("Generation blocked by policy: model={}, events={}",
                    model, ((PolicyRejectedException) error).getPolicyEvents());
        } else if (error instanceof GatewayTimeoutException) {
            type = TelemetryEventType.GENERATION_TIMEOUT;
            log.error("Generation timed out: model={}, {}", model, error.getMessage());
        } else {
            type = TelemetryEventType.GENERATION_ERROR;
            log.error("Generation failed: model={}, {}", model, error.getMessage());
        }

        telemetry.recordEvent(type, SOURCE, actorIds(actorId), TelemetryData.builder()
                .operation("generate_text")
                .parameters(Map.of("model", model))
                .error(String.valueOf(error.getMessage()))
                .durationMs(durationMs)
                .build(), null);
    }

    private static List<String> actorIds(String actorId) {
        return actorId != null ? List.of(actorId) : List.of();
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
