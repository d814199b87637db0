package com.lumen.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lumen.config.LumenProperties;
import com.lumen.exception.GatewayException;
import com.lumen.exception.GatewayTimeoutException;
import com.lumen.exception.RuntimeFaultException;
import com.lumen.model.GenerateOptions;
import com.lumen.model.GenerationResult;
import com.lumen.model.HealthStatus;
import com.lumen.model.RuntimeGenerateRequest;
import com.lumen.model.RuntimeGenerateResponse;
import com.lumen.model.RuntimeHealth;
import com.lumen.model.RuntimeModel;
import io.netty.handler.timeout.ReadTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.codec.DecodingException;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Ollama-compatible runtime client over HTTP.
 * Endpoints: {@code POST /api/generate}, {@code GET /api/tags}, {@code GET /api/ps},
 * {@code POST /api/pull}.
 */
@Slf4j
@Component
public class OllamaRuntimeClient implements InferenceRuntimeClient {

    private static final TypeReference<List<RuntimeModel>> MODEL_LIST = new TypeReference<>() {
    };
    private static final int MAX_ERROR_BODY = 500;

    private final WebClient webClient;
    private final LumenProperties.RuntimeConfig config;
    private final RuntimeRequestFactory requestFactory;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public OllamaRuntimeClient(
            @Qualifier("runtimeWebClient") WebClient webClient,
            LumenProperties properties,
            RuntimeRequestFactory requestFactory,
            ObjectMapper objectMapper,
            Clock clock) {
        this.webClient = webClient;
        this.config = properties.getRuntime();
        this.requestFactory = requestFactory;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public Mono<GenerationResult> generate(String prompt, GenerateOptions options) {
        RuntimeGenerateRequest request = requestFactory.build(prompt, options, false);
        log.debug("Forwarding generate request to runtime: model={}", request.getModel());

        return Mono.defer(() -> {
            long start = System.nanoTime();
            return webClient.post()
                    .uri("/api/generate")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(request)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, this::toFault)
                    .bodyToMono(RuntimeGenerateResponse.class)
                    .switchIfEmpty(Mono.error(() -> new RuntimeFaultException("Runtime returned an empty generate body")))
                    .map(response -> GenerationResult.builder()
                            .content(response.getResponse() != null ? response.getResponse() : "")
                            .model(response.getModel() != null ? response.getModel() : request.getModel())
                            .tokenUsage(response.tokenUsage())
                            .durationMs((System.nanoTime() - start) / 1_000_000)
                            .build());
        }).transform(call -> withDeadline("generate", config.getTimeout(), call));
    }

    @Override
    public Flux<String> generateStream(String prompt, GenerateOptions options) {
        RuntimeGenerateRequest request = requestFactory.build(prompt, options, true);
        log.debug("Forwarding streaming generate request to runtime: model={}", request.getModel());

        return Flux.defer(() -> {
            NdjsonStreamDecoder decoder = new NdjsonStreamDecoder(objectMapper);
            return webClient.post()
                    .uri("/api/generate")
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_NDJSON)
                    .bodyValue(request)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, this::toFault)
                    .bodyToFlux(DataBuffer.class)
                    .concatMapIterable(buffer -> decoder.feed(drain(buffer)))
                    .concatWith(Flux.defer(() -> Flux.fromIterable(decoder.flush())))
                    .takeUntil(RuntimeGenerateResponse::isDone);
        })
                // Deadline applies to the gap between records, not the whole stream
                .timeout(config.getTimeout())
                .map(record -> record.getResponse() != null ? record.getResponse() : "")
                .filter(fragment -> !fragment.isEmpty())
                .onErrorMap(error -> translate("generate_stream", config.getTimeout(), error));
    }

    @Override
    public Mono<List<RuntimeModel>> listModels() {
        return fetchModels().transform(call -> withDeadline("list_models", config.getTimeout(), call));
    }

    @Override
    public Mono<RuntimeHealth> probe() {
        Mono<JsonNode> running = webClient.get()
                .uri("/api/ps")
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::toFault)
                .bodyToMono(JsonNode.class)
                .defaultIfEmpty(objectMapper.createObjectNode());

        return Mono.zip(fetchModels(), running)
                .map(tuple -> RuntimeHealth.builder()
                        .status(HealthStatus.HEALTHY)
                        .models(tuple.getT1())
                        .resourceStats(resourceStats(tuple.getT2()))
                        .lastCheck(clock.instant())
                        .build())
                .transform(call -> withDeadline("probe", config.getTimeout(), call));
    }

    @Override
    public Mono<Void> pullModel(String name) {
        log.info("Pulling model {} on runtime", name);
        return webClient.post()
                .uri("/api/pull")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("name", name, "stream", false))
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::toFault)
                .bodyToMono(JsonNode.class)
                .doOnNext(status -> log.info("Model pull finished: name={}, status={}",
                        name, status.path("status").asText("unknown")))
                .then()
                .transform(call -> withDeadline("pull_model", config.getPullTimeout(), call));
    }

    private Mono<List<RuntimeModel>> fetchModels() {
        return webClient.get()
                .uri("/api/tags")
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::toFault)
                .bodyToMono(JsonNode.class)
                .map(this::parseModels)
                .defaultIfEmpty(List.of());
    }

    private List<RuntimeModel> parseModels(JsonNode tags) {
        JsonNode models = tags.path("models");
        if (!models.isArray()) {
            return List.of();
        }
        try {
            return objectMapper.convertValue(models, MODEL_LIST);
        } catch (IllegalArgumentException e) {
            throw new RuntimeFaultException("Malformed model list from runtime", e);
        }
    }

    /**
     * Figures derived from the runtime's process list: running models, loaded bytes
     * and the share of them in VRAM.
     */
    private Map<String, Object> resourceStats(JsonNode ps) {
        JsonNode running = ps.path("models");
        long size = 0;
        long vram = 0;
        int count = 0;
        if (running.isArray()) {
            for (JsonNode model : running) {
                count++;
                size += model.path("size").asLong(0);
                vram += model.path("size_vram").asLong(0);
            }
        }
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("runningModels", count);
        stats.put("loadedBytes", size);
        stats.put("vramBytes", vram);
        return stats;
    }

    private Mono<? extends Throwable> toFault(ClientResponse response) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> new RuntimeFaultException(
                        "Runtime returned HTTP " + status + abbreviate(body), status, null));
    }

    private <T> Mono<T> withDeadline(String operation, Duration deadline, Mono<T> call) {
        return call.timeout(deadline)
                .onErrorMap(error -> translate(operation, deadline, error));
    }

    /**
     * Map transport and decoding failures onto the gateway's error types.
     */
    Throwable translate(String operation, Duration deadline, Throwable error) {
        if (error instanceof GatewayException) {
            return error;
        }
        if (error instanceof TimeoutException || isReadTimeout(error)) {
            log.warn("Runtime call '{}' exceeded deadline of {}ms", operation, deadline.toMillis());
            return new GatewayTimeoutException(operation, deadline, error);
        }
        if (error instanceof WebClientRequestException) {
            return new RuntimeFaultException("Runtime unreachable during '" + operation + "': "
                    + error.getMessage(), error);
        }
        if (error instanceof DecodingException || error instanceof JsonProcessingException) {
            return new RuntimeFaultException("Malformed runtime response during '" + operation + "'", error);
        }
        return new RuntimeFaultException("Runtime call '" + operation + "' failed: " + error.getMessage(), error);
    }

    private static boolean isReadTimeout(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof ReadTimeoutException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static byte[] drain(DataBuffer buffer) {
        try {
            byte[] bytes = new byte[buffer.readableByteCount()];
            buffer.read(bytes);
            return bytes;
        } finally {
            DataBufferUtils.release(buffer);
        }
    }

    private static String abbreviate(String body) {
        if (body.isBlank()) {
            return "";
        }
        String trimmed = body.length() <= MAX_ERROR_BODY ? body : body.substring(0, MAX_ERROR_BODY) + "...";
        return ": " + trimmed;
    }
}
