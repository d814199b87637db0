package com.lumen.controller;

import com.lumen.model.RuntimeHealth;
import com.lumen.model.RuntimeModel;
import com.lumen.model.dto.ConnectorStatus;
import com.lumen.model.dto.GenerateRequest;
import com.lumen.model.dto.GenerateResponse;
import com.lumen.model.dto.StreamFragment;
import com.lumen.service.InferenceGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Generation and runtime management endpoints.
 */
@Slf4j
@RestController
@RequestMapping("/v1")
public class GenerationController {

    private final InferenceGateway gateway;

    public GenerationController(InferenceGateway gateway) {
        this.gateway = gateway;
    }

    /**
     * Generate text. With {@code stream=true} the body is NDJSON, one fragment per line.
     */
    @PostMapping(value = "/generate", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<?>> generate(@RequestBody GenerateRequest request) {
        log.info("Received generate request: model={}, stream={}", request.getModel(), request.getStream());

        if (Boolean.TRUE.equals(request.getStream())) {
            Flux<StreamFragment> fragments = gateway
                    .generateTextStream(request.getPrompt(), request.toOptions(), request.getActorId())
                    .map(StreamFragment::new);
            return Mono.just(ResponseEntity.ok()
                    .contentType(MediaType.APPLICATION_NDJSON)
                    .body(fragments));
        }

        long start = System.nanoTime();
        return gateway.generateText(request.getPrompt(), request.toOptions(), request.getActorId())
                .map(text -> ResponseEntity.ok(GenerateResponse.builder()
                        .model(request.getModel())
                        .response(text)
                        .durationMs((System.nanoTime() - start) / 1_000_000)
                        .build()));
    }

    @GetMapping("/models")
    public Mono<List<RuntimeModel>> listModels() {
        return gateway.listModels();
    }

    @GetMapping("/health")
    public Mono<RuntimeHealth> health() {
        return gateway.health();
    }

    @PostMapping("/models/pull")
    public Mono<ResponseEntity<Map<String, String>>> pullModel(@RequestBody Map<String, String> body) {
        String name = body.get("name");
        return gateway.pullModel(name)
                .then(Mono.fromSupplier(() -> ResponseEntity.status(HttpStatus.OK)
                        .body(Map.of("status", "success", "model", name))));
    }

    @GetMapping("/status")
    public ConnectorStatus status() {
        return gateway.status();
    }
}
