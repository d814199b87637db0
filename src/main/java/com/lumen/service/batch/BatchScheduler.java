package com.lumen.service.batch;

import com.lumen.config.LumenProperties;
import com.lumen.exception.BatchingDisabledException;
import com.lumen.model.BatchRequest;
import com.lumen.model.BatchResponse;
import com.lumen.model.GenerationResult;
import com.lumen.model.Priority;
import com.lumen.model.dto.BatchStatistics;
import com.lumen.model.telemetry.TelemetryData;
import com.lumen.model.telemetry.TelemetryEventType;
import com.lumen.service.telemetry.TelemetryRecorder;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Accumulates generation requests and dispatches them in per-model chunks.
 * <p>
 * A drain takes up to {@code maxRequestsPerDrain} pending requests, groups them by model
 * in first-seen order, orders each group HIGH before MEDIUM before LOW (stable within a
 * priority) and cuts it into chunks of at most {@code chunkSize}. Chunks of one model run
 * one after another and so do the requests inside a chunk; different models run
 * concurrently. Only one drain runs at a time.
 */
@Slf4j
@Service
public class BatchScheduler {

    private static final String SOURCE = "batch-scheduler";

    private final BatchDispatcher dispatcher;
    private final TelemetryRecorder telemetry;
    private final LumenProperties.BatchConfig config;
    private final Clock clock;

    private final Queue<PendingRequest> pending = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final AtomicBoolean drainScheduled = new AtomicBoolean(false);

    private final AtomicLong drainCycles = new AtomicLong();
    private final AtomicLong dispatchedChunks = new AtomicLong();
    private final AtomicLong dispatchedRequests = new AtomicLong();
    private final AtomicLong failedRequests = new AtomicLong();

    private volatile ScheduledExecutorService timer;

    public BatchScheduler(
            BatchDispatcher dispatcher,
            TelemetryRecorder telemetry,
            LumenProperties properties,
            Clock clock) {
        this.dispatcher = dispatcher;
        this.telemetry = telemetry;
        this.config = properties.getBatch();
        this.clock = clock;
    }

    @PostConstruct
    public void start() {
        if (!config.isEnabled()) {
            log.info("Batch scheduling disabled");
            return;
        }
        timer = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "batch-scheduler");
            thread.setDaemon(true);
            return thread;
        });
        log.info("Batch scheduler started: debounce={}ms, chunkSize={}, maxRequestsPerDrain={}",
                config.getDebounce().toMillis(), config.getChunkSize(), config.getMaxRequestsPerDrain());
    }

    @PreDestroy
    public void stop() {
        ScheduledExecutorService current = timer;
        timer = null;
        if (current != null) {
            current.shutdownNow();
        }
        PendingRequest left;
        while ((left = pending.poll()) != null) {
            left.sink.tryEmitError(new IllegalStateException("Batch scheduler stopped"));
        }
    }

    /**
     * Queue a request without waiting for its result; the response is reported through
     * a BATCH_RESPONSE telemetry event.
     *
     * @return the request id
     * @throws BatchingDisabledException when batch scheduling is switched off
     */
    public String enqueue(BatchRequest request) {
        return accept(request).request.getId();
    }

    /**
     * Queue a request and return a handle that completes when it has been dispatched.
     */
    public Mono<BatchResponse> submit(BatchRequest request) {
        return accept(request).sink.asMono();
    }

    private PendingRequest accept(BatchRequest request) {
        if (!config.isEnabled()) {
            throw new BatchingDisabledException();
        }
        if (request.getPrompt() == null || request.getPrompt().isBlank()) {
            throw new IllegalArgumentException("Batch request prompt must not be empty");
        }
        if (request.getModel() == null || request.getModel().isBlank()) {
            throw new IllegalArgumentException("Batch request model must not be empty");
        }

        BatchRequest normalized = request.toBuilder()
                .id(request.getId() != null ? request.getId() : UUID.randomUUID().toString())
                .submittedAt(request.getSubmittedAt() != null ? request.getSubmittedAt() : clock.instant())
                .priority(request.getPriority() != null ? request.getPriority() : Priority.MEDIUM)
                .build();

        PendingRequest entry = new PendingRequest(normalized, Sinks.one());
        pending.offer(entry);
        log.debug("Enqueued batch request {} (model={}, priority={}, pending={})",
                normalized.getId(), normalized.getModel(), normalized.getPriority(), pending.size());
        scheduleDrain();
        return entry;
    }

    private void scheduleDrain() {
        ScheduledExecutorService current = timer;
        if (current == null || !drainScheduled.compareAndSet(false, true)) {
            return;
        }
        current.schedule(this::onTimer, config.getDebounce().toMillis(), TimeUnit.MILLISECONDS);
    }

    private void onTimer() {
        drainScheduled.set(false);
        drain()
                .doFinally(signal -> {
                    if (!pending.isEmpty()) {
                        scheduleDrain();
                    }
                })
                .subscribe(
                        summary -> { },
                        error -> log.error("Batch drain failed", error));
    }

    /**
     * Run one drain cycle. Returns an empty summary when another drain is running or
     * nothing is pending.
     */
    public Mono<DrainSummary> drain() {
        return Mono.defer(() -> {
            if (!draining.compareAndSet(false, true)) {
                log.debug("Batch drain already running, skipping");
                return Mono.just(DrainSummary.empty());
            }

            List<PendingRequest> taken = take();
            if (taken.isEmpty()) {
                draining.set(false);
                return Mono.just(DrainSummary.empty());
            }
            drainCycles.incrementAndGet();

            Map<String, List<PendingRequest>> byModel = new LinkedHashMap<>();
            for (PendingRequest entry : taken) {
                byModel.computeIfAbsent(entry.request.getModel(), model -> new ArrayList<>()).add(entry);
            }

            return Flux.fromIterable(byModel.entrySet())
                    .flatMapSequential(group -> dispatchModel(group.getKey(), group.getValue()))
                    .collectList()
                    .map(DrainSummary::new)
                    .doOnNext(summary -> log.info("Batch drain dispatched {} requests in {} chunks across {} models ({} still pending)",
                            summary.requestCount(), summary.getChunks().size(), byModel.size(), pending.size()))
                    .doFinally(signal -> draining.set(false));
        });
    }

    private List<PendingRequest> take() {
        List<PendingRequest> taken = new ArrayList<>();
        PendingRequest next;
        while (taken.size() < config.getMaxRequestsPerDrain() && (next = pending.poll()) != null) {
            taken.add(next);
        }
        return taken;
    }

    private Flux<DrainSummary.DispatchedChunk> dispatchModel(String model, List<PendingRequest> requests) {
        List<PendingRequest> ordered = new ArrayList<>(requests);
        // List.sort is stable, so arrival order holds within a priority
        ordered.sort(Comparator.comparingInt(entry -> entry.request.getPriority().getRank()));

        List<List<PendingRequest>> chunks = new ArrayList<>();
        for (int from = 0; from < ordered.size(); from += config.getChunkSize()) {
            chunks.add(ordered.subList(from, Math.min(from + config.getChunkSize(), ordered.size())));
        }

        return Flux.fromIterable(chunks)
                .concatMap(chunk -> dispatchChunk(model, chunk));
    }

    private Mono<DrainSummary.DispatchedChunk> dispatchChunk(String model, List<PendingRequest> chunk) {
        List<String> ids = chunk.stream().map(entry -> entry.request.getId()).collect(Collectors.toList());
        log.debug("Dispatching chunk of {} for model {}", chunk.size(), model);

        return Flux.fromIterable(chunk)
                .concatMap(entry -> dispatchOne(entry, chunk.size()))
                .then(Mono.fromSupplier(() -> {
                    dispatchedChunks.incrementAndGet();
                    return new DrainSummary.DispatchedChunk(model, ids, chunk.size());
                }));
    }

    private Mono<Void> dispatchOne(PendingRequest entry, int batchSize) {
        BatchRequest request = entry.request;
        return Mono.defer(() -> {
            long start = System.nanoTime();
            return dispatcher.dispatch(request)
                    .switchIfEmpty(Mono.error(() -> new IllegalStateException(
                            "Dispatcher completed without a result for " + request.getId())))
                    .map(result -> toResponse(request, result, batchSize, (System.nanoTime() - start) / 1_000_000));
        })
                .doOnNext(response -> {
                    dispatchedRequests.incrementAndGet();
                    recordResponse(request, response);
                    entry.sink.tryEmitValue(response);
                })
                .onErrorResume(error -> {
                    failedRequests.incrementAndGet();
                    entry.sink.tryEmitError(error);
                    return Mono.empty();
                })
                .then();
    }

    private BatchResponse toResponse(BatchRequest request, GenerationResult result, int batchSize, long elapsedMs) {
        return BatchResponse.builder()
                .id(request.getId())
                .content(result.getContent())
                .model(result.getModel() != null ? result.getModel() : request.getModel())
                .processingTimeMs(elapsedMs)
                .servedFromCache(false)
                .batchSize(batchSize)
                .tokenUsage(result.getTokenUsage())
                .build();
    }

    private void recordResponse(BatchRequest request, BatchResponse response) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("requestId", response.getId());
        parameters.put("model", response.getModel());
        parameters.put("priority", request.getPriority().name());
        parameters.put("batchSize", response.getBatchSize());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("servedFromCache", response.isServedFromCache());
        result.put("contentLength", response.getContent() != null ? response.getContent().length() : 0);

        telemetry.record(TelemetryEventType.BATCH_RESPONSE, SOURCE, TelemetryData.builder()
                .operation("batch_response")
                .parameters(parameters)
                .result(result)
                .durationMs(response.getProcessingTimeMs())
                .build());
    }

    public BatchStatistics stats() {
        return BatchStatistics.builder()
                .pending(pending.size())
                .draining(draining.get())
                .drainCycles(drainCycles.get())
                .dispatchedChunks(dispatchedChunks.get())
                .dispatchedRequests(dispatchedRequests.get())
                .failedRequests(failedRequests.get())
                .build();
    }

    private static final class PendingRequest {
        private final BatchRequest request;
        private final Sinks.One<BatchResponse> sink;

        private PendingRequest(BatchRequest request, Sinks.One<BatchResponse> sink) {
            this.request = request;
            this.sink = sink;
        }
    }
}
