package com.lumen.service.batch;

import com.lumen.config.LumenProperties;
import com.lumen.exception.BatchingDisabledException;
import com.lumen.model.BatchRequest;
import com.lumen.model.BatchResponse;
import com.lumen.model.GenerationResult;
import com.lumen.model.Priority;
import com.lumen.model.TokenUsage;
import com.lumen.model.dto.BatchStatistics;
import com.lumen.model.telemetry.TelemetryEventType;
import com.lumen.service.telemetry.TelemetryRecorder;
import com.lumen.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Tests for BatchScheduler. Most tests trigger drains directly; the timer tests start the scheduler.
 */
class BatchSchedulerTest {

    private final List<String> dispatchedPrompts = new CopyOnWriteArrayList<>();

    private TelemetryRecorder telemetry;
    private LumenProperties properties;
    private BatchScheduler scheduler;

    @BeforeEach
    void setUp() {
        telemetry = mock(TelemetryRecorder.class);
        properties = new LumenProperties();
        properties.getBatch().setChunkSize(10);
        properties.getBatch().setMaxRequestsPerDrain(100);

        BatchDispatcher dispatcher = request -> {
            dispatchedPrompts.add(request.getPrompt());
            if (request.getPrompt().startsWith("fail")) {
                return Mono.error(new IllegalStateException("runtime rejected " + request.getPrompt()));
            }
            return Mono.just(GenerationResult.builder()
                    .content("echo: " + request.getPrompt())
                    .model(request.getModel())
                    .tokenUsage(TokenUsage.of(3, 5))
                    .build());
        };

        scheduler = new BatchScheduler(dispatcher, telemetry, properties,
                MutableClock.startingAt("2024-05-01T10:00:00Z"));
    }

    private static BatchRequest request(String prompt, String model, Priority priority) {
        return BatchRequest.builder()
                .prompt(prompt)
                .model(model)
                .priority(priority)
                .build();
    }

    @Test
    void testHigherPriorityDispatchesFirst() {
        scheduler.enqueue(request("low", "llama3:8b", Priority.LOW));
        scheduler.enqueue(request("high", "llama3:8b", Priority.HIGH));
        scheduler.enqueue(request("medium", "llama3:8b", Priority.MEDIUM));

        scheduler.drain().block();

        assertEquals(List.of("high", "medium", "low"), dispatchedPrompts);
    }

    @Test
    void testSamePriorityKeepsArrivalOrder() {
        scheduler.enqueue(request("first", "m", Priority.MEDIUM));
        scheduler.enqueue(request("urgent", "m", Priority.HIGH));
        scheduler.enqueue(request("second", "m", Priority.MEDIUM));
        scheduler.enqueue(request("third", "m", Priority.MEDIUM));

        scheduler.drain().block();

        assertEquals(List.of("urgent", "first", "second", "third"), dispatchedPrompts);
    }

    @Test
    void testRequestsAreChunkedPerModel() {
        for (int i = 0; i < 12; i++) {
            scheduler.enqueue(request("p" + i, "llama3:8b", Priority.MEDIUM));
        }

        DrainSummary summary = scheduler.drain().block();

        assertNotNull(summary);
        assertEquals(List.of(10, 2), summary.getChunks().stream()
                .map(DrainSummary.DispatchedChunk::getSize)
                .collect(Collectors.toList()));
        assertEquals(12, summary.requestCount());
        verify(telemetry, times(12)).record(eq(TelemetryEventType.BATCH_RESPONSE), any(), any());
    }

    @Test
    void testModelsAreGroupedSeparately() {
        scheduler.enqueue(request("a1", "llama3:8b", Priority.MEDIUM));
        scheduler.enqueue(request("b1", "mistral:7b", Priority.MEDIUM));
        scheduler.enqueue(request("a2", "llama3:8b", Priority.MEDIUM));

        DrainSummary summary = scheduler.drain().block();

        assertNotNull(summary);
        assertEquals(2, summary.getChunks().size());
        assertEquals("llama3:8b", summary.getChunks().get(0).getModel());
        assertEquals(2, summary.getChunks().get(0).getSize());
        assertEquals("mistral:7b", summary.getChunks().get(1).getModel());
    }

    @Test
    void testFailureOnlyAffectsItsOwnRequest() {
        Mono<BatchResponse> ok1 = scheduler.submit(request("ok-1", "m", Priority.MEDIUM));
        Mono<BatchResponse> failed = scheduler.submit(request("fail-1", "m", Priority.MEDIUM));
        Mono<BatchResponse> ok2 = scheduler.submit(request("ok-2", "m", Priority.MEDIUM));

        scheduler.drain().block();

        StepVerifier.create(ok1)
                .assertNext(response -> {
                    assertEquals("echo: ok-1", response.getContent());
                    assertEquals(3, response.getBatchSize());
                    assertFalse(response.isServedFromCache());
                })
                .verifyComplete();
        StepVerifier.create(failed)
                .expectErrorMatches(error -> error.getMessage().contains("fail-1"))
                .verify();
        StepVerifier.create(ok2)
                .assertNext(response -> assertEquals("echo: ok-2", response.getContent()))
                .verifyComplete();

        BatchStatistics stats = scheduler.stats();
        assertEquals(2, stats.getDispatchedRequests());
        assertEquals(1, stats.getFailedRequests());
        assertEquals(1, stats.getDrainCycles());
    }

    @Test
    void testDrainTakesAtMostConfiguredRequests() {
        properties.getBatch().setMaxRequestsPerDrain(5);
        for (int i = 0; i < 7; i++) {
            scheduler.enqueue(request("p" + i, "m", Priority.MEDIUM));
        }

        DrainSummary first = scheduler.drain().block();
        assertNotNull(first);
        assertEquals(5, first.requestCount());
        assertEquals(2, scheduler.stats().getPending());

        DrainSummary second = scheduler.drain().block();
        assertNotNull(second);
        assertEquals(2, second.requestCount());
        assertEquals(0, scheduler.stats().getPending());
    }

    @Test
    void testEmptyDrainDispatchesNothing() {
        DrainSummary summary = scheduler.drain().block();

        assertNotNull(summary);
        assertTrue(summary.getChunks().isEmpty());
        assertEquals(0, scheduler.stats().getDrainCycles());
    }

    @Test
    void testEnqueueAssignsIdAndRejectsBlankInput() {
        String id = scheduler.enqueue(request("hello", "m", null));

        assertNotNull(id);
        assertFalse(id.isBlank());
        assertEquals(1, scheduler.stats().getPending());

        assertThrows(IllegalArgumentException.class, () -> scheduler.enqueue(request(" ", "m", Priority.LOW)));
        assertThrows(IllegalArgumentException.class, () -> scheduler.enqueue(request("hi", null, Priority.LOW)));
    }

    @Test
    void testStopFailsPendingHandles() {
        Mono<BatchResponse> pending = scheduler.submit(request("never", "m", Priority.LOW));

        scheduler.stop();

        StepVerifier.create(pending)
                .expectError(IllegalStateException.class)
                .verify();
    }

    @Test
    void testDisabledSchedulerRejectsRequests() {
        properties.getBatch().setEnabled(false);

        assertThrows(BatchingDisabledException.class, () -> scheduler.enqueue(request("hello", "m", Priority.LOW)));
        assertThrows(BatchingDisabledException.class, () -> scheduler.submit(request("hello", "m", Priority.LOW)));
        assertEquals(0, scheduler.stats().getPending());
    }

    @Test
    void testTimerDrainsEverythingOverSeveralCycles() {
        properties.getBatch().setDebounce(Duration.ofMillis(20));
        properties.getBatch().setMaxRequestsPerDrain(5);
        scheduler.start();
        try {
            List<Mono<BatchResponse>> handles = new ArrayList<>();
            for (int i = 0; i < 12; i++) {
                handles.add(scheduler.submit(request("p" + i, "m", Priority.MEDIUM)));
            }

            List<BatchResponse> responses = Flux.merge(handles).collectList().block(Duration.ofSeconds(10));

            assertNotNull(responses);
            assertEquals(12, responses.size());
            assertEquals(12, dispatchedPrompts.size());
            BatchStatistics stats = scheduler.stats();
            assertEquals(0, stats.getPending());
            assertEquals(12, stats.getDispatchedRequests());
            assertTrue(stats.getDrainCycles() >= 3, "expected at least 3 drain cycles, got " + stats.getDrainCycles());
        } finally {
            scheduler.stop();
        }
    }

    @Test
    void testTimerRearmsForLateArrivals() {
        properties.getBatch().setDebounce(Duration.ofMillis(20));
        scheduler.start();
        try {
            BatchResponse first = scheduler.submit(request("early", "m", Priority.MEDIUM)).block(Duration.ofSeconds(10));
            BatchResponse second = scheduler.submit(request("late", "m", Priority.MEDIUM)).block(Duration.ofSeconds(10));

            assertNotNull(first);
            assertNotNull(second);
            assertEquals("echo: late", second.getContent());
            assertEquals(2, scheduler.stats().getDrainCycles());
        } finally {
            scheduler.stop();
        }
    }
}
