package com.lumen.controller;

import com.lumen.exception.BatchingDisabledException;
import com.lumen.model.BatchRequest;
import com.lumen.model.Priority;
import com.lumen.model.dto.BatchStatistics;
import com.lumen.runtime.RuntimeRequestFactory;
import com.lumen.service.batch.BatchScheduler;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Web layer tests for BatchController.
 */
@WebFluxTest(controllers = BatchController.class)
class BatchControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private BatchScheduler batchScheduler;

    @MockBean
    private RuntimeRequestFactory requestFactory;

    @Test
    void testSubmitIsAccepted() {
        when(requestFactory.resolveModel(any())).thenReturn("llama3:8b");
        when(batchScheduler.enqueue(any())).thenReturn("req-1");

        webTestClient.post().uri("/v1/batch")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("prompt", "classify this", "priority", "HIGH"))
                .exchange()
                .expectStatus().isAccepted()
                .expectBody()
                .jsonPath("$.id").isEqualTo("req-1")
                .jsonPath("$.status").isEqualTo("queued");

        ArgumentCaptor<BatchRequest> request = ArgumentCaptor.forClass(BatchRequest.class);
        verify(batchScheduler).enqueue(request.capture());
        assertEquals("llama3:8b", request.getValue().getModel());
        assertEquals(Priority.HIGH, request.getValue().getPriority());
        assertFalse(request.getValue().getOptions().isUrgent());
    }

    @Test
    void testSubmitWhileBatchingDisabled() {
        when(requestFactory.resolveModel(any())).thenReturn("llama3:8b");
        when(batchScheduler.enqueue(any())).thenThrow(new BatchingDisabledException());

        webTestClient.post().uri("/v1/batch")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("prompt", "classify this"))
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.title").isEqualTo("batching_disabled");
    }

    @Test
    void testStats() {
        when(batchScheduler.stats()).thenReturn(BatchStatistics.builder().pending(4).drainCycles(2).build());

        webTestClient.get().uri("/v1/batch/stats")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.pending").isEqualTo(4)
                .jsonPath("$.drainCycles").isEqualTo(2);
    }
}
