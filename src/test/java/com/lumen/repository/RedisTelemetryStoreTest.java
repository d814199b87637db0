package com.lumen.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lumen.config.JacksonConfiguration;
import com.lumen.model.telemetry.LearningFeedback;
import com.lumen.model.telemetry.LearningModel;
import com.lumen.model.telemetry.LearningTrack;
import com.lumen.model.telemetry.ModelStatus;
import com.lumen.model.telemetry.TelemetryReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for RedisTelemetryStore against mocked Redis operations.
 */
class RedisTelemetryStoreTest {

    private ObjectMapper objectMapper;
    private ListOperations<String, String> listOps;
    private HashOperations<String, Object, Object> hashOps;
    private RedisTelemetryStore store;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        objectMapper = JacksonConfiguration.configure(new ObjectMapper());
        StringRedisTemplate redisTemplate = mock(StringRedisTemplate.class);
        listOps = mock(ListOperations.class);
        hashOps = mock(HashOperations.class);
        when(redisTemplate.opsForList()).thenReturn(listOps);
        doReturn(hashOps).when(redisTemplate).opsForHash();

        store = new RedisTelemetryStore(redisTemplate, objectMapper);
    }

    @Test
    void testAppendReportPushesAndTrims() {
        store.appendReport(TelemetryReport.builder().id("rep-1").period("24h").build());

        verify(listOps).leftPush(eq(RedisTelemetryStore.REPORTS_KEY), anyString());
        verify(listOps).trim(RedisTelemetryStore.REPORTS_KEY, 0, 99);
    }

    @Test
    void testRecentReportsDeserialize() throws Exception {
        String json = objectMapper.writeValueAsString(TelemetryReport.builder()
                .id("rep-2")
                .timestamp(Instant.parse("2024-05-01T10:00:00Z"))
                .period("6h")
                .build());
        when(listOps.range(RedisTelemetryStore.REPORTS_KEY, 0, 4)).thenReturn(List.of(json));

        List<TelemetryReport> reports = store.recentReports(5);

        assertEquals(1, reports.size());
        assertEquals("rep-2", reports.get(0).getId());
        assertEquals(Instant.parse("2024-05-01T10:00:00Z"), reports.get(0).getTimestamp());
    }

    @Test
    void testFeedbackRoundTripsThroughList() throws Exception {
        LearningFeedback feedback = LearningFeedback.builder().id("fb-1").eventId("evt-1").accuracy(0.9).build();
        when(listOps.range(RedisTelemetryStore.FEEDBACK_KEY, 0, -1))
                .thenReturn(List.of(objectMapper.writeValueAsString(feedback)));
        when(listOps.size(RedisTelemetryStore.FEEDBACK_KEY)).thenReturn(1L);

        store.appendFeedback(feedback);

        verify(listOps).rightPush(eq(RedisTelemetryStore.FEEDBACK_KEY), anyString());
        assertEquals(1, store.feedbackCount());
        assertEquals(0.9, store.listFeedback().get(0).getAccuracy(), 1e-9);
    }

    @Test
    void testModelsAreStoredInHash() throws Exception {
        LearningModel model = LearningModel.builder()
                .id("model-1")
                .track(LearningTrack.USAGE_CLUSTERING)
                .version("1.0.0")
                .status(ModelStatus.ACTIVE)
                .build();
        when(hashOps.values(RedisTelemetryStore.MODELS_KEY))
                .thenReturn(List.of(objectMapper.writeValueAsString(model)));

        store.saveModel(model);

        verify(hashOps).put(eq(RedisTelemetryStore.MODELS_KEY), eq("model-1"), anyString());
        List<LearningModel> loaded = store.loadModels();
        assertEquals(1, loaded.size());
        assertEquals(LearningTrack.USAGE_CLUSTERING, loaded.get(0).getTrack());
    }

    @Test
    void testDeleteModelRemovesHashField() {
        store.deleteModel("model-1");

        verify(hashOps).delete(RedisTelemetryStore.MODELS_KEY, "model-1");
    }

    @Test
    void testRedisFailuresDegradeToEmptyReads() {
        when(listOps.range(anyString(), anyLong(), anyLong()))
                .thenThrow(new RedisConnectionFailureException("connection refused"));
        when(listOps.size(anyString())).thenThrow(new RedisConnectionFailureException("connection refused"));

        assertTrue(store.recentReports(10).isEmpty());
        assertTrue(store.listFeedback().isEmpty());
        assertEquals(0, store.feedbackCount());
    }
}
