package com.lumen.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lumen.model.telemetry.LearningFeedback;
import com.lumen.model.telemetry.LearningModel;
import com.lumen.model.telemetry.TelemetryReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;

/**
 * Redis-backed telemetry store. Values are JSON strings.
 * <p>
 * Keys:
 * <ul>
 *   <li>{@code lumen:telemetry:reports} list, newest first, capped</li>
 *   <li>{@code lumen:telemetry:feedback} list, arrival order</li>
 *   <li>{@code lumen:telemetry:models} hash of model id to snapshot</li>
 * </ul>
 * Redis failures are logged and degrade to empty reads; telemetry never fails a caller.
 */
@Slf4j
@Repository
@ConditionalOnProperty(prefix = "lumen.telemetry", name = "store", havingValue = "redis")
public class RedisTelemetryStore implements TelemetryStore {

    static final String REPORTS_KEY = "lumen:telemetry:reports";
    static final String FEEDBACK_KEY = "lumen:telemetry:feedback";
    static final String MODELS_KEY = "lumen:telemetry:models";
    private static final long MAX_REPORTS = 100;

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    public RedisTelemetryStore(
            @Qualifier("telemetryRedisTemplate") StringRedisTemplate redisTemplate,
            ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void appendReport(TelemetryReport report) {
        try {
            redisTemplate.opsForList().leftPush(REPORTS_KEY, objectMapper.writeValueAsString(report));
            redisTemplate.opsForList().trim(REPORTS_KEY, 0, MAX_REPORTS - 1);
            log.debug("Stored telemetry report in Redis: id={}", report.getId());
        } catch (Exception e) {
            log.error("Error storing telemetry report in Redis: id={}", report.getId(), e);
        }
    }

    @Override
    public List<TelemetryReport> recentReports(int limit) {
        try {
            List<String> values = redisTemplate.opsForList().range(REPORTS_KEY, 0, limit - 1L);
            return readAll(values, TelemetryReport.class);
        } catch (Exception e) {
            log.error("Error reading telemetry reports from Redis", e);
            return List.of();
        }
    }

    @Override
    public void appendFeedback(LearningFeedback feedback) {
        try {
            redisTemplate.opsForList().rightPush(FEEDBACK_KEY, objectMapper.writeValueAsString(feedback));
        } catch (Exception e) {
            log.error("Error storing feedback in Redis: id={}", feedback.getId(), e);
        }
    }

    @Override
    public List<LearningFeedback> listFeedback() {
        try {
            List<String> values = redisTemplate.opsForList().range(FEEDBACK_KEY, 0, -1);
            return readAll(values, LearningFeedback.class);
        } catch (Exception e) {
            log.error("Error reading feedback from Redis", e);
            return List.of();
        }
    }

    @Override
    public long feedbackCount() {
        try {
            Long size = redisTemplate.opsForList().size(FEEDBACK_KEY);
            return size != null ? size : 0L;
        } catch (Exception e) {
            log.error("Error counting feedback in Redis", e);
            return 0L;
        }
    }

    @Override
    public void saveModel(LearningModel model) {
        try {
            redisTemplate.opsForHash().put(MODELS_KEY, model.getId(), objectMapper.writeValueAsString(model));
        } catch (Exception e) {
            log.error("Error storing model snapshot in Redis: id={}", model.getId(), e);
        }
    }

    @Override
    public List<LearningModel> loadModels() {
        try {
            List<Object> values = redisTemplate.opsForHash().values(MODELS_KEY);
            List<LearningModel> models = new ArrayList<>(values.size());
            for (Object value : values) {
                models.add(objectMapper.readValue(value.toString(), LearningModel.class));
            }
            return models;
        } catch (Exception e) {
            log.error("Error loading model snapshots from Redis", e);
            return List.of();
        }
    }

    @Override
    public void deleteModel(String modelId) {
        try {
            redisTemplate.opsForHash().delete(MODELS_KEY, modelId);
        } catch (Exception e) {
            log.error("Error deleting model snapshot from Redis: id={}", modelId, e);
        }
    }

    private <T> List<T> readAll(List<String> values, Class<T> type) throws JsonProcessingException {
        if (values == null) {
            return List.of();
        }
        List<T> result = new ArrayList<>(values.size());
        for (String value : values) {
            result.add(objectMapper.readValue(value, type));
        }
        return result;
    }
}
