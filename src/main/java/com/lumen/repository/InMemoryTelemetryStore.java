package com.lumen.repository;

import com.lumen.model.telemetry.LearningFeedback;
import com.lumen.model.telemetry.LearningModel;
import com.lumen.model.telemetry.TelemetryReport;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Process-local telemetry store. Keeps the last {@value #MAX_REPORTS} reports.
 */
@Repository
@ConditionalOnProperty(prefix = "lumen.telemetry", name = "store", havingValue = "memory", matchIfMissing = true)
public class InMemoryTelemetryStore implements TelemetryStore {

    static final int MAX_REPORTS = 100;

    private final Deque<TelemetryReport> reports = new ArrayDeque<>();
    private final List<LearningFeedback> feedback = new ArrayList<>();
    private final Map<String, LearningModel> models = new LinkedHashMap<>();

    @Override
    public synchronized void appendReport(TelemetryReport report) {
        reports.addFirst(report);
        while (reports.size() > MAX_REPORTS) {
            reports.removeLast();
        }
    }

    @Override
    public synchronized List<TelemetryReport> recentReports(int limit) {
        List<TelemetryReport> result = new ArrayList<>(Math.min(limit, reports.size()));
        Iterator<TelemetryReport> it = reports.iterator();
        while (it.hasNext() && result.size() < limit) {
            result.add(it.next());
        }
        return result;
    }

    @Override
    public synchronized void appendFeedback(LearningFeedback entry) {
        feedback.add(entry);
    }

    @Override
    public synchronized List<LearningFeedback> listFeedback() {
        return List.copyOf(feedback);
    }

    @Override
    public synchronized long feedbackCount() {
        return feedback.size();
    }

    @Override
    public synchronized void saveModel(LearningModel model) {
        models.put(model.getId(), model.toBuilder().build());
    }

    @Override
    public synchronized List<LearningModel> loadModels() {
        List<LearningModel> result = new ArrayList<>(models.size());
        models.values().forEach(model -> result.add(model.toBuilder().build()));
        return result;
    }

    @Override
    public synchronized void deleteModel(String modelId) {
        models.remove(modelId);
    }
}
