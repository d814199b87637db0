package com.lumen.controller;

import com.lumen.model.dto.AnalyzeRequest;
import com.lumen.model.dto.FeedbackRequest;
import com.lumen.model.dto.PageResult;
import com.lumen.model.dto.RecordEventRequest;
import com.lumen.model.dto.TelemetryHealth;
import com.lumen.model.dto.TelemetryStats;
import com.lumen.model.dto.TrainModelsRequest;
import com.lumen.model.telemetry.AnalysisKind;
import com.lumen.model.telemetry.Anomaly;
import com.lumen.model.telemetry.LearningFeedback;
import com.lumen.model.telemetry.LearningModel;
import com.lumen.model.telemetry.ModelPerformance;
import com.lumen.model.telemetry.Pattern;
import com.lumen.model.telemetry.Severity;
import com.lumen.model.telemetry.TelemetryEvent;
import com.lumen.model.telemetry.TelemetryEventType;
import com.lumen.model.telemetry.TelemetryInsight;
import com.lumen.model.telemetry.TelemetryReport;
import com.lumen.service.telemetry.TelemetryEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

/**
 * Telemetry ingestion, feedback, analysis and learning-model endpoints.
 * List endpoints page with 1-based {@code page} and {@code limit}.
 */
@Slf4j
@RestController
@RequestMapping("/v1/telemetry")
public class TelemetryController {

    private final TelemetryEngine engine;

    public TelemetryController(TelemetryEngine engine) {
        this.engine = engine;
    }

    @PostMapping("/events")
    public ResponseEntity<TelemetryEvent> recordEvent(@RequestBody RecordEventRequest request) {
        TelemetryEvent event = engine.recordEvent(
                request.getType(), request.getSource(), request.getActorIds(),
                request.getData(), request.getMetadata());
        return ResponseEntity.status(HttpStatus.CREATED).body(event);
    }

    @GetMapping("/events")
    public PageResult<TelemetryEvent> listEvents(
            @RequestParam(required = false) TelemetryEventType type,
            @RequestParam(required = false) String source,
            @RequestParam(required = false) Instant startDate,
            @RequestParam(required = false) Instant endDate,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int limit) {
        return engine.listEvents(type, source, startDate, endDate, page, limit);
    }

    @GetMapping("/events/{id}")
    public TelemetryEvent getEvent(@PathVariable String id) {
        return engine.getEvent(id);
    }

    @PostMapping("/feedback")
    public ResponseEntity<LearningFeedback> provideFeedback(@RequestBody FeedbackRequest request) {
        LearningFeedback feedback = engine.provideFeedback(request);
        log.info("Feedback recorded for event {}: accuracy={}", feedback.getEventId(), feedback.getAccuracy());
        return ResponseEntity.status(HttpStatus.CREATED).body(feedback);
    }

    @GetMapping("/feedback")
    public PageResult<LearningFeedback> listFeedback(
            @RequestParam(required = false) String eventId,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int limit) {
        return engine.listFeedback(eventId, page, limit);
    }

    /**
     * Analyze the events inside a timeframe ("24h" when the body is absent).
     */
    @PostMapping("/analyze")
    public TelemetryReport analyze(@RequestBody(required = false) AnalyzeRequest request) {
        String timeframe = request != null && request.getTimeframe() != null ? request.getTimeframe() : "24h";
        log.info("Telemetry analysis requested: timeframe={}", timeframe);
        return engine.analyze(timeframe);
    }

    @GetMapping("/reports")
    public List<TelemetryReport> reports(@RequestParam(defaultValue = "10") int limit) {
        return engine.recentReports(limit);
    }

    @PostMapping("/train-models")
    public List<LearningModel> trainModels(@RequestBody(required = false) TrainModelsRequest request) {
        List<LearningModel> trained = engine.trainModels(request != null ? request.getTracks() : null);
        log.info("Trained {} learning models", trained.size());
        return trained;
    }

    @GetMapping("/models")
    public List<LearningModel> models() {
        return engine.getModels();
    }

    @GetMapping("/models/{id}/performance")
    public ModelPerformance modelPerformance(@PathVariable String id) {
        return engine.getModelPerformance(id);
    }

    @PostMapping("/models/{id}/deactivate")
    public LearningModel deactivateModel(@PathVariable String id) {
        log.info("Deactivating learning model {}", id);
        return engine.deactivateModel(id);
    }

    @GetMapping("/insights")
    public PageResult<TelemetryInsight> insights(
            @RequestParam(required = false) AnalysisKind type,
            @RequestParam(required = false) Severity severity,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int limit) {
        return engine.getInsights(type, severity, page, limit);
    }

    @GetMapping("/patterns")
    public List<Pattern> patterns() {
        return engine.getPatterns();
    }

    @GetMapping("/anomalies")
    public List<Anomaly> anomalies() {
        return engine.getAnomalies();
    }

    @GetMapping("/health")
    public TelemetryHealth health() {
        return engine.health();
    }

    @GetMapping("/stats")
    public TelemetryStats stats() {
        return engine.stats();
    }
}
