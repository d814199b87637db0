package com.lumen.service.telemetry;

import com.lumen.config.LumenProperties;
import com.lumen.exception.ResourceNotFoundException;
import com.lumen.model.dto.FeedbackRequest;
import com.lumen.model.dto.PageResult;
import com.lumen.model.dto.TelemetryHealth;
import com.lumen.model.dto.TelemetryStats;
import com.lumen.model.telemetry.AnalysisKind;
import com.lumen.model.telemetry.Anomaly;
import com.lumen.model.telemetry.Correction;
import com.lumen.model.telemetry.DerivedAnalysis;
import com.lumen.model.telemetry.LearningFeedback;
import com.lumen.model.telemetry.LearningModel;
import com.lumen.model.telemetry.LearningTrack;
import com.lumen.model.telemetry.ModelPerformance;
import com.lumen.model.telemetry.Pattern;
import com.lumen.model.telemetry.Severity;
import com.lumen.model.telemetry.TelemetryData;
import com.lumen.model.telemetry.TelemetryEvent;
import com.lumen.model.telemetry.TelemetryEventType;
import com.lumen.model.telemetry.TelemetryInsight;
import com.lumen.model.telemetry.TelemetryMetadata;
import com.lumen.model.telemetry.TelemetryReport;
import com.lumen.model.telemetry.TrainingData;
import com.lumen.repository.TelemetryStore;
import com.lumen.service.scoring.ScoringStrategy;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
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
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Event-sourced telemetry pipeline.
 * <p>
 * {@link #recordEvent} only appends to the event log and the processing queue. A timer
 * drains the queue in batches through {@link EventAnalyzer}; only one drain runs at a time.
 * The queue holds at most {@code maxEvents} events; when it is full the oldest queued event
 * is dropped unanalyzed. A second timer retrains the learning models.
 */
@Slf4j
@Service
public class TelemetryEngine implements TelemetryRecorder {

    private static final String SOURCE = "telemetry-engine";

    private final LumenProperties.TelemetryConfig config;
    private final EventAnalyzer eventAnalyzer;
    private final TelemetryAnalyzer telemetryAnalyzer;
    private final ModelRegistry modelRegistry;
    private final TelemetryStore store;
    private final ResourceUsageProvider resourceUsageProvider;
    private final ScoringStrategy scoringStrategy;
    private final Clock clock;

    // Guarded by itself; insertion order is arrival order
    private final Map<String, TelemetryEvent> events = new LinkedHashMap<>();
    private final Queue<TelemetryEvent> queue = new ConcurrentLinkedQueue<>();
    private final AtomicInteger queueLength = new AtomicInteger();
    private final AtomicBoolean processing = new AtomicBoolean(false);

    // Derived records, guarded by derivedLock
    private final Object derivedLock = new Object();
    private final Map<String, Pattern> patterns = new LinkedHashMap<>();
    private final Deque<TelemetryInsight> insights = new ArrayDeque<>();
    private final Deque<Anomaly> anomalies = new ArrayDeque<>();

    private final AtomicLong processedEvents = new AtomicLong();
    private final AtomicLong analysisFailures = new AtomicLong();
    private final AtomicLong droppedEvents = new AtomicLong();

    private ScheduledExecutorService scheduler;

    public TelemetryEngine(
            LumenProperties properties,
            EventAnalyzer eventAnalyzer,
            TelemetryAnalyzer telemetryAnalyzer,
            ModelRegistry modelRegistry,
            TelemetryStore store,
            ResourceUsageProvider resourceUsageProvider,
            ScoringStrategy scoringStrategy,
            Clock clock) {
        this.config = properties.getTelemetry();
        this.eventAnalyzer = eventAnalyzer;
        this.telemetryAnalyzer = telemetryAnalyzer;
        this.modelRegistry = modelRegistry;
        this.store = store;
        this.resourceUsageProvider = resourceUsageProvider;
        this.scoringStrategy = scoringStrategy;
        this.clock = clock;
    }

    @PostConstruct
    public void start() {
        if (!config.isEnabled()) {
            log.info("Telemetry processing disabled");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "telemetry-engine");
            thread.setDaemon(true);
            return thread;
        });
        long drainMs = config.getProcessingInterval().toMillis();
        long trainMs = config.getTrainingInterval().toMillis();
        scheduler.scheduleWithFixedDelay(this::drainQuietly, drainMs, drainMs, TimeUnit.MILLISECONDS);
        scheduler.scheduleWithFixedDelay(this::trainQuietly, trainMs, trainMs, TimeUnit.MILLISECONDS);
        log.info("Telemetry engine started: drain every {}ms (batch {}), training every {}ms",
                drainMs, config.getBatchSize(), trainMs);
    }

    @PreDestroy
    public void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }

    // ==================== Recording ====================

    /**
     * Append an event and queue it for analysis. Never blocks on analysis.
     */
    @Override
    public TelemetryEvent recordEvent(TelemetryEventType type, String source, List<String> actorIds,
                                      TelemetryData data, TelemetryMetadata metadata) {
        if (type == null) {
            throw new IllegalArgumentException("Event type is required");
        }
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("Event source is required");
        }

        TelemetryData effectiveData = data != null ? data : TelemetryData.builder().build();
        if (effectiveData.getDurationMs() < 0) {
            throw new IllegalArgumentException("Event duration must not be negative");
        }
        if (effectiveData.getResourceUsage() == null) {
            effectiveData = effectiveData.toBuilder()
                    .resourceUsage(resourceUsageProvider.current())
                    .build();
        }

        TelemetryEvent event = TelemetryEvent.builder()
                .id(UUID.randomUUID().toString())
                .timestamp(clock.instant())
                .type(type)
                .source(source)
                .actorIds(actorIds != null ? List.copyOf(actorIds) : List.of())
                .data(effectiveData)
                .metadata(withDefaults(metadata))
                .build();

        if (!config.isEnabled()) {
            return event;
        }

        synchronized (events) {
            events.put(event.getId(), event);
            Iterator<String> oldest = events.keySet().iterator();
            while (events.size() > config.getMaxEvents() && oldest.hasNext()) {
                oldest.next();
                oldest.remove();
            }
        }
        enqueue(event);

        log.debug("Recorded telemetry event: type={}, source={}, id={}", type, source, event.getId());
        return event;
    }

    private void enqueue(TelemetryEvent event) {
        queue.offer(event);
        if (queueLength.incrementAndGet() <= config.getMaxEvents()) {
            return;
        }
        TelemetryEvent dropped = queue.poll();
        if (dropped != null) {
            queueLength.decrementAndGet();
            if (droppedEvents.incrementAndGet() == 1) {
                log.warn("Telemetry queue full ({} events), dropping oldest unanalyzed events", config.getMaxEvents());
            }
            log.debug("Dropped queued telemetry event {} ({})", dropped.getId(), dropped.getType());
        }
    }

    private TelemetryMetadata withDefaults(TelemetryMetadata metadata) {
        TelemetryMetadata base = metadata != null ? metadata : TelemetryMetadata.builder().build();
        return base.toBuilder()
                .version(base.getVersion() != null ? base.getVersion() : config.getVersion())
                .environment(base.getEnvironment() != null ? base.getEnvironment() : config.getEnvironment())
                .instanceId(base.getInstanceId() != null ? base.getInstanceId() : config.getInstanceId())
                .build();
    }

    // ==================== Processing ====================

    /**
     * Analyze up to {@code batchSize} queued events in arrival order.
     * A call made while another drain is running returns 0 without touching the queue.
     *
     * @return number of events this call analyzed
     */
    public int drain() {
        if (!processing.compareAndSet(false, true)) {
            log.debug("Telemetry drain already running, skipping");
            return 0;
        }

        int processed = 0;
        try {
            List<TelemetryEvent> batch = new ArrayList<>();
            TelemetryEvent next;
            while (batch.size() < config.getBatchSize() && (next = queue.poll()) != null) {
                queueLength.decrementAndGet();
                batch.add(next);
            }

            for (TelemetryEvent event : batch) {
                if (processEvent(event)) {
                    processed++;
                }
            }

            if (!batch.isEmpty()) {
                pruneDerivedRecords();
                log.info("Processed {} telemetry events ({} dequeued, {} queued)",
                        processed, batch.size(), queueLength.get());
            }
        } finally {
            processing.set(false);
        }
        return processed;
    }

    private boolean processEvent(TelemetryEvent event) {
        if (event.isProcessed()) {
            return false;
        }

        try {
            DerivedAnalysis analysis = eventAnalyzer.analyze(event);
            event.attachAnalysis(analysis);
            collectDerivedRecords(event, analysis);

            if (!event.markProcessed()) {
                return false;
            }
            processedEvents.incrementAndGet();
            return true;

        } catch (RuntimeException e) {
            analysisFailures.incrementAndGet();
            log.error("Error analyzing telemetry event {} ({})", event.getId(), event.getType(), e);
            if (event.getType() != TelemetryEventType.ANALYSIS_FAILURE) {
                Map<String, Object> parameters = new LinkedHashMap<>();
                parameters.put("eventId", event.getId());
                parameters.put("eventType", event.getType().name());
                record(TelemetryEventType.ANALYSIS_FAILURE, SOURCE, TelemetryData.builder()
                        .operation("event_analysis")
                        .parameters(parameters)
                        .error(String.valueOf(e.getMessage()))
                        .build());
            }
            return false;
        }
    }

    private void collectDerivedRecords(TelemetryEvent event, DerivedAnalysis analysis) {
        synchronized (derivedLock) {
            String patternKey = event.getType() + ":" + event.getSource();
            Pattern pattern = patterns.get(patternKey);
            long frequency = pattern == null ? 1 : pattern.getFrequency() + 1;
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("eventType", event.getType().name());
            data.put("source", event.getSource());
            patterns.put(patternKey, Pattern.builder()
                    .id(pattern == null ? UUID.randomUUID().toString() : pattern.getId())
                    .type(AnalysisKind.USAGE)
                    .description("Frequent " + event.getType() + " operations from " + event.getSource())
                    .frequency(frequency)
                    .confidence(0.7)
                    .impact(frequency > config.getPatternFrequencyThreshold() ? Severity.MEDIUM : Severity.LOW)
                    .data(data)
                    .build());

            anomalies.addAll(analysis.getAnomalies());

            if (!analysis.getInsights().isEmpty()) {
                insights.add(TelemetryInsight.builder()
                        .id(UUID.randomUUID().toString())
                        .timestamp(clock.instant())
                        .type(event.hasError() ? AnalysisKind.ERROR : AnalysisKind.PERFORMANCE)
                        .title(event.getType() + " operation analysis")
                        .description(String.join("; ", analysis.getInsights()))
                        .severity(analysis.getAnomalies().isEmpty() ? Severity.MEDIUM : Severity.HIGH)
                        .confidence(analysis.getConfidence())
                        .data(Map.of("eventId", event.getId(), "source", event.getSource()))
                        .recommendations(analysis.getRecommendations())
                        .actions(List.of("Review logs", "Check metrics"))
                        .build());
            }
        }
    }

    private void pruneDerivedRecords() {
        int max = config.getMaxDerivedRecords();
        synchronized (derivedLock) {
            while (insights.size() > max) {
                insights.removeFirst();
            }
            while (anomalies.size() > max) {
                anomalies.removeFirst();
            }
            Iterator<String> oldest = patterns.keySet().iterator();
            while (patterns.size() > max && oldest.hasNext()) {
                oldest.next();
                oldest.remove();
            }
        }
    }

    /**
     * One timer tick: keeps draining batches until the queue is empty, bounded by the
     * number of batches a full queue holds.
     */
    void drainQuietly() {
        int maxRounds = Math.max(1, config.getMaxEvents() / Math.max(1, config.getBatchSize()));
        try {
            int rounds = 0;
            do {
                drain();
            } while (!queue.isEmpty() && ++rounds < maxRounds);
        } catch (RuntimeException e) {
            log.error("Telemetry drain failed", e);
        }
    }

    private void trainQuietly() {
        try {
            trainModels(List.of());
        } catch (RuntimeException e) {
            log.error("Scheduled model training failed", e);
        }
    }

    // ==================== Analysis and learning ====================

    /**
     * Analyze events recorded within {@code timeframe} and persist the report.
     */
    public TelemetryReport analyze(String timeframe) {
        String period = timeframe != null ? timeframe : "24h";
        Duration window = TelemetryAnalyzer.parseTimeframe(period);
        Instant now = clock.instant();
        Instant since = now.minus(window);

        List<TelemetryEvent> windowEvents = snapshotEvents().stream()
                .filter(event -> !event.getTimestamp().isBefore(since))
                .collect(Collectors.toList());

        long start = System.nanoTime();
        TelemetryReport report = telemetryAnalyzer.analyze(
                windowEvents, period, modelRegistry.overallFeedbackAccuracy(), now);
        store.appendReport(report);

        synchronized (derivedLock) {
            insights.addAll(report.getInsights());
        }
        pruneDerivedRecords();

        log.info("Telemetry analysis over {} completed: {} events, {} anomalies in {}ms",
                period, windowEvents.size(), report.getAnomalies().size(),
                (System.nanoTime() - start) / 1_000_000);
        return report;
    }

    /**
     * Attach ground truth to a recorded event and fold the resulting accuracy into the
     * performance regression track.
     */
    public LearningFeedback provideFeedback(FeedbackRequest request) {
        if (request.getEventId() == null || request.getEventId().isBlank()) {
            throw new IllegalArgumentException("eventId is required");
        }
        if (request.getActualOutcome() == null) {
            throw new IllegalArgumentException("actualOutcome is required");
        }
        if (request.getRating() != null && (request.getRating() < 1 || request.getRating() > 5)) {
            throw new IllegalArgumentException("rating must be between 1 and 5");
        }

        TelemetryEvent event = getEvent(request.getEventId());
        double actual = request.getActualOutcome();
        Double predicted = request.getPredictedOutcome() != null
                ? request.getPredictedOutcome()
                : firstPrediction(event);

        double accuracy = predicted == null ? 0.5 : scoringStrategy.predictionAccuracy(predicted, actual);

        List<Correction> corrections = request.getCorrections() != null ? request.getCorrections() : List.of();
        LearningFeedback feedback = LearningFeedback.builder()
                .id(UUID.randomUUID().toString())
                .timestamp(clock.instant())
                .eventId(event.getId())
                .actualOutcome(actual)
                .predictedOutcome(predicted)
                .accuracy(accuracy)
                .feedback(request.getFeedback())
                .rating(request.getRating())
                .corrections(corrections)
                .improvements(corrections.stream()
                        .map(c -> "Improve " + c.getField() + " prediction accuracy")
                        .collect(Collectors.toList()))
                .build();

        store.appendFeedback(feedback);
        event.markProcessed();
        modelRegistry.recordFeedback(LearningTrack.PERFORMANCE_REGRESSION, accuracy);

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("eventId", event.getId());
        parameters.put("accuracy", accuracy);
        record(TelemetryEventType.LEARNING_FEEDBACK, SOURCE, TelemetryData.builder()
                .operation("provide_feedback")
                .parameters(parameters)
                .result(feedback.getId())
                .build());

        log.info("Learning feedback for event {}: accuracy={}", event.getId(), String.format("%.3f", accuracy));
        return feedback;
    }

    private static Double firstPrediction(TelemetryEvent event) {
        DerivedAnalysis analysis = event.getDerivedAnalysis();
        if (analysis == null || analysis.getPredictions().isEmpty()) {
            return null;
        }
        return analysis.getPredictions().get(0).getValue();
    }

    /**
     * Train a new version of each requested track; all tracks when {@code tracks} is empty.
     */
    public List<LearningModel> trainModels(Collection<LearningTrack> tracks) {
        Collection<LearningTrack> selected = tracks == null || tracks.isEmpty()
                ? List.of(LearningTrack.values())
                : tracks;

        List<TelemetryEvent> snapshot = snapshotEvents();
        List<LearningModel> trained = new ArrayList<>();
        for (LearningTrack track : selected) {
            trained.add(trainTrack(track, snapshot));
        }
        log.info("Trained {} learning models on {} events", trained.size(), snapshot.size());
        return trained;
    }

    public LearningModel retrain(LearningTrack track) {
        return trainTrack(track, snapshotEvents());
    }

    private LearningModel trainTrack(LearningTrack track, List<TelemetryEvent> snapshot) {
        LearningModel model = modelRegistry.train(track, trainingData(track, snapshot));

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("modelId", model.getId());
        parameters.put("track", track.name());
        parameters.put("version", model.getVersion());
        record(TelemetryEventType.MODEL_UPDATE, SOURCE, TelemetryData.builder()
                .operation("train_model")
                .parameters(parameters)
                .build());
        return model;
    }

    private TrainingData trainingData(LearningTrack track, List<TelemetryEvent> snapshot) {
        long errors = snapshot.stream().filter(TelemetryEvent::hasError).count();
        return TrainingData.builder()
                .samples(snapshot.size())
                .features(track.getFeatures().size())
                .errorRate(snapshot.isEmpty() ? 0.0 : (double) errors / snapshot.size())
                .meanDurationMs(snapshot.stream().mapToLong(TelemetryEvent::durationMs).average().orElse(0.0))
                .sources(List.of("telemetry"))
                .build();
    }

    public LearningModel deactivateModel(String modelId) {
        return modelRegistry.deactivate(modelId);
    }

    // ==================== Queries ====================

    /**
     * Events matching all given filters, newest first. Null filters match everything.
     */
    public PageResult<TelemetryEvent> listEvents(TelemetryEventType type, String source,
                                                 Instant since, Instant until, int page, int limit) {
        List<TelemetryEvent> matching = snapshotEvents().stream()
                .filter(e -> type == null || e.getType() == type)
                .filter(e -> source == null || source.equals(e.getSource()))
                .filter(e -> since == null || !e.getTimestamp().isBefore(since))
                .filter(e -> until == null || !e.getTimestamp().isAfter(until))
                .sorted(Comparator.comparing(TelemetryEvent::getTimestamp).reversed())
                .collect(Collectors.toList());
        return PageResult.of(matching, page, limit);
    }

    public TelemetryEvent getEvent(String eventId) {
        synchronized (events) {
            TelemetryEvent event = events.get(eventId);
            if (event == null) {
                throw ResourceNotFoundException.event(eventId);
            }
            return event;
        }
    }

    public PageResult<LearningFeedback> listFeedback(String eventId, int page, int limit) {
        List<LearningFeedback> matching = store.listFeedback().stream()
                .filter(f -> eventId == null || eventId.equals(f.getEventId()))
                .collect(Collectors.toList());
        return PageResult.of(matching, page, limit);
    }

    public List<LearningModel> getModels() {
        return modelRegistry.models();
    }

    public ModelPerformance getModelPerformance(String modelId) {
        return modelRegistry.find(modelId)
                .map(LearningModel::getPerformance)
                .orElseThrow(() -> ResourceNotFoundException.model(modelId));
    }

    public PageResult<TelemetryInsight> getInsights(AnalysisKind type, Severity severity, int page, int limit) {
        List<TelemetryInsight> matching;
        synchronized (derivedLock) {
            matching = insights.stream()
                    .filter(i -> type == null || i.getType() == type)
                    .filter(i -> severity == null || i.getSeverity() == severity)
                    .collect(Collectors.toList());
        }
        return PageResult.of(matching, page, limit);
    }

    public List<Pattern> getPatterns() {
        synchronized (derivedLock) {
            return new ArrayList<>(patterns.values());
        }
    }

    public List<Anomaly> getAnomalies() {
        synchronized (derivedLock) {
            return new ArrayList<>(anomalies);
        }
    }

    public List<TelemetryReport> recentReports(int limit) {
        return store.recentReports(limit);
    }

    public TelemetryHealth health() {
        int eventCount;
        synchronized (events) {
            eventCount = events.size();
        }
        int insightCount;
        int patternCount;
        int anomalyCount;
        synchronized (derivedLock) {
            insightCount = insights.size();
            patternCount = patterns.size();
            anomalyCount = anomalies.size();
        }
        return TelemetryHealth.builder()
                .status(config.isEnabled() ? "healthy" : "disabled")
                .events(eventCount)
                .feedback((int) store.feedbackCount())
                .models(modelRegistry.size())
                .insights(insightCount)
                .patterns(patternCount)
                .anomalies(anomalyCount)
                .queueLength(queueLength.get())
                .droppedEvents(droppedEvents.get())
                .processing(processing.get())
                .processedEvents(processedEvents.get())
                .analysisFailures(analysisFailures.get())
                .build();
    }

    public TelemetryStats stats() {
        TelemetryHealth health = health();
        Map<TelemetryEventType, Long> eventTypes = snapshotEvents().stream()
                .collect(Collectors.groupingBy(TelemetryEvent::getType,
                        () -> new EnumMap<>(TelemetryEventType.class), Collectors.counting()));
        return TelemetryStats.builder()
                .status(health.getStatus())
                .totalEvents(health.getEvents())
                .totalFeedback(health.getFeedback())
                .totalModels(health.getModels())
                .totalInsights(health.getInsights())
                .queueLength(health.getQueueLength())
                .droppedEvents(health.getDroppedEvents())
                .processing(health.isProcessing())
                .processedEvents(health.getProcessedEvents())
                .analysisFailures(health.getAnalysisFailures())
                .eventTypes(eventTypes)
                .feedbackAccuracy(modelRegistry.overallFeedbackAccuracy())
                .build();
    }

    private List<TelemetryEvent> snapshotEvents() {
        synchronized (events) {
            return new ArrayList<>(events.values());
        }
    }
}
