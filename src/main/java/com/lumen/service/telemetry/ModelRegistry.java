package com.lumen.service.telemetry;

import com.lumen.config.LumenProperties;
import com.lumen.exception.ResourceNotFoundException;
import com.lumen.model.telemetry.LearningModel;
import com.lumen.model.telemetry.LearningTrack;
import com.lumen.model.telemetry.ModelPerformance;
import com.lumen.model.telemetry.ModelStatus;
import com.lumen.model.telemetry.TrainingData;
import com.lumen.repository.TelemetryStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Versioned learning models, one independent lineage per {@link LearningTrack}.
 * <p>
 * Training a track creates a new version that goes TRAINING then ACTIVE; the previous
 * version of the same track becomes DEPRECATED. Other tracks are left untouched. Each track
 * keeps at most {@code max-deprecated-versions} deprecated versions; older ones are dropped
 * from the registry and the store.
 */
@Slf4j
@Component
public class ModelRegistry {

    private static final Map<LearningTrack, ModelPerformance> BASELINES = new EnumMap<>(LearningTrack.class);
    private static final Map<LearningTrack, Map<String, Object>> HYPERPARAMETERS = new EnumMap<>(LearningTrack.class);

    static {
        BASELINES.put(LearningTrack.PERFORMANCE_REGRESSION, baseline(0.85, 0.82, 0.88, 0.85));
        BASELINES.put(LearningTrack.ANOMALY_DETECTION, baseline(0.92, 0.89, 0.94, 0.91));
        BASELINES.put(LearningTrack.USAGE_CLUSTERING, baseline(0.88, 0.85, 0.90, 0.87));
        BASELINES.put(LearningTrack.ERROR_CLASSIFICATION, baseline(0.90, 0.87, 0.93, 0.90));

        HYPERPARAMETERS.put(LearningTrack.PERFORMANCE_REGRESSION, Map.of("learningRate", 0.001, "batchSize", 32, "epochs", 100));
        HYPERPARAMETERS.put(LearningTrack.ANOMALY_DETECTION, Map.of("threshold", 0.95, "sensitivity", 0.8));
        HYPERPARAMETERS.put(LearningTrack.USAGE_CLUSTERING, Map.of("clusters", 5, "algorithm", "kmeans"));
        HYPERPARAMETERS.put(LearningTrack.ERROR_CLASSIFICATION, Map.of("learningRate", 0.001, "batchSize", 64, "epochs", 60));
    }

    private final TelemetryStore store;
    private final Clock clock;
    private final Duration retrainInterval;
    private final int maxDeprecatedVersions;

    // Insertion order is training order
    private final Map<String, LearningModel> models = new LinkedHashMap<>();
    private final Map<LearningTrack, Integer> versionCounters = new EnumMap<>(LearningTrack.class);
    // Current ACTIVE or INACTIVE version per track
    private final Map<LearningTrack, String> heads = new EnumMap<>(LearningTrack.class);
    // Deprecated version ids per track, oldest first
    private final Map<LearningTrack, Deque<String>> deprecated = new EnumMap<>(LearningTrack.class);
    private final Map<LearningTrack, FeedbackStats> feedbackStats = new EnumMap<>(LearningTrack.class);

    public ModelRegistry(TelemetryStore store, Clock clock, LumenProperties properties) {
        this.store = store;
        this.clock = clock;
        this.retrainInterval = properties.getTelemetry().getTrainingInterval();
        this.maxDeprecatedVersions = Math.max(0, properties.getTelemetry().getMaxDeprecatedVersions());
        for (LearningTrack track : LearningTrack.values()) {
            feedbackStats.put(track, new FeedbackStats());
            deprecated.put(track, new ArrayDeque<>());
        }
        restore(store.loadModels());
    }

    private void restore(List<LearningModel> snapshots) {
        List<LearningModel> ordered = new ArrayList<>(snapshots);
        ordered.sort(Comparator.comparing(LearningModel::getLastTrained,
                Comparator.nullsFirst(Comparator.naturalOrder())));

        for (LearningModel model : ordered) {
            LearningTrack track = model.getTrack();
            models.put(model.getId(), model);
            versionCounters.merge(track, generationOf(model) + 1, Math::max);
            if (model.getStatus() == ModelStatus.DEPRECATED) {
                deprecated.get(track).addLast(model.getId());
            } else if (model.getStatus() == ModelStatus.ACTIVE || model.getStatus() == ModelStatus.INACTIVE) {
                heads.put(track, model.getId());
            }
        }
        deprecated.keySet().forEach(this::pruneDeprecated);
        if (!snapshots.isEmpty()) {
            log.info("Restored {} learning model snapshots", models.size());
        }
    }

    /**
     * Minor component of a "1.N.0" version; unparseable versions count as generation 0.
     */
    private static int generationOf(LearningModel model) {
        String version = model.getVersion();
        if (version == null) {
            return 0;
        }
        String[] parts = version.split("\\.");
        if (parts.length < 2) {
            return 0;
        }
        try {
            return Math.max(0, Integer.parseInt(parts[1]));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    /**
     * Train a new version of {@code track} on {@code trainingData} and make it active.
     */
    public synchronized LearningModel train(LearningTrack track, TrainingData trainingData) {
        Instant now = clock.instant();
        int generation = versionCounters.merge(track, 1, Integer::sum) - 1;

        LearningModel model = LearningModel.builder()
                .id(UUID.randomUUID().toString())
                .name(track.getDisplayName())
                .track(track)
                .type(track.getModelType())
                .version("1." + generation + ".0")
                .status(ModelStatus.TRAINING)
                .features(track.getFeatures())
                .hyperparameters(HYPERPARAMETERS.get(track))
                .trainingData(trainingData)
                .build();

        FeedbackStats stats = feedbackStats.get(track);
        model.setPerformance(BASELINES.get(track).toBuilder()
                .feedbackSamples(stats.samples)
                .feedbackAccuracy(stats.mean())
                .lastUpdated(now)
                .build());

        Optional<LearningModel> previous = active(track);
        model.transitionTo(ModelStatus.ACTIVE);
        model.setLastTrained(now);
        model.setNextRetrain(now.plus(retrainInterval));
        models.put(model.getId(), model);
        heads.put(track, model.getId());
        store.saveModel(model);

        previous.ifPresent(old -> {
            old.transitionTo(ModelStatus.DEPRECATED);
            store.saveModel(old);
            deprecated.get(track).addLast(old.getId());
            pruneDeprecated(track);
        });

        log.info("Trained {} version {} on {} samples{}", track, model.getVersion(),
                trainingData.getSamples(),
                previous.map(old -> ", deprecated " + old.getVersion()).orElse(""));
        return model.toBuilder().build();
    }

    /**
     * Current non-deprecated version of a track, if any. An INACTIVE version still
     * counts as the track's head until it is replaced.
     */
    private Optional<LearningModel> active(LearningTrack track) {
        String headId = heads.get(track);
        return headId == null ? Optional.empty() : Optional.ofNullable(models.get(headId));
    }

    private void pruneDeprecated(LearningTrack track) {
        Deque<String> versions = deprecated.get(track);
        while (versions.size() > maxDeprecatedVersions) {
            String id = versions.pollFirst();
            LearningModel removed = models.remove(id);
            store.deleteModel(id);
            log.debug("Pruned deprecated {} model {} ({})", track, id,
                    removed == null ? "unknown" : removed.getVersion());
        }
    }

    /**
     * Move an ACTIVE model to INACTIVE.
     *
     * @throws ResourceNotFoundException if no model has this id
     * @throws IllegalStateException if the model is not ACTIVE
     */
    public synchronized LearningModel deactivate(String modelId) {
        LearningModel model = models.get(modelId);
        if (model == null) {
            throw ResourceNotFoundException.model(modelId);
        }
        model.transitionTo(ModelStatus.INACTIVE);
        store.saveModel(model);
        log.info("Deactivated model {} ({} {})", modelId, model.getTrack(), model.getVersion());
        return model.toBuilder().build();
    }

    /**
     * Fold a feedback accuracy sample into the track's statistics and its active model.
     */
    public synchronized void recordFeedback(LearningTrack track, double accuracy) {
        FeedbackStats stats = feedbackStats.get(track);
        stats.add(accuracy);

        active(track).ifPresent(model -> {
            model.setPerformance(model.getPerformance().toBuilder()
                    .feedbackSamples(stats.samples)
                    .feedbackAccuracy(stats.mean())
                    .lastUpdated(clock.instant())
                    .build());
            store.saveModel(model);
        });
    }

    public synchronized List<LearningModel> models() {
        List<LearningModel> result = new ArrayList<>(models.size());
        models.values().forEach(model -> result.add(model.toBuilder().build()));
        return result;
    }

    public synchronized Optional<LearningModel> find(String modelId) {
        return Optional.ofNullable(models.get(modelId)).map(model -> model.toBuilder().build());
    }

    public synchronized int size() {
        return models.size();
    }

    /**
     * Mean accuracy across all feedback received, 0 when there is none.
     */
    public synchronized double overallFeedbackAccuracy() {
        long samples = 0;
        double sum = 0.0;
        for (FeedbackStats stats : feedbackStats.values()) {
            samples += stats.samples;
            sum += stats.sum;
        }
        return samples == 0 ? 0.0 : sum / samples;
    }

    private static ModelPerformance baseline(double accuracy, double precision, double recall, double f1) {
        return ModelPerformance.builder()
                .accuracy(accuracy)
                .precision(precision)
                .recall(recall)
                .f1Score(f1)
                .build();
    }

    private static class FeedbackStats {
        private long samples;
        private double sum;

        void add(double accuracy) {
            samples++;
            sum += accuracy;
        }

        double mean() {
            return samples == 0 ? 0.0 : sum / samples;
        }
    }
}
