package com.lumen.service.telemetry;

import com.lumen.config.LumenProperties;
import com.lumen.model.telemetry.AnalysisKind;
import com.lumen.model.telemetry.Anomaly;
import com.lumen.model.telemetry.Pattern;
import com.lumen.model.telemetry.Prediction;
import com.lumen.model.telemetry.Severity;
import com.lumen.model.telemetry.TelemetryEvent;
import com.lumen.model.telemetry.TelemetryEventType;
import com.lumen.model.telemetry.TelemetryInsight;
import com.lumen.model.telemetry.TelemetryReport;
import com.lumen.model.telemetry.TelemetrySummary;
import com.lumen.model.telemetry.Trend;
import com.lumen.model.telemetry.TrendDirection;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Aggregate analysis over a window of telemetry events.
 * Stateless; the caller selects the window.
 */
@Component
public class TelemetryAnalyzer {

    static final Duration DEFAULT_TIMEFRAME = Duration.ofHours(24);
    static final Duration MAX_TIMEFRAME = Duration.ofDays(3650);

    // A slope below this fraction of the mean counts as flat
    private static final double STABLE_SLOPE_RATIO = 0.01;
    private static final double ANOMALY_MEAN_FACTOR = 2.0;
    private static final double PREDICTION_GROWTH = 1.1;

    private final LumenProperties.TelemetryConfig config;

    public TelemetryAnalyzer(LumenProperties properties) {
        this.config = properties.getTelemetry();
    }

    /**
     * Parse a timeframe such as "6h", "2d" or "1w". An unknown unit falls back to 24 hours.
     *
     * @throws IllegalArgumentException when the amount is not a positive integer or the
     *                                  window is longer than ten years
     */
    public static Duration parseTimeframe(String timeframe) {
        if (timeframe == null || timeframe.length() < 2) {
            return DEFAULT_TIMEFRAME;
        }
        char unit = timeframe.charAt(timeframe.length() - 1);
        if (unit != 'h' && unit != 'd' && unit != 'w') {
            return DEFAULT_TIMEFRAME;
        }

        long amount;
        try {
            amount = Long.parseLong(timeframe.substring(0, timeframe.length() - 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid timeframe: " + timeframe, e);
        }
        if (amount <= 0) {
            throw new IllegalArgumentException("Timeframe must be positive: " + timeframe);
        }

        long hoursPerUnit = unit == 'h' ? 1 : unit == 'd' ? 24 : 24 * 7;
        long hours;
        try {
            hours = Math.multiplyExact(amount, hoursPerUnit);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Timeframe too large: " + timeframe, e);
        }
        if (hours > MAX_TIMEFRAME.toHours()) {
            throw new IllegalArgumentException("Timeframe exceeds " + MAX_TIMEFRAME.toDays() + " days: " + timeframe);
        }
        return Duration.ofHours(hours);
    }

    /**
     * Build a report over {@code events}. An empty window yields a zero-valued report,
     * feedback accuracy included.
     *
     * @param feedbackAccuracy mean feedback accuracy to carry into the summary
     */
    public TelemetryReport analyze(List<TelemetryEvent> events, String period,
                                   double feedbackAccuracy, Instant now) {
        List<TelemetryEvent> window = events.stream()
                .sorted(Comparator.comparing(TelemetryEvent::getTimestamp))
                .collect(Collectors.toList());

        if (window.isEmpty()) {
            return emptyReport(period, now);
        }

        double meanDuration = window.stream().mapToLong(TelemetryEvent::durationMs).average().orElse(0.0);

        List<TelemetryInsight> insights = insights(window, now);
        List<Pattern> patterns = patterns(window);
        List<Anomaly> anomalies = anomalies(window, meanDuration);
        List<Trend> trends = List.of(durationTrend(window, meanDuration, period));
        List<Prediction> predictions = List.of(Prediction.builder()
                .id(UUID.randomUUID().toString())
                .type(AnalysisKind.PERFORMANCE)
                .metric("average_operation_duration")
                .value(meanDuration * PREDICTION_GROWTH)
                .confidence(0.8)
                .timeframe("1h")
                .factors(List.of("current_load", "historical_patterns"))
                .build());

        List<String> recommendations = recommendations(insights, anomalies, trends);

        return TelemetryReport.builder()
                .id(UUID.randomUUID().toString())
                .timestamp(now)
                .period(period)
                .summary(summary(window, feedbackAccuracy))
                .insights(insights)
                .patterns(patterns)
                .anomalies(anomalies)
                .trends(trends)
                .predictions(predictions)
                .recommendations(recommendations)
                .actions(recommendations.stream().map(r -> "Action: " + r).collect(Collectors.toList()))
                .build();
    }

    private List<TelemetryInsight> insights(List<TelemetryEvent> window, Instant now) {
        List<TelemetryInsight> insights = new ArrayList<>();

        long slow = window.stream().filter(e -> e.durationMs() > config.getSlowOperationThresholdMs()).count();
        if (slow > 0) {
            insights.add(TelemetryInsight.builder()
                    .id(UUID.randomUUID().toString())
                    .timestamp(now)
                    .type(AnalysisKind.PERFORMANCE)
                    .title("Performance degradation")
                    .description(slow + " slow operations detected")
                    .severity(Severity.HIGH)
                    .confidence(0.9)
                    .data(Map.of("slowOperations", slow))
                    .recommendations(List.of("Optimize slow operations", "Monitor performance"))
                    .actions(List.of("Review code", "Check resources"))
                    .build());
        }

        long errors = window.stream().filter(TelemetryEvent::hasError).count();
        if (errors > 0) {
            insights.add(TelemetryInsight.builder()
                    .id(UUID.randomUUID().toString())
                    .timestamp(now)
                    .type(AnalysisKind.ERROR)
                    .title("Elevated error rate")
                    .description(errors + " errors detected")
                    .severity(Severity.MEDIUM)
                    .confidence(0.8)
                    .data(Map.of("errors", errors))
                    .recommendations(List.of("Improve error handling", "Add monitoring"))
                    .actions(List.of("Fix errors", "Add alerts"))
                    .build());
        }

        return insights;
    }

    private List<Pattern> patterns(List<TelemetryEvent> window) {
        Map<TelemetryEventType, Long> counts = countByType(window);
        List<Pattern> patterns = new ArrayList<>();
        counts.forEach((type, count) -> {
            if (count > config.getPatternFrequencyThreshold()) {
                patterns.add(Pattern.builder()
                        .id(UUID.randomUUID().toString())
                        .type(AnalysisKind.USAGE)
                        .description("Frequent " + type + " operations")
                        .frequency(count)
                        .confidence(0.8)
                        .impact(Severity.LOW)
                        .data(Map.of("eventType", type.name(), "count", count))
                        .build());
            }
        });
        return patterns;
    }

    private List<Anomaly> anomalies(List<TelemetryEvent> window, double meanDuration) {
        double threshold = meanDuration * ANOMALY_MEAN_FACTOR;
        return window.stream()
                .filter(e -> e.durationMs() > threshold)
                .map(e -> Anomaly.builder()
                        .id(UUID.randomUUID().toString())
                        .type(AnalysisKind.PERFORMANCE)
                        .severity(Severity.HIGH)
                        .description("Unusually long operation duration")
                        .eventId(e.getId())
                        .threshold(threshold)
                        .actualValue(e.durationMs())
                        .confidence(0.9)
                        .recommendations(List.of("Investigate performance issue"))
                        .build())
                .collect(Collectors.toList());
    }

    /**
     * Least-squares fit of duration against event position in the window.
     */
    Trend durationTrend(List<TelemetryEvent> window, double meanDuration, String period) {
        int n = window.size();
        double meanX = (n - 1) / 2.0;
        double covariance = 0.0;
        double varianceX = 0.0;
        for (int i = 0; i < n; i++) {
            double dx = i - meanX;
            covariance += dx * (window.get(i).durationMs() - meanDuration);
            varianceX += dx * dx;
        }
        double slope = varianceX == 0.0 ? 0.0 : covariance / varianceX;

        TrendDirection direction = TrendDirection.STABLE;
        if (Math.abs(slope) > Math.abs(meanDuration) * STABLE_SLOPE_RATIO) {
            direction = slope > 0 ? TrendDirection.INCREASING : TrendDirection.DECREASING;
        }

        double intercept = meanDuration - slope * meanX;
        return Trend.builder()
                .id(UUID.randomUUID().toString())
                .metric("operation_duration")
                .direction(direction)
                .slope(slope)
                .confidence(0.7)
                .timeframe(period)
                .prediction(intercept + slope * n)
                .build();
    }

    private List<String> recommendations(List<TelemetryInsight> insights, List<Anomaly> anomalies, List<Trend> trends) {
        List<String> recommendations = new ArrayList<>();
        if (!anomalies.isEmpty()) {
            recommendations.add("Investigate detected anomalies");
        }
        if (insights.stream().anyMatch(i -> i.getSeverity() == Severity.HIGH)) {
            recommendations.add("Address high-severity insights");
        }
        if (trends.stream().anyMatch(t -> t.getDirection() == TrendDirection.INCREASING
                && t.getMetric().contains("duration"))) {
            recommendations.add("Monitor performance trends");
        }
        return recommendations;
    }

    private TelemetrySummary summary(List<TelemetryEvent> window, double feedbackAccuracy) {
        double total = window.size();
        long errors = window.stream().filter(TelemetryEvent::hasError).count();
        long slow = window.stream().filter(e -> e.durationMs() > config.getSlowOperationThresholdMs()).count();
        return TelemetrySummary.builder()
                .totalEvents(window.size())
                .eventTypes(countByType(window))
                .averageConfidence(window.stream().mapToDouble(TelemetryEvent::getConfidence).average().orElse(0.0))
                .errorRate(errors / total)
                .performanceScore(1.0 - slow / total)
                .feedbackAccuracy(feedbackAccuracy)
                .build();
    }

    private static Map<TelemetryEventType, Long> countByType(List<TelemetryEvent> window) {
        return window.stream().collect(Collectors.groupingBy(
                TelemetryEvent::getType,
                () -> new EnumMap<>(TelemetryEventType.class),
                Collectors.counting()));
    }

    private TelemetryReport emptyReport(String period, Instant now) {
        return TelemetryReport.builder()
                .id(UUID.randomUUID().toString())
                .timestamp(now)
                .period(period)
                .summary(TelemetrySummary.builder()
                        .totalEvents(0)
                        .eventTypes(Map.of())
                        .averageConfidence(0.0)
                        .errorRate(0.0)
                        .performanceScore(0.0)
                        .feedbackAccuracy(0.0)
                        .build())
                .insights(List.of())
                .patterns(List.of())
                .anomalies(List.of())
                .trends(List.of())
                .predictions(List.of())
                .recommendations(List.of())
                .actions(List.of())
                .build();
    }
}
