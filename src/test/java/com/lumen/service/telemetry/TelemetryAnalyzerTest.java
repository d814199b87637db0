package com.lumen.service.telemetry;

import com.lumen.config.LumenProperties;
import com.lumen.model.telemetry.TelemetryData;
import com.lumen.model.telemetry.TelemetryEvent;
import com.lumen.model.telemetry.TelemetryEventType;
import com.lumen.model.telemetry.TelemetryReport;
import com.lumen.model.telemetry.Trend;
import com.lumen.model.telemetry.TrendDirection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TelemetryAnalyzer.
 */
class TelemetryAnalyzerTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

    private TelemetryAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new TelemetryAnalyzer(new LumenProperties());
    }

    private static List<TelemetryEvent> events(long... durations) {
        List<TelemetryEvent> events = new ArrayList<>();
        for (int i = 0; i < durations.length; i++) {
            events.add(TelemetryEvent.builder()
                    .id(UUID.randomUUID().toString())
                    .timestamp(START.plusSeconds(i))
                    .type(TelemetryEventType.GENERATION_SUCCESS)
                    .source("gateway")
                    .data(TelemetryData.builder().durationMs(durations[i]).build())
                    .build());
        }
        return events;
    }

    @Test
    void testParseTimeframe() {
        assertEquals(Duration.ofHours(6), TelemetryAnalyzer.parseTimeframe("6h"));
        assertEquals(Duration.ofDays(2), TelemetryAnalyzer.parseTimeframe("2d"));
        assertEquals(Duration.ofDays(7), TelemetryAnalyzer.parseTimeframe("1w"));
        assertEquals(Duration.ofHours(24), TelemetryAnalyzer.parseTimeframe("5m"));
        assertEquals(Duration.ofHours(24), TelemetryAnalyzer.parseTimeframe(null));
        assertEquals(Duration.ofHours(24), TelemetryAnalyzer.parseTimeframe("h"));
    }

    @Test
    void testParseTimeframeRejectsBadAmounts() {
        assertThrows(IllegalArgumentException.class, () -> TelemetryAnalyzer.parseTimeframe("xh"));
        assertThrows(IllegalArgumentException.class, () -> TelemetryAnalyzer.parseTimeframe("0d"));
        assertThrows(IllegalArgumentException.class, () -> TelemetryAnalyzer.parseTimeframe("-2h"));
        assertThrows(IllegalArgumentException.class, () -> TelemetryAnalyzer.parseTimeframe("99999999999999w"));
        assertThrows(IllegalArgumentException.class, () -> TelemetryAnalyzer.parseTimeframe("9999999999999d"));
        assertThrows(IllegalArgumentException.class, () -> TelemetryAnalyzer.parseTimeframe("3651d"));
        assertEquals(Duration.ofDays(3650), TelemetryAnalyzer.parseTimeframe("3650d"));
    }

    @Test
    void testIncreasingTrendIsProjected() {
        TelemetryReport report = analyzer.analyze(events(100, 200, 300, 400), "24h", 0.9, START);

        Trend trend = report.getTrends().get(0);
        assertEquals(TrendDirection.INCREASING, trend.getDirection());
        assertEquals(100.0, trend.getSlope(), 1e-9);
        assertEquals(500.0, trend.getPrediction(), 1e-9);
        assertEquals(List.of("Monitor performance trends"), report.getRecommendations());
        assertEquals(List.of("Action: Monitor performance trends"), report.getActions());
        assertEquals(275.0, report.getPredictions().get(0).getValue(), 1e-9);
        assertEquals(0.9, report.getSummary().getFeedbackAccuracy(), 1e-9);
    }

    @Test
    void testFlatSeriesIsStable() {
        Trend trend = analyzer.durationTrend(events(100, 100, 100), 100.0, "1h");

        assertEquals(TrendDirection.STABLE, trend.getDirection());
        assertEquals(0.0, trend.getSlope(), 1e-9);
    }

    @Test
    void testOutliersAboveTwiceTheMeanAreAnomalies() {
        List<TelemetryEvent> window = events(10, 10, 10, 100);

        TelemetryReport report = analyzer.analyze(window, "24h", 0.0, START);

        assertEquals(1, report.getAnomalies().size());
        assertEquals(window.get(3).getId(), report.getAnomalies().get(0).getEventId());
        assertEquals(65.0, report.getAnomalies().get(0).getThreshold(), 1e-9);
        assertTrue(report.getRecommendations().contains("Investigate detected anomalies"));
    }

    @Test
    void testFrequentEventTypesBecomePatterns() {
        long[] durations = new long[11];
        TelemetryReport report = analyzer.analyze(events(durations), "24h", 0.0, START);

        assertEquals(1, report.getPatterns().size());
        assertEquals(11, report.getPatterns().get(0).getFrequency());
        assertTrue(analyzer.analyze(events(new long[10]), "24h", 0.0, START).getPatterns().isEmpty());
    }

    @Test
    void testEmptyWindowGivesZeroReport() {
        TelemetryReport report = analyzer.analyze(List.of(), "6h", 0.75, START);

        assertEquals("6h", report.getPeriod());
        assertEquals(0, report.getSummary().getTotalEvents());
        assertEquals(0.0, report.getSummary().getFeedbackAccuracy(), 1e-9);
        assertTrue(report.getInsights().isEmpty());
        assertTrue(report.getTrends().isEmpty());
        assertTrue(report.getRecommendations().isEmpty());
    }
}
