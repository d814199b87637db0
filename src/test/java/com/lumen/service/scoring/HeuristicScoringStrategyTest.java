package com.lumen.service.scoring;

import com.lumen.model.TokenUsage;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for HeuristicScoringStrategy.
 */
class HeuristicScoringStrategyTest {

    private final HeuristicScoringStrategy scoring = new HeuristicScoringStrategy();

    @Test
    void testPredictionAccuracy() {
        assertEquals(1.0 - 10.0 / 110.0, scoring.predictionAccuracy(100, 110), 1e-9);
        assertEquals(1.0, scoring.predictionAccuracy(42, 42), 1e-9);
        assertEquals(1.0, scoring.predictionAccuracy(0, 0), 1e-9);
        assertEquals(0.0, scoring.predictionAccuracy(0, 50), 1e-9);
    }

    @Test
    void testLongFastEfficientResponseScoresHigh() {
        String content = "x".repeat(500);

        double score = scoring.responseConfidence(content, TokenUsage.of(10, 10), 200);

        // 0.4 * 1.0 + 0.3 * 0.5 + 0.3 * 1.0
        assertEquals(0.85, score, 1e-9);
    }

    @Test
    void testSlowEmptyResponseScoresLow() {
        double score = scoring.responseConfidence("", null, 8000);

        assertEquals(0.3 * 0.5 + 0.3 * 0.4, score, 1e-9);
    }

    @Test
    void testMediumLatencyBand() {
        double fast = scoring.responseConfidence("hello", TokenUsage.empty(), 999);
        double medium = scoring.responseConfidence("hello", TokenUsage.empty(), 1000);

        assertEquals(0.3 * 0.3, fast - medium, 1e-9);
    }
}
