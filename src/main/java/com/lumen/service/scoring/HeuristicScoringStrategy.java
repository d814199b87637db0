package com.lumen.service.scoring;

import com.lumen.model.TokenUsage;
import org.springframework.stereotype.Component;

/**
 * Default scoring: fixed weights over simple ratios.
 */
@Component
public class HeuristicScoringStrategy implements ScoringStrategy {

    private static final double LENGTH_WEIGHT = 0.4;
    private static final double EFFICIENCY_WEIGHT = 0.3;
    private static final double SPEED_WEIGHT = 0.3;

    // Responses at or above this many characters get the full length score
    private static final int FULL_LENGTH_CHARS = 500;

    @Override
    public double responseConfidence(String content, TokenUsage usage, long processingTimeMs) {
        double lengthScore = content == null ? 0.0 : Math.min(1.0, content.length() / (double) FULL_LENGTH_CHARS);

        double efficiencyScore = 0.5;
        if (usage != null && usage.getPromptTokens() > 0) {
            double ratio = usage.getCompletionTokens() / (double) usage.getPromptTokens();
            efficiencyScore = ratio / (1.0 + ratio);
        }

        double speedScore;
        if (processingTimeMs < 1000) {
            speedScore = 1.0;
        } else if (processingTimeMs < 5000) {
            speedScore = 0.7;
        } else {
            speedScore = 0.4;
        }

        double score = LENGTH_WEIGHT * lengthScore + EFFICIENCY_WEIGHT * efficiencyScore + SPEED_WEIGHT * speedScore;
        return Math.max(0.0, Math.min(1.0, score));
    }

    /**
     * Normalized absolute error against the larger of the two values.
     */
    @Override
    public double predictionAccuracy(double predicted, double actual) {
        double maxValue = Math.max(Math.abs(predicted), Math.abs(actual));
        if (maxValue == 0.0) {
            return 1.0;
        }
        double error = Math.abs(predicted - actual);
        return Math.max(0.0, 1.0 - error / maxValue);
    }
}
