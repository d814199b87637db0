package com.lumen.service.scoring;

import com.lumen.model.TokenUsage;

/**
 * Pluggable formulas for confidence and accuracy figures.
 * These are diagnostic scores, never used for correctness decisions.
 */
public interface ScoringStrategy {

    /**
     * Confidence of a runtime response (0.0-1.0) from its length, token efficiency
     * and how quickly it was produced.
     */
    double responseConfidence(String content, TokenUsage usage, long processingTimeMs);

    /**
     * Accuracy of a prediction against the observed outcome (0.0-1.0).
     */
    double predictionAccuracy(double predicted, double actual);
}
