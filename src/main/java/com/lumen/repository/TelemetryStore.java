package com.lumen.repository;

import com.lumen.model.telemetry.LearningFeedback;
import com.lumen.model.telemetry.LearningModel;
import com.lumen.model.telemetry.TelemetryReport;

import java.util.List;

/**
 * Append/query persistence for analysis reports, feedback and model snapshots.
 */
public interface TelemetryStore {

    void appendReport(TelemetryReport report);

    /**
     * @return up to {@code limit} reports, newest first
     */
    List<TelemetryReport> recentReports(int limit);

    void appendFeedback(LearningFeedback feedback);

    /**
     * @return all feedback in arrival order
     */
    List<LearningFeedback> listFeedback();

    long feedbackCount();

    /**
     * Insert or replace a model snapshot by id.
     */
    void saveModel(LearningModel model);

    List<LearningModel> loadModels();

    /**
     * Remove a model snapshot; unknown ids are ignored.
     */
    void deleteModel(String modelId);
}
