package com.trafficguardian.detector.feedback;

import java.time.Instant;
import java.util.Map;

/**
 * Feedback totals, overall and per model selection.
 *
 * @param lastRetrain {@code null} when no model set has been trained
 */
public record FeedbackStats(
        int totalFeedback,
        int genuineAnomalies,
        int falsePositives,
        int pendingSinceLastRetrain,
        Instant lastRetrain,
        RetrainState state,
        Map<String, ModelFeedback> feedbackByModel) {

    public FeedbackStats {
        feedbackByModel = Map.copyOf(feedbackByModel);
    }

    public record ModelFeedback(int total, int genuine, int falsePositives) {
    }
}
