package com.trafficguardian.detector.feedback;

import com.trafficguardian.detector.config.FeedbackConfig;

/**
 * Retraining thresholds, taken from configuration or supplied per call.
 *
 * @param retrainIntervalDays minimum days between retrains
 * @param minFeedbackCount    minimum new feedback entries, and minimum valid
 *                            records for a retrain
 * @param maxFeedbackAgeDays  feedback older than this is ignored
 */
public record RetrainPolicy(int retrainIntervalDays, int minFeedbackCount, int maxFeedbackAgeDays) {

    public RetrainPolicy {
        if (retrainIntervalDays < 0 || minFeedbackCount < 1 || maxFeedbackAgeDays < 1) {
            throw new IllegalArgumentException("Invalid retrain policy: interval=" + retrainIntervalDays
                    + ", minFeedback=" + minFeedbackCount + ", maxAge=" + maxFeedbackAgeDays);
        }
    }

    public static RetrainPolicy from(FeedbackConfig config) {
        return new RetrainPolicy(config.getRetrainIntervalDays(), config.getMinFeedbackCount(),
                config.getMaxFeedbackAgeDays());
    }
}
