package com.trafficguardian.detector.detection;

import com.trafficguardian.detector.feature.FeatureTransformer;

import java.time.Instant;

/**
 * Immutable model set in force: the transformer and both models fitted
 * together on the same data. Replaced as a whole, never in parts.
 *
 * @param trainedAt     when the set was fitted; doubles as the last retrain
 *                      time
 * @param contamination expected outlier share the models were fitted with
 * @param samples       number of training records
 */
public record DetectorState(
        long version,
        Instant trainedAt,
        FeatureTransformer transformer,
        IsolationForestModel isolationForest,
        LocalOutlierFactorModel lof,
        double contamination,
        int samples) {
}
