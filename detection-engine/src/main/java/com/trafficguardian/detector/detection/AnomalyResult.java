package com.trafficguardian.detector.detection;

import com.trafficguardian.detector.traffic.TrafficRecord;

import java.util.List;

/**
 * Scoring outcome for one traffic record.
 *
 * <p>
 * Per-model fields are {@code null} when that model was not requested.
 * </p>
 *
 * @param record          the scored record
 * @param anomaly         final decision
 * @param combinedScore   mean of the requested models' normalized scores, in
 *                        [0, 1]
 * @param flaggedBy       names of the requested models whose native decision
 *                        flags the record
 * @param modelUsed       selection the decision was made with
 * @param modelVersion    version of the model set that produced the scores
 *
 * @author Naveed Gung
 */
public record AnomalyResult(
        TrafficRecord record,
        boolean anomaly,
        Double isolationForestRaw,
        Double isolationForestScore,
        Double lofRaw,
        Double lofScore,
        double combinedScore,
        List<String> flaggedBy,
        ModelSelection modelUsed,
        long modelVersion) {

    public AnomalyResult {
        flaggedBy = List.copyOf(flaggedBy);
    }
}
