package com.trafficguardian.detector.storage;

import java.time.Instant;

/**
 * A persisted anomaly detection, the target of analyst feedback.
 *
 * @param logId   storage id of the traffic record that was flagged
 * @param genuine analyst judgment, {@code null} until feedback arrives
 */
public record StoredAnomaly(
        long anomalyId,
        Long logId,
        int deviceId,
        Instant detectedAt,
        double score,
        String modelUsed,
        Boolean genuine) {

    public StoredAnomaly withGenuine(boolean judgment) {
        return new StoredAnomaly(anomalyId, logId, deviceId, detectedAt, score, modelUsed, judgment);
    }
}
