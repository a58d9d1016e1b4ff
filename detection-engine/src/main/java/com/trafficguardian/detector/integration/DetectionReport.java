package com.trafficguardian.detector.integration;

import com.trafficguardian.detector.detection.AnomalyResult;
import com.trafficguardian.detector.detection.ModelSelection;
import com.trafficguardian.detector.storage.StoredAnomaly;

import java.util.List;

/**
 * Outcome of one detection call.
 *
 * @param recordsProcessed number of normalized records scored
 * @param anomalies        the anomalous results only
 * @param stored           persisted anomalies, empty when storing was off
 * @param threshold        threshold applied, {@code null} for native decisions
 */
public record DetectionReport(
        int recordsProcessed,
        List<AnomalyResult> anomalies,
        List<StoredAnomaly> stored,
        Double threshold,
        ModelSelection model,
        long modelVersion) {

    public DetectionReport {
        anomalies = List.copyOf(anomalies);
        stored = List.copyOf(stored);
    }

    public int anomalyCount() {
        return anomalies.size();
    }
}
