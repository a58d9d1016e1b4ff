package com.trafficguardian.detector.detection;

import java.time.Instant;

/**
 * Snapshot of detector readiness for health reporting.
 */
public record DetectorStatus(
        boolean ready,
        long version,
        Instant trainedAt,
        int featureCount,
        int samples,
        double contamination) {

    static DetectorStatus notReady() {
        return new DetectorStatus(false, 0L, null, 0, 0, 0.0);
    }

    static DetectorStatus of(DetectorState state) {
        return new DetectorStatus(true, state.version(), state.trainedAt(),
                state.transformer().featureCount(), state.samples(), state.contamination());
    }
}
