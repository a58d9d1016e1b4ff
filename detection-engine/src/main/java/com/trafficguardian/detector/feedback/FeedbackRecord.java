package com.trafficguardian.detector.feedback;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * One analyst judgment on a past detection, as appended to the feedback log.
 *
 * @param timestamp    when the judged anomaly was detected
 * @param genuine      {@code true} for a confirmed anomaly, {@code false} for
 *                     a false positive
 * @param feedbackTime when the judgment was recorded
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FeedbackRecord(
        long anomalyId,
        Long logId,
        int deviceId,
        Instant timestamp,
        boolean genuine,
        Instant feedbackTime,
        String modelUsed) {
}
