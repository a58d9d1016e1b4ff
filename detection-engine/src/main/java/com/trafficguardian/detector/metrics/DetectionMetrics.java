package com.trafficguardian.detector.metrics;

import com.trafficguardian.detector.detection.EnsembleAnomalyDetector;
import com.trafficguardian.detector.feedback.FeedbackLoop;
import com.trafficguardian.detector.feedback.RetrainOutcome;
import com.trafficguardian.detector.integration.DetectionService;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Exposes detector and feedback metrics via Micrometer.
 *
 * <p>
 * Registered gauges (in addition to the detector's counters and timers):
 * </p>
 * <ul>
 * <li>{@code guardian.models.version} - version of the model set in force</li>
 * <li>{@code guardian.models.ready} - 1 when a model set is loaded</li>
 * <li>{@code guardian.feedback.pending} - feedback entries since the last
 * retrain</li>
 * <li>{@code guardian.stream.buffered_messages} - messages waiting in live
 * stream buffers</li>
 * <li>{@code guardian.uptime_seconds} - detection engine uptime</li>
 * </ul>
 *
 * <p>
 * Also runs the periodic retraining policy check.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class DetectionMetrics {

    private static final Logger log = LoggerFactory.getLogger(DetectionMetrics.class);

    private final EnsembleAnomalyDetector detector;
    private final FeedbackLoop feedbackLoop;
    private final DetectionService detectionService;
    private final MeterRegistry meterRegistry;

    private final long startTime = System.currentTimeMillis();

    public DetectionMetrics(
            EnsembleAnomalyDetector detector,
            FeedbackLoop feedbackLoop,
            DetectionService detectionService,
            MeterRegistry meterRegistry) {
        this.detector = detector;
        this.feedbackLoop = feedbackLoop;
        this.detectionService = detectionService;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void registerGauges() {
        Gauge.builder("guardian.models.version", detector, d -> d.status().version())
                .description("Version of the model set in force")
                .register(meterRegistry);

        Gauge.builder("guardian.models.ready", detector, d -> d.isReady() ? 1.0 : 0.0)
                .description("Whether a trained model set is loaded")
                .register(meterRegistry);

        Gauge.builder("guardian.feedback.pending", feedbackLoop, FeedbackLoop::pendingFeedbackCount)
                .description("Feedback entries recorded since the last retrain")
                .register(meterRegistry);

        Gauge.builder("guardian.stream.buffered_messages", detectionService,
                DetectionService::bufferedStreamMessages)
                .description("Messages waiting in live stream buffers")
                .register(meterRegistry);

        Gauge.builder("guardian.uptime_seconds", this, g -> (System.currentTimeMillis() - g.startTime) / 1000.0)
                .description("Detection engine uptime in seconds")
                .register(meterRegistry);

        log.info("Detection metrics registered");
    }

    /**
     * Periodic retraining check, so accumulated feedback is acted on even when
     * no new feedback arrives.
     */
    @Scheduled(fixedDelayString = "${guardian.feedback.check-interval-ms:3600000}",
            initialDelayString = "${guardian.feedback.check-interval-ms:3600000}")
    public void periodicRetrainCheck() {
        log.debug("Running periodic retrain check");

        try {
            RetrainOutcome outcome = feedbackLoop.checkRetrain();
            if (outcome.retrained()) {
                log.info("Periodic check retrained the models, now version {}", detector.status().version());
            }
        } catch (Exception e) {
            log.error("Periodic retrain check failed: {}", e.getMessage(), e);
        }
    }
}
