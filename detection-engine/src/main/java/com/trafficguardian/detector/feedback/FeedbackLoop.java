package com.trafficguardian.detector.feedback;

import com.trafficguardian.detector.config.FeedbackConfig;
import com.trafficguardian.detector.detection.DetectorState;
import com.trafficguardian.detector.detection.EnsembleAnomalyDetector;
import com.trafficguardian.detector.error.InsufficientDataException;
import com.trafficguardian.detector.error.NotFoundException;
import com.trafficguardian.detector.storage.AnomalyRepository;
import com.trafficguardian.detector.storage.StoredAnomaly;
import com.trafficguardian.detector.storage.TrafficRepository;
import com.trafficguardian.detector.traffic.TrafficRecord;
import com.trafficguardian.detector.traffic.TrafficTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Records analyst feedback on detections and retrains the ensemble from it.
 *
 * <p>
 * After every feedback write the retraining policy is evaluated: a retrain
 * runs only when the retrain interval has elapsed since the last retrain AND
 * at least {@code minFeedbackCount} entries arrived since then. A forced
 * retrain skips both checks. Evaluation and execution form one critical
 * section; a concurrent attempt reports {@link RetrainOutcome#ALREADY_RUNNING}.
 * </p>
 *
 * <p>
 * Retraining failures never propagate: they are logged, the state becomes
 * {@link RetrainState#ERROR} and the previous model set stays in force.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class FeedbackLoop {

    private static final Logger log = LoggerFactory.getLogger(FeedbackLoop.class);

    static final double MIN_CONTAMINATION = 0.01;
    static final double MAX_CONTAMINATION = 0.5;

    private final FeedbackConfig config;
    private final FeedbackLog feedbackLog;
    private final AnomalyRepository anomalyRepository;
    private final TrafficRepository trafficRepository;
    private final EnsembleAnomalyDetector detector;
    private final Clock clock;

    private final ReentrantLock retrainLock = new ReentrantLock();
    private volatile RetrainState state = RetrainState.IDLE;
    private volatile String lastError;

    public FeedbackLoop(
            FeedbackConfig config,
            FeedbackLog feedbackLog,
            AnomalyRepository anomalyRepository,
            TrafficRepository trafficRepository,
            EnsembleAnomalyDetector detector,
            Clock clock) {
        this.config = config;
        this.feedbackLog = feedbackLog;
        this.anomalyRepository = anomalyRepository;
        this.trafficRepository = trafficRepository;
        this.detector = detector;
        this.clock = clock;
    }

    public RetrainOutcome recordFeedback(long anomalyId, boolean genuine) {
        return recordFeedback(anomalyId, genuine, RetrainPolicy.from(config));
    }

    /**
     * Record a judgment on a stored anomaly, then evaluate the retraining
     * policy.
     *
     * @throws NotFoundException if no anomaly has that id; nothing is written
     */
    public RetrainOutcome recordFeedback(long anomalyId, boolean genuine, RetrainPolicy policy) {
        StoredAnomaly anomaly = anomalyRepository.findById(anomalyId)
                .orElseThrow(() -> new NotFoundException("Anomaly " + anomalyId + " not found"));

        if (!anomalyRepository.updateGenuine(anomalyId, genuine)) {
            log.warn("Anomaly {} disappeared before its judgment could be stored", anomalyId);
        }
        feedbackLog.append(new FeedbackRecord(
                anomalyId,
                anomaly.logId(),
                anomaly.deviceId(),
                anomaly.detectedAt(),
                genuine,
                clock.instant(),
                anomaly.modelUsed()));
        log.info("Recorded feedback for anomaly {}: genuine={}", anomalyId, genuine);

        return checkRetrain(policy);
    }

    public RetrainOutcome checkRetrain() {
        return checkRetrain(RetrainPolicy.from(config));
    }

    /**
     * Evaluate the policy and retrain when both conditions hold. A previous
     * failure is cleared here, so the loop is idle again until the next
     * attempt fails.
     */
    public RetrainOutcome checkRetrain(RetrainPolicy policy) {
        if (!retrainLock.tryLock()) {
            return RetrainOutcome.ALREADY_RUNNING;
        }
        try {
            if (state == RetrainState.ERROR) {
                log.info("Clearing retrain error state, last error: {}", lastError);
                state = RetrainState.IDLE;
            }
            Instant now = clock.instant();
            Instant lastRetrain = lastRetrain();
            if (lastRetrain != null
                    && Duration.between(lastRetrain, now).compareTo(Duration.ofDays(policy.retrainIntervalDays())) < 0) {
                log.debug("Skipping retraining: last retrain at {} is within {} days",
                        lastRetrain, policy.retrainIntervalDays());
                return RetrainOutcome.SKIPPED_INTERVAL;
            }
            int pending = feedbackSince(lastRetrain);
            if (pending < policy.minFeedbackCount()) {
                log.debug("Skipping retraining: {} new feedback entries, {} required",
                        pending, policy.minFeedbackCount());
                return RetrainOutcome.SKIPPED_FEEDBACK_COUNT;
            }
            return retrainLocked(policy);
        } finally {
            retrainLock.unlock();
        }
    }

    public RetrainOutcome retrain(boolean force) {
        return retrain(force, RetrainPolicy.from(config));
    }

    /**
     * @param force {@code true} to skip the interval and feedback-count checks
     */
    public RetrainOutcome retrain(boolean force, RetrainPolicy policy) {
        if (!force) {
            return checkRetrain(policy);
        }
        if (!retrainLock.tryLock()) {
            return RetrainOutcome.ALREADY_RUNNING;
        }
        try {
            log.info("Forced retraining requested");
            return retrainLocked(policy);
        } finally {
            retrainLock.unlock();
        }
    }

    private RetrainOutcome retrainLocked(RetrainPolicy policy) {
        state = RetrainState.TRAINING;
        Instant cutoff = clock.instant().minus(Duration.ofDays(policy.maxFeedbackAgeDays()));
        Collection<FeedbackRecord> selected = latestPerAnomaly(cutoff);
        Set<Long> logIds = selected.stream()
                .map(FeedbackRecord::logId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());

        TrafficTable records;
        try {
            records = trafficRepository.findByLogIds(logIds);
        } catch (RuntimeException e) {
            return fail(RetrainOutcome.ERROR, "Fetching " + logIds.size() + " feedback records failed", e);
        }
        if (records.size() < policy.minFeedbackCount()) {
            return fail(RetrainOutcome.INSUFFICIENT_DATA, String.format(
                    "%d valid records for %d feedback entries, %d required",
                    records.size(), selected.size(), policy.minFeedbackCount()), null);
        }

        double contamination = contamination(selected, records);
        log.info("Retraining with {} records from {} feedback entries, contamination={}",
                records.size(), selected.size(), contamination);
        try {
            detector.train(records, contamination, policy.minFeedbackCount());
        } catch (InsufficientDataException e) {
            return fail(RetrainOutcome.INSUFFICIENT_DATA, e.getMessage(), null);
        } catch (RuntimeException e) {
            return fail(RetrainOutcome.ERROR, "Model fitting failed", e);
        }
        state = RetrainState.IDLE;
        lastError = null;
        log.info("Models retrained from feedback");
        return RetrainOutcome.RETRAINED;
    }

    private RetrainOutcome fail(RetrainOutcome outcome, String message, Exception cause) {
        state = RetrainState.ERROR;
        lastError = message;
        if (cause != null) {
            log.error("Retraining failed: {}", message, cause);
        } else {
            log.warn("Retraining skipped: {}", message);
        }
        return outcome;
    }

    /**
     * Feedback within the recency window, reduced to the most recent judgment
     * per anomaly (later log entries win ties).
     */
    Collection<FeedbackRecord> latestPerAnomaly(Instant cutoff) {
        Map<Long, FeedbackRecord> latest = new LinkedHashMap<>();
        for (FeedbackRecord entry : feedbackLog.entries()) {
            if (entry.feedbackTime() == null || entry.feedbackTime().isBefore(cutoff)) {
                continue;
            }
            latest.merge(entry.anomalyId(), entry,
                    (previous, candidate) -> candidate.feedbackTime().isBefore(previous.feedbackTime())
                            ? previous
                            : candidate);
        }
        return latest.values();
    }

    /**
     * Share of genuine judgments among the selected feedback whose records were
     * found, clamped to the range the models accept.
     */
    static double contamination(Collection<FeedbackRecord> selected, TrafficTable records) {
        Set<Long> found = records.stream().map(TrafficRecord::logId).collect(Collectors.toSet());
        List<FeedbackRecord> usable = selected.stream().filter(f -> found.contains(f.logId())).toList();
        if (usable.isEmpty()) {
            return MIN_CONTAMINATION;
        }
        double genuineShare = (double) usable.stream().filter(FeedbackRecord::genuine).count() / usable.size();
        return Math.max(MIN_CONTAMINATION, Math.min(MAX_CONTAMINATION, genuineShare));
    }

    /** Time of the last (re)training, {@code null} if the detector was never trained. */
    public Instant lastRetrain() {
        return detector.currentState().map(DetectorState::trainedAt).orElse(null);
    }

    private int feedbackSince(Instant since) {
        if (since == null) {
            return feedbackLog.size();
        }
        return (int) feedbackLog.entries().stream()
                .filter(f -> f.feedbackTime() != null && f.feedbackTime().isAfter(since))
                .count();
    }

    public int pendingFeedbackCount() {
        return feedbackSince(lastRetrain());
    }

    public FeedbackStats stats() {
        List<FeedbackRecord> entries = feedbackLog.entries();
        int genuine = (int) entries.stream().filter(FeedbackRecord::genuine).count();
        Map<String, FeedbackStats.ModelFeedback> byModel = new TreeMap<>();
        entries.stream()
                .collect(Collectors.groupingBy(f -> f.modelUsed() != null ? f.modelUsed() : "unknown"))
                .forEach((model, modelEntries) -> {
                    int modelGenuine = (int) modelEntries.stream().filter(FeedbackRecord::genuine).count();
                    byModel.put(model, new FeedbackStats.ModelFeedback(
                            modelEntries.size(), modelGenuine, modelEntries.size() - modelGenuine));
                });
        return new FeedbackStats(entries.size(), genuine, entries.size() - genuine, pendingFeedbackCount(),
                lastRetrain(), state, byModel);
    }

    public RetrainState state() {
        return state;
    }

    public String lastError() {
        return lastError;
    }
}
