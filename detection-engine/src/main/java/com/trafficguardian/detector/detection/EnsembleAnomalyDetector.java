package com.trafficguardian.detector.detection;

import com.trafficguardian.detector.config.DetectionConfig;
import com.trafficguardian.detector.error.ConfigurationException;
import com.trafficguardian.detector.error.InsufficientDataException;
import com.trafficguardian.detector.error.NotReadyException;
import com.trafficguardian.detector.feature.FeatureExtractor;
import com.trafficguardian.detector.feature.FeatureMatrix;
import com.trafficguardian.detector.traffic.TrafficTable;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Two-model ensemble anomaly detector.
 *
 * <p>
 * Model A (isolation forest) and Model B (local outlier factor) are always
 * fitted together, on the same feature matrix and with the same
 * contamination, and published with their feature transformer as one
 * {@link DetectorState}. Training is single-writer; scoring takes a snapshot
 * of the state at call start and never observes a half-replaced set.
 * </p>
 *
 * <p>
 * With a threshold, a record is anomalous when its combined (or single-model)
 * score is strictly greater than the threshold. Without one, the requested
 * models' native decisions are OR-ed.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class EnsembleAnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(EnsembleAnomalyDetector.class);

    private final DetectionConfig config;
    private final FeatureExtractor featureExtractor;
    private final ModelStore modelStore;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final AtomicReference<DetectorState> state = new AtomicReference<>();
    private final ReentrantLock trainingLock = new ReentrantLock();

    private Counter recordsScored;
    private Counter anomaliesDetected;
    private Counter trainingRuns;
    private Timer scoringLatency;
    private Timer trainingLatency;

    public EnsembleAnomalyDetector(
            DetectionConfig config,
            FeatureExtractor featureExtractor,
            ModelStore modelStore,
            MeterRegistry meterRegistry,
            Clock clock) {
        this.config = config;
        this.featureExtractor = featureExtractor;
        this.modelStore = modelStore;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        recordsScored = Counter.builder("guardian.detection.records.scored")
                .description("Traffic records scored by the ensemble")
                .register(meterRegistry);
        anomaliesDetected = Counter.builder("guardian.detection.anomalies.detected")
                .description("Traffic records flagged as anomalous")
                .register(meterRegistry);
        trainingRuns = Counter.builder("guardian.detection.training.runs")
                .description("Completed model set trainings")
                .register(meterRegistry);
        scoringLatency = Timer.builder("guardian.detection.scoring.latency")
                .description("Time to extract features and score one batch")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);
        trainingLatency = Timer.builder("guardian.detection.training.latency")
                .description("Time to fit and persist one model set")
                .register(meterRegistry);

        try {
            modelStore.load().ifPresentOrElse(
                    loaded -> {
                        state.set(loaded);
                        log.info("Ensemble detector ready with model set version {}", loaded.version());
                    },
                    () -> log.warn("No persisted model set under {}, detector needs training", modelStore.root()));
        } catch (NotReadyException e) {
            log.error("Persisted model set could not be loaded, detector needs training", e);
        }
    }

    /**
     * Fit a new model set on a table and make it current.
     *
     * @param contamination expected outlier share, {@code null} for the
     *                      configured default
     * @throws InsufficientDataException if the table has fewer than the
     *                                   configured minimum of records
     */
    public DetectorStatus train(TrafficTable table, Double contamination) {
        return train(table, contamination, config.getMinTrainingSamples());
    }

    /**
     * Fit a new model set with an explicit minimum sample count, as used by
     * feedback-driven retraining.
     */
    public DetectorStatus train(TrafficTable table, Double contamination, int minSamples) {
        int required = Math.max(2, minSamples);
        if (table.size() < required) {
            throw new InsufficientDataException(table.size(), required);
        }
        double share = contamination != null ? contamination : config.getContamination();
        if (!(share > 0.0 && share <= 0.5)) {
            throw new ConfigurationException("Contamination must be in (0, 0.5], got " + share);
        }

        trainingLock.lock();
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            FeatureExtractor.Extraction extraction = featureExtractor.extract(
                    table, config.isAdvancedFeatures(), true, null);
            double[][] x = extraction.matrix().values();

            DetectionConfig.IsolationForest forestConfig = config.getIsolationForest();
            IsolationForestModel modelA = IsolationForestModel.fit(x, share, forestConfig.getTrees(),
                    forestConfig.getSubsample(), forestConfig.getSeed());
            LocalOutlierFactorModel modelB = LocalOutlierFactorModel.fit(x, config.getLof().getNeighbors(), share);

            DetectorState current = state.get();
            long version = Math.max(modelStore.nextVersion(), current != null ? current.version() + 1 : 1L);
            DetectorState next = new DetectorState(version, clock.instant(), extraction.transformer(),
                    modelA, modelB, share, table.size());
            modelStore.save(next);
            state.set(next);
            trainingRuns.increment();

            log.info("Trained model set version {}: {} records, {} features, contamination={}",
                    version, table.size(), extraction.transformer().featureCount(), share);
            return DetectorStatus.of(next);
        } finally {
            sample.stop(trainingLatency);
            trainingLock.unlock();
        }
    }

    /**
     * Score a table.
     *
     * @param threshold decision threshold on the normalized score, or
     *                  {@code null} for the models' native decisions
     * @param selection models to use, {@code null} for the configured default
     * @throws NotReadyException if no model set has been trained or loaded
     */
    public List<AnomalyResult> score(TrafficTable table, Double threshold, ModelSelection selection) {
        DetectorState snapshot = requireState();
        if (table.isEmpty()) {
            return List.of();
        }
        ModelSelection models = selection != null ? selection : ModelSelection.fromName(config.getDefaultModel());

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            FeatureMatrix matrix = featureExtractor.extract(
                    table, snapshot.transformer().advanced(), false, snapshot.transformer()).matrix();
            double[][] x = matrix.values();
            int n = x.length;

            double[] forestDecisions = models.usesIsolationForest()
                    ? snapshot.isolationForest().decisionFunction(x)
                    : null;
            double[] lofDecisions = models.usesLof() ? snapshot.lof().decisionFunction(x) : null;
            double[] lofScores = lofDecisions != null ? normalizeLof(snapshot.lof(), lofDecisions) : null;

            List<AnomalyResult> results = new ArrayList<>(n);
            int anomalies = 0;
            for (int i = 0; i < n; i++) {
                Double forestRaw = forestDecisions != null ? forestDecisions[i] : null;
                Double forestScore = forestRaw != null ? IsolationForestModel.normalize(forestRaw) : null;
                Double lofRaw = lofDecisions != null ? lofDecisions[i] : null;
                Double lofScore = lofScores != null ? lofScores[i] : null;

                double combined = combine(forestScore, lofScore);
                List<String> flaggedBy = new ArrayList<>(2);
                if (forestRaw != null && forestRaw < 0.0) {
                    flaggedBy.add(IsolationForestModel.NAME);
                }
                if (lofRaw != null && lofRaw < 0.0) {
                    flaggedBy.add(LocalOutlierFactorModel.NAME);
                }
                boolean anomaly = threshold != null ? combined > threshold : !flaggedBy.isEmpty();
                if (anomaly) {
                    anomalies++;
                }
                results.add(new AnomalyResult(table.get(i), anomaly, forestRaw, forestScore, lofRaw, lofScore,
                        combined, flaggedBy, models, snapshot.version()));
            }

            recordsScored.increment(n);
            anomaliesDetected.increment(anomalies);
            log.debug("Scored {} records with {} (threshold={}): {} anomalies", n, models.modelName(),
                    threshold, anomalies);
            return results;
        } finally {
            sample.stop(scoringLatency);
        }
    }

    private double[] normalizeLof(LocalOutlierFactorModel lof, double[] decisions) {
        double[] scores = new double[decisions.length];
        if (config.getLofNormalization() == ScoreNormalization.CALIBRATED) {
            for (int i = 0; i < decisions.length; i++) {
                scores[i] = lof.normalizeCalibrated(decisions[i]);
            }
            return scores;
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double d : decisions) {
            min = Math.min(min, d);
            max = Math.max(max, d);
        }
        for (int i = 0; i < decisions.length; i++) {
            scores[i] = LocalOutlierFactorModel.normalize(decisions[i], min, max);
        }
        return scores;
    }

    private static double combine(Double forestScore, Double lofScore) {
        if (forestScore != null && lofScore != null) {
            return (forestScore + lofScore) / 2.0;
        }
        return forestScore != null ? forestScore : lofScore;
    }

    /** Normalized features of a table under the transformer in force. */
    public FeatureMatrix extractFeatures(TrafficTable table) {
        DetectorState snapshot = requireState();
        return featureExtractor.extract(table, snapshot.transformer().advanced(), false, snapshot.transformer())
                .matrix();
    }

    private DetectorState requireState() {
        DetectorState snapshot = state.get();
        if (snapshot == null) {
            throw new NotReadyException("No trained model set, train the detector first");
        }
        return snapshot;
    }

    public boolean isReady() {
        return state.get() != null;
    }

    public Optional<DetectorState> currentState() {
        return Optional.ofNullable(state.get());
    }

    public DetectorStatus status() {
        DetectorState snapshot = state.get();
        return snapshot != null ? DetectorStatus.of(snapshot) : DetectorStatus.notReady();
    }

    public boolean isTraining() {
        return trainingLock.isLocked();
    }
}
