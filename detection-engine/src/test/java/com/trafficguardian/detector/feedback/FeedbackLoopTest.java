package com.trafficguardian.detector.feedback;

import com.trafficguardian.detector.TrafficFixtures;
import com.trafficguardian.detector.TrafficFixtures.MutableClock;
import com.trafficguardian.detector.config.FeedbackConfig;
import com.trafficguardian.detector.detection.AnomalyResult;
import com.trafficguardian.detector.detection.EnsembleAnomalyDetector;
import com.trafficguardian.detector.detection.ModelSelection;
import com.trafficguardian.detector.detection.ModelStore;
import com.trafficguardian.detector.error.NotFoundException;
import com.trafficguardian.detector.feature.FeatureExtractor;
import com.trafficguardian.detector.storage.InMemoryAnomalyRepository;
import com.trafficguardian.detector.storage.InMemoryTrafficRepository;
import com.trafficguardian.detector.storage.StoredAnomaly;
import com.trafficguardian.detector.storage.TrafficRepository;
import com.trafficguardian.detector.traffic.TrafficRecord;
import com.trafficguardian.detector.traffic.TrafficTable;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FeedbackLoopTest {

    private static final Instant T0 = Instant.parse("2024-03-05T00:00:00Z");

    @TempDir
    Path dir;

    private MutableClock clock;
    private FeedbackConfig config;
    private InMemoryTrafficRepository trafficRepository;
    private InMemoryAnomalyRepository anomalyRepository;
    private FeedbackLog feedbackLog;
    private EnsembleAnomalyDetector detector;
    private FeedbackLoop loop;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        config = new FeedbackConfig();
        config.setRetrainIntervalDays(7);
        config.setMinFeedbackCount(10);
        config.setMaxFeedbackAgeDays(90);
        trafficRepository = new InMemoryTrafficRepository();
        anomalyRepository = new InMemoryAnomalyRepository(clock);
        feedbackLog = new FeedbackLog(dir.resolve("feedback").resolve("history.jsonl"),
                TrafficFixtures.objectMapper());
        detector = new EnsembleAnomalyDetector(TrafficFixtures.detectionConfig(), new FeatureExtractor(),
                new ModelStore(dir.resolve("models"), 3, TrafficFixtures.objectMapper()),
                new SimpleMeterRegistry(), clock);
        detector.init();
        loop = newLoop(trafficRepository);
    }

    private FeedbackLoop newLoop(TrafficRepository traffic) {
        return new FeedbackLoop(config, feedbackLog, anomalyRepository, traffic, detector, clock);
    }

    private List<StoredAnomaly> storeAnomalies(int count, long seed) {
        TrafficTable stored = trafficRepository.saveAll(TrafficFixtures.normalTraffic(count, seed));
        List<AnomalyResult> results = new ArrayList<>();
        for (TrafficRecord record : stored) {
            results.add(new AnomalyResult(record, true, -0.1, 0.55, -0.2, 0.9, 0.72,
                    List.of("isolation_forest"), ModelSelection.BOTH, 1L));
        }
        return anomalyRepository.saveAll(results);
    }

    @Test
    void shouldRejectFeedbackForUnknownAnomaly() {
        assertThrows(NotFoundException.class, () -> loop.recordFeedback(404L, true));

        assertEquals(0, feedbackLog.size());
        assertFalse(Files.exists(feedbackLog.file()));
    }

    @Test
    void shouldPersistJudgmentAndUpdateAnomaly() {
        StoredAnomaly anomaly = storeAnomalies(1, 1L).get(0);

        loop.recordFeedback(anomaly.anomalyId(), false);

        assertEquals(Boolean.FALSE, anomalyRepository.findById(anomaly.anomalyId()).orElseThrow().genuine());
        FeedbackRecord entry = feedbackLog.entries().get(0);
        assertEquals(anomaly.anomalyId(), entry.anomalyId());
        assertEquals(anomaly.logId(), entry.logId());
        assertEquals(T0, entry.feedbackTime());
        assertEquals("both", entry.modelUsed());
        assertFalse(entry.genuine());

        FeedbackLog reopened = new FeedbackLog(feedbackLog.file(), TrafficFixtures.objectMapper());
        assertEquals(feedbackLog.entries(), reopened.entries());
    }

    @Test
    void shouldRetrainUntrainedDetectorOnceEnoughFeedbackArrives() {
        List<StoredAnomaly> anomalies = storeAnomalies(10, 2L);

        for (int i = 0; i < 9; i++) {
            assertEquals(RetrainOutcome.SKIPPED_FEEDBACK_COUNT,
                    loop.recordFeedback(anomalies.get(i).anomalyId(), i < 3));
        }
        RetrainOutcome outcome = loop.recordFeedback(anomalies.get(9).anomalyId(), false);

        assertEquals(RetrainOutcome.RETRAINED, outcome);
        assertTrue(detector.isReady());
        assertEquals(10, detector.status().samples());
        assertEquals(0.3, detector.status().contamination(), 1e-12);
        assertEquals(RetrainState.IDLE, loop.state());
        assertEquals(T0, loop.lastRetrain());
        assertEquals(0, loop.pendingFeedbackCount());
    }

    @Test
    void shouldWaitForRetrainInterval() {
        detector.train(TrafficFixtures.normalTraffic(60, 3L), null);
        List<StoredAnomaly> anomalies = storeAnomalies(12, 4L);
        clock.advance(Duration.ofDays(1));

        for (StoredAnomaly anomaly : anomalies) {
            assertEquals(RetrainOutcome.SKIPPED_INTERVAL, loop.recordFeedback(anomaly.anomalyId(), true));
        }
        assertEquals(12, loop.pendingFeedbackCount());

        clock.advance(Duration.ofDays(7));

        assertEquals(RetrainOutcome.RETRAINED, loop.checkRetrain());
        assertEquals(2L, detector.status().version());
        assertEquals(0.5, detector.status().contamination(), 1e-12);
        assertEquals(T0.plus(Duration.ofDays(8)), loop.lastRetrain());
    }

    @Test
    void shouldRequireFeedbackSinceLastRetrain() {
        List<StoredAnomaly> anomalies = storeAnomalies(10, 5L);
        for (StoredAnomaly anomaly : anomalies) {
            loop.recordFeedback(anomaly.anomalyId(), false);
        }
        assertEquals(1L, detector.status().version());

        clock.advance(Duration.ofDays(10));

        assertEquals(RetrainOutcome.SKIPPED_FEEDBACK_COUNT, loop.checkRetrain());
        assertEquals(1L, detector.status().version());
    }

    @Test
    void shouldForceRetrainRegardlessOfPolicy() {
        detector.train(TrafficFixtures.normalTraffic(60, 6L), null);
        clock.advance(Duration.ofHours(1));
        for (StoredAnomaly anomaly : storeAnomalies(10, 7L)) {
            loop.recordFeedback(anomaly.anomalyId(), false);
        }
        assertEquals(1L, detector.status().version());

        assertEquals(RetrainOutcome.RETRAINED, loop.retrain(true));

        assertEquals(2L, detector.status().version());
        assertEquals(FeedbackLoop.MIN_CONTAMINATION, detector.status().contamination(), 1e-12);
    }

    @Test
    void shouldKeepModelsWhenTooFewRecordsRemain() {
        detector.train(TrafficFixtures.normalTraffic(60, 8L), null);
        for (StoredAnomaly anomaly : storeAnomalies(5, 9L)) {
            loop.recordFeedback(anomaly.anomalyId(), true);
        }

        assertEquals(RetrainOutcome.INSUFFICIENT_DATA, loop.retrain(true));

        assertEquals(RetrainState.ERROR, loop.state());
        assertNotNull(loop.lastError());
        assertEquals(1L, detector.status().version());
    }

    @Test
    void shouldReturnToIdleOnNextCheckAfterFailure() {
        detector.train(TrafficFixtures.normalTraffic(60, 8L), null);
        for (StoredAnomaly anomaly : storeAnomalies(5, 9L)) {
            loop.recordFeedback(anomaly.anomalyId(), true);
        }
        assertEquals(RetrainOutcome.INSUFFICIENT_DATA, loop.retrain(true));
        assertEquals(RetrainState.ERROR, loop.state());

        assertEquals(RetrainOutcome.SKIPPED_INTERVAL, loop.checkRetrain());

        assertEquals(RetrainState.IDLE, loop.state());
        assertEquals(1L, detector.status().version());
    }

    @Test
    void shouldRecordFeedbackWhenAnomalyVanishesDuringUpdate() {
        StoredAnomaly anomaly = storeAnomalies(1, 13L).get(0);
        InMemoryAnomalyRepository vanishing = new InMemoryAnomalyRepository(clock) {
            @Override
            public Optional<StoredAnomaly> findById(long anomalyId) {
                return anomalyRepository.findById(anomalyId);
            }
        };
        FeedbackLoop racing = new FeedbackLoop(config, feedbackLog, vanishing, trafficRepository, detector, clock);

        racing.recordFeedback(anomaly.anomalyId(), true);

        assertEquals(1, feedbackLog.size());
    }

    @Test
    void shouldKeepModelsWhenRecordFetchFails() {
        detector.train(TrafficFixtures.normalTraffic(60, 10L), null);
        for (StoredAnomaly anomaly : storeAnomalies(10, 11L)) {
            loop.recordFeedback(anomaly.anomalyId(), true);
        }
        FeedbackLoop failing = newLoop(new InMemoryTrafficRepository() {
            @Override
            public TrafficTable findByLogIds(Collection<Long> logIds) {
                throw new IllegalStateException("database unavailable");
            }
        });

        assertEquals(RetrainOutcome.ERROR, failing.retrain(true));

        assertEquals(RetrainState.ERROR, failing.state());
        assertEquals(1L, detector.status().version());
        assertTrue(detector.isReady());
    }

    @Test
    void shouldUseMostRecentJudgmentPerAnomaly() {
        StoredAnomaly anomaly = storeAnomalies(1, 12L).get(0);
        loop.recordFeedback(anomaly.anomalyId(), true);
        clock.advance(Duration.ofMinutes(5));
        loop.recordFeedback(anomaly.anomalyId(), false);

        Collection<FeedbackRecord> latest = loop.latestPerAnomaly(T0.minus(Duration.ofDays(1)));

        assertEquals(1, latest.size());
        assertFalse(latest.iterator().next().genuine());
    }

    @Test
    void shouldIgnoreFeedbackOlderThanMaxAge() {
        StoredAnomaly anomaly = storeAnomalies(1, 13L).get(0);
        loop.recordFeedback(anomaly.anomalyId(), true);

        assertTrue(loop.latestPerAnomaly(T0.plusSeconds(1)).isEmpty());
    }

    @Test
    void shouldSummarizeFeedbackByModel() {
        List<StoredAnomaly> anomalies = storeAnomalies(3, 14L);
        loop.recordFeedback(anomalies.get(0).anomalyId(), true);
        loop.recordFeedback(anomalies.get(1).anomalyId(), false);
        loop.recordFeedback(anomalies.get(2).anomalyId(), false);

        FeedbackStats stats = loop.stats();

        assertEquals(3, stats.totalFeedback());
        assertEquals(1, stats.genuineAnomalies());
        assertEquals(2, stats.falsePositives());
        assertEquals(3, stats.pendingSinceLastRetrain());
        assertNull(stats.lastRetrain());
        assertEquals(new FeedbackStats.ModelFeedback(3, 1, 2), stats.feedbackByModel().get("both"));
    }

    @Test
    void shouldRejectInvalidPolicy() {
        assertThrows(IllegalArgumentException.class, () -> new RetrainPolicy(7, 0, 90));
    }
}
