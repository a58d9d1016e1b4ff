package com.trafficguardian.detector.storage;

import com.trafficguardian.detector.detection.AnomalyResult;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local anomaly store, active unless another storage type is
 * configured.
 *
 * @author Naveed Gung
 */
@Repository
@ConditionalOnProperty(prefix = "guardian.storage", name = "type", havingValue = "memory", matchIfMissing = true)
public class InMemoryAnomalyRepository implements AnomalyRepository {

    private final Map<Long, StoredAnomaly> anomalies = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Clock clock;

    public InMemoryAnomalyRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public List<StoredAnomaly> saveAll(List<AnomalyResult> results) {
        List<StoredAnomaly> saved = new ArrayList<>();
        for (AnomalyResult result : results) {
            if (!result.anomaly()) {
                continue;
            }
            StoredAnomaly anomaly = new StoredAnomaly(
                    sequence.incrementAndGet(),
                    result.record().logId(),
                    result.record().deviceId(),
                    clock.instant(),
                    result.combinedScore(),
                    result.modelUsed().modelName(),
                    null);
            anomalies.put(anomaly.anomalyId(), anomaly);
            saved.add(anomaly);
        }
        return saved;
    }

    @Override
    public Optional<StoredAnomaly> findById(long anomalyId) {
        return Optional.ofNullable(anomalies.get(anomalyId));
    }

    @Override
    public boolean updateGenuine(long anomalyId, boolean genuine) {
        return anomalies.computeIfPresent(anomalyId, (id, anomaly) -> anomaly.withGenuine(genuine)) != null;
    }

    @Override
    public List<StoredAnomaly> findRecent(int limit) {
        return anomalies.values().stream()
                .sorted(Comparator.comparingLong(StoredAnomaly::anomalyId).reversed())
                .limit(Math.max(0, limit))
                .toList();
    }
}
