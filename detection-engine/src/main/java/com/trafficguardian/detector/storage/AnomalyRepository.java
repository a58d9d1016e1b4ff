package com.trafficguardian.detector.storage;

import com.trafficguardian.detector.detection.AnomalyResult;

import java.util.List;
import java.util.Optional;

/**
 * Storage of anomaly detections.
 *
 * @author Naveed Gung
 */
public interface AnomalyRepository {

    /**
     * Persist the anomalous results of a scoring call; non-anomalous results
     * are ignored.
     */
    List<StoredAnomaly> saveAll(List<AnomalyResult> results);

    Optional<StoredAnomaly> findById(long anomalyId);

    /** @return {@code false} when no anomaly has that id */
    boolean updateGenuine(long anomalyId, boolean genuine);

    List<StoredAnomaly> findRecent(int limit);
}
