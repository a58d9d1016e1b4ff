package com.trafficguardian.detector.storage;

import com.trafficguardian.detector.traffic.TrafficTable;

import java.util.Collection;

/**
 * Storage of canonical traffic records.
 *
 * @author Naveed Gung
 */
public interface TrafficRepository {

    /**
     * Persist a batch, assigning a log id to every record.
     *
     * @return the batch with log ids set, in the same order
     */
    TrafficTable saveAll(TrafficTable table);

    /**
     * Most recent records, newest first.
     *
     * @param deviceId restrict to one device, or {@code null} for all
     */
    TrafficTable findRecent(int limit, Integer deviceId);

    TrafficTable findByLogIds(Collection<Long> logIds);
}
