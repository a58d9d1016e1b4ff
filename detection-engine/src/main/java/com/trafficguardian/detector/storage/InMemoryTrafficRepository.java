package com.trafficguardian.detector.storage;

import com.trafficguardian.detector.traffic.TrafficRecord;
import com.trafficguardian.detector.traffic.TrafficTable;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local traffic store, active unless another storage type is
 * configured.
 *
 * @author Naveed Gung
 */
@Repository
@ConditionalOnProperty(prefix = "guardian.storage", name = "type", havingValue = "memory", matchIfMissing = true)
public class InMemoryTrafficRepository implements TrafficRepository {

    private final Map<Long, TrafficRecord> records = new ConcurrentSkipListMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public TrafficTable saveAll(TrafficTable table) {
        List<TrafficRecord> saved = new ArrayList<>(table.size());
        for (TrafficRecord record : table) {
            TrafficRecord stored = record.withLogId(sequence.incrementAndGet());
            records.put(stored.logId(), stored);
            saved.add(stored);
        }
        return TrafficTable.of(saved);
    }

    @Override
    public TrafficTable findRecent(int limit, Integer deviceId) {
        return TrafficTable.of(records.values().stream()
                .filter(r -> deviceId == null || r.deviceId() == deviceId)
                .sorted(Comparator.comparing(TrafficRecord::timestamp)
                        .thenComparing(TrafficRecord::logId)
                        .reversed())
                .limit(Math.max(0, limit))
                .toList());
    }

    @Override
    public TrafficTable findByLogIds(Collection<Long> logIds) {
        return TrafficTable.of(logIds.stream()
                .distinct()
                .map(records::get)
                .filter(Objects::nonNull)
                .toList());
    }

    public int size() {
        return records.size();
    }
}
