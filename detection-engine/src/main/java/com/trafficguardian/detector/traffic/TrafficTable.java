package com.trafficguardian.detector.traffic;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Ordered, immutable batch of normalized traffic records.
 *
 * @author Naveed Gung
 */
public final class TrafficTable implements Iterable<TrafficRecord> {

    private static final TrafficTable EMPTY = new TrafficTable(List.of());

    private final List<TrafficRecord> records;

    private TrafficTable(List<TrafficRecord> records) {
        this.records = records;
    }

    public static TrafficTable of(List<TrafficRecord> records) {
        return records.isEmpty() ? EMPTY : new TrafficTable(List.copyOf(records));
    }

    public static TrafficTable empty() {
        return EMPTY;
    }

    public List<TrafficRecord> records() {
        return records;
    }

    public TrafficRecord get(int index) {
        return records.get(index);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public Stream<TrafficRecord> stream() {
        return records.stream();
    }

    public TrafficTable concat(TrafficTable other) {
        if (other.isEmpty()) {
            return this;
        }
        List<TrafficRecord> merged = new ArrayList<>(records.size() + other.size());
        merged.addAll(records);
        merged.addAll(other.records);
        return new TrafficTable(List.copyOf(merged));
    }

    /** Assigns the same device to every record, as when an operator overrides the source device. */
    public TrafficTable withDeviceId(int deviceId) {
        return new TrafficTable(records.stream().map(r -> r.withDeviceId(deviceId)).toList());
    }

    public TrafficTable filterByDevice(int deviceId) {
        return new TrafficTable(records.stream().filter(r -> r.deviceId() == deviceId).toList());
    }

    public TrafficTable limit(int maxRecords) {
        if (maxRecords <= 0 || maxRecords >= records.size()) {
            return this;
        }
        return new TrafficTable(records.subList(0, maxRecords));
    }

    @Override
    public Iterator<TrafficRecord> iterator() {
        return records.iterator();
    }

    @Override
    public String toString() {
        return "TrafficTable[" + records.size() + " records]";
    }
}
