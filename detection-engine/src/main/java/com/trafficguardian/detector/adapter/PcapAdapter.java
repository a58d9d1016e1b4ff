package com.trafficguardian.detector.adapter;

import com.trafficguardian.detector.adapter.pcap.Packet;
import com.trafficguardian.detector.adapter.pcap.PcapReader;
import com.trafficguardian.detector.error.FormatException;
import com.trafficguardian.detector.traffic.TrafficRecord;
import com.trafficguardian.detector.traffic.TrafficTable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Adapter for packet captures. Packets are aggregated into flows keyed by
 * their five-tuple, one record per flow.
 *
 * @author Naveed Gung
 */
public class PcapAdapter extends TrafficAdapter<List<Packet>> {

    private final PcapReader reader;

    public PcapAdapter() {
        this(new PcapReader());
    }

    public PcapAdapter(PcapReader reader) {
        this.reader = reader;
    }

    @Override
    public AdapterType type() {
        return AdapterType.PCAP;
    }

    @Override
    public List<Packet> load(Path source) {
        requireExists(source);
        byte[] data;
        try {
            data = Files.readAllBytes(source);
        } catch (IOException e) {
            log.error("Error loading PCAP file {}", source, e);
            throw new FormatException("Cannot read capture " + source, e);
        }
        List<Packet> packets = reader.read(data);
        log.info("Loaded PCAP file {} with {} IP packets", source, packets.size());
        return packets;
    }

    @Override
    public TrafficTable normalize(List<Packet> packets) {
        Map<String, Flow> flows = new LinkedHashMap<>();
        for (Packet packet : packets) {
            flows.computeIfAbsent(packet.flowKey(), key -> new Flow(packet)).add(packet);
        }
        List<TrafficRecord> records = new ArrayList<>(flows.size());
        for (Flow flow : flows.values()) {
            records.add(flow.toRecord());
        }
        log.debug("Aggregated {} packets into {} flows", packets.size(), records.size());
        return TrafficTable.of(records);
    }

    private static final class Flow {

        private final Packet first;
        private Instant start;
        private Instant end;
        private long bytes;

        Flow(Packet first) {
            this.first = first;
            this.start = first.timestamp();
            this.end = first.timestamp();
        }

        void add(Packet packet) {
            bytes += packet.length();
            if (packet.timestamp().isBefore(start)) {
                start = packet.timestamp();
            }
            if (packet.timestamp().isAfter(end)) {
                end = packet.timestamp();
            }
        }

        TrafficRecord toRecord() {
            return TrafficRecord.builder()
                    .timestamp(start)
                    .deviceId(0)
                    .srcIp(first.srcIp())
                    .dstIp(first.dstIp())
                    .srcPort(first.srcPort())
                    .dstPort(first.dstPort())
                    .protocol(first.protocol())
                    .packetSize(bytes)
                    .duration(Duration.between(start, end).toNanos() / 1e9)
                    .origBytes(bytes)
                    .respBytes(0L)
                    .build();
        }
    }
}
