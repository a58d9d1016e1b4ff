package com.trafficguardian.detector.adapter;

import com.trafficguardian.detector.adapter.pcap.Captures;
import com.trafficguardian.detector.adapter.pcap.Packet;
import com.trafficguardian.detector.error.FormatException;
import com.trafficguardian.detector.traffic.TrafficRecord;
import com.trafficguardian.detector.traffic.TrafficTable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PcapAdapterTest {

    private static final Instant T0 = Instant.parse("2024-03-04T10:00:00Z");

    @TempDir
    Path dir;

    @Test
    void shouldAggregatePacketsIntoFlows() {
        List<Packet> packets = List.of(
                new Packet(T0, "192.168.1.5", "10.0.0.1", 40000, 443, "tcp", 60),
                new Packet(T0.plusSeconds(1), "192.168.1.6", "10.0.0.2", 5353, 53, "udp", 80),
                new Packet(T0.plusMillis(2500), "192.168.1.5", "10.0.0.1", 40000, 443, "tcp", 100),
                new Packet(T0.plusMillis(1500), "192.168.1.6", "10.0.0.2", 5353, 53, "udp", 90));

        TrafficTable table = new PcapAdapter().normalize(packets);

        assertEquals(2, table.size());
        TrafficRecord tcp = table.get(0);
        assertEquals(T0, tcp.timestamp());
        assertEquals(160L, tcp.packetSize());
        assertEquals(160L, tcp.origBytes());
        assertEquals(0L, tcp.respBytes());
        assertEquals(2.5, tcp.duration(), 1e-9);
        assertEquals(0, tcp.deviceId());
        assertEquals(443, tcp.dstPort());

        TrafficRecord udp = table.get(1);
        assertEquals(170L, udp.packetSize());
        assertEquals(0.5, udp.duration(), 1e-9);
        assertEquals("udp", udp.protocol());
    }

    @Test
    void shouldNotMergeReverseDirection() {
        List<Packet> packets = List.of(
                new Packet(T0, "10.0.0.1", "10.0.0.2", 1000, 2000, "tcp", 60),
                new Packet(T0, "10.0.0.2", "10.0.0.1", 2000, 1000, "tcp", 60));

        assertEquals(2, new PcapAdapter().normalize(packets).size());
    }

    @Test
    void shouldReadCaptureFile() throws Exception {
        Path file = dir.resolve("capture.pcap");
        Files.write(file, Captures.twoFlowCapture());

        TrafficTable table = new PcapAdapter().process(file);

        assertEquals(2, table.size());
        assertEquals(160L, table.get(0).packetSize());
    }

    @Test
    void shouldRejectGarbageFile() throws Exception {
        Path file = dir.resolve("garbage.pcap");
        Files.writeString(file, "definitely not a capture");

        assertThrows(FormatException.class, () -> new PcapAdapter().process(file));
    }
}
