package com.trafficguardian.detector.adapter;

import com.trafficguardian.detector.error.NotFoundException;
import com.trafficguardian.detector.traffic.CanonicalField;
import com.trafficguardian.detector.traffic.TrafficRecord;
import com.trafficguardian.detector.traffic.TrafficTable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CsvAdapterTest {

    @TempDir
    Path dir;

    @Test
    void shouldNormalizeCanonicalColumns() throws Exception {
        Path file = dir.resolve("traffic.csv");
        Files.writeString(file, """
                timestamp,device_id,src_ip,dst_ip,src_port,dst_port,protocol,packet_size,duration,orig_bytes,resp_bytes
                2024-03-04T10:00:00Z,3,192.168.1.13,10.0.0.1,40001,443,TCP,1200,1.5,500,700
                2024-03-04T10:00:30Z,4,192.168.1.14,10.0.0.2,40002,53,udp,90,0.01,40,50
                """);

        TrafficTable table = new CsvAdapter().process(file);

        assertEquals(2, table.size());
        TrafficRecord first = table.get(0);
        assertEquals(Instant.parse("2024-03-04T10:00:00Z"), first.timestamp());
        assertEquals(3, first.deviceId());
        assertEquals("192.168.1.13", first.srcIp());
        assertEquals(443, first.dstPort());
        assertEquals("tcp", first.protocol());
        assertEquals(1200L, first.packetSize());
        assertEquals(1.5, first.duration());
        assertEquals(700L, first.respBytes());
        assertEquals("udp", table.get(1).protocol());
    }

    @Test
    void shouldInferSynonymColumnsAndDefaultTheRest() throws Exception {
        Path file = dir.resolve("export.csv");
        Files.writeString(file, """
                Time,Host,Source,Destination,SPort,DPort,Proto,Size
                2024-03-04 10:00:00,7,10.1.1.1,10.1.1.2,1234,80,tcp,64
                """);

        TrafficRecord record = new CsvAdapter().process(file).get(0);

        assertEquals(7, record.deviceId());
        assertEquals("10.1.1.1", record.srcIp());
        assertEquals("10.1.1.2", record.dstIp());
        assertEquals(1234, record.srcPort());
        assertEquals(80, record.dstPort());
        assertEquals(64L, record.packetSize());
        assertEquals(TrafficRecord.UNKNOWN, record.service());
        assertEquals(TrafficRecord.NORMAL, record.label());
    }

    @Test
    void shouldPreferExplicitMapping() throws Exception {
        Path file = dir.resolve("custom.csv");
        Files.writeString(file, """
                a,b,c
                5,1000,udp
                """);

        TrafficTable table = new CsvAdapter(Map.of(
                CanonicalField.DEVICE_ID, "a",
                CanonicalField.PACKET_SIZE, "b",
                CanonicalField.PROTOCOL, "c")).process(file);

        assertEquals(5, table.get(0).deviceId());
        assertEquals(1000L, table.get(0).packetSize());
        assertEquals("udp", table.get(0).protocol());
    }

    @Test
    void shouldReturnEmptyTableForHeaderOnlyFile() throws Exception {
        Path file = dir.resolve("empty.csv");
        Files.writeString(file, "timestamp,src_ip\n");

        assertTrue(new CsvAdapter().process(file).isEmpty());
    }

    @Test
    void shouldRejectMissingFile() {
        assertThrows(NotFoundException.class, () -> new CsvAdapter().process(dir.resolve("missing.csv")));
    }
}
