package com.trafficguardian.detector.traffic;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TrafficRecordTest {

    @Test
    void shouldFillDefaultsForMissingFields() {
        TrafficRecord record = TrafficRecord.builder().build();

        assertNotNull(record.timestamp());
        assertEquals(0, record.deviceId());
        assertEquals(TrafficRecord.UNKNOWN, record.srcIp());
        assertEquals(TrafficRecord.UNKNOWN, record.protocol());
        assertEquals(TrafficRecord.NORMAL, record.label());
        assertEquals(0L, record.packetSize());
        assertEquals(0.0, record.duration());
        assertNull(record.logId());
    }

    @Test
    void shouldReplaceInvalidNumericValues() {
        TrafficRecord record = TrafficRecord.builder()
                .srcPort(70_000)
                .dstPort(-1)
                .packetSize(-5L)
                .duration(Double.NaN)
                .origBytes(-1L)
                .build();

        assertEquals(0, record.srcPort());
        assertEquals(0, record.dstPort());
        assertEquals(0L, record.packetSize());
        assertEquals(0.0, record.duration());
        assertEquals(0L, record.origBytes());
    }

    @Test
    void shouldCoerceRawValuesThroughSet() {
        TrafficRecord record = TrafficRecord.builder()
                .set(CanonicalField.TIMESTAMP, "1700000000.5")
                .set(CanonicalField.SRC_PORT, "8080")
                .set(CanonicalField.PACKET_SIZE, "1500.4")
                .set(CanonicalField.PROTOCOL, " TCP ")
                .set(CanonicalField.SERVICE, "-")
                .build();

        assertEquals(Instant.ofEpochSecond(1_700_000_000L, 500_000_000L), record.timestamp());
        assertEquals(8080, record.srcPort());
        assertEquals(1500L, record.packetSize());
        assertEquals("tcp", record.protocol());
        assertEquals(TrafficRecord.UNKNOWN, record.service());
    }

    @Test
    void shouldKeepOtherFieldsWhenOverridingDevice() {
        TrafficRecord record = TrafficRecord.builder().deviceId(3).srcIp("10.0.0.1").build();

        TrafficRecord moved = record.withDeviceId(9);

        assertEquals(9, moved.deviceId());
        assertEquals("10.0.0.1", moved.srcIp());
        assertEquals(record.timestamp(), moved.timestamp());
    }
}
