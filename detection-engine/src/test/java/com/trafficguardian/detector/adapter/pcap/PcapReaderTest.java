package com.trafficguardian.detector.adapter.pcap;

import com.trafficguardian.detector.error.FormatException;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PcapReaderTest {

    private final PcapReader reader = new PcapReader();

    @Test
    void shouldDecodeLittleEndianClassicCapture() {
        Captures.Builder capture = Captures.classic(ByteOrder.LITTLE_ENDIAN)
                .packet(100, 250_000, Captures.ethernetIpv4("192.168.1.5", "10.0.0.1", 6, 40000, 443), 60)
                .packet(101, 0, Captures.ethernetIpv4("192.168.1.6", "10.0.0.2", 17, 5353, 53), 80);

        List<Packet> packets = reader.read(capture.bytes());

        assertEquals(2, packets.size());
        Packet first = packets.get(0);
        assertEquals(Instant.ofEpochSecond(100, 250_000_000L), first.timestamp());
        assertEquals("192.168.1.5", first.srcIp());
        assertEquals("10.0.0.1", first.dstIp());
        assertEquals(40000, first.srcPort());
        assertEquals(443, first.dstPort());
        assertEquals("tcp", first.protocol());
        assertEquals(60, first.length());
        assertEquals("udp", packets.get(1).protocol());
        assertEquals(53, packets.get(1).dstPort());
    }

    @Test
    void shouldDecodeBigEndianClassicCapture() {
        Captures.Builder capture = Captures.classic(ByteOrder.BIG_ENDIAN)
                .packet(5, 0, Captures.ethernetIpv4("10.0.0.7", "10.0.0.8", 17, 6000, 123), 98);

        Packet packet = reader.read(capture.bytes()).get(0);

        assertEquals("udp", packet.protocol());
        assertEquals(6000, packet.srcPort());
        assertEquals(123, packet.dstPort());
        assertEquals("10.0.0.7", packet.srcIp());
        assertEquals(Instant.ofEpochSecond(5), packet.timestamp());
    }

    @Test
    void shouldSkipNonIpFrames() {
        byte[] arp = new byte[42];
        arp[12] = 0x08;
        arp[13] = 0x06;
        Captures.Builder capture = Captures.classic(ByteOrder.LITTLE_ENDIAN)
                .packet(1, 0, arp, 42)
                .packet(2, 0, Captures.ethernetIpv4("10.0.0.1", "10.0.0.2", 17, 1000, 2000), 50);

        List<Packet> packets = reader.read(capture.bytes());

        assertEquals(1, packets.size());
        assertEquals(2000, packets.get(0).dstPort());
    }

    @Test
    void shouldDecodePcapNgEnhancedPackets() {
        byte[] frame = Captures.ethernetIpv4("172.16.0.2", "172.16.0.3", 6, 1883, 51000);
        ByteBuffer buf = ByteBuffer.allocate(28 + 20 + 32 + padded(frame.length)).order(ByteOrder.LITTLE_ENDIAN);
        // section header
        buf.putInt(0x0A0D0D0A).putInt(28).putInt(0x1A2B3C4D).putShort((short) 1).putShort((short) 0)
                .putLong(-1L).putInt(28);
        // interface description, ethernet, default microsecond resolution
        buf.putInt(1).putInt(20).putShort((short) 1).putShort((short) 0).putInt(65535).putInt(20);
        // enhanced packet at t = 1700000000.5 s
        long ticks = 1_700_000_000_500_000L;
        int blockLength = 32 + padded(frame.length);
        buf.putInt(6).putInt(blockLength).putInt(0)
                .putInt((int) (ticks >>> 32)).putInt((int) ticks)
                .putInt(frame.length).putInt(120)
                .put(frame).put(new byte[padded(frame.length) - frame.length])
                .putInt(blockLength);

        List<Packet> packets = reader.read(buf.array());

        assertEquals(1, packets.size());
        Packet packet = packets.get(0);
        assertEquals(Instant.ofEpochSecond(1_700_000_000L, 500_000_000L), packet.timestamp());
        assertEquals(1883, packet.srcPort());
        assertEquals(120, packet.length());
        assertEquals("172.16.0.2:1883-172.16.0.3:51000-tcp", packet.flowKey());
    }

    @Test
    void shouldRejectUnknownMagic() {
        assertThrows(FormatException.class, () -> reader.read(new byte[] {1, 2, 3, 4, 5, 6, 7, 8}));
    }

    @Test
    void shouldRejectTruncatedGlobalHeader() {
        byte[] data = ByteBuffer.allocate(10).order(ByteOrder.BIG_ENDIAN).putInt(0xA1B2C3D4).array();

        assertThrows(FormatException.class, () -> reader.read(data));
    }

    private static int padded(int length) {
        return (length + 3) & ~3;
    }
}
