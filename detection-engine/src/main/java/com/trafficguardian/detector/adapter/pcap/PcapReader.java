package com.trafficguardian.detector.adapter.pcap;

import com.trafficguardian.detector.error.FormatException;
import io.pkts.Pcap;
import io.pkts.packet.IPv4Packet;
import io.pkts.packet.PCapPacket;
import io.pkts.packet.TransportPacket;
import io.pkts.protocol.Protocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads capture files through the pkts capture library and reduces every
 * IPv4 frame to a {@link Packet}.
 *
 * <p>
 * Classic libpcap files are handed to pkts directly. pcapng files are first
 * re-framed into a classic capture by {@link PcapNgTranscoder}. Frames that do
 * not carry IPv4 are dropped.
 * </p>
 *
 * @author Naveed Gung
 */
public class PcapReader {

    private static final Logger log = LoggerFactory.getLogger(PcapReader.class);

    static final int MAGIC_MICROS = 0xA1B2C3D4;
    static final int MAGIC_NANOS = 0xA1B23C4D;
    static final int PCAPNG_SECTION_HEADER = 0x0A0D0D0A;

    private static final int GLOBAL_HEADER_LENGTH = 24;

    /**
     * Decode every IPv4 packet of a capture.
     *
     * @throws FormatException if the data is not a pcap or pcapng capture
     */
    public List<Packet> read(byte[] data) {
        if (data.length < 4) {
            throw new FormatException("Capture too short: " + data.length + " bytes");
        }
        int magic = ByteBuffer.wrap(data).order(ByteOrder.BIG_ENDIAN).getInt(0);
        byte[] classic = magic == PCAPNG_SECTION_HEADER ? PcapNgTranscoder.toClassic(data) : data;
        requireClassicHeader(classic);

        Pcap pcap;
        try {
            pcap = Pcap.openStream(new ByteArrayInputStream(classic));
        } catch (IOException | RuntimeException e) {
            throw new FormatException("Cannot open capture", e);
        }

        List<Packet> packets = new ArrayList<>();
        int[] frames = {0};
        try {
            pcap.loop(frame -> {
                frames[0]++;
                decode(frame).ifPresent(packets::add);
                return true;
            });
        } catch (IOException | RuntimeException e) {
            throw new FormatException("Truncated capture after " + frames[0] + " frames", e);
        }
        log.debug("Decoded {} IPv4 packets out of {} frames", packets.size(), frames[0]);
        return packets;
    }

    private static void requireClassicHeader(byte[] data) {
        int magic = ByteBuffer.wrap(data).order(ByteOrder.BIG_ENDIAN).getInt(0);
        boolean known = magic == MAGIC_MICROS || magic == MAGIC_NANOS
                || Integer.reverseBytes(magic) == MAGIC_MICROS || Integer.reverseBytes(magic) == MAGIC_NANOS;
        if (!known) {
            throw new FormatException(String.format("Not a pcap capture: magic 0x%08X", magic));
        }
        if (data.length < GLOBAL_HEADER_LENGTH) {
            throw new FormatException("Truncated pcap global header");
        }
    }

    Optional<Packet> decode(io.pkts.packet.Packet frame) {
        IPv4Packet ip;
        try {
            if (!frame.hasProtocol(Protocol.IPv4)) {
                return Optional.empty();
            }
            ip = (IPv4Packet) frame.getPacket(Protocol.IPv4);
        } catch (IOException | RuntimeException e) {
            log.debug("Skipping undecodable frame: {}", e.getMessage());
            return Optional.empty();
        }
        Instant timestamp = Instant.EPOCH.plus(frame.getArrivalTime(), ChronoUnit.MICROS);
        int length = frame instanceof PCapPacket ? (int) ((PCapPacket) frame).getTotalLength() : 0;

        String protocol = "unknown";
        int srcPort = 0;
        int dstPort = 0;
        try {
            if (frame.hasProtocol(Protocol.TCP)) {
                TransportPacket tcp = (TransportPacket) frame.getPacket(Protocol.TCP);
                protocol = "tcp";
                srcPort = tcp.getSourcePort();
                dstPort = tcp.getDestinationPort();
            } else if (frame.hasProtocol(Protocol.UDP)) {
                TransportPacket udp = (TransportPacket) frame.getPacket(Protocol.UDP);
                protocol = "udp";
                srcPort = udp.getSourcePort();
                dstPort = udp.getDestinationPort();
            } else if (frame.hasProtocol(Protocol.ICMP)) {
                protocol = "icmp";
            }
        } catch (IOException | RuntimeException e) {
            // transport stays unknown, the IP layer is still usable
            log.debug("Cannot decode transport layer of {} -> {}: {}",
                    ip.getSourceIP(), ip.getDestinationIP(), e.getMessage());
        }
        return Optional.of(new Packet(timestamp, ip.getSourceIP(), ip.getDestinationIP(),
                srcPort, dstPort, protocol, length));
    }
}
