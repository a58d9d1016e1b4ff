package com.trafficguardian.detector.adapter.pcap;

import java.time.Instant;

/**
 * One decoded IP packet from a capture file.
 *
 * @param length original on-the-wire length in bytes
 */
public record Packet(
        Instant timestamp,
        String srcIp,
        String dstIp,
        int srcPort,
        int dstPort,
        String protocol,
        int length) {

    /** Five-tuple key grouping packets into flows. */
    public String flowKey() {
        return srcIp + ":" + srcPort + "-" + dstIp + ":" + dstPort + "-" + protocol;
    }
}
