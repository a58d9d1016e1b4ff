package com.trafficguardian.detector.traffic;

import java.time.Instant;
import java.util.Locale;

/**
 * One normalized network traffic record.
 *
 * <p>
 * The canonical constructor fills every absent or invalid field with its
 * default, so a {@code TrafficRecord} always exposes the complete schema no
 * matter which adapter produced it:
 * </p>
 * <ul>
 * <li>timestamp: the current instant</li>
 * <li>addresses, protocol, service, connection state, attack type:
 * {@code "unknown"}</li>
 * <li>label: {@code "normal"}</li>
 * <li>numeric fields: 0 (also for ports outside 0-65535, negative sizes and
 * non-finite durations)</li>
 * </ul>
 *
 * @param logId      storage identifier, {@code null} until persisted
 * @param timestamp  start of the connection or packet
 * @param deviceId   monitored device, possibly synthesized by the adapter
 * @param duration   connection duration in seconds
 *
 * @author Naveed Gung
 */
public record TrafficRecord(
        Long logId,
        Instant timestamp,
        int deviceId,
        String srcIp,
        String dstIp,
        int srcPort,
        int dstPort,
        String protocol,
        long packetSize,
        double duration,
        long origBytes,
        long respBytes,
        String service,
        String connState,
        String label,
        String attackType) {

    public static final String UNKNOWN = "unknown";
    public static final String NORMAL = "normal";

    public TrafficRecord {
        timestamp = timestamp != null ? timestamp : Instant.now();
        deviceId = Math.max(0, deviceId);
        srcIp = textOrDefault(srcIp, UNKNOWN);
        dstIp = textOrDefault(dstIp, UNKNOWN);
        srcPort = validPort(srcPort);
        dstPort = validPort(dstPort);
        protocol = textOrDefault(protocol, UNKNOWN).toLowerCase(Locale.ROOT);
        packetSize = Math.max(0L, packetSize);
        duration = Double.isFinite(duration) && duration > 0 ? duration : 0.0;
        origBytes = Math.max(0L, origBytes);
        respBytes = Math.max(0L, respBytes);
        service = textOrDefault(service, UNKNOWN);
        connState = textOrDefault(connState, UNKNOWN);
        label = textOrDefault(label, NORMAL);
        attackType = textOrDefault(attackType, UNKNOWN);
    }

    public static Builder builder() {
        return new Builder();
    }

    public TrafficRecord withDeviceId(int newDeviceId) {
        return new TrafficRecord(logId, timestamp, newDeviceId, srcIp, dstIp, srcPort, dstPort, protocol,
                packetSize, duration, origBytes, respBytes, service, connState, label, attackType);
    }

    public TrafficRecord withLogId(Long newLogId) {
        return new TrafficRecord(newLogId, timestamp, deviceId, srcIp, dstIp, srcPort, dstPort, protocol,
                packetSize, duration, origBytes, respBytes, service, connState, label, attackType);
    }

    /** Value of a canonical field, boxed. */
    public Object value(CanonicalField field) {
        return switch (field) {
            case TIMESTAMP -> timestamp;
            case DEVICE_ID -> deviceId;
            case SRC_IP -> srcIp;
            case DST_IP -> dstIp;
            case SRC_PORT -> srcPort;
            case DST_PORT -> dstPort;
            case PROTOCOL -> protocol;
            case PACKET_SIZE -> packetSize;
            case DURATION -> duration;
            case ORIG_BYTES -> origBytes;
            case RESP_BYTES -> respBytes;
            case SERVICE -> service;
            case CONN_STATE -> connState;
            case LABEL -> label;
            case ATTACK_TYPE -> attackType;
        };
    }

    private static String textOrDefault(String value, String fallback) {
        if (value == null) {
            return fallback;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? fallback : trimmed;
    }

    private static int validPort(int port) {
        return port >= 0 && port <= 65_535 ? port : 0;
    }

    /**
     * Mutable builder accepting partially-known values. Unset fields fall back
     * to the record defaults on {@link #build()}.
     */
    public static final class Builder {

        private Long logId;
        private Instant timestamp;
        private Integer deviceId;
        private String srcIp;
        private String dstIp;
        private Integer srcPort;
        private Integer dstPort;
        private String protocol;
        private Long packetSize;
        private Double duration;
        private Long origBytes;
        private Long respBytes;
        private String service;
        private String connState;
        private String label;
        private String attackType;

        private Builder() {
        }

        public Builder logId(Long logId) {
            this.logId = logId;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder deviceId(Integer deviceId) {
            this.deviceId = deviceId;
            return this;
        }

        public Builder srcIp(String srcIp) {
            this.srcIp = srcIp;
            return this;
        }

        public Builder dstIp(String dstIp) {
            this.dstIp = dstIp;
            return this;
        }

        public Builder srcPort(Integer srcPort) {
            this.srcPort = srcPort;
            return this;
        }

        public Builder dstPort(Integer dstPort) {
            this.dstPort = dstPort;
            return this;
        }

        public Builder protocol(String protocol) {
            this.protocol = protocol;
            return this;
        }

        public Builder packetSize(Long packetSize) {
            this.packetSize = packetSize;
            return this;
        }

        public Builder duration(Double duration) {
            this.duration = duration;
            return this;
        }

        public Builder origBytes(Long origBytes) {
            this.origBytes = origBytes;
            return this;
        }

        public Builder respBytes(Long respBytes) {
            this.respBytes = respBytes;
            return this;
        }

        public Builder service(String service) {
            this.service = service;
            return this;
        }

        public Builder connState(String connState) {
            this.connState = connState;
            return this;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder attackType(String attackType) {
            this.attackType = attackType;
            return this;
        }

        public boolean hasDeviceId() {
            return deviceId != null;
        }

        /**
         * Set a canonical field from a raw source value, coercing it to the
         * field's type. Values that cannot be coerced are left unset.
         */
        public Builder set(CanonicalField field, Object raw) {
            switch (field) {
                case TIMESTAMP -> timestamp = FieldValues.toInstant(raw);
                case DEVICE_ID -> deviceId = FieldValues.toInteger(raw);
                case SRC_IP -> srcIp = FieldValues.toText(raw);
                case DST_IP -> dstIp = FieldValues.toText(raw);
                case SRC_PORT -> srcPort = FieldValues.toInteger(raw);
                case DST_PORT -> dstPort = FieldValues.toInteger(raw);
                case PROTOCOL -> protocol = FieldValues.toText(raw);
                case PACKET_SIZE -> packetSize = FieldValues.toLong(raw);
                case DURATION -> duration = FieldValues.toDouble(raw);
                case ORIG_BYTES -> origBytes = FieldValues.toLong(raw);
                case RESP_BYTES -> respBytes = FieldValues.toLong(raw);
                case SERVICE -> service = FieldValues.toText(raw);
                case CONN_STATE -> connState = FieldValues.toText(raw);
                case LABEL -> label = FieldValues.toText(raw);
                case ATTACK_TYPE -> attackType = FieldValues.toText(raw);
            }
            return this;
        }

        public TrafficRecord build() {
            return new TrafficRecord(
                    logId,
                    timestamp,
                    deviceId != null ? deviceId : 0,
                    srcIp,
                    dstIp,
                    srcPort != null ? srcPort : 0,
                    dstPort != null ? dstPort : 0,
                    protocol,
                    packetSize != null ? packetSize : 0L,
                    duration != null ? duration : 0.0,
                    origBytes != null ? origBytes : 0L,
                    respBytes != null ? respBytes : 0L,
                    service,
                    connState,
                    label,
                    attackType);
        }
    }
}
