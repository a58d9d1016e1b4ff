package com.trafficguardian.detector.traffic;

import java.util.Arrays;
import java.util.List;

/**
 * Fields of the canonical traffic schema every adapter must produce.
 *
 * @author Naveed Gung
 */
public enum CanonicalField {

    TIMESTAMP("timestamp", true),
    DEVICE_ID("device_id", true),
    SRC_IP("src_ip", true),
    DST_IP("dst_ip", true),
    SRC_PORT("src_port", true),
    DST_PORT("dst_port", true),
    PROTOCOL("protocol", true),
    PACKET_SIZE("packet_size", true),
    DURATION("duration", true),
    ORIG_BYTES("orig_bytes", true),
    RESP_BYTES("resp_bytes", true),
    SERVICE("service", false),
    CONN_STATE("conn_state", false),
    LABEL("label", false),
    ATTACK_TYPE("attack_type", false);

    private final String columnName;
    private final boolean required;

    CanonicalField(String columnName, boolean required) {
        this.columnName = columnName;
        this.required = required;
    }

    /** Snake-case column name used by tabular and structured sources. */
    public String columnName() {
        return columnName;
    }

    public boolean isRequired() {
        return required;
    }

    public static List<CanonicalField> required() {
        return Arrays.stream(values()).filter(CanonicalField::isRequired).toList();
    }

    public static List<CanonicalField> optional() {
        return Arrays.stream(values()).filter(f -> !f.isRequired()).toList();
    }
}
