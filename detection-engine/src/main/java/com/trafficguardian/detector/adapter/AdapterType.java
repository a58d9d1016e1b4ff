package com.trafficguardian.detector.adapter;

import com.trafficguardian.detector.error.UnsupportedTypeException;

import java.util.Locale;

/**
 * Source families the adapter factory can construct.
 *
 * @author Naveed Gung
 */
public enum AdapterType {

    CSV("csv"),
    JSON("json"),
    PCAP("pcap"),
    IOT23("iot23"),
    MQTT("mqtt");

    private final String typeName;

    AdapterType(String typeName) {
        this.typeName = typeName;
    }

    public String typeName() {
        return typeName;
    }

    public boolean requiresFile() {
        return this != MQTT;
    }

    public static AdapterType fromName(String name) {
        String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "csv" -> CSV;
            case "json", "jsonl" -> JSON;
            case "pcap", "pcapng" -> PCAP;
            case "iot23", "iot-23", "zeek" -> IOT23;
            case "mqtt", "stream" -> MQTT;
            default -> throw new UnsupportedTypeException("Unsupported adapter type: " + name);
        };
    }
}
