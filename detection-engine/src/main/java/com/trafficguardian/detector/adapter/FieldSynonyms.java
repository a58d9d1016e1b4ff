package com.trafficguardian.detector.adapter;

import com.trafficguardian.detector.traffic.CanonicalField;

import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed synonym dictionaries used to auto-detect the source column (or key
 * path) holding each canonical field.
 *
 * <p>
 * For every canonical field the synonyms are tried in order. A synonym matches
 * a column exactly first, then case-insensitively; the first synonym that
 * matches anything wins.
 * </p>
 *
 * @author Naveed Gung
 */
public final class FieldSynonyms {

    /** Column names seen in tabular exports and flow datasets. */
    public static final FieldSynonyms TABULAR = new FieldSynonyms(Map.ofEntries(
            Map.entry(CanonicalField.TIMESTAMP, List.of("timestamp", "time", "date", "datetime", "ts")),
            Map.entry(CanonicalField.DEVICE_ID, List.of("device_id", "device", "deviceid", "id", "host", "host_id")),
            Map.entry(CanonicalField.SRC_IP, List.of("src_ip", "source_ip", "src", "source", "id.orig_h")),
            Map.entry(CanonicalField.DST_IP, List.of("dst_ip", "destination_ip", "dst", "destination", "id.resp_h")),
            Map.entry(CanonicalField.SRC_PORT, List.of("src_port", "source_port", "sport", "id.orig_p")),
            Map.entry(CanonicalField.DST_PORT, List.of("dst_port", "destination_port", "dport", "id.resp_p")),
            Map.entry(CanonicalField.PROTOCOL, List.of("protocol", "proto", "prot", "proto_name")),
            Map.entry(CanonicalField.PACKET_SIZE, List.of("packet_size", "size", "pkt_size", "packets")),
            Map.entry(CanonicalField.DURATION, List.of("duration", "dur", "time_delta", "elapsed")),
            Map.entry(CanonicalField.ORIG_BYTES, List.of("orig_bytes", "orig_pkts", "bytes_out", "sent_bytes")),
            Map.entry(CanonicalField.RESP_BYTES, List.of("resp_bytes", "resp_pkts", "bytes_in", "received_bytes")),
            Map.entry(CanonicalField.SERVICE, List.of("service", "svc", "app_protocol")),
            Map.entry(CanonicalField.CONN_STATE, List.of("conn_state", "state", "connection_state")),
            Map.entry(CanonicalField.LABEL, List.of("label", "class", "is_anomaly", "is_attack")),
            Map.entry(CanonicalField.ATTACK_TYPE, List.of("attack_type", "attack", "attack_class"))));

    /** Flattened key paths seen in JSON flow exports and device telemetry. */
    public static final FieldSynonyms STRUCTURED = new FieldSynonyms(Map.ofEntries(
            Map.entry(CanonicalField.TIMESTAMP,
                    List.of("timestamp", "time", "date", "datetime", "ts", "startTime", "endTime")),
            Map.entry(CanonicalField.DEVICE_ID,
                    List.of("device_id", "device", "deviceId", "id", "host", "hostId", "sourceId")),
            Map.entry(CanonicalField.SRC_IP,
                    List.of("src_ip", "source_ip", "srcIp", "sourceIp", "src", "source", "ipv4_src_addr")),
            Map.entry(CanonicalField.DST_IP,
                    List.of("dst_ip", "destination_ip", "dstIp", "destinationIp", "dst", "destination",
                            "ipv4_dst_addr")),
            Map.entry(CanonicalField.SRC_PORT,
                    List.of("src_port", "source_port", "srcPort", "sourcePort", "sport", "l4_src_port")),
            Map.entry(CanonicalField.DST_PORT,
                    List.of("dst_port", "destination_port", "dstPort", "destinationPort", "dport", "l4_dst_port")),
            Map.entry(CanonicalField.PROTOCOL,
                    List.of("protocol", "proto", "protocolId", "protocolName", "l4_proto")),
            Map.entry(CanonicalField.PACKET_SIZE,
                    List.of("packet_size", "packetSize", "size", "bytes", "octets", "in_bytes", "out_bytes")),
            Map.entry(CanonicalField.DURATION,
                    List.of("duration", "dur", "flowDuration", "flow_duration", "elapsed", "timeElapsed")),
            Map.entry(CanonicalField.ORIG_BYTES,
                    List.of("orig_bytes", "origBytes", "bytesOut", "out_bytes", "sentBytes", "bytes_sent")),
            Map.entry(CanonicalField.RESP_BYTES,
                    List.of("resp_bytes", "respBytes", "bytesIn", "in_bytes", "receivedBytes", "bytes_received")),
            Map.entry(CanonicalField.SERVICE, List.of("service", "svc", "app_protocol")),
            Map.entry(CanonicalField.CONN_STATE, List.of("conn_state", "state", "connState")),
            Map.entry(CanonicalField.LABEL, List.of("label", "class", "is_anomaly", "is_attack")),
            Map.entry(CanonicalField.ATTACK_TYPE, List.of("attack_type", "attackType", "attack"))));

    private final Map<CanonicalField, List<String>> synonyms;

    private FieldSynonyms(Map<CanonicalField, List<String>> synonyms) {
        this.synonyms = new EnumMap<>(synonyms);
    }

    public List<String> synonymsFor(CanonicalField field) {
        return synonyms.getOrDefault(field, List.of());
    }

    /**
     * Infer the source column for every canonical field that can be matched.
     *
     * @return mapping in canonical field order; unmatched fields are absent
     */
    public Map<CanonicalField, String> infer(Collection<String> columns) {
        Map<CanonicalField, String> mapping = new LinkedHashMap<>();
        for (CanonicalField field : CanonicalField.values()) {
            match(field, columns).ifPresent(column -> mapping.put(field, column));
        }
        return mapping;
    }

    Optional<String> match(CanonicalField field, Collection<String> columns) {
        for (String synonym : synonymsFor(field)) {
            if (columns.contains(synonym)) {
                return Optional.of(synonym);
            }
            for (String column : columns) {
                if (column.equalsIgnoreCase(synonym)) {
                    return Optional.of(column);
                }
            }
        }
        return Optional.empty();
    }
}
