package com.trafficguardian.detector.adapter;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.trafficguardian.detector.error.FormatException;
import com.trafficguardian.detector.traffic.FieldValues;
import com.trafficguardian.detector.traffic.TrafficRecord;
import com.trafficguardian.detector.traffic.TrafficTable;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Adapter for the IoT-23 labeled dataset: Zeek {@code conn.log} files,
 * tab-separated, no header, {@code #} comment lines.
 *
 * <p>
 * IoT-23 files join the last three columns ({@code tunnel_parents},
 * {@code label}, {@code detailed-label}) with spaces instead of tabs; such
 * rows are split back into their columns before mapping.
 * </p>
 *
 * @author Naveed Gung
 */
public class Iot23Adapter extends TrafficAdapter<List<Map<String, String>>> {

    static final List<String> COLUMNS = List.of(
            "ts", "uid", "id.orig_h", "id.orig_p", "id.resp_h", "id.resp_p",
            "proto", "service", "duration", "orig_bytes", "resp_bytes",
            "conn_state", "local_orig", "local_resp", "missed_bytes",
            "history", "orig_pkts", "orig_ip_bytes", "resp_pkts",
            "resp_ip_bytes", "tunnel_parents", "label", "detailed_label");

    private static final CsvSchema SCHEMA = CsvSchema.emptySchema()
            .withColumnSeparator('\t')
            .withoutQuoteChar()
            .withComments();

    private final CsvMapper mapper;

    public Iot23Adapter() {
        this.mapper = new CsvMapper();
        this.mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        this.mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
    }

    @Override
    public AdapterType type() {
        return AdapterType.IOT23;
    }

    @Override
    public List<Map<String, String>> load(Path source) {
        requireExists(source);
        List<Map<String, String>> rows = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(source, StandardCharsets.UTF_8);
                MappingIterator<String[]> it = mapper.readerFor(String[].class).with(SCHEMA).readValues(reader)) {
            while (it.hasNextValue()) {
                rows.add(toRow(splitJoinedTail(it.nextValue())));
            }
        } catch (IOException e) {
            log.error("Error loading IoT-23 file {}", source, e);
            throw new FormatException("Cannot parse IoT-23 file " + source + ": " + e.getMessage(), e);
        }
        log.info("Loaded IoT-23 file {} with {} rows", source, rows.size());
        return rows;
    }

    static String[] splitJoinedTail(String[] values) {
        if (values.length >= COLUMNS.size() || values.length == 0) {
            return values;
        }
        String last = values[values.length - 1].trim();
        String[] tail = last.split("\\s+");
        if (tail.length <= 1) {
            return values;
        }
        String[] split = Arrays.copyOf(values, values.length - 1 + tail.length);
        System.arraycopy(tail, 0, split, values.length - 1, tail.length);
        return split;
    }

    private static Map<String, String> toRow(String[] values) {
        Map<String, String> row = new HashMap<>();
        for (int i = 0; i < Math.min(values.length, COLUMNS.size()); i++) {
            row.put(COLUMNS.get(i), values[i]);
        }
        return row;
    }

    @Override
    public TrafficTable normalize(List<Map<String, String>> rows) {
        List<TrafficRecord> records = new ArrayList<>(rows.size());
        for (Map<String, String> row : rows) {
            String srcIp = FieldValues.toText(row.get("id.orig_h"));
            Long origPackets = FieldValues.toLong(row.get("orig_pkts"));
            Long respPackets = FieldValues.toLong(row.get("resp_pkts"));
            String detailedLabel = FieldValues.toText(row.get("detailed_label"));

            records.add(TrafficRecord.builder()
                    .timestamp(FieldValues.toInstant(row.get("ts")))
                    .deviceId(deviceIdFromAddress(srcIp))
                    .srcIp(srcIp)
                    .dstIp(FieldValues.toText(row.get("id.resp_h")))
                    .srcPort(FieldValues.toInteger(row.get("id.orig_p")))
                    .dstPort(FieldValues.toInteger(row.get("id.resp_p")))
                    .protocol(FieldValues.toText(row.get("proto")))
                    .packetSize((origPackets != null ? origPackets : 0L) + (respPackets != null ? respPackets : 0L))
                    .duration(FieldValues.toDouble(row.get("duration")))
                    .origBytes(FieldValues.toLong(row.get("orig_bytes")))
                    .respBytes(FieldValues.toLong(row.get("resp_bytes")))
                    .service(FieldValues.toText(row.get("service")))
                    .connState(FieldValues.toText(row.get("conn_state")))
                    .label(FieldValues.toText(row.get("label")))
                    .attackType(detailedLabel != null ? detailedLabel : TrafficRecord.NORMAL)
                    .build());
        }
        return TrafficTable.of(records);
    }

    /** Last octet of an IPv4 address, 0 for anything else. */
    static int deviceIdFromAddress(String address) {
        if (address == null || address.indexOf(':') >= 0) {
            return 0;
        }
        Integer octet = FieldValues.toInteger(address.substring(address.lastIndexOf('.') + 1));
        return octet != null && octet >= 0 && octet <= 255 ? octet : 0;
    }
}
