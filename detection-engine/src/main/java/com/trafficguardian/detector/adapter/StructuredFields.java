package com.trafficguardian.detector.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.trafficguardian.detector.traffic.CanonicalField;
import com.trafficguardian.detector.traffic.TrafficRecord;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Field access helpers shared by the structured-object adapters.
 *
 * @author Naveed Gung
 */
final class StructuredFields {

    private StructuredFields() {
    }

    /** Flatten nested objects into dot-separated key paths, in document order. */
    static Map<String, JsonNode> flatten(JsonNode node) {
        Map<String, JsonNode> flat = new LinkedHashMap<>();
        flatten(node, "", flat);
        return flat;
    }

    private static void flatten(JsonNode node, String prefix, Map<String, JsonNode> flat) {
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String key = prefix + entry.getKey();
            if (entry.getValue().isObject()) {
                flatten(entry.getValue(), key + ".", flat);
            } else {
                flat.put(key, entry.getValue());
            }
        }
    }

    /**
     * Resolve a dot path against an object. A key that itself contains dots
     * (Zeek style {@code id.orig_h}) is matched literally before the path is
     * split.
     *
     * @return the value, or {@code null} when any segment is missing
     */
    static JsonNode at(JsonNode node, String path) {
        if (node == null || path == null) {
            return null;
        }
        if (node.has(path)) {
            return node.get(path);
        }
        int dot = path.indexOf('.');
        if (dot < 0) {
            return null;
        }
        return at(node.get(path.substring(0, dot)), path.substring(dot + 1));
    }

    /** Build a record from one object using a canonical field to key path mapping. */
    static TrafficRecord.Builder toBuilder(JsonNode node, Map<CanonicalField, String> mapping) {
        TrafficRecord.Builder builder = TrafficRecord.builder();
        mapping.forEach((field, path) -> {
            JsonNode value = at(node, path);
            if (value != null) {
                builder.set(field, value);
            }
        });
        return builder;
    }

    static Map<CanonicalField, String> infer(JsonNode sample) {
        return FieldSynonyms.STRUCTURED.infer(flatten(sample).keySet());
    }
}
