package com.trafficguardian.detector.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trafficguardian.detector.error.FormatException;
import com.trafficguardian.detector.traffic.CanonicalField;
import com.trafficguardian.detector.traffic.TrafficRecord;
import com.trafficguardian.detector.traffic.TrafficTable;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Adapter for structured-object sources: a JSON document or a JSON-lines file
 * with one object per line.
 *
 * <p>
 * An optional records path ({@code data.flows}) selects the list of records
 * inside the document. Field values are taken by dot path from each object,
 * either through an explicit mapping or by auto-detection on the flattened
 * first object.
 * </p>
 *
 * @author Naveed Gung
 */
public class JsonAdapter extends TrafficAdapter<List<JsonNode>> {

    private final ObjectMapper mapper;
    private final String recordsPath;
    private final Map<CanonicalField, String> fieldMapping;

    public JsonAdapter(ObjectMapper mapper) {
        this(mapper, null, Map.of());
    }

    /**
     * @param recordsPath  dot path to the record list, {@code null} for the root
     * @param fieldMapping explicit canonical field to key path mapping; empty to
     *                     auto-detect
     */
    public JsonAdapter(ObjectMapper mapper, String recordsPath, Map<CanonicalField, String> fieldMapping) {
        this.mapper = mapper;
        this.recordsPath = recordsPath;
        this.fieldMapping = Map.copyOf(fieldMapping);
    }

    @Override
    public AdapterType type() {
        return AdapterType.JSON;
    }

    @Override
    public List<JsonNode> load(Path source) {
        requireExists(source);
        String name = source.getFileName().toString().toLowerCase(Locale.ROOT);
        List<JsonNode> objects = name.endsWith(".jsonl") ? readLines(source) : readDocument(source);
        log.info("Loaded JSON file {} with {} records", source, objects.size());
        return objects;
    }

    private List<JsonNode> readDocument(Path source) {
        JsonNode root;
        try {
            root = mapper.readTree(source.toFile());
        } catch (IOException e) {
            log.error("Error loading JSON file {}", source, e);
            throw new FormatException("Cannot parse JSON file " + source + ": " + e.getMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            return List.of();
        }
        return recordList(navigate(root));
    }

    private List<JsonNode> readLines(Path source) {
        List<JsonNode> objects = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(source, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                objects.add(parseLine(line, source, lineNumber));
            }
        } catch (IOException e) {
            log.error("Error reading JSON lines file {}", source, e);
            throw new FormatException("Cannot read JSON lines file " + source, e);
        }
        return objects;
    }

    private JsonNode parseLine(String line, Path source, int lineNumber) {
        try {
            JsonNode node = mapper.readTree(line);
            if (!node.isObject()) {
                throw new FormatException("Line " + lineNumber + " of " + source + " is not a JSON object");
            }
            return node;
        } catch (JsonProcessingException e) {
            log.error("Malformed JSON at line {} of {}", lineNumber, source);
            throw new FormatException("Malformed JSON at line " + lineNumber + " of " + source, e);
        }
    }

    private JsonNode navigate(JsonNode root) {
        if (recordsPath == null || recordsPath.isBlank()) {
            return root;
        }
        JsonNode current = root;
        for (String segment : recordsPath.split("\\.")) {
            if (current.isObject() && current.has(segment)) {
                current = current.get(segment);
            } else {
                log.warn("Records path segment '{}' of '{}' not found, using enclosing node", segment, recordsPath);
                break;
            }
        }
        return current;
    }

    private List<JsonNode> recordList(JsonNode node) {
        if (node.isObject()) {
            return List.of(node);
        }
        if (!node.isArray()) {
            throw new FormatException("Expected a JSON object or array of objects, got " + node.getNodeType());
        }
        List<JsonNode> objects = new ArrayList<>(node.size());
        for (JsonNode element : node) {
            if (!element.isObject()) {
                throw new FormatException("JSON array element is not an object: " + element.getNodeType());
            }
            objects.add(element);
        }
        return objects;
    }

    @Override
    public TrafficTable normalize(List<JsonNode> raw) {
        if (raw.isEmpty()) {
            return TrafficTable.empty();
        }
        Map<CanonicalField, String> mapping = fieldMapping;
        if (mapping.isEmpty()) {
            mapping = StructuredFields.infer(raw.get(0));
            log.info("Inferred JSON field mapping: {}", mapping);
        }
        List<TrafficRecord> records = new ArrayList<>(raw.size());
        for (JsonNode node : raw) {
            records.add(StructuredFields.toBuilder(node, mapping).build());
        }
        return TrafficTable.of(records);
    }
}
