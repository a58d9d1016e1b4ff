package com.trafficguardian.detector.adapter;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.trafficguardian.detector.error.FormatException;
import com.trafficguardian.detector.traffic.CanonicalField;
import com.trafficguardian.detector.traffic.TrafficRecord;
import com.trafficguardian.detector.traffic.TrafficTable;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Adapter for tabular (comma-separated, header row) traffic exports.
 *
 * <p>
 * Columns are mapped onto canonical fields either from an explicit mapping or
 * by auto-detection against {@link FieldSynonyms#TABULAR}.
 * </p>
 *
 * @author Naveed Gung
 */
public class CsvAdapter extends TrafficAdapter<CsvAdapter.Rows> {

    /** Header and rows of a tabular source, in file order. */
    public record Rows(List<String> columns, List<Map<String, String>> rows) {
    }

    private final CsvMapper mapper;
    private final Map<CanonicalField, String> columnMapping;

    public CsvAdapter() {
        this(Map.of());
    }

    /**
     * @param columnMapping explicit canonical field to column mapping; empty
     *                      to auto-detect
     */
    public CsvAdapter(Map<CanonicalField, String> columnMapping) {
        this.mapper = new CsvMapper();
        this.mapper.enable(CsvParser.Feature.TRIM_SPACES);
        this.mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
        this.columnMapping = Map.copyOf(columnMapping);
    }

    @Override
    public AdapterType type() {
        return AdapterType.CSV;
    }

    @Override
    public Rows load(Path source) {
        requireExists(source);
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (Reader reader = Files.newBufferedReader(source, StandardCharsets.UTF_8);
                MappingIterator<Map<String, String>> it = mapper.readerFor(Map.class)
                        .with(schema)
                        .readValues(reader)) {
            List<Map<String, String>> rows = it.readAll();
            List<String> columns = rows.isEmpty() ? List.of() : List.copyOf(rows.get(0).keySet());
            log.info("Loaded CSV file {} with {} rows and {} columns", source, rows.size(), columns.size());
            return new Rows(columns, rows);
        } catch (IOException e) {
            log.error("Error loading CSV file {}", source, e);
            throw new FormatException("Cannot parse CSV file " + source + ": " + e.getMessage(), e);
        }
    }

    @Override
    public TrafficTable normalize(Rows raw) {
        Map<CanonicalField, String> mapping = columnMapping.isEmpty()
                ? inferMapping(raw.columns())
                : columnMapping;

        List<TrafficRecord> records = new ArrayList<>(raw.rows().size());
        for (Map<String, String> row : raw.rows()) {
            TrafficRecord.Builder builder = TrafficRecord.builder();
            mapping.forEach((field, column) -> builder.set(field, row.get(column)));
            records.add(builder.build());
        }
        return TrafficTable.of(records);
    }

    Map<CanonicalField, String> inferMapping(List<String> columns) {
        Map<CanonicalField, String> mapping = FieldSynonyms.TABULAR.infer(columns);
        log.info("Inferred CSV column mapping: {}", mapping);
        for (CanonicalField field : CanonicalField.required()) {
            if (!mapping.containsKey(field)) {
                log.debug("No column found for required field {}, default applies", field.columnName());
            }
        }
        return mapping;
    }
}
