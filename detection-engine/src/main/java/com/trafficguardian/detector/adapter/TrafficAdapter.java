package com.trafficguardian.detector.adapter;

import com.trafficguardian.detector.error.NotFoundException;
import com.trafficguardian.detector.error.SchemaException;
import com.trafficguardian.detector.traffic.TrafficRecord;
import com.trafficguardian.detector.traffic.TrafficTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Base class for every traffic source adapter.
 *
 * <p>
 * An adapter turns one source format into a {@link TrafficTable} in three
 * steps: {@link #load} reads the raw representation, {@link #normalize} maps it
 * onto canonical records and {@link #ensureSchema} verifies that every record
 * exposes the complete schema.
 * </p>
 *
 * @param <R> raw representation produced by {@link #load}
 *
 * @author Naveed Gung
 */
public abstract class TrafficAdapter<R> {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    public abstract AdapterType type();

    /**
     * Read the raw representation of a source.
     *
     * @throws NotFoundException if the source does not exist
     * @throws com.trafficguardian.detector.error.FormatException if the content
     *         cannot be parsed
     */
    public abstract R load(Path source);

    public abstract TrafficTable normalize(R raw);

    /**
     * Verify the canonical schema of a normalized table.
     *
     * <p>
     * Records fill their own defaults on construction, so the only failure left
     * is a record that could not be built at all.
     * </p>
     */
    public TrafficTable ensureSchema(TrafficTable table) {
        int index = 0;
        for (TrafficRecord record : table) {
            if (record == null) {
                throw new SchemaException(type().typeName() + " adapter produced no record at row " + index);
            }
            index++;
        }
        return table;
    }

    public TrafficTable process(Path source) {
        TrafficTable table = ensureSchema(normalize(load(source)));
        log.info("Normalized {} records from {} source {}", table.size(), type().typeName(), source);
        return table;
    }

    protected static void requireExists(Path source) {
        if (source == null || !Files.isRegularFile(source)) {
            throw new NotFoundException("Traffic source not found: " + source);
        }
    }
}
