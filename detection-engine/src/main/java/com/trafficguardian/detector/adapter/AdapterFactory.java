package com.trafficguardian.detector.adapter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trafficguardian.detector.config.StreamConfig;
import com.trafficguardian.detector.error.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Chooses and constructs the adapter for a traffic source.
 *
 * <p>
 * An explicit type name wins; otherwise the type is inferred from the file
 * name. Unrecognized extensions fall back to the tabular adapter.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class AdapterFactory {

    private static final Logger log = LoggerFactory.getLogger(AdapterFactory.class);

    private final ObjectMapper objectMapper;
    private final StreamConfig streamConfig;

    public AdapterFactory(ObjectMapper objectMapper, StreamConfig streamConfig) {
        this.objectMapper = objectMapper;
        this.streamConfig = streamConfig;
    }

    public TrafficAdapter<?> create(Path source) {
        return create(source, null);
    }

    /**
     * @param source       file to read; may be {@code null} for a live stream
     * @param explicitType adapter type name, or {@code null} to infer from the
     *                     file name
     * @throws NotFoundException if a file-based source does not exist
     * @throws com.trafficguardian.detector.error.UnsupportedTypeException if
     *         the explicit type is unknown
     */
    public TrafficAdapter<?> create(Path source, String explicitType) {
        if (explicitType != null && !explicitType.isBlank()) {
            AdapterType type = AdapterType.fromName(explicitType);
            if (type.requiresFile()) {
                requireFile(source);
            }
            return create(type);
        }
        requireFile(source);
        return create(inferType(source));
    }

    public TrafficAdapter<?> create(AdapterType type) {
        return switch (type) {
            case CSV -> new CsvAdapter();
            case JSON -> new JsonAdapter(objectMapper);
            case PCAP -> new PcapAdapter();
            case IOT23 -> new Iot23Adapter();
            case MQTT -> createStreamAdapter();
        };
    }

    public LiveStreamAdapter createStreamAdapter() {
        return new LiveStreamAdapter(objectMapper, streamConfig.getBufferSize(), streamConfig.getTopics());
    }

    static AdapterType inferType(Path source) {
        String name = source.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".csv")) {
            return AdapterType.CSV;
        }
        if (name.endsWith(".json") || name.endsWith(".jsonl")) {
            return AdapterType.JSON;
        }
        if (name.endsWith(".pcap") || name.endsWith(".pcapng") || name.endsWith(".cap")) {
            return AdapterType.PCAP;
        }
        if (name.endsWith(".log") || name.endsWith(".tsv") || name.contains("conn.log")) {
            return AdapterType.IOT23;
        }
        log.warn("Could not determine adapter type for {}, defaulting to CSV", source);
        return AdapterType.CSV;
    }

    private static void requireFile(Path source) {
        if (source == null || !Files.isRegularFile(source)) {
            throw new NotFoundException("Traffic source not found: " + source);
        }
    }
}
