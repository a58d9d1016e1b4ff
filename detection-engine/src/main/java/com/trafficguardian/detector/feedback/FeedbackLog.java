package com.trafficguardian.detector.feedback;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trafficguardian.detector.config.FeedbackConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only feedback history, one JSON object per line.
 *
 * <p>
 * The file is read once on construction. Entries are never rewritten; a
 * later judgment on the same anomaly is simply appended.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class FeedbackLog {

    private static final Logger log = LoggerFactory.getLogger(FeedbackLog.class);

    private final Path file;
    private final ObjectMapper objectMapper;
    private final List<FeedbackRecord> entries = new CopyOnWriteArrayList<>();

    @Autowired
    public FeedbackLog(FeedbackConfig config, ObjectMapper objectMapper) {
        this(Path.of(config.getHistoryPath()), objectMapper);
    }

    public FeedbackLog(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
        this.entries.addAll(readExisting());
    }

    private List<FeedbackRecord> readExisting() {
        if (!Files.isRegularFile(file)) {
            return List.of();
        }
        List<FeedbackRecord> loaded = new ArrayList<>();
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read feedback history " + file, e);
        }
        int lineNumber = 0;
        for (String line : lines) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            try {
                loaded.add(objectMapper.readValue(line, FeedbackRecord.class));
            } catch (JsonProcessingException e) {
                log.warn("Skipping unreadable feedback entry at line {} of {}: {}",
                        lineNumber, file, e.getOriginalMessage());
            }
        }
        log.info("Loaded {} feedback entries from {}", loaded.size(), file);
        return loaded;
    }

    /**
     * Append one entry to the file and the in-memory view.
     *
     * @throws UncheckedIOException if the file cannot be written; nothing is
     *                              appended in that case
     */
    public synchronized void append(FeedbackRecord record) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            String line = objectMapper.writeValueAsString(record) + System.lineSeparator();
            Files.writeString(file, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.error("Failed to append feedback for anomaly {}", record.anomalyId(), e);
            throw new UncheckedIOException("Cannot append to feedback history " + file, e);
        }
        entries.add(record);
    }

    /** Snapshot of all entries in append order. */
    public List<FeedbackRecord> entries() {
        return List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }

    public Path file() {
        return file;
    }
}
