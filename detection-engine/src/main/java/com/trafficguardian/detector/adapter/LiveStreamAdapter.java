package com.trafficguardian.detector.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trafficguardian.detector.error.FormatException;
import com.trafficguardian.detector.traffic.CanonicalField;
import com.trafficguardian.detector.traffic.FieldValues;
import com.trafficguardian.detector.traffic.TrafficRecord;
import com.trafficguardian.detector.traffic.TrafficTable;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Adapter for live message streams.
 *
 * <p>
 * Each {@code (topic, payload)} message is normalized on arrival and appended
 * to a bounded buffer. When the buffer reaches {@code bufferSize} its contents
 * are handed to the batch handler as one {@link TrafficTable}. Appending and
 * flushing share one lock, so every message lands in exactly one batch and
 * batches are delivered in arrival order.
 * </p>
 *
 * <p>
 * The device id comes from the payload when present, otherwise from the second
 * topic segment ({@code iot/<device_id>/data}), otherwise 0.
 * </p>
 *
 * @author Naveed Gung
 */
public class LiveStreamAdapter extends TrafficAdapter<List<LiveStreamAdapter.StreamMessage>> {

    /** One received message; the payload is a parsed JSON object. */
    public record StreamMessage(String topic, JsonNode payload) {
    }

    private final ObjectMapper mapper;
    private final int bufferSize;
    private final List<String> topics;
    private final ReentrantLock lock = new ReentrantLock();
    private final List<TrafficRecord> buffer = new ArrayList<>();
    private final AtomicLong receivedMessages = new AtomicLong();
    private final AtomicLong droppedMessages = new AtomicLong();
    // guarded by lock
    private boolean stopped;

    private volatile Consumer<TrafficTable> batchHandler = batch -> {
    };
    private volatile StreamSource source;
    private volatile Double threshold;
    private volatile String model;

    public LiveStreamAdapter(ObjectMapper mapper, int bufferSize, List<String> topics) {
        if (bufferSize < 1) {
            throw new IllegalArgumentException("bufferSize must be >= 1, got " + bufferSize);
        }
        this.mapper = mapper;
        this.bufferSize = bufferSize;
        this.topics = List.copyOf(topics);
    }

    @Override
    public AdapterType type() {
        return AdapterType.MQTT;
    }

    /**
     * Subscribe to the configured topics and deliver full batches to the
     * handler.
     */
    public void start(StreamSource streamSource, Consumer<TrafficTable> handler) {
        this.batchHandler = handler;
        lock.lock();
        try {
            stopped = false;
        } finally {
            lock.unlock();
        }
        this.source = streamSource;
        streamSource.subscribe(topics, this::onMessage);
        log.info("Live stream started: topics={}, bufferSize={}", topics, bufferSize);
    }

    /**
     * Close the subscription and flush whatever is still buffered. Messages
     * arriving afterwards are dropped and counted.
     */
    public void stop() {
        StreamSource current = source;
        source = null;
        if (current != null) {
            current.close();
        }
        lock.lock();
        try {
            stopped = true;
            if (!buffer.isEmpty()) {
                flushLocked();
            }
        } finally {
            lock.unlock();
        }
        log.info("Live stream stopped: received={}, dropped={}", receivedMessages.get(), droppedMessages.get());
    }

    public boolean isRunning() {
        return source != null;
    }

    /**
     * Accept one message. Malformed payloads are dropped with a warning and
     * never reach the buffer.
     */
    public void onMessage(String topic, byte[] payload) {
        receivedMessages.incrementAndGet();
        TrafficRecord record;
        try {
            record = toRecord(new StreamMessage(topic, parse(payload)));
        } catch (FormatException e) {
            droppedMessages.incrementAndGet();
            log.warn("Dropping malformed message on topic {}: {}", topic, e.getMessage());
            return;
        }

        lock.lock();
        try {
            if (stopped) {
                droppedMessages.incrementAndGet();
                log.warn("Dropping message on topic {} received after the stream stopped", topic);
                return;
            }
            buffer.add(record);
            if (buffer.size() >= bufferSize) {
                flushLocked();
            }
        } finally {
            lock.unlock();
        }
    }

    private void flushLocked() {
        TrafficTable batch = TrafficTable.of(buffer);
        buffer.clear();
        try {
            batchHandler.accept(batch);
        } catch (RuntimeException e) {
            log.error("Batch handler failed for {} buffered messages", batch.size(), e);
        }
    }

    private JsonNode parse(byte[] payload) {
        JsonNode node;
        try {
            node = mapper.readTree(new String(payload, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new FormatException("payload is not JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw new FormatException("payload is not a JSON object");
        }
        return node;
    }

    /** Replay recorded messages from a JSON-lines file of {@code {"topic": ..., "payload": {...}}} lines. */
    @Override
    public List<StreamMessage> load(Path recording) {
        requireExists(recording);
        List<StreamMessage> messages = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(recording, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                JsonNode node = parse(line.getBytes(StandardCharsets.UTF_8));
                JsonNode payload = node.get("payload");
                if (payload != null && payload.isObject()) {
                    messages.add(new StreamMessage(FieldValues.toText(node.get("topic")), payload));
                } else {
                    messages.add(new StreamMessage(null, node));
                }
            }
        } catch (IOException e) {
            log.error("Error reading stream recording {}", recording, e);
            throw new FormatException("Cannot read stream recording " + recording, e);
        }
        log.info("Loaded {} recorded messages from {}", messages.size(), recording);
        return messages;
    }

    @Override
    public TrafficTable normalize(List<StreamMessage> messages) {
        List<TrafficRecord> records = new ArrayList<>(messages.size());
        for (StreamMessage message : messages) {
            records.add(toRecord(message));
        }
        return TrafficTable.of(records);
    }

    TrafficRecord toRecord(StreamMessage message) {
        Map<CanonicalField, String> mapping = StructuredFields.infer(message.payload());
        TrafficRecord.Builder builder = StructuredFields.toBuilder(message.payload(), mapping);
        if (!builder.hasDeviceId()) {
            builder.deviceId(deviceIdFromTopic(message.topic()));
        }
        return builder.build();
    }

    static int deviceIdFromTopic(String topic) {
        if (topic == null) {
            return 0;
        }
        String[] parts = topic.split("/");
        if (parts.length < 2) {
            return 0;
        }
        Integer deviceId = FieldValues.toInteger(parts[1]);
        return deviceId != null ? deviceId : 0;
    }

    public int bufferedCount() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    public long receivedCount() {
        return receivedMessages.get();
    }

    public long droppedCount() {
        return droppedMessages.get();
    }

    public int getBufferSize() {
        return bufferSize;
    }

    public List<String> getTopics() {
        return topics;
    }

    /** Threshold applied to this stream's batches, {@code null} for the configured default. */
    public Double getThreshold() {
        return threshold;
    }

    public void setThreshold(Double threshold) {
        this.threshold = threshold;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }
}
