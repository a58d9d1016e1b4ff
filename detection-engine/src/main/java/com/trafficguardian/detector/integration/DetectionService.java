package com.trafficguardian.detector.integration;

import com.trafficguardian.detector.adapter.AdapterFactory;
import com.trafficguardian.detector.adapter.LiveStreamAdapter;
import com.trafficguardian.detector.adapter.StreamSource;
import com.trafficguardian.detector.adapter.TrafficAdapter;
import com.trafficguardian.detector.config.DetectionConfig;
import com.trafficguardian.detector.detection.AnomalyResult;
import com.trafficguardian.detector.detection.DetectorStatus;
import com.trafficguardian.detector.detection.EnsembleAnomalyDetector;
import com.trafficguardian.detector.detection.ModelSelection;
import com.trafficguardian.detector.error.NotFoundException;
import com.trafficguardian.detector.error.NotReadyException;
import com.trafficguardian.detector.storage.AnomalyRepository;
import com.trafficguardian.detector.storage.StoredAnomaly;
import com.trafficguardian.detector.storage.TrafficRepository;
import com.trafficguardian.detector.traffic.TrafficTable;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Orchestrates adapter, feature extraction, ensemble scoring and storage for
 * files, stored traffic and live streams.
 *
 * <p>
 * File and batch ingestion abort on the first adapter or extraction error.
 * Live streams skip a failed batch and keep running. Training and scoring are
 * CPU-bound; the {@code *Async} variants run them on the bounded-elastic
 * scheduler.
 * </p>
 *
 * @author Naveed Gung
 */
@Service
public class DetectionService {

    private static final Logger log = LoggerFactory.getLogger(DetectionService.class);

    private final AdapterFactory adapterFactory;
    private final EnsembleAnomalyDetector detector;
    private final TrafficRepository trafficRepository;
    private final AnomalyRepository anomalyRepository;
    private final DetectionConfig config;

    private final List<LiveStreamAdapter> liveStreams = new CopyOnWriteArrayList<>();

    public DetectionService(
            AdapterFactory adapterFactory,
            EnsembleAnomalyDetector detector,
            TrafficRepository trafficRepository,
            AnomalyRepository anomalyRepository,
            DetectionConfig config) {
        this.adapterFactory = adapterFactory;
        this.detector = detector;
        this.trafficRepository = trafficRepository;
        this.anomalyRepository = anomalyRepository;
        this.config = config;
    }

    /**
     * Normalize a file, score it and optionally store traffic and anomalies.
     *
     * @throws NotFoundException if the file does not exist
     * @throws NotReadyException if no model set is loaded; nothing is stored
     */
    public DetectionReport detectFromFile(Path file, DetectionRequest request) {
        TrafficAdapter<?> adapter = adapterFactory.create(file, request.adapterType());
        if (!detector.isReady()) {
            throw new NotReadyException("No trained model set, train the detector before detecting");
        }
        TrafficTable table = adapter.process(file);
        if (request.deviceId() != null) {
            table = table.withDeviceId(request.deviceId());
        }
        Double threshold = resolveThreshold(request.threshold());
        ModelSelection model = resolveModel(request.model());
        log.info("Detecting anomalies in {} records from {} (threshold={}, model={})",
                table.size(), file, threshold, model.modelName());

        if (request.storeResults()) {
            table = trafficRepository.saveAll(table);
        }
        List<AnomalyResult> anomalies = anomaliesOf(detector.score(table, threshold, model));
        List<StoredAnomaly> stored = request.storeResults() && !anomalies.isEmpty()
                ? anomalyRepository.saveAll(anomalies)
                : List.of();
        log.info("Detected {} anomalies in {} ({} stored)", anomalies.size(), file, stored.size());
        return new DetectionReport(table.size(), anomalies, stored, threshold, model, detector.status().version());
    }

    /**
     * Score the most recent stored traffic.
     *
     * @param deviceId restrict to one device, {@code null} for all
     * @return anomalous results only
     */
    public List<AnomalyResult> detectFromTraffic(Integer deviceId, int limit, Double threshold, String model) {
        TrafficTable table = trafficRepository.findRecent(limit, deviceId);
        if (table.isEmpty()) {
            log.warn("No stored traffic to process (deviceId={}, limit={})", deviceId, limit);
            return List.of();
        }
        Double resolvedThreshold = resolveThreshold(threshold);
        ModelSelection selection = resolveModel(model);
        log.info("Detecting anomalies in {} stored records (threshold={}, model={})",
                table.size(), resolvedThreshold, selection.modelName());
        List<AnomalyResult> anomalies = anomaliesOf(detector.score(table, resolvedThreshold, selection));
        log.info("Detected {} anomalies", anomalies.size());
        return anomalies;
    }

    /** Score stored traffic and persist the anomalies found. */
    public int processAndStore(Integer deviceId, int limit, Double threshold, String model) {
        List<AnomalyResult> anomalies = detectFromTraffic(deviceId, limit, threshold, model);
        if (anomalies.isEmpty()) {
            log.info("No anomalies detected");
            return 0;
        }
        int count = anomalyRepository.saveAll(anomalies).size();
        log.info("Stored {} anomalies", count);
        return count;
    }

    /**
     * Train a fresh model set from a file.
     *
     * @param limit use at most this many records, {@code null} for all
     */
    public DetectorStatus trainFromFile(Path file, String adapterType, Double contamination, Integer limit) {
        TrafficTable table = adapterFactory.create(file, adapterType).process(file);
        if (limit != null) {
            table = table.limit(limit);
        }
        log.info("Training from {} with {} records", file, table.size());
        return detector.train(table, contamination);
    }

    /**
     * Subscribe a new live stream and score every flushed batch.
     *
     * @param threshold per-stream threshold, {@code null} for the configured
     *                  default
     * @param model     per-stream model selection, {@code null} for the
     *                  configured default
     */
    public LiveStreamAdapter startLiveStream(StreamSource source, Double threshold, String model) {
        LiveStreamAdapter stream = adapterFactory.createStreamAdapter();
        stream.setThreshold(threshold);
        stream.setModel(model);
        liveStreams.add(stream);
        stream.start(source, batch -> scoreStreamBatch(stream, batch));
        return stream;
    }

    /**
     * Store and score one flushed stream batch. Failures are logged and the
     * stream continues with the next batch.
     */
    void scoreStreamBatch(LiveStreamAdapter stream, TrafficTable batch) {
        try {
            TrafficTable stored = trafficRepository.saveAll(batch);
            List<AnomalyResult> anomalies = anomaliesOf(detector.score(stored,
                    resolveThreshold(stream.getThreshold()), resolveModel(stream.getModel())));
            if (!anomalies.isEmpty()) {
                anomalyRepository.saveAll(anomalies);
                log.warn("Live stream batch of {} records contained {} anomalies", batch.size(), anomalies.size());
            }
        } catch (RuntimeException e) {
            log.error("Failed to score live stream batch of {} records: {}", batch.size(), e.getMessage(), e);
        }
    }

    public void stopLiveStream(LiveStreamAdapter stream) {
        stream.stop();
        liveStreams.remove(stream);
    }

    @PreDestroy
    public void stopLiveStreams() {
        for (LiveStreamAdapter stream : liveStreams) {
            stopLiveStream(stream);
        }
    }

    public List<LiveStreamAdapter> liveStreams() {
        return List.copyOf(liveStreams);
    }

    public int bufferedStreamMessages() {
        return liveStreams.stream().mapToInt(LiveStreamAdapter::bufferedCount).sum();
    }

    public Mono<DetectionReport> detectFromFileAsync(Path file, DetectionRequest request) {
        return Mono.fromCallable(() -> detectFromFile(file, request))
                .subscribeOn(Schedulers.boundedElastic());
    }

    public Mono<DetectorStatus> trainFromFileAsync(Path file, String adapterType, Double contamination,
            Integer limit) {
        return Mono.fromCallable(() -> trainFromFile(file, adapterType, contamination, limit))
                .subscribeOn(Schedulers.boundedElastic());
    }

    public Mono<Integer> processAndStoreAsync(Integer deviceId, int limit, Double threshold, String model) {
        return Mono.fromCallable(() -> processAndStore(deviceId, limit, threshold, model))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Double resolveThreshold(Double threshold) {
        return threshold != null ? threshold : config.getDefaultThreshold();
    }

    private ModelSelection resolveModel(String model) {
        return ModelSelection.fromName(model != null ? model : config.getDefaultModel());
    }

    private static List<AnomalyResult> anomaliesOf(List<AnomalyResult> results) {
        return results.stream().filter(AnomalyResult::anomaly).toList();
    }
}
