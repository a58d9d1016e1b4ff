package com.trafficguardian.detector.feature;

import com.trafficguardian.detector.error.NotReadyException;
import com.trafficguardian.detector.traffic.TrafficRecord;
import com.trafficguardian.detector.traffic.TrafficTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns a traffic table into a normalized numeric feature matrix.
 *
 * <p>
 * The feature layout depends only on the {@code advanced} flag and the
 * category vocabularies frozen at training time:
 * </p>
 *
 * <pre>
 * basic     bytes_ratio, packet_rate, log_duration, log_orig_bytes,
 *           log_resp_bytes, log_packet_size, src_port_type, dst_port_type,
 *           protocol_&lt;category&gt;...
 * advanced  hour_sin, hour_cos, day_sin, day_cos,
 *           packets_per_window, avg_packet_size_window,
 *           std_packet_size_window, total_duration_window,
 *           conn_state_&lt;category&gt;..., state_transition_freq,
 *           is_web, is_mail, is_dns, is_file_transfer, service_diversity,
 *           src_flow_count, dst_flow_count, flow_size, flow_duration,
 *           time_diff_cv
 * </pre>
 *
 * <p>
 * Batch-level features that need more records than the batch has (time
 * windows below 10 records, inter-arrival variation below 5 records per
 * device) are 0 so the layout never changes.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class FeatureExtractor {

    private static final Logger log = LoggerFactory.getLogger(FeatureExtractor.class);

    static final List<String> BASIC_FEATURES = List.of(
            "bytes_ratio", "packet_rate", "log_duration", "log_orig_bytes",
            "log_resp_bytes", "log_packet_size", "src_port_type", "dst_port_type");

    static final List<String> TIME_FEATURES = List.of(
            "hour_sin", "hour_cos", "day_sin", "day_cos",
            "packets_per_window", "avg_packet_size_window", "std_packet_size_window", "total_duration_window");

    static final List<String> SERVICE_AND_FLOW_FEATURES = List.of(
            "state_transition_freq",
            "is_web", "is_mail", "is_dns", "is_file_transfer", "service_diversity",
            "src_flow_count", "dst_flow_count", "flow_size", "flow_duration",
            "time_diff_cv");

    private static final Set<String> WEB_SERVICES = Set.of("http", "https", "ssl", "web");
    private static final Set<String> MAIL_SERVICES = Set.of("smtp", "pop3", "imap");
    private static final Set<String> FILE_TRANSFER_SERVICES = Set.of("ftp", "sftp", "tftp");

    static final int MIN_WINDOW_RECORDS = 10;
    static final int MAX_WINDOWS = 10;
    static final int MIN_DEVICE_RECORDS_FOR_CV = 5;

    /** Normalized matrix and the transformer that produced it. */
    public record Extraction(FeatureMatrix matrix, FeatureTransformer transformer) {
    }

    /**
     * Extract and normalize features.
     *
     * @param training {@code true} to learn vocabularies and fit a fresh
     *                 scaler; {@code false} to apply {@code current}
     * @param current  transformer in force, ignored when training
     * @throws NotReadyException if not training and no transformer exists
     * @throws com.trafficguardian.detector.error.ConfigurationException if the
     *         extracted layout differs from the transformer's
     */
    public Extraction extract(TrafficTable table, boolean advanced, boolean training, FeatureTransformer current) {
        if (training) {
            CategoryVocabulary protocols = CategoryVocabulary.learn("protocol",
                    table.stream().map(TrafficRecord::protocol).toList());
            CategoryVocabulary connStates = CategoryVocabulary.learn("conn_state",
                    table.stream().map(TrafficRecord::connState).toList());
            FeatureMatrix raw = rawFeatures(table, advanced, protocols, connStates);
            FeatureTransformer fitted = FeatureTransformer.fit(advanced, protocols, connStates, raw);
            log.info("Fitted feature transformer: {} features over {} records ({} protocols, {} connection states)",
                    fitted.featureCount(), table.size(), protocols.size(), connStates.size());
            return new Extraction(fitted.transform(raw), fitted);
        }
        if (current == null) {
            throw new NotReadyException("No fitted feature transformer, train the detector first");
        }
        FeatureMatrix raw = rawFeatures(table, advanced, current.protocols(), current.connStates());
        return new Extraction(current.transform(raw), current);
    }

    public static List<String> featureNames(boolean advanced, CategoryVocabulary protocols,
            CategoryVocabulary connStates) {
        List<String> names = new ArrayList<>(BASIC_FEATURES);
        names.addAll(protocols.featureNames());
        if (advanced) {
            names.addAll(TIME_FEATURES);
            names.addAll(connStates.featureNames());
            names.addAll(SERVICE_AND_FLOW_FEATURES);
        }
        return names;
    }

    /** Unscaled features in the layout given by {@link #featureNames}. */
    FeatureMatrix rawFeatures(TrafficTable table, boolean advanced, CategoryVocabulary protocols,
            CategoryVocabulary connStates) {
        List<String> names = featureNames(advanced, protocols, connStates);
        List<TrafficRecord> records = table.records();
        int n = records.size();
        double[][] values = new double[n][names.size()];

        BatchContext context = advanced ? new BatchContext(records) : null;
        for (int i = 0; i < n; i++) {
            TrafficRecord r = records.get(i);
            double[] row = values[i];
            int col = 0;

            row[col++] = (double) r.origBytes() / Math.max(r.respBytes(), 1L);
            row[col++] = r.packetSize() / Math.max(r.duration(), 0.001);
            row[col++] = Math.log1p(r.duration());
            row[col++] = Math.log1p(r.origBytes());
            row[col++] = Math.log1p(r.respBytes());
            row[col++] = Math.log1p(r.packetSize());
            row[col++] = portType(r.srcPort());
            row[col++] = portType(r.dstPort());
            row[col + protocols.indexOf(r.protocol())] = 1.0;
            col += protocols.size();

            if (!advanced) {
                continue;
            }
            ZonedDateTime time = r.timestamp().atZone(ZoneOffset.UTC);
            int hour = time.getHour();
            int day = time.getDayOfWeek().getValue() - 1;
            row[col++] = Math.sin(2 * Math.PI * hour / 24);
            row[col++] = Math.cos(2 * Math.PI * hour / 24);
            row[col++] = Math.sin(2 * Math.PI * day / 7);
            row[col++] = Math.cos(2 * Math.PI * day / 7);
            System.arraycopy(context.window[i], 0, row, col, 4);
            col += 4;

            row[col + connStates.indexOf(r.connState())] = 1.0;
            col += connStates.size();
            row[col++] = context.transitionFrequency[i];

            row[col++] = WEB_SERVICES.contains(r.service()) ? 1.0 : 0.0;
            row[col++] = MAIL_SERVICES.contains(r.service()) ? 1.0 : 0.0;
            row[col++] = "dns".equals(r.service()) ? 1.0 : 0.0;
            row[col++] = FILE_TRANSFER_SERVICES.contains(r.service()) ? 1.0 : 0.0;
            row[col++] = context.servicesByDevice.get(r.deviceId()).size();

            String flowId = flowId(r);
            row[col++] = context.flowsBySource.get(r.srcIp()).size();
            row[col++] = context.flowsByDestination.get(r.dstIp()).size();
            row[col++] = context.flowSize.get(flowId);
            row[col++] = context.flowDuration(flowId);
            row[col] = context.timeDiffCv.getOrDefault(r.deviceId(), 0.0);
        }
        return new FeatureMatrix(names, values);
    }

    static int portType(int port) {
        if (port < 1024) {
            return 0;
        }
        return port < 49152 ? 1 : 2;
    }

    static String flowId(TrafficRecord r) {
        return r.srcIp() + ":" + r.srcPort() + "-" + r.dstIp() + ":" + r.dstPort();
    }

    private static double seconds(Instant instant) {
        return instant.getEpochSecond() + instant.getNano() / 1e9;
    }

    /** Aggregates over the whole batch needed by the advanced features. */
    private static final class BatchContext {

        final double[][] window;
        final double[] transitionFrequency;
        final Map<Integer, Set<String>> servicesByDevice = new HashMap<>();
        final Map<String, Set<String>> flowsBySource = new HashMap<>();
        final Map<String, Set<String>> flowsByDestination = new HashMap<>();
        final Map<String, Double> flowSize = new HashMap<>();
        final Map<String, double[]> flowSpan = new HashMap<>();
        final Map<Integer, Double> timeDiffCv = new HashMap<>();

        BatchContext(List<TrafficRecord> records) {
            this.window = windowStatistics(records);
            this.transitionFrequency = transitionFrequencies(records);
            for (TrafficRecord r : records) {
                String flowId = flowId(r);
                double t = seconds(r.timestamp());
                servicesByDevice.computeIfAbsent(r.deviceId(), k -> new HashSet<>()).add(r.service());
                flowsBySource.computeIfAbsent(r.srcIp(), k -> new HashSet<>()).add(flowId);
                flowsByDestination.computeIfAbsent(r.dstIp(), k -> new HashSet<>()).add(flowId);
                flowSize.merge(flowId, (double) r.packetSize(), Double::sum);
                flowSpan.merge(flowId, new double[] {t, t},
                        (a, b) -> new double[] {Math.min(a[0], b[0]), Math.max(a[1], b[1])});
            }
            records.stream()
                    .collect(Collectors.groupingBy(TrafficRecord::deviceId))
                    .forEach((device, deviceRecords) -> timeDiffCv.put(device, interArrivalCv(deviceRecords)));
        }

        double flowDuration(String flowId) {
            double[] span = flowSpan.get(flowId);
            return span[1] - span[0];
        }

        /**
         * Per record: count, mean packet size, sample deviation of packet size
         * and total duration of its equal-width time window.
         */
        private static double[][] windowStatistics(List<TrafficRecord> records) {
            int n = records.size();
            double[][] stats = new double[n][4];
            if (n < MIN_WINDOW_RECORDS) {
                return stats;
            }
            int bins = Math.min(MAX_WINDOWS, n / 5);
            double[] times = records.stream().mapToDouble(r -> seconds(r.timestamp())).toArray();
            double min = Arrays.stream(times).min().orElse(0.0);
            double max = Arrays.stream(times).max().orElse(0.0);
            double width = (max - min) / bins;

            int[] bin = new int[n];
            int[] count = new int[bins];
            double[] sum = new double[bins];
            double[] sumSquares = new double[bins];
            double[] durations = new double[bins];
            for (int i = 0; i < n; i++) {
                int b = width > 0 ? Math.min(bins - 1, (int) ((times[i] - min) / width)) : 0;
                bin[i] = b;
                double size = records.get(i).packetSize();
                count[b]++;
                sum[b] += size;
                sumSquares[b] += size * size;
                durations[b] += records.get(i).duration();
            }
            for (int i = 0; i < n; i++) {
                int b = bin[i];
                double mean = sum[b] / count[b];
                double variance = count[b] > 1
                        ? Math.max(0.0, (sumSquares[b] - count[b] * mean * mean) / (count[b] - 1))
                        : 0.0;
                stats[i][0] = count[b];
                stats[i][1] = mean;
                stats[i][2] = Math.sqrt(variance);
                stats[i][3] = durations[b];
            }
            return stats;
        }

        /** Share of the transition from the previous record's state among all consecutive transitions. */
        private static double[] transitionFrequencies(List<TrafficRecord> records) {
            int n = records.size();
            double[] frequency = new double[n];
            if (n < 2) {
                return frequency;
            }
            Map<String, Integer> counts = new HashMap<>();
            String[] keys = new String[n];
            for (int i = 1; i < n; i++) {
                keys[i] = records.get(i - 1).connState() + "_to_" + records.get(i).connState();
                counts.merge(keys[i], 1, Integer::sum);
            }
            for (int i = 1; i < n; i++) {
                frequency[i] = (double) counts.get(keys[i]) / (n - 1);
            }
            return frequency;
        }

        /** Coefficient of variation of inter-arrival times, 0 when too few records. */
        private static double interArrivalCv(List<TrafficRecord> deviceRecords) {
            if (deviceRecords.size() < MIN_DEVICE_RECORDS_FOR_CV) {
                return 0.0;
            }
            double[] times = deviceRecords.stream()
                    .map(TrafficRecord::timestamp)
                    .sorted(Comparator.naturalOrder())
                    .mapToDouble(FeatureExtractor::seconds)
                    .toArray();
            int m = times.length - 1;
            double[] diffs = new double[m];
            double sum = 0.0;
            for (int i = 0; i < m; i++) {
                diffs[i] = times[i + 1] - times[i];
                sum += diffs[i];
            }
            double mean = sum / m;
            if (mean <= 0.0) {
                return 0.0;
            }
            double squares = 0.0;
            for (double d : diffs) {
                squares += (d - mean) * (d - mean);
            }
            return Math.sqrt(squares / (m - 1)) / mean;
        }
    }
}
