package com.trafficguardian.detector;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.trafficguardian.detector.config.DetectionConfig;
import com.trafficguardian.detector.traffic.TrafficRecord;
import com.trafficguardian.detector.traffic.TrafficTable;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Shared test data: reproducible benign IoT traffic and obvious outliers.
 */
public final class TrafficFixtures {

    public static final Instant START = Instant.parse("2024-03-04T10:00:00Z");

    private static final String[] PROTOCOLS = {"tcp", "udp", "tcp", "tcp"};
    private static final String[] SERVICES = {"http", "dns", "mqtt", "ssl"};
    private static final String[] STATES = {"SF", "S0", "SF", "REJ"};

    private TrafficFixtures() {
    }

    public static ObjectMapper objectMapper() {
        return JsonMapper.builder().findAndAddModules().build();
    }

    /** Small, fast model settings suitable for unit tests. */
    public static DetectionConfig detectionConfig() {
        DetectionConfig config = new DetectionConfig();
        config.setMinTrainingSamples(20);
        config.setContamination(0.1);
        config.setAdvancedFeatures(false);
        config.getIsolationForest().setTrees(50);
        config.getLof().setNeighbors(10);
        return config;
    }

    public static TrafficTable normalTraffic(int count, long seed) {
        Random random = new Random(seed);
        List<TrafficRecord> records = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int device = 1 + random.nextInt(4);
            int variant = random.nextInt(PROTOCOLS.length);
            long orig = 200 + random.nextInt(600);
            long resp = 300 + random.nextInt(900);
            records.add(TrafficRecord.builder()
                    .timestamp(START.plusSeconds(i * 30L + random.nextInt(20)))
                    .deviceId(device)
                    .srcIp("192.168.1." + (10 + device))
                    .dstIp("10.0.0." + (1 + random.nextInt(3)))
                    .srcPort(40_000 + random.nextInt(9_000))
                    .dstPort(variant == 1 ? 53 : 443)
                    .protocol(PROTOCOLS[variant])
                    .packetSize(orig + resp)
                    .duration(0.5 + random.nextDouble() * 2.0)
                    .origBytes(orig)
                    .respBytes(resp)
                    .service(SERVICES[variant])
                    .connState(STATES[variant])
                    .build());
        }
        return TrafficTable.of(records);
    }

    /** Exfiltration-like flow far outside the benign distribution. */
    public static TrafficRecord outlier(int deviceId) {
        return TrafficRecord.builder()
                .timestamp(START.plusSeconds(3_600))
                .deviceId(deviceId)
                .srcIp("192.168.1.99")
                .dstIp("203.0.113.7")
                .srcPort(61_000)
                .dstPort(6_667)
                .protocol("tcp")
                .packetSize(90_000_000L)
                .duration(0.01)
                .origBytes(80_000_000L)
                .respBytes(0L)
                .service("irc")
                .connState("OTH")
                .build();
    }

    /** Clock that tests can move forward explicitly. */
    public static final class MutableClock extends Clock {

        private Instant now;

        public MutableClock(Instant start) {
            this.now = start;
        }

        public void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
