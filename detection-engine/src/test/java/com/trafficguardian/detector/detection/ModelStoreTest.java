package com.trafficguardian.detector.detection;

import com.trafficguardian.detector.TrafficFixtures;
import com.trafficguardian.detector.error.NotReadyException;
import com.trafficguardian.detector.feature.FeatureExtractor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;

class ModelStoreTest {

    @TempDir
    Path root;

    private ModelStore store;
    private EnsembleAnomalyDetector detector;

    @BeforeEach
    void setUp() {
        store = new ModelStore(root, 2, TrafficFixtures.objectMapper());
        detector = new EnsembleAnomalyDetector(TrafficFixtures.detectionConfig(), new FeatureExtractor(), store,
                new SimpleMeterRegistry(), Clock.systemUTC());
        detector.init();
    }

    @Test
    void shouldLoadNothingFromEmptyDirectory() {
        assertTrue(store.load().isEmpty());
        assertEquals(1L, store.nextVersion());
    }

    @Test
    void shouldKeepOnlyRetainedVersions() {
        for (long seed = 1; seed <= 3; seed++) {
            detector.train(TrafficFixtures.normalTraffic(40, seed), null);
        }

        assertFalse(Files.exists(root.resolve("v1")));
        assertTrue(Files.isDirectory(root.resolve("v2")));
        assertTrue(Files.isDirectory(root.resolve("v3")));
        assertEquals(3L, store.load().orElseThrow().version());
        assertEquals(4L, store.nextVersion());
        assertFalse(Files.exists(root.resolve(ModelStore.MANIFEST + ".tmp")));
    }

    @Test
    void shouldLoadCompleteModelSet() {
        detector.train(TrafficFixtures.normalTraffic(40, 1L), 0.15);

        DetectorState loaded = store.load().orElseThrow();

        assertEquals(1L, loaded.version());
        assertEquals(0.15, loaded.contamination());
        assertEquals(40, loaded.samples());
        assertEquals(detector.status().featureCount(), loaded.transformer().featureCount());
        assertEquals(loaded.transformer().featureCount(), loaded.isolationForest().featureCount());
        assertEquals(loaded.transformer().featureCount(), loaded.lof().featureCount());
    }

    @Test
    void shouldReportUnreadableManifest() throws Exception {
        Files.writeString(root.resolve(ModelStore.MANIFEST), "{not json");

        assertThrows(NotReadyException.class, () -> store.load());
    }
}
