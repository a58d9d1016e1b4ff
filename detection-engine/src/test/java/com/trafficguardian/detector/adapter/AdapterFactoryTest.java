package com.trafficguardian.detector.adapter;

import com.trafficguardian.detector.TrafficFixtures;
import com.trafficguardian.detector.config.StreamConfig;
import com.trafficguardian.detector.error.NotFoundException;
import com.trafficguardian.detector.error.UnsupportedTypeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AdapterFactoryTest {

    @TempDir
    Path dir;

    private AdapterFactory factory;

    @BeforeEach
    void setUp() {
        StreamConfig streamConfig = new StreamConfig();
        streamConfig.setBufferSize(25);
        factory = new AdapterFactory(TrafficFixtures.objectMapper(), streamConfig);
    }

    @Test
    void shouldInferTypeFromFileName() {
        assertEquals(AdapterType.CSV, AdapterFactory.inferType(Path.of("flows.CSV")));
        assertEquals(AdapterType.JSON, AdapterFactory.inferType(Path.of("flows.json")));
        assertEquals(AdapterType.JSON, AdapterFactory.inferType(Path.of("flows.jsonl")));
        assertEquals(AdapterType.PCAP, AdapterFactory.inferType(Path.of("capture.pcapng")));
        assertEquals(AdapterType.IOT23, AdapterFactory.inferType(Path.of("conn.log.labeled")));
        assertEquals(AdapterType.IOT23, AdapterFactory.inferType(Path.of("zeek.tsv")));
        assertEquals(AdapterType.CSV, AdapterFactory.inferType(Path.of("export.dat")));
    }

    @Test
    void shouldCreateInferredAdapter() throws Exception {
        Path file = Files.writeString(dir.resolve("capture.pcap"), "");

        assertInstanceOf(PcapAdapter.class, factory.create(file));
    }

    @Test
    void shouldPreferExplicitType() throws Exception {
        Path file = Files.writeString(dir.resolve("data.txt"), "");

        assertInstanceOf(JsonAdapter.class, factory.create(file, "JSONL"));
        assertInstanceOf(Iot23Adapter.class, factory.create(file, "iot-23"));
    }

    @Test
    void shouldCreateStreamAdapterWithoutFile() {
        TrafficAdapter<?> adapter = factory.create(null, "mqtt");

        LiveStreamAdapter stream = assertInstanceOf(LiveStreamAdapter.class, adapter);
        assertEquals(25, stream.getBufferSize());
        assertEquals(AdapterType.MQTT, stream.type());
    }

    @Test
    void shouldRejectUnknownType() throws Exception {
        Path file = Files.writeString(dir.resolve("data.csv"), "");

        assertThrows(UnsupportedTypeException.class, () -> factory.create(file, "parquet"));
    }

    @Test
    void shouldRejectMissingFile() {
        assertThrows(NotFoundException.class, () -> factory.create(dir.resolve("absent.csv")));
        assertThrows(NotFoundException.class, () -> factory.create(dir.resolve("absent.csv"), "csv"));
    }
}
