package com.trafficguardian.detector.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Live-stream ingestion configuration.
 *
 * @author Naveed Gung
 */
@Configuration
@ConfigurationProperties(prefix = "guardian.stream")
@Validated
public class StreamConfig {

    @Min(1)
    private int bufferSize = 10;

    private List<String> topics = new ArrayList<>(List.of("iot/+/data"));

    public int getBufferSize() {
        return bufferSize;
    }

    public void setBufferSize(int bufferSize) {
        this.bufferSize = bufferSize;
    }

    public List<String> getTopics() {
        return topics;
    }

    public void setTopics(List<String> topics) {
        this.topics = topics;
    }
}
