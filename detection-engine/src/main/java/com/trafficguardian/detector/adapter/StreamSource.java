package com.trafficguardian.detector.adapter;

import java.util.List;

/**
 * Transport delivering live messages (an MQTT client, a message broker
 * consumer, a test double).
 *
 * @author Naveed Gung
 */
public interface StreamSource extends AutoCloseable {

    /**
     * Subscribe to topic filters. The source calls the listener once per
     * message, possibly from its own threads.
     */
    void subscribe(List<String> topics, MessageListener listener);

    /** Stop delivering messages. */
    @Override
    void close();

    @FunctionalInterface
    interface MessageListener {
        void onMessage(String topic, byte[] payload);
    }
}
