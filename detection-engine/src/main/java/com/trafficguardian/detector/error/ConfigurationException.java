package com.trafficguardian.detector.error;

/** Feature space of an extracted matrix does not match the fitted transformer. */
public class ConfigurationException extends DetectionException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
