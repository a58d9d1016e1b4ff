package com.trafficguardian.detector.error;

/** A canonical record could not be completed, even with defaults. */
public class SchemaException extends DetectionException {

    public SchemaException(String message) {
        super(message);
    }

    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
