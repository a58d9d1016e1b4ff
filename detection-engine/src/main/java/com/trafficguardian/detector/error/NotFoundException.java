package com.trafficguardian.detector.error;

/** A traffic source, file or stored entity does not exist. */
public class NotFoundException extends DetectionException {

    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
