package com.trafficguardian.detector.error;

/** Raw input could not be decoded or parsed. */
public class FormatException extends DetectionException {

    public FormatException(String message) {
        super(message);
    }

    public FormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
