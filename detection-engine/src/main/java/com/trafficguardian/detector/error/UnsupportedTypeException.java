package com.trafficguardian.detector.error;

/** An explicitly requested adapter type is unknown. */
public class UnsupportedTypeException extends DetectionException {

    public UnsupportedTypeException(String message) {
        super(message);
    }

    public UnsupportedTypeException(String message, Throwable cause) {
        super(message, cause);
    }
}
