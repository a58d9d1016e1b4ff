package com.trafficguardian.detector.error;

/** No fitted model set is available for scoring. */
public class NotReadyException extends DetectionException {

    public NotReadyException(String message) {
        super(message);
    }

    public NotReadyException(String message, Throwable cause) {
        super(message, cause);
    }
}
