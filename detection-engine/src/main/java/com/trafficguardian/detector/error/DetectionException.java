package com.trafficguardian.detector.error;

/**
 * Base type for failures raised by the detection pipeline.
 *
 * <p>
 * Adapter and feature errors propagate to the integration layer, which decides
 * whether to abort a batch or skip a single record. Retraining failures are
 * absorbed by the feedback loop instead.
 * </p>
 *
 * @author Naveed Gung
 */
public abstract class DetectionException extends RuntimeException {

    protected DetectionException(String message) {
        super(message);
    }

    protected DetectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
