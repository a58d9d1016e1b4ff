package com.trafficguardian.detector.error;

/** Too few valid samples to train or retrain the ensemble. */
public class InsufficientDataException extends DetectionException {

    private final int available;
    private final int required;

    public InsufficientDataException(int available, int required) {
        super(String.format("Insufficient training data: %d valid records, at least %d required",
                available, required));
        this.available = available;
        this.required = required;
    }

    public int getAvailable() {
        return available;
    }

    public int getRequired() {
        return required;
    }
}
