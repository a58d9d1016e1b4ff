package com.trafficguardian.detector.feedback;

/** Retraining readiness of the feedback loop. */
public enum RetrainState {
    IDLE,
    TRAINING,
    /** Last attempt failed; the next eligible check tries again. */
    ERROR
}
