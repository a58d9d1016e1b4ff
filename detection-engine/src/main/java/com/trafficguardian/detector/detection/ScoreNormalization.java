package com.trafficguardian.detector.detection;

/**
 * How raw Model B (local outlier factor) decisions are mapped onto [0, 1].
 */
public enum ScoreNormalization {

    /** Min-max over the batch being scored; a single-record batch always scores 0. */
    BATCH,

    /** Min-max over the decision range observed on the training data. */
    CALIBRATED
}
