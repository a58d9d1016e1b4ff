package com.trafficguardian.detector.feedback;

/**
 * Result of evaluating, and possibly executing, the retraining policy.
 */
public enum RetrainOutcome {

    /** A new model set was fitted and is now current. */
    RETRAINED,

    /** The retrain interval has not elapsed since the last retrain. */
    SKIPPED_INTERVAL,

    /** Not enough feedback has arrived since the last retrain. */
    SKIPPED_FEEDBACK_COUNT,

    /** Too few valid records after filtering; the previous model set stays. */
    INSUFFICIENT_DATA,

    /** Fetching records or fitting failed; the previous model set stays. */
    ERROR,

    /** Another retrain is in progress. */
    ALREADY_RUNNING;

    public boolean retrained() {
        return this == RETRAINED;
    }
}
