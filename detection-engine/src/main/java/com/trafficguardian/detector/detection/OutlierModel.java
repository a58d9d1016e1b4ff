package com.trafficguardian.detector.detection;

import java.io.Serializable;

/**
 * An unsupervised outlier model fitted on normalized feature vectors.
 *
 * @author Naveed Gung
 */
public interface OutlierModel extends Serializable {

    /** Short name used in results, metrics and persisted file names. */
    String name();

    /**
     * Signed outlier decision per row. Negative values are outliers; the more
     * negative, the more anomalous.
     */
    double[] decisionFunction(double[][] x);

    /** Native decision: {@code true} for rows the model flags as outliers. */
    default boolean[] predict(double[][] x) {
        double[] decisions = decisionFunction(x);
        boolean[] outliers = new boolean[decisions.length];
        for (int i = 0; i < decisions.length; i++) {
            outliers[i] = decisions[i] < 0.0;
        }
        return outliers;
    }

    /** Number of features the model was fitted on. */
    int featureCount();
}
