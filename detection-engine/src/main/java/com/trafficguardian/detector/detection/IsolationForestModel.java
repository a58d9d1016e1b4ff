package com.trafficguardian.detector.detection;

import smile.anomaly.IsolationForest;
import smile.math.MathEx;

/**
 * Model A: isolation forest.
 *
 * <p>
 * Smile scores lie in (0, 1], higher meaning easier to isolate. The decision
 * is the contamination threshold of the training scores minus the score, so
 * it stays within (-1, 1) and is negative for the most isolated
 * {@code contamination} share of the training data.
 * </p>
 *
 * @author Naveed Gung
 */
public final class IsolationForestModel implements OutlierModel {

    private static final long serialVersionUID = 1L;

    public static final String NAME = "isolation_forest";

    private final IsolationForest forest;
    private final double threshold;
    private final int featureCount;

    private IsolationForestModel(IsolationForest forest, double threshold, int featureCount) {
        this.forest = forest;
        this.threshold = threshold;
        this.featureCount = featureCount;
    }

    public static IsolationForestModel fit(double[][] x, double contamination, int trees, double subsample,
            long seed) {
        MathEx.setSeed(seed);
        int sampleSize = Math.max(2, (int) Math.round(x.length * subsample));
        int maxDepth = (int) Math.ceil(Math.log(sampleSize) / Math.log(2));
        IsolationForest forest = IsolationForest.fit(x, trees, maxDepth, subsample, 0);
        double threshold = Percentiles.of(forest.score(x), 1.0 - contamination);
        return new IsolationForestModel(forest, threshold, x[0].length);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public double[] decisionFunction(double[][] x) {
        double[] scores = forest.score(x);
        double[] decisions = new double[scores.length];
        for (int i = 0; i < scores.length; i++) {
            decisions[i] = threshold - scores[i];
        }
        return decisions;
    }

    /** Map a decision onto [0, 1], higher meaning more anomalous. */
    public static double normalize(double decision) {
        return Math.max(0.0, Math.min(1.0, (1.0 - decision) / 2.0));
    }

    public double threshold() {
        return threshold;
    }

    @Override
    public int featureCount() {
        return featureCount;
    }
}
