package com.trafficguardian.detector.detection;

import smile.neighbor.KDTree;
import smile.neighbor.Neighbor;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Model B: local outlier factor in novelty mode.
 *
 * <p>
 * The training set is kept; new points are compared against their {@code k}
 * nearest training neighbours. The decision is {@code -LOF - offset} where the
 * offset is the {@code contamination} percentile of the training
 * {@code -LOF} values, so the same share of the training data is negative as
 * for Model A.
 * </p>
 *
 * @author Naveed Gung
 */
public final class LocalOutlierFactorModel implements OutlierModel {

    private static final long serialVersionUID = 1L;

    public static final String NAME = "local_outlier_factor";

    private static final double EPSILON = 1e-10;

    private final double[][] data;
    private final int k;
    private final double[] kDistance;
    private final double[] lrd;
    private final double offset;
    private final double trainingDecisionMin;
    private final double trainingDecisionMax;

    private transient volatile KDTree<double[]> tree;

    private LocalOutlierFactorModel(double[][] data, int k, double[] kDistance, double[] lrd, double offset,
            double trainingDecisionMin, double trainingDecisionMax, KDTree<double[]> tree) {
        this.data = data;
        this.k = k;
        this.kDistance = kDistance;
        this.lrd = lrd;
        this.offset = offset;
        this.trainingDecisionMin = trainingDecisionMin;
        this.trainingDecisionMax = trainingDecisionMax;
        this.tree = tree;
    }

    /**
     * @param neighbors requested neighbourhood size, capped at {@code n - 1}
     */
    public static LocalOutlierFactorModel fit(double[][] x, int neighbors, double contamination) {
        int n = x.length;
        if (n < 2) {
            throw new IllegalArgumentException("Local outlier factor needs at least 2 samples, got " + n);
        }
        int k = Math.max(1, Math.min(neighbors, n - 1));
        KDTree<double[]> tree = new KDTree<>(x, x);

        int[][] neighbourIndex = new int[n][];
        double[][] neighbourDistance = new double[n][];
        double[] kDistance = new double[n];
        for (int i = 0; i < n; i++) {
            Neighbor<double[], double[]>[] found = trainingNeighbours(tree, x, i, k);
            neighbourIndex[i] = new int[k];
            neighbourDistance[i] = new double[k];
            for (int j = 0; j < k; j++) {
                neighbourIndex[i][j] = found[j].index;
                neighbourDistance[i][j] = found[j].distance;
            }
            kDistance[i] = neighbourDistance[i][k - 1];
        }

        double[] lrd = new double[n];
        for (int i = 0; i < n; i++) {
            lrd[i] = localReachabilityDensity(neighbourIndex[i], neighbourDistance[i], kDistance);
        }

        double[] negativeLof = new double[n];
        for (int i = 0; i < n; i++) {
            negativeLof[i] = -outlierFactor(neighbourIndex[i], lrd, lrd[i]);
        }
        double offset = Percentiles.of(negativeLof, contamination);
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double value : negativeLof) {
            double decision = value - offset;
            min = Math.min(min, decision);
            max = Math.max(max, decision);
        }
        return new LocalOutlierFactorModel(x, k, kDistance, lrd, offset, min, max, tree);
    }

    /**
     * k nearest neighbours of a training point, excluding the point itself.
     * The query is a copy so the tree does not skip it by identity; the self
     * match is removed explicitly, or the farthest neighbour when duplicates
     * hide it.
     */
    private static Neighbor<double[], double[]>[] trainingNeighbours(KDTree<double[]> tree, double[][] x, int i,
            int k) {
        Neighbor<double[], double[]>[] found = sorted(tree.search(x[i].clone(), k + 1));
        int self = -1;
        for (int j = 0; j < found.length; j++) {
            if (found[j].index == i) {
                self = j;
                break;
            }
        }
        if (self < 0) {
            return Arrays.copyOf(found, k);
        }
        Neighbor<double[], double[]>[] withoutSelf = Arrays.copyOf(found, k);
        for (int j = self; j < k && j + 1 < found.length; j++) {
            withoutSelf[j] = found[j + 1];
        }
        return withoutSelf;
    }

    private static Neighbor<double[], double[]>[] sorted(Neighbor<double[], double[]>[] neighbours) {
        Arrays.sort(neighbours, Comparator.comparingDouble(nb -> nb.distance));
        return neighbours;
    }

    private static double localReachabilityDensity(int[] neighbourIndex, double[] neighbourDistance,
            double[] kDistance) {
        double sum = 0.0;
        for (int j = 0; j < neighbourIndex.length; j++) {
            sum += Math.max(kDistance[neighbourIndex[j]], neighbourDistance[j]);
        }
        return 1.0 / (sum / neighbourIndex.length + EPSILON);
    }

    private static double outlierFactor(int[] neighbourIndex, double[] lrd, double ownLrd) {
        double sum = 0.0;
        for (int index : neighbourIndex) {
            sum += lrd[index];
        }
        return sum / neighbourIndex.length / ownLrd;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public double[] decisionFunction(double[][] x) {
        KDTree<double[]> index = tree();
        double[] decisions = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            Neighbor<double[], double[]>[] found = sorted(index.search(x[i].clone(), k));
            int[] neighbourIndex = new int[found.length];
            double[] neighbourDistance = new double[found.length];
            for (int j = 0; j < found.length; j++) {
                neighbourIndex[j] = found[j].index;
                neighbourDistance[j] = found[j].distance;
            }
            double ownLrd = localReachabilityDensity(neighbourIndex, neighbourDistance, kDistance);
            decisions[i] = -outlierFactor(neighbourIndex, lrd, ownLrd) - offset;
        }
        return decisions;
    }

    /** Min-max normalisation against the decision range seen on the training data. */
    public double normalizeCalibrated(double decision) {
        return normalize(decision, trainingDecisionMin, trainingDecisionMax);
    }

    /**
     * Map a decision onto [0, 1] against a decision range; lower decisions
     * score higher. A degenerate range scores 0.
     */
    static double normalize(double decision, double min, double max) {
        double range = max - min;
        if (!(range > 0.0)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, (max - decision) / range));
    }

    private KDTree<double[]> tree() {
        KDTree<double[]> current = tree;
        if (current == null) {
            synchronized (this) {
                current = tree;
                if (current == null) {
                    current = new KDTree<>(data, data);
                    tree = current;
                }
            }
        }
        return current;
    }

    public int neighbors() {
        return k;
    }

    public double offset() {
        return offset;
    }

    @Override
    public int featureCount() {
        return data[0].length;
    }
}
