package com.trafficguardian.detector.feature;

import java.util.List;

/**
 * Numeric feature matrix, one row per traffic record, columns named by
 * {@code featureNames}.
 */
public record FeatureMatrix(List<String> featureNames, double[][] values) {

    public FeatureMatrix {
        featureNames = List.copyOf(featureNames);
    }

    public int rows() {
        return values.length;
    }

    public int columns() {
        return featureNames.size();
    }

    public double[] row(int index) {
        return values[index];
    }

    public int columnIndex(String featureName) {
        return featureNames.indexOf(featureName);
    }

    /** Single value by feature name. */
    public double get(int row, String featureName) {
        int column = columnIndex(featureName);
        if (column < 0) {
            throw new IllegalArgumentException("No feature named " + featureName);
        }
        return values[row][column];
    }
}
