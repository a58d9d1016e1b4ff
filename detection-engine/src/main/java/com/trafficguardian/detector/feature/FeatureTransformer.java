package com.trafficguardian.detector.feature;

import com.trafficguardian.detector.error.ConfigurationException;

import java.util.List;

/**
 * Fitted extraction state: frozen category vocabularies, the feature layout
 * they produce and a standard scaler (per-feature mean and scale).
 *
 * <p>
 * Persisted as JSON alongside the models it was fitted with.
 * </p>
 *
 * @author Naveed Gung
 */
public record FeatureTransformer(
        boolean advanced,
        CategoryVocabulary protocols,
        CategoryVocabulary connStates,
        List<String> featureNames,
        double[] mean,
        double[] scale) {

    public FeatureTransformer {
        featureNames = List.copyOf(featureNames);
        if (mean.length != featureNames.size() || scale.length != featureNames.size()) {
            throw new ConfigurationException("Scaler has " + mean.length + " means and " + scale.length
                    + " scales for " + featureNames.size() + " features");
        }
    }

    /**
     * Fit a standard scaler (population mean and deviation) on a raw matrix.
     * Constant features, and features whose deviation is only rounding noise,
     * get scale 1 so they normalize to 0.
     */
    static FeatureTransformer fit(boolean advanced, CategoryVocabulary protocols, CategoryVocabulary connStates,
            FeatureMatrix raw) {
        int columns = raw.columns();
        int rows = raw.rows();
        double[] mean = new double[columns];
        double[] scale = new double[columns];
        for (int j = 0; j < columns; j++) {
            if (rows == 0) {
                scale[j] = 1.0;
                continue;
            }
            double first = raw.values()[0][j];
            boolean constant = true;
            double sum = 0.0;
            for (int i = 0; i < rows; i++) {
                double v = raw.values()[i][j];
                sum += v;
                constant &= v == first;
            }
            if (constant) {
                mean[j] = first;
                scale[j] = 1.0;
                continue;
            }
            double m = sum / rows;
            double squares = 0.0;
            for (int i = 0; i < rows; i++) {
                double d = raw.values()[i][j] - m;
                squares += d * d;
            }
            double std = Math.sqrt(squares / rows);
            mean[j] = m;
            scale[j] = isNegligible(std, m) ? 1.0 : std;
        }
        return new FeatureTransformer(advanced, protocols, connStates, raw.featureNames(), mean, scale);
    }

    static boolean isNegligible(double std, double mean) {
        return !Double.isFinite(std) || std < 10 * Math.ulp(1.0) * Math.max(1.0, Math.abs(mean));
    }

    public int featureCount() {
        return featureNames.size();
    }

    /**
     * Scale a raw matrix with the fitted statistics.
     *
     * @throws ConfigurationException if the matrix layout differs from the
     *                                fitted one
     */
    public FeatureMatrix transform(FeatureMatrix raw) {
        if (!featureNames.equals(raw.featureNames())) {
            throw new ConfigurationException(String.format(
                    "Feature layout mismatch: transformer expects %d features %s, got %d features %s",
                    featureNames.size(), featureNames, raw.columns(), raw.featureNames()));
        }
        double[][] scaled = new double[raw.rows()][];
        for (int i = 0; i < raw.rows(); i++) {
            double[] source = raw.values()[i];
            double[] target = new double[source.length];
            for (int j = 0; j < source.length; j++) {
                target[j] = (source[j] - mean[j]) / scale[j];
            }
            scaled[i] = target;
        }
        return new FeatureMatrix(featureNames, scaled);
    }
}
