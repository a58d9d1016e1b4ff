package com.trafficguardian.detector.config;

import com.trafficguardian.detector.detection.ScoreNormalization;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the ensemble anomaly detector.
 *
 * <p>
 * {@code defaultThreshold} and {@code defaultModel} only apply when a caller
 * does not pass its own; a {@code null} default threshold switches callers to
 * the models' native outlier decisions.
 * </p>
 *
 * @author Naveed Gung
 */
@Configuration
@ConfigurationProperties(prefix = "guardian.detection")
@Validated
public class DetectionConfig {

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double defaultThreshold = 0.7;

    @NotBlank
    private String defaultModel = "both";

    @DecimalMin("0.001")
    @DecimalMax("0.5")
    private double contamination = 0.1;

    @Min(1)
    private int minTrainingSamples = 100;

    private boolean advancedFeatures = true;

    @NotNull
    private ScoreNormalization lofNormalization = ScoreNormalization.CALIBRATED;

    private IsolationForest isolationForest = new IsolationForest();
    private Lof lof = new Lof();

    public Double getDefaultThreshold() {
        return defaultThreshold;
    }

    public void setDefaultThreshold(Double defaultThreshold) {
        this.defaultThreshold = defaultThreshold;
    }

    public String getDefaultModel() {
        return defaultModel;
    }

    public void setDefaultModel(String defaultModel) {
        this.defaultModel = defaultModel;
    }

    public double getContamination() {
        return contamination;
    }

    public void setContamination(double contamination) {
        this.contamination = contamination;
    }

    public int getMinTrainingSamples() {
        return minTrainingSamples;
    }

    public void setMinTrainingSamples(int minTrainingSamples) {
        this.minTrainingSamples = minTrainingSamples;
    }

    public boolean isAdvancedFeatures() {
        return advancedFeatures;
    }

    public void setAdvancedFeatures(boolean advancedFeatures) {
        this.advancedFeatures = advancedFeatures;
    }

    public ScoreNormalization getLofNormalization() {
        return lofNormalization;
    }

    public void setLofNormalization(ScoreNormalization lofNormalization) {
        this.lofNormalization = lofNormalization;
    }

    public IsolationForest getIsolationForest() {
        return isolationForest;
    }

    public void setIsolationForest(IsolationForest isolationForest) {
        this.isolationForest = isolationForest;
    }

    public Lof getLof() {
        return lof;
    }

    public void setLof(Lof lof) {
        this.lof = lof;
    }

    public static class IsolationForest {
        @Min(1)
        private int trees = 100;
        @DecimalMin("0.01")
        @DecimalMax("1.0")
        private double subsample = 0.7;
        private long seed = 42L;

        public int getTrees() {
            return trees;
        }

        public void setTrees(int trees) {
            this.trees = trees;
        }

        public double getSubsample() {
            return subsample;
        }

        public void setSubsample(double subsample) {
            this.subsample = subsample;
        }

        public long getSeed() {
            return seed;
        }

        public void setSeed(long seed) {
            this.seed = seed;
        }
    }

    public static class Lof {
        @Min(1)
        private int neighbors = 20;

        public int getNeighbors() {
            return neighbors;
        }

        public void setNeighbors(int neighbors) {
            this.neighbors = neighbors;
        }
    }
}
