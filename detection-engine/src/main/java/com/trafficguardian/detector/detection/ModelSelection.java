package com.trafficguardian.detector.detection;

import com.trafficguardian.detector.error.UnsupportedTypeException;

import java.util.Locale;

/**
 * Which ensemble member(s) decide anomalies for a scoring call.
 */
public enum ModelSelection {

    ISOLATION_FOREST("isolation_forest"),
    LOF("lof"),
    BOTH("both");

    private final String modelName;

    ModelSelection(String modelName) {
        this.modelName = modelName;
    }

    public String modelName() {
        return modelName;
    }

    public boolean usesIsolationForest() {
        return this != LOF;
    }

    public boolean usesLof() {
        return this != ISOLATION_FOREST;
    }

    public static ModelSelection fromName(String name) {
        String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "isolation_forest", "isolation-forest", "iforest", "a" -> ISOLATION_FOREST;
            case "lof", "local_outlier_factor", "b" -> LOF;
            case "both", "ensemble" -> BOTH;
            default -> throw new UnsupportedTypeException("Unknown model selection: " + name);
        };
    }
}
