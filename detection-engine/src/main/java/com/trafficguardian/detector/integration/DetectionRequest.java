package com.trafficguardian.detector.integration;

/**
 * Per-call options for file-based detection. {@code null} fields fall back to
 * inference (adapter type) or configuration (threshold, model).
 *
 * @param adapterType  explicit adapter name, {@code null} to infer from the
 *                     file name
 * @param deviceId     device to assign to every record, {@code null} to keep
 *                     the source's
 * @param threshold    score threshold, {@code null} for the configured default
 * @param model        model selection name, {@code null} for the configured
 *                     default
 * @param storeResults persist traffic and detected anomalies
 */
public record DetectionRequest(
        String adapterType,
        Integer deviceId,
        Double threshold,
        String model,
        boolean storeResults) {

    public static DetectionRequest defaults() {
        return new DetectionRequest(null, null, null, null, true);
    }

    public DetectionRequest withAdapterType(String type) {
        return new DetectionRequest(type, deviceId, threshold, model, storeResults);
    }

    public DetectionRequest withDeviceId(Integer device) {
        return new DetectionRequest(adapterType, device, threshold, model, storeResults);
    }

    public DetectionRequest withThreshold(Double value) {
        return new DetectionRequest(adapterType, deviceId, value, model, storeResults);
    }

    public DetectionRequest withModel(String name) {
        return new DetectionRequest(adapterType, deviceId, threshold, name, storeResults);
    }

    public DetectionRequest withStoreResults(boolean store) {
        return new DetectionRequest(adapterType, deviceId, threshold, model, store);
    }
}
