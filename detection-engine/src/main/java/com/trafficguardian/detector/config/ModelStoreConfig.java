package com.trafficguardian.detector.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Location of the persisted model set.
 *
 * @author Naveed Gung
 */
@Configuration
@ConfigurationProperties(prefix = "guardian.models")
@Validated
public class ModelStoreConfig {

    @NotBlank
    private String path = "models";

    /** Number of model-set versions kept on disk, including the current one. */
    @Min(1)
    private int retainedVersions = 3;

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public int getRetainedVersions() {
        return retainedVersions;
    }

    public void setRetainedVersions(int retainedVersions) {
        this.retainedVersions = retainedVersions;
    }
}
