package com.trafficguardian.detector.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Feedback-driven retraining policy.
 *
 * <p>
 * Retraining runs only when both the interval since the last retrain has
 * elapsed and enough new feedback has accumulated. Feedback older than
 * {@code maxFeedbackAgeDays} is ignored when selecting training records.
 * </p>
 *
 * @author Naveed Gung
 */
@Configuration
@ConfigurationProperties(prefix = "guardian.feedback")
@Validated
public class FeedbackConfig {

    @Min(0)
    private int retrainIntervalDays = 7;

    @Min(1)
    private int minFeedbackCount = 10;

    @Min(1)
    private int maxFeedbackAgeDays = 90;

    @NotBlank
    private String historyPath = "models/feedback/feedback_history.jsonl";

    @Min(1000)
    private long checkIntervalMs = 3_600_000L;

    public int getRetrainIntervalDays() {
        return retrainIntervalDays;
    }

    public void setRetrainIntervalDays(int retrainIntervalDays) {
        this.retrainIntervalDays = retrainIntervalDays;
    }

    public int getMinFeedbackCount() {
        return minFeedbackCount;
    }

    public void setMinFeedbackCount(int minFeedbackCount) {
        this.minFeedbackCount = minFeedbackCount;
    }

    public int getMaxFeedbackAgeDays() {
        return maxFeedbackAgeDays;
    }

    public void setMaxFeedbackAgeDays(int maxFeedbackAgeDays) {
        this.maxFeedbackAgeDays = maxFeedbackAgeDays;
    }

    public String getHistoryPath() {
        return historyPath;
    }

    public void setHistoryPath(String historyPath) {
        this.historyPath = historyPath;
    }

    public long getCheckIntervalMs() {
        return checkIntervalMs;
    }

    public void setCheckIntervalMs(long checkIntervalMs) {
        this.checkIntervalMs = checkIntervalMs;
    }
}
