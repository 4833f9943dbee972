package com.eventrelay.common.retry.autoconfigure;

import com.eventrelay.common.retry.RetryOptions;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "common.retry")
public class RetryProperties {

    @Min(1)
    private int attempts = 3;
    @Min(0)
    private long backoffMs = RetryOptions.DEFAULT_BACKOFF_MS;
    @DecimalMin("1.0")
    private double backoffMultiplier = RetryOptions.DEFAULT_MULTIPLIER;
    @Min(0)
    private long jitterMs = RetryOptions.DEFAULT_JITTER_MS;
    @Min(0)
    private long maxBackoffMs = RetryOptions.DEFAULT_MAX_BACKOFF_MS;

    public RetryOptions toOptions() {
        return new RetryOptions(attempts, backoffMs, backoffMultiplier, jitterMs, maxBackoffMs);
    }

    public int getAttempts() {
        return attempts;
    }

    public void setAttempts(int attempts) {
        this.attempts = attempts;
    }

    public long getBackoffMs() {
        return backoffMs;
    }

    public void setBackoffMs(long backoffMs) {
        this.backoffMs = backoffMs;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public void setBackoffMultiplier(double backoffMultiplier) {
        this.backoffMultiplier = backoffMultiplier;
    }

    public long getJitterMs() {
        return jitterMs;
    }

    public void setJitterMs(long jitterMs) {
        this.jitterMs = jitterMs;
    }

    public long getMaxBackoffMs() {
        return maxBackoffMs;
    }

    public void setMaxBackoffMs(long maxBackoffMs) {
        this.maxBackoffMs = maxBackoffMs;
    }
}
