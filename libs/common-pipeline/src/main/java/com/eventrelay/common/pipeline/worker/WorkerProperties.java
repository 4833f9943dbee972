package com.eventrelay.common.pipeline.worker;

import com.eventrelay.contracts.Topics;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "pipeline.worker")
public class WorkerProperties {

    private boolean enabled = false;
    @NotBlank
    private String inboundTopic = Topics.WEBHOOKS_INBOUND;
    @NotBlank
    private String processedTopic = Topics.WEBHOOKS_PROCESSED;
    @NotBlank
    private String deadLetterTopic = Topics.WEBHOOKS_DLQ;
    @NotBlank
    private String groupId = "webhook-workers";
    @Min(0)
    private int maxRetries = 3;
    @Min(0)
    private long retryDelayMs = 1000L;
    @Min(1)
    private int metricsLogInterval = 100;
    @Min(1)
    private int concurrency = 1;
    @NotNull
    private Duration redeliveryBackoff = Duration.ofSeconds(1);

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getInboundTopic() {
        return inboundTopic;
    }

    public void setInboundTopic(String inboundTopic) {
        this.inboundTopic = inboundTopic;
    }

    public String getProcessedTopic() {
        return processedTopic;
    }

    public void setProcessedTopic(String processedTopic) {
        this.processedTopic = processedTopic;
    }

    public String getDeadLetterTopic() {
        return deadLetterTopic;
    }

    public void setDeadLetterTopic(String deadLetterTopic) {
        this.deadLetterTopic = deadLetterTopic;
    }

    public String getGroupId() {
        return groupId;
    }

    public void setGroupId(String groupId) {
        this.groupId = groupId;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public long getRetryDelayMs() {
        return retryDelayMs;
    }

    public void setRetryDelayMs(long retryDelayMs) {
        this.retryDelayMs = retryDelayMs;
    }

    public int getMetricsLogInterval() {
        return metricsLogInterval;
    }

    public void setMetricsLogInterval(int metricsLogInterval) {
        this.metricsLogInterval = metricsLogInterval;
    }

    public int getConcurrency() {
        return concurrency;
    }

    public void setConcurrency(int concurrency) {
        this.concurrency = concurrency;
    }

    public Duration getRedeliveryBackoff() {
        return redeliveryBackoff;
    }

    public void setRedeliveryBackoff(Duration redeliveryBackoff) {
        this.redeliveryBackoff = redeliveryBackoff;
    }
}
