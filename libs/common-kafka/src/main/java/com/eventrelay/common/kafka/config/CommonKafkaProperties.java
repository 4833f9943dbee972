package com.eventrelay.common.kafka.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "common.kafka")
public class CommonKafkaProperties {

    private final Consumer consumer = new Consumer();
    private final Retry retry = new Retry();
    private final Dlt dlt = new Dlt();
    private final Publish publish = new Publish();
    private final Logging logging = new Logging();

    public Consumer getConsumer() {
        return consumer;
    }

    public Retry getRetry() {
        return retry;
    }

    public Dlt getDlt() {
        return dlt;
    }

    public Publish getPublish() {
        return publish;
    }

    public Logging getLogging() {
        return logging;
    }

    public static class Consumer {
        private long pollTimeoutMs = 1500L;
        private Integer maxPollRecords;
        private boolean missingTopicsFatal = false;
        /** How long stop() waits for the in-flight record before the container gives up. */
        private long shutdownTimeoutMs = 30_000L;

        public long getPollTimeoutMs() {
            return pollTimeoutMs;
        }

        public void setPollTimeoutMs(long pollTimeoutMs) {
            this.pollTimeoutMs = pollTimeoutMs;
        }

        public Integer getMaxPollRecords() {
            return maxPollRecords;
        }

        public void setMaxPollRecords(Integer maxPollRecords) {
            this.maxPollRecords = maxPollRecords;
        }

        public boolean isMissingTopicsFatal() {
            return missingTopicsFatal;
        }

        public void setMissingTopicsFatal(boolean missingTopicsFatal) {
            this.missingTopicsFatal = missingTopicsFatal;
        }

        public long getShutdownTimeoutMs() {
            return shutdownTimeoutMs;
        }

        public void setShutdownTimeoutMs(long shutdownTimeoutMs) {
            this.shutdownTimeoutMs = shutdownTimeoutMs;
        }
    }

    /**
     * Transport-level redelivery used by containers whose listener rethrows failures.
     */
    public static class Retry {
        private long initialBackoffMs = 200L;
        private double multiplier = 2.0;
        private long maxBackoffMs = 30_000L;
        private int maxAttempts = 6;

        public long getInitialBackoffMs() {
            return initialBackoffMs;
        }

        public void setInitialBackoffMs(long initialBackoffMs) {
            this.initialBackoffMs = initialBackoffMs;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public long getMaxBackoffMs() {
            return maxBackoffMs;
        }

        public void setMaxBackoffMs(long maxBackoffMs) {
            this.maxBackoffMs = maxBackoffMs;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }
    }

    public static class Dlt {
        private boolean enabled = true;
        private String suffix = ".DLT";
        private boolean samePartition = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getSuffix() {
            return suffix;
        }

        public void setSuffix(String suffix) {
            this.suffix = suffix;
        }

        public boolean isSamePartition() {
            return samePartition;
        }

        public void setSamePartition(boolean samePartition) {
            this.samePartition = samePartition;
        }
    }

    public static class Publish {
        private long timeoutMs = 10_000L;

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    public static class Logging {
        private boolean mdcEnabled = true;

        public boolean isMdcEnabled() {
            return mdcEnabled;
        }

        public void setMdcEnabled(boolean mdcEnabled) {
            this.mdcEnabled = mdcEnabled;
        }
    }
}
