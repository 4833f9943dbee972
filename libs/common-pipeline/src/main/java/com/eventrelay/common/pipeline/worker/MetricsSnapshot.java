package com.eventrelay.common.pipeline.worker;

public record MetricsSnapshot(
        long processed,
        long failed,
        long retried,
        long deadLettered,
        long duplicates,
        long conflicts
) {
    public double successRate() {
        long total = processed + failed;
        return total == 0 ? 1.0 : (double) processed / total;
    }
}
