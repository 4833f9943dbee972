package com.eventrelay.common.pipeline.worker;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.util.concurrent.atomic.AtomicLong;

public class WorkerMetrics implements MeterBinder {

    private final String topic;
    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong retried = new AtomicLong();
    private final AtomicLong deadLettered = new AtomicLong();
    private final AtomicLong duplicates = new AtomicLong();
    private final AtomicLong conflicts = new AtomicLong();

    public WorkerMetrics(String topic) {
        this.topic = topic;
    }

    public synchronized long recordProcessed() {
        processed.incrementAndGet();
        return processed.get() + failed.get();
    }

    public synchronized long recordDeadLettered() {
        deadLettered.incrementAndGet();
        failed.incrementAndGet();
        return processed.get() + failed.get();
    }

    public void recordRetried() {
        retried.incrementAndGet();
    }

    public void recordDuplicate() {
        duplicates.incrementAndGet();
    }

    public void recordConflict() {
        conflicts.incrementAndGet();
    }

    public synchronized MetricsSnapshot snapshot() {
        return new MetricsSnapshot(processed.get(), failed.get(), retried.get(), deadLettered.get(),
                duplicates.get(), conflicts.get());
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Tags tags = Tags.of("topic", topic);
        counter(registry, "pipeline.worker.processed", processed, tags);
        counter(registry, "pipeline.worker.failed", failed, tags);
        counter(registry, "pipeline.worker.retried", retried, tags);
        counter(registry, "pipeline.worker.dead_lettered", deadLettered, tags);
        counter(registry, "pipeline.worker.duplicates", duplicates, tags);
        counter(registry, "pipeline.worker.conflicts", conflicts, tags);
        Gauge.builder("pipeline.worker.success_rate", this, m -> m.snapshot().successRate())
                .tags(tags)
                .register(registry);
    }

    private static void counter(MeterRegistry registry, String name, AtomicLong value, Tags tags) {
        FunctionCounter.builder(name, value, AtomicLong::doubleValue).tags(tags).register(registry);
    }
}
