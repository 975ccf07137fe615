package com.hcltech.bgjobs.common.metrics;

/**
 * Minimal façade for emitting numeric metrics.
 * <p>Counters and histograms share the same low-cardinality naming space.</p>
 * Implementations must be thread-safe: job threads report concurrently.
 */
public interface Metrics {

    /** Increment a named counter by 1. */
    void increment(String name);

    /** Record a value (typically a duration in nanos) in a histogram. */
    void histogram(String name, long value);

    Metrics nullMetrics = new NullMetrics();
}

final class NullMetrics implements Metrics {

    @Override
    public void increment(String name) {
    }

    @Override
    public void histogram(String name, long value) {
    }
}
