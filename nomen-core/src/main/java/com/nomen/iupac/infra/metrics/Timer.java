package com.nomen.iupac.infra.metrics;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Latency recorder. Thread-safe.
 */
public interface Timer {

    /**
     * Runs {@code work} and records its wall-clock duration, also when it throws.
     */
    <T> T record(Supplier<T> work);

    void record(Duration duration);

    long count();

    /**
     * Duration at the given percentile (0.0-1.0); zero when nothing was recorded.
     */
    Duration percentile(double percentile);
}
