package com.nomen.iupac.infra.metrics.internal;

import com.nomen.iupac.infra.metrics.Counter;
import com.nomen.iupac.infra.metrics.Gauge;
import com.nomen.iupac.infra.metrics.MetricsRegistry;
import com.nomen.iupac.infra.metrics.Timer;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Registry that records nothing. Used when no provider is on the classpath.
 */
final class NoOpMetricsRegistry implements MetricsRegistry {

    private static final Counter COUNTER = new Counter() {
        public void increment() {}
        public void increment(long amount) {}
        public long count() { return 0L; }
    };

    private static final Gauge GAUGE = new Gauge() {
        public void set(double value) {}
        public double value() { return 0.0; }
    };

    private static final Timer TIMER = new Timer() {
        public <T> T record(Supplier<T> work) { return work.get(); }
        public void record(Duration duration) {}
        public long count() { return 0L; }
        public Duration percentile(double percentile) { return Duration.ZERO; }
    };

    @Override
    public Counter counter(String name, String... tags) {
        return COUNTER;
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        return GAUGE;
    }

    @Override
    public Timer timer(String name, String... tags) {
        return TIMER;
    }
}
