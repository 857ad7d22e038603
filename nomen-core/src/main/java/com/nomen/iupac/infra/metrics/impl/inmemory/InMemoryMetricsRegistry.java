package com.nomen.iupac.infra.metrics.impl.inmemory;

import com.nomen.iupac.infra.metrics.Counter;
import com.nomen.iupac.infra.metrics.Gauge;
import com.nomen.iupac.infra.metrics.MetricsRegistry;
import com.nomen.iupac.infra.metrics.Timer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Registry keeping every metric in memory, keyed by name plus tags.
 * Intended for tests and local runs.
 */
public final class InMemoryMetricsRegistry implements MetricsRegistry {

    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, Gauge> gauges = new ConcurrentHashMap<>();
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();

    @Override
    public Counter counter(String name, String... tags) {
        MetricsRegistry.checkName(name, tags);
        return counters.computeIfAbsent(key(name, tags), k -> new InMemoryCounter());
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        MetricsRegistry.checkName(name, tags);
        return gauges.computeIfAbsent(key(name, tags), k -> new InMemoryGauge());
    }

    @Override
    public Timer timer(String name, String... tags) {
        MetricsRegistry.checkName(name, tags);
        return timers.computeIfAbsent(key(name, tags), k -> new InMemoryTimer());
    }

    /**
     * Current count of a counter, 0 if it was never created.
     */
    public long counterValue(String name, String... tags) {
        Counter counter = counters.get(key(name, tags));
        return counter == null ? 0L : counter.count();
    }

    private static String key(String name, String... tags) {
        if (tags.length == 0) {
            return name;
        }
        return name + "{" + String.join(",", tags) + "}";
    }

    private static final class InMemoryCounter implements Counter {
        private final AtomicLong value = new AtomicLong();

        public void increment() {
            value.incrementAndGet();
        }

        public void increment(long amount) {
            if (amount < 0) {
                throw new IllegalArgumentException("Counter increments must be >= 0, was " + amount);
            }
            value.addAndGet(amount);
        }

        public long count() {
            return value.get();
        }
    }

    private static final class InMemoryGauge implements Gauge {
        private volatile double value;

        public void set(double newValue) {
            value = newValue;
        }

        public double value() {
            return value;
        }
    }

    private static final class InMemoryTimer implements Timer {
        private final List<Duration> recordings = new CopyOnWriteArrayList<>();

        public <T> T record(Supplier<T> work) {
            long start = System.nanoTime();
            try {
                return work.get();
            } finally {
                recordings.add(Duration.ofNanos(System.nanoTime() - start));
            }
        }

        public void record(Duration duration) {
            if (duration.isNegative()) {
                throw new IllegalArgumentException("Cannot record negative duration: " + duration);
            }
            recordings.add(duration);
        }

        public long count() {
            return recordings.size();
        }

        public Duration percentile(double percentile) {
            if (recordings.isEmpty()) {
                return Duration.ZERO;
            }
            List<Duration> sorted = new ArrayList<>(recordings);
            Collections.sort(sorted);
            double p = Math.max(0.0, Math.min(1.0, percentile));
            int index = (int) Math.ceil(p * sorted.size()) - 1;
            return sorted.get(Math.max(0, index));
        }
    }
}
