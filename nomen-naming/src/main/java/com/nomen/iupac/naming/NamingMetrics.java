package com.nomen.iupac.naming;

import com.nomen.iupac.infra.metrics.Counter;
import com.nomen.iupac.infra.metrics.MetricsRegistry;
import com.nomen.iupac.infra.metrics.Timer;

import java.util.function.Supplier;

/**
 * Metrics recorded by the naming facade.
 */
final class NamingMetrics {

    static final String NAMES_TOTAL = "nomen_names_total";
    static final String FALLBACK_NAMES_TOTAL = "nomen_fallback_names_total";
    static final String CONFLICTS_TOTAL = "nomen_conflicts_total";
    static final String NAMING_DURATION = "nomen_naming_duration";

    private final Counter names;
    private final Counter fallbacks;
    private final Counter conflicts;
    private final Timer duration;

    NamingMetrics(MetricsRegistry registry) {
        this.names = registry.counter(NAMES_TOTAL);
        this.fallbacks = registry.counter(FALLBACK_NAMES_TOTAL);
        this.conflicts = registry.counter(CONFLICTS_TOTAL);
        this.duration = registry.timer(NAMING_DURATION);
    }

    <T> T time(Supplier<T> work) {
        return duration.record(work);
    }

    void recordName() {
        names.increment();
    }

    void recordFallback() {
        fallbacks.increment();
    }

    void recordConflicts(int count) {
        if (count > 0) {
            conflicts.increment(count);
        }
    }
}
