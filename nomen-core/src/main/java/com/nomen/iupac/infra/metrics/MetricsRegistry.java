package com.nomen.iupac.infra.metrics;

import com.nomen.iupac.infra.metrics.internal.MetricsRegistryHolder;

import java.util.regex.Pattern;

/**
 * Framework-agnostic metrics registry.
 *
 * <p>Implementations are discovered through {@link java.util.ServiceLoader}
 * (see {@link com.nomen.iupac.infra.metrics.api.MetricsRegistryProvider}); the
 * fallback records nothing.
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * MetricsRegistry metrics = MetricsRegistry.getInstance();
 * metrics.counter("nomen_fallback_names_total").increment();
 * }</pre>
 */
public interface MetricsRegistry {

    Pattern VALID_NAME = Pattern.compile("[a-z][a-z0-9_]*");

    /**
     * Creates or retrieves a counter.
     *
     * @param name metric name (lowercase, digits and underscores)
     * @param tags alternating key/value labels
     */
    Counter counter(String name, String... tags);

    Gauge gauge(String name, String... tags);

    Timer timer(String name, String... tags);

    /**
     * Returns the process-wide registry.
     */
    static MetricsRegistry getInstance() {
        return MetricsRegistryHolder.INSTANCE;
    }

    /**
     * @throws IllegalArgumentException for names outside {@link #VALID_NAME} or odd tag counts
     */
    static void checkName(String name, String... tags) {
        if (name == null || !VALID_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid metric name: " + name);
        }
        if (tags.length % 2 != 0) {
            throw new IllegalArgumentException("Tags must be key/value pairs, got " + tags.length + " values");
        }
    }
}
