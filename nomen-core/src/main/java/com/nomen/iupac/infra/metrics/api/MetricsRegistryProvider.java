package com.nomen.iupac.infra.metrics.api;

import com.nomen.iupac.infra.metrics.MetricsRegistry;

/**
 * Service Provider Interface for {@link MetricsRegistry} implementations.
 *
 * <p>Implementations need a public no-arg constructor and are registered in
 * {@code META-INF/services/com.nomen.iupac.infra.metrics.api.MetricsRegistryProvider}.
 * When several are present the highest {@link #priority()} wins.
 */
public interface MetricsRegistryProvider {

    MetricsRegistry create();

    default int priority() {
        return 0;
    }

    default String name() {
        return getClass().getSimpleName();
    }
}
