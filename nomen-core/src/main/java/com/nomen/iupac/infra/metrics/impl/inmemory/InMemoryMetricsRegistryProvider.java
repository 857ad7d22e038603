package com.nomen.iupac.infra.metrics.impl.inmemory;

import com.nomen.iupac.infra.metrics.MetricsRegistry;
import com.nomen.iupac.infra.metrics.api.MetricsRegistryProvider;

/**
 * In-memory metrics provider.
 *
 * <p>To enable in tests, create
 * {@code src/test/resources/META-INF/services/com.nomen.iupac.infra.metrics.api.MetricsRegistryProvider}
 * containing this class name.
 */
public final class InMemoryMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public MetricsRegistry create() {
        return new InMemoryMetricsRegistry();
    }

    @Override
    public int priority() {
        return 1000;
    }

    @Override
    public String name() {
        return "InMemory";
    }
}
