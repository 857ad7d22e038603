package com.nomen.iupac.infra.metrics.internal;

import com.nomen.iupac.infra.metrics.MetricsRegistry;
import com.nomen.iupac.infra.metrics.api.MetricsRegistryProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.ServiceLoader;
import java.util.stream.StreamSupport;

/**
 * Lazy holder for the process-wide {@link MetricsRegistry}.
 *
 * <p><b>INTERNAL USE ONLY</b> - API may change without notice.
 */
public final class MetricsRegistryHolder {

    private static final Logger logger = LoggerFactory.getLogger(MetricsRegistryHolder.class);

    public static final MetricsRegistry INSTANCE = discover();

    private MetricsRegistryHolder() {
        throw new AssertionError("No instances");
    }

    private static MetricsRegistry discover() {
        ServiceLoader<MetricsRegistryProvider> loader = ServiceLoader.load(MetricsRegistryProvider.class);
        MetricsRegistryProvider provider = StreamSupport.stream(loader.spliterator(), false)
                .max(Comparator.comparingInt(MetricsRegistryProvider::priority))
                .orElse(null);
        if (provider == null) {
            logger.info("No metrics provider found, using no-op registry");
            return new NoOpMetricsRegistry();
        }
        logger.info("Using metrics provider {} (priority {})", provider.name(), provider.priority());
        return provider.create();
    }
}
