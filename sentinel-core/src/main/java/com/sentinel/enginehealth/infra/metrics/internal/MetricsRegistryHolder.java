package com.sentinel.enginehealth.infra.metrics.internal;

import com.sentinel.enginehealth.infra.metrics.MetricsRegistry;
import com.sentinel.enginehealth.infra.metrics.api.MetricsRegistryProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.ServiceLoader;
import java.util.stream.StreamSupport;

/**
 * Lazy holder for the process-wide MetricsRegistry.
 *
 * <p><b>INTERNAL USE ONLY</b> - API may change without notice.
 */
public final class MetricsRegistryHolder {

    private static final Logger logger = LoggerFactory.getLogger(MetricsRegistryHolder.class);

    public static final MetricsRegistry INSTANCE = select(ServiceLoader.load(MetricsRegistryProvider.class));

    private MetricsRegistryHolder() {
        throw new AssertionError("No instances");
    }

    static MetricsRegistry select(Iterable<MetricsRegistryProvider> providers) {
        MetricsRegistryProvider provider = StreamSupport.stream(providers.spliterator(), false)
                .max(Comparator.comparingInt(MetricsRegistryProvider::priority))
                .orElse(null);

        if (provider == null) {
            logger.info("No metrics provider found, using no-op implementation");
            return new NoOpMetricsRegistry();
        }
        logger.info("Using metrics provider {} (priority {})", provider.name(), provider.priority());
        return provider.create();
    }
}
