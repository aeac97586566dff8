package com.qcache.config;

import com.qcache.core.Cache;
import com.qcache.core.CachePolicyType;
import com.qcache.metric.Counter;
import com.qcache.metric.MetricsRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

/**
 * CDI tarafından yönetilen bu yapılandırma sınıfı, {@link AppProperties}
 * üzerinden okunan değerlerle metrik kayıt defterini ve uygulamanın
 * paylaştığı önbellek bean'ini üretir.
 */
@ApplicationScoped
public class AppConfig {

    private static final Logger LOG = Logger.getLogger(AppConfig.class);

    private final AppProperties properties;

    @Inject
    public AppConfig(AppProperties properties) {
        this.properties = properties;
    }

    @Produces
    @Singleton
    public MetricsRegistry metricsRegistry() {
        MetricsRegistry metrics = new MetricsRegistry();
        metrics.counter(MetricsRegistry.HITS);
        metrics.counter(MetricsRegistry.MISSES);
        metrics.counter(MetricsRegistry.REMOVALS);
        return metrics;
    }

    @Produces
    @Singleton
    public Cache<String, String> cache(MetricsRegistry metrics) {
        var cacheProps = properties.cache();
        CachePolicyType policy = CachePolicyType.fromConfig(cacheProps.policy());
        // Kapasite tahliyeleri ile açık remove/purge silmelerinin toplamı.
        Counter removals = metrics.counter(MetricsRegistry.REMOVALS);
        Cache<String, String> cache = policy.create(
                cacheProps.size(),
                cacheProps.recentRatio(),
                cacheProps.ghostRatio(),
                (key, value) -> removals.inc());
        LOG.infof("Cache initialised with policy %s and size %d", policy, cacheProps.size());
        return cache;
    }
}
