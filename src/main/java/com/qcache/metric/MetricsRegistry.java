package com.qcache.metric;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Önbellek sayaçlarını isimle tutan merkezi kayıt yapısı. Sayaçlar ilk
 * istendikleri anda oluşturulur ve tüm bileşenler arasında paylaşılır.
 */
public final class MetricsRegistry {
    public static final String HITS = "cache_hits";
    public static final String MISSES = "cache_misses";
    public static final String REMOVALS = "cache_removals";

    private final Map<String, Counter> counters = new ConcurrentHashMap<>();

    public Counter counter(String name) { return counters.computeIfAbsent(name, Counter::new); }

    /** İsme göre sıralı anlık sayaç değerleri. */
    public Map<String, Long> snapshot() {
        Map<String, Long> values = new TreeMap<>();
        counters.forEach((name, counter) -> values.put(name, counter.get()));
        return values;
    }
}
