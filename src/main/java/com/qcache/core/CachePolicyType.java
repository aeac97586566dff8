package com.qcache.core;

import java.util.Locale;

/**
 * Yapılandırmadan seçilebilen tahliye disiplinleri.
 */
public enum CachePolicyType
{
    LRU {
        @Override
        public <K, V> Cache<K, V> create(int size, double recentRatio, double ghostRatio,
                                         EvictionListener<K, V> onEvict)
        {
            return new SynchronizedLruCache<>(size, onEvict);
        }
    },
    TWO_QUEUE {
        @Override
        public <K, V> Cache<K, V> create(int size, double recentRatio, double ghostRatio,
                                         EvictionListener<K, V> onEvict)
        {
            return TwoQueueCache.<K, V>builder(size)
                    .recentRatio(recentRatio)
                    .ghostRatio(ghostRatio)
                    .onEvict(onEvict)
                    .build();
        }
    };

    /** Oran parametreleri yalnızca {@link #TWO_QUEUE} için anlamlıdır. */
    public abstract <K, V> Cache<K, V> create(int size, double recentRatio, double ghostRatio,
                                              EvictionListener<K, V> onEvict);

    public static CachePolicyType fromConfig(String value)
    {
        if (value == null || value.isBlank()) return TWO_QUEUE;
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        if ("2Q".equals(normalized)) return TWO_QUEUE;
        try {
            return CachePolicyType.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown cache policy: " + value, ex);
        }
    }
}
