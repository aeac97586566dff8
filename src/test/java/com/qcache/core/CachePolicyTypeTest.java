package com.qcache.core;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CachePolicyTypeTest
{
    @Nested
    class TypeResolution
    {
        // Bu test yapılandırma değeri boş olduğunda 2Q politikasının seçildiğini doğrular.
        @Test
        void from_config_returns_two_queue_for_blank_value()
        {
            assertEquals(CachePolicyType.TWO_QUEUE, CachePolicyType.fromConfig(null));
            assertEquals(CachePolicyType.TWO_QUEUE, CachePolicyType.fromConfig(" "));
        }

        // Bu test farklı yazımlarla verilen politika adlarının doğru çözümlendiğini gösterir.
        @Test
        void from_config_normalizes_names()
        {
            assertEquals(CachePolicyType.TWO_QUEUE, CachePolicyType.fromConfig("two-queue"));
            assertEquals(CachePolicyType.TWO_QUEUE, CachePolicyType.fromConfig("2q"));
            assertEquals(CachePolicyType.LRU, CachePolicyType.fromConfig(" lru "));
        }

        // Bu test bilinmeyen politika değerinde istisna fırlatıldığını doğrular.
        @Test
        void from_config_throws_for_unknown_value()
        {
            var ex = assertThrows(IllegalArgumentException.class, () -> CachePolicyType.fromConfig("arc"));
            assertEquals("Unknown cache policy: arc", ex.getMessage());
        }
    }

    @Nested
    class Creation
    {
        // Bu test her politikanın beklenen önbellek tipini ve dinleyiciyi kurduğunu doğrular.
        @Test
        void create_builds_matching_cache()
        {
            AtomicInteger evictions = new AtomicInteger();
            Cache<String, String> lru = CachePolicyType.LRU.create(1, 0.25, 0.5, (k, v) -> evictions.incrementAndGet());
            assertInstanceOf(SynchronizedLruCache.class, lru);
            lru.add("a", "1");
            lru.add("b", "2");
            assertEquals(1, evictions.get());

            Cache<String, String> twoQueue = CachePolicyType.TWO_QUEUE.create(8, 0.5, 0.25, (k, v) -> evictions.incrementAndGet());
            TwoQueueCache<String, String> typed = assertInstanceOf(TwoQueueCache.class, twoQueue);
            assertEquals(4, typed.recentSize());
            assertEquals(2, typed.ghostSize());
        }

        // Bu test geçersiz oranların fabrika üzerinden de reddedildiğini gösterir.
        @Test
        void create_propagates_validation_errors()
        {
            assertThrows(IllegalArgumentException.class, () -> CachePolicyType.TWO_QUEUE.create(8, 2.0, 0.5, null));
            assertThrows(IllegalArgumentException.class, () -> CachePolicyType.LRU.create(0, 0.25, 0.5, null));
        }
    }
}
