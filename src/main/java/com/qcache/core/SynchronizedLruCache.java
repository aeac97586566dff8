package com.qcache.core;

import com.qcache.core.model.CacheEntry;
import com.qcache.core.model.ContainsOrAddResult;
import com.qcache.core.model.PeekOrAddResult;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link LruCache} örneğini tek bir {@link ReentrantLock} arkasına alan
 * thread-safe LRU önbelleğidir. Tahliye dinleyicisi kilit tutulurken çağrılır.
 */
public final class SynchronizedLruCache<K, V> implements Cache<K, V>
{
    private static final Logger LOG = Logger.getLogger(SynchronizedLruCache.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final LruCache<K, V> lru;

    public SynchronizedLruCache(int size)
    {
        this(size, null);
    }

    public SynchronizedLruCache(int size, EvictionListener<K, V> onEvict)
    {
        this.lru = new LruCache<>(size, onEvict);
        LOG.debugf("LRU cache created with size %d", size);
    }

    @Override
    public boolean add(K key, V value) {
        lock.lock();
        try { return lru.add(key, value); }
        finally { lock.unlock(); }
    }

    @Override
    public Optional<V> get(K key) {
        lock.lock();
        try { return lru.get(key); }
        finally { lock.unlock(); }
    }

    @Override
    public Optional<V> peek(K key) {
        lock.lock();
        try { return lru.peek(key); }
        finally { lock.unlock(); }
    }

    @Override
    public boolean contains(K key) {
        lock.lock();
        try { return lru.contains(key); }
        finally { lock.unlock(); }
    }

    /**
     * Anahtar yoksa ekler; varsa sıralamaya dokunmadan mevcut durumu bildirir.
     */
    public ContainsOrAddResult containsOrAdd(K key, V value) {
        lock.lock();
        try {
            if (lru.contains(key)) {
                return new ContainsOrAddResult(true, false);
            }
            return new ContainsOrAddResult(false, lru.add(key, value));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Anahtar varsa sıralamayı değiştirmeden önceki değeri döndürür, yoksa yeni değeri ekler.
     */
    public PeekOrAddResult<V> peekOrAdd(K key, V value) {
        lock.lock();
        try {
            Optional<V> previous = lru.peek(key);
            if (previous.isPresent()) {
                return new PeekOrAddResult<>(previous, false);
            }
            return new PeekOrAddResult<>(Optional.empty(), lru.add(key, value));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean remove(K key) {
        lock.lock();
        try { return lru.remove(key); }
        finally { lock.unlock(); }
    }

    public Optional<CacheEntry<K, V>> removeOldest() {
        lock.lock();
        try { return lru.removeOldest(); }
        finally { lock.unlock(); }
    }

    public Optional<CacheEntry<K, V>> getOldest() {
        lock.lock();
        try { return lru.getOldest(); }
        finally { lock.unlock(); }
    }

    public int resize(int size) {
        lock.lock();
        try {
            int evicted = lru.resize(size);
            LOG.debugf("LRU cache resized to %d, %d entries evicted", size, evicted);
            return evicted;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<K> keys() {
        lock.lock();
        try { return lru.keys(); }
        finally { lock.unlock(); }
    }

    @Override
    public int len() {
        lock.lock();
        try { return lru.len(); }
        finally { lock.unlock(); }
    }

    @Override
    public void purge() {
        lock.lock();
        try { lru.purge(); }
        finally { lock.unlock(); }
    }
}
