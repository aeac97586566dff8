package com.qcache.core;

import com.qcache.core.model.CacheEntry;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Sabit kapasiteli, thread-safe olmayan LRU önbelleğidir. Girdiler ekleme
 * sırasını koruyan bir {@link LinkedHashMap} içinde tutulur; en eski girdi
 * haritanın başında, en son dokunulan girdi sonundadır. Bir anahtarı en yeni
 * konuma taşımak haritadan çıkarıp yeniden eklemekle yapılır, böylece ekleme,
 * arama, öne alma ve en eskiyi çıkarma işlemleri O(1) kalır.
 *
 * <p>Yapı tek bir sahip tarafından kullanılmak üzere tasarlanmıştır; eşzamanlı
 * erişim için {@link SynchronizedLruCache} ya da {@link TwoQueueCache}
 * kullanılmalıdır.</p>
 */
public final class LruCache<K, V>
{
    private final LinkedHashMap<K, V> items = new LinkedHashMap<>();
    private final EvictionListener<K, V> onEvict; // nullable
    private int capacity;

    public LruCache(int capacity)
    {
        this(capacity, null);
    }

    public LruCache(int capacity, EvictionListener<K, V> onEvict)
    {
        if (capacity <= 0) {
            throw new IllegalArgumentException("must provide a positive size");
        }
        this.capacity = capacity;
        this.onEvict = onEvict;
    }

    /**
     * Değeri ekler ya da günceller ve anahtarı en yeni konuma taşır.
     *
     * @return ekleme kapasiteyi aştığı için en eski girdi çıkarıldıysa {@code true}
     */
    public boolean add(K key, V value)
    {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        items.remove(key);
        items.put(key, value);
        if (items.size() > capacity) {
            removeOldestInternal();
            return true;
        }
        return false;
    }

    /** Anahtarı arar; bulunursa en yeni konuma taşır. */
    public Optional<V> get(K key)
    {
        V value = items.remove(key);
        if (value == null) {
            return Optional.empty();
        }
        items.put(key, value);
        return Optional.of(value);
    }

    /** Sıralamayı değiştirmeden değeri döndürür. */
    public Optional<V> peek(K key)
    {
        return Optional.ofNullable(items.get(key));
    }

    public boolean contains(K key)
    {
        return items.containsKey(key);
    }

    /** Anahtar varsa girdiyi siler ve dinleyiciyi bilgilendirir. */
    public boolean remove(K key)
    {
        V removed = items.remove(key);
        if (removed == null) {
            return false;
        }
        notifyEvict(key, removed);
        return true;
    }

    /**
     * Girdiyi dinleyiciyi çağırmadan çıkarır. Girdi yapıdan ayrılmayıp başka
     * bir havuza taşındığında kullanılır.
     */
    Optional<V> detach(K key)
    {
        return Optional.ofNullable(items.remove(key));
    }

    public Optional<CacheEntry<K, V>> removeOldest()
    {
        return Optional.ofNullable(removeOldestInternal());
    }

    public Optional<CacheEntry<K, V>> getOldest()
    {
        Iterator<Map.Entry<K, V>> it = items.entrySet().iterator();
        if (!it.hasNext()) {
            return Optional.empty();
        }
        Map.Entry<K, V> eldest = it.next();
        return Optional.of(new CacheEntry<>(eldest.getKey(), eldest.getValue()));
    }

    /** Anahtarların en eskiden en yeniye anlık kopyası. */
    public List<K> keys()
    {
        return new ArrayList<>(items.keySet());
    }

    public int len()
    {
        return items.size();
    }

    public int capacity()
    {
        return capacity;
    }

    /**
     * Kapasiteyi değiştirir. Yeni kapasite mevcut girdi sayısından küçükse
     * sığana kadar en eski girdiler çıkarılır.
     *
     * @return çıkarılan girdi sayısı
     */
    public int resize(int newCapacity)
    {
        if (newCapacity <= 0) {
            throw new IllegalArgumentException("must provide a positive size");
        }
        int diff = Math.max(0, items.size() - newCapacity);
        for (int i = 0; i < diff; i++) {
            removeOldestInternal();
        }
        this.capacity = newCapacity;
        return diff;
    }

    /**
     * Tüm girdileri en eskiden başlayarak siler; dinleyici her girdi silindikten
     * hemen sonra bir kez çağrılır. Dinleyici istisna fırlatırsa henüz
     * bildirilmemiş girdiler önbellekte kalır.
     */
    public void purge()
    {
        while (!items.isEmpty()) {
            removeOldestInternal();
        }
    }

    private CacheEntry<K, V> removeOldestInternal()
    {
        Iterator<Map.Entry<K, V>> it = items.entrySet().iterator();
        if (!it.hasNext()) {
            return null;
        }
        Map.Entry<K, V> eldest = it.next();
        K key = eldest.getKey();
        V value = eldest.getValue();
        it.remove();
        notifyEvict(key, value);
        return new CacheEntry<>(key, value);
    }

    private void notifyEvict(K key, V value)
    {
        if (onEvict != null) {
            onEvict.onEvict(key, value);
        }
    }
}
