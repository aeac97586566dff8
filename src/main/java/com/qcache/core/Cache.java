package com.qcache.core;

import java.util.List;
import java.util.Optional;

/**
 * Thread-safe önbellek uygulamalarının ortak sözleşmesi. Bulunamayan anahtarlar
 * hata değil, boş {@link Optional} ya da {@code false} ile bildirilir.
 */
public interface Cache<K, V>
{
    /** @return ekleme sırasında bir girdi tahliye edildiyse {@code true} */
    boolean add(K key, V value);

    Optional<V> get(K key);

    Optional<V> peek(K key);

    boolean contains(K key);

    boolean remove(K key);

    List<K> keys();

    int len();

    void purge();
}
