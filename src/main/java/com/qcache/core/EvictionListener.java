package com.qcache.core;

/**
 * Bir girdi yapıdan ayrıldığında son bilinen anahtar ve değeriyle çağrılan
 * geri çağırım. Çağrı, tetikleyen işlemin thread'inde ve varsa kilit
 * içindeyken senkron olarak yapılır; bu yüzden dinleyici aynı önbelleğe
 * tekrar çağrı yapmamalıdır.
 */
@FunctionalInterface
public interface EvictionListener<K, V>
{
    void onEvict(K key, V value);
}
