package com.qcache.core.model;

/**
 * Önbellekteki tek bir anahtar-değer çiftinin değiştirilemez görüntüsüdür.
 * En eski girdiyi okuyan ya da çıkaran işlemler sonucu bu tiple döndürür.
 */
public record CacheEntry<K, V>(K key, V value) {}
