package com.qcache.core.model;

/** {@code containsOrAdd} sonucu: anahtarın zaten var olup olmadığı ve eklemenin tahliyeye yol açıp açmadığı. */
public record ContainsOrAddResult(boolean found, boolean evicted) {}
