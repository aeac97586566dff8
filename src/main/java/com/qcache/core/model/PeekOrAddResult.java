package com.qcache.core.model;

import java.util.Optional;

/** {@code peekOrAdd} sonucu: varsa önceki değer ve eklemenin tahliyeye yol açıp açmadığı. */
public record PeekOrAddResult<V>(Optional<V> previous, boolean evicted) {}
