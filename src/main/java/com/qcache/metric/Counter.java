package com.qcache.metric;

import java.util.concurrent.atomic.LongAdder;

/**
 * İsabet, ıskalama ve silme gibi önbellek olaylarını sayan thread-safe sayaçtır.
 */
public final class Counter
{
    private final String name;
    private final LongAdder value = new LongAdder();
    public Counter(String name) { this.name = name; }
    public void inc() { value.increment(); }
    public long get() { return value.sum(); }
    public String name() { return name; }
}
