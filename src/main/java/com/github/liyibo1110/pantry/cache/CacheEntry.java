package com.github.liyibo1110.pantry.cache;

import com.google.errorprone.annotations.Immutable;
import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.NonNull;

import java.util.Objects;

/**
 * cache中的一个条目：value + 写入时间 + 写入时的ttl
 * 只能整体替换，不会被局部修改；writeTime只在写入（set、resolve成功、revalidate成功、resetTtlOnGet）时更新，读取不会更新
 * @author liyibo
 * @date 2026-10-12 14:02
 */
@Immutable(containerOf = "V")
public final class CacheEntry<V> {
    private final long writeTime;
    private final long ttlNanos;
    private final V value;

    CacheEntry(long writeTime, @NonNegative long ttlNanos, @NonNull V value) {
        this.writeTime = writeTime;
        this.ttlNanos = ttlNanos;
        this.value = Objects.requireNonNull(value);
    }

    /**
     * 最近一次写入的时间点（Ticker纳秒）
     */
    public long writeTime() {
        return this.writeTime;
    }

    @NonNegative
    public long ttlNanos() {
        return this.ttlNanos;
    }

    @NonNull
    public V value() {
        return this.value;
    }

    /**
     * now >= writeTime + ttl即为过期
     */
    public boolean isExpired(long now) {
        return now - this.writeTime >= this.ttlNanos;
    }

    @Override
    public boolean equals(Object obj) {
        if(this == obj)
            return true;
        else if(!(obj instanceof CacheEntry))
            return false;
        CacheEntry<?> other = (CacheEntry<?>)obj;
        return this.writeTime == other.writeTime
                && this.ttlNanos == other.ttlNanos
                && this.value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.writeTime, this.ttlNanos, this.value);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + '{'
                + "writeTime=" + this.writeTime + ", "
                + "ttl=" + this.ttlNanos + "ns, "
                + "value=" + this.value
                + '}';
    }
}
