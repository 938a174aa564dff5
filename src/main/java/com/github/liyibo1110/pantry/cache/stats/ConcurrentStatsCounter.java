package com.github.liyibo1110.pantry.cache.stats;

import com.github.liyibo1110.pantry.cache.RemovalCause;
import org.checkerframework.checker.nullness.qual.NonNull;

import java.util.concurrent.atomic.LongAdder;

/**
 * 线程安全的StatsCounter实现
 * @author liyibo
 * @date 2026-10-13 09:31
 */
public class ConcurrentStatsCounter implements StatsCounter {
    private final LongAdder hitCount;
    private final LongAdder missCount;
    private final LongAdder resolveSuccessCount;
    private final LongAdder resolveFailureCount;
    private final LongAdder totalResolveTime;
    private final LongAdder revalidationSuccessCount;
    private final LongAdder revalidationFailureCount;
    private final LongAdder evictionCount;
    private final LongAdder expirationCount;

    public ConcurrentStatsCounter() {
        // 默认都是0
        this.hitCount = new LongAdder();
        this.missCount = new LongAdder();
        this.resolveSuccessCount = new LongAdder();
        this.resolveFailureCount = new LongAdder();
        this.totalResolveTime = new LongAdder();
        this.revalidationSuccessCount = new LongAdder();
        this.revalidationFailureCount = new LongAdder();
        this.evictionCount = new LongAdder();
        this.expirationCount = new LongAdder();
    }

    @Override
    public void recordHits(int count) {
        this.hitCount.add(count);
    }

    @Override
    public void recordMisses(int count) {
        this.missCount.add(count);
    }

    @Override
    public void recordResolveSuccess(long resolveTime) {
        this.resolveSuccessCount.increment();
        this.totalResolveTime.add(resolveTime);
    }

    @Override
    public void recordResolveFailure(long resolveTime) {
        this.resolveFailureCount.increment();
        this.totalResolveTime.add(resolveTime);
    }

    @Override
    public void recordRevalidationSuccess() {
        this.revalidationSuccessCount.increment();
    }

    @Override
    public void recordRevalidationFailure() {
        this.revalidationFailureCount.increment();
    }

    @Override
    public void recordEviction(RemovalCause cause) {
        switch(cause) {
            case SIZE:
                this.evictionCount.increment();
                return;
            case EXPIRED:
                this.expirationCount.increment();
                return;
            default:
                break;
        }
    }

    @Override
    public CacheStats snapshot() {
        return CacheStats.of(
            negativeToMaxValue(this.hitCount.sum()),
            negativeToMaxValue(this.missCount.sum()),
            negativeToMaxValue(this.resolveSuccessCount.sum()),
            negativeToMaxValue(this.resolveFailureCount.sum()),
            negativeToMaxValue(this.totalResolveTime.sum()),
            negativeToMaxValue(this.revalidationSuccessCount.sum()),
            negativeToMaxValue(this.revalidationFailureCount.sum()),
            negativeToMaxValue(this.evictionCount.sum()),
            negativeToMaxValue(this.expirationCount.sum()));
    }

    /**
     * 将指定的StatsCounter里面的记录值累加进来
     */
    public void incrementBy(@NonNull StatsCounter other) {
        CacheStats snapshot = other.snapshot();
        this.hitCount.add(snapshot.hitCount());
        this.missCount.add(snapshot.missCount());
        this.resolveSuccessCount.add(snapshot.resolveSuccessCount());
        this.resolveFailureCount.add(snapshot.resolveFailureCount());
        this.totalResolveTime.add(snapshot.totalResolveTime());
        this.revalidationSuccessCount.add(snapshot.revalidationSuccessCount());
        this.revalidationFailureCount.add(snapshot.revalidationFailureCount());
        this.evictionCount.add(snapshot.evictionCount());
        this.expirationCount.add(snapshot.expirationCount());
    }

    private static long negativeToMaxValue(long value) {
        return (value >= 0) ? value : Long.MAX_VALUE;
    }

    @Override
    public String toString() {
        return this.snapshot().toString();
    }
}
