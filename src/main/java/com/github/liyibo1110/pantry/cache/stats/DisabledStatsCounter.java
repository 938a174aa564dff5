package com.github.liyibo1110.pantry.cache.stats;

import com.github.liyibo1110.pantry.cache.RemovalCause;

/**
 * 不进行任何记录的StatsCounter实现
 * @author liyibo
 * @date 2026-10-13 09:36
 */
enum DisabledStatsCounter implements StatsCounter {
    INSTANCE;

    @Override
    public void recordHits(int count) {}

    @Override
    public void recordMisses(int count) {}

    @Override
    public void recordResolveSuccess(long resolveTime) {}

    @Override
    public void recordResolveFailure(long resolveTime) {}

    @Override
    public void recordRevalidationSuccess() {}

    @Override
    public void recordRevalidationFailure() {}

    @Override
    public void recordEviction(RemovalCause cause) {}

    @Override
    public CacheStats snapshot() {
        return CacheStats.empty();
    }

    @Override
    public String toString() {
        return this.snapshot().toString();
    }
}
