package com.github.liyibo1110.pantry.cache.stats;

import com.github.liyibo1110.pantry.cache.RemovalCause;
import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.NonNull;

/**
 * 缓存运行期间累积统计数据，供Cache.stats方法来呈现
 * @author liyibo
 * @date 2026-10-13 09:20
 */
public interface StatsCounter {

    /**
     * 命中了缓存被调用
     */
    void recordHits(@NonNegative int count);

    /**
     * 未命中缓存时被调用（包括过期被惰性删除的情况）
     */
    void recordMisses(@NonNegative int count);

    /**
     * resolve管道得到了值时被调用
     * @param resolveTime 整个管道花费的纳秒数
     */
    void recordResolveSuccess(@NonNegative long resolveTime);

    /**
     * resolve管道所有resolver都没有给出值（返回null或者失败）时被调用
     * @param resolveTime 整个管道花费的纳秒数
     */
    void recordResolveFailure(@NonNegative long resolveTime);

    /**
     * revalidation得到了新值时被调用
     */
    void recordRevalidationSuccess();

    /**
     * revalidation没有得到值（条目随后会被删除）时被调用
     */
    void recordRevalidationFailure();

    /**
     * 条目被移除时被调用，只有SIZE和EXPIRED会被计入
     */
    void recordEviction(@NonNull RemovalCause cause);

    /**
     * 返回当前计数器快照实例
     */
    @NonNull
    CacheStats snapshot();

    /**
     * 返回DisabledStatsCounter计数器的实例
     */
    static @NonNull StatsCounter disabledStatsCounter() {
        return DisabledStatsCounter.INSTANCE;
    }

    /**
     * 返回GuardedStatsCounter计数器的实例
     */
    static @NonNull StatsCounter guardedStatsCounter(@NonNull StatsCounter statsCounter) {
        return (statsCounter instanceof GuardedStatsCounter || statsCounter == DisabledStatsCounter.INSTANCE)
                ? statsCounter
                : new GuardedStatsCounter(statsCounter);
    }
}
