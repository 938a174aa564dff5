package com.github.liyibo1110.pantry.cache.stats;

import com.google.errorprone.annotations.Immutable;
import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.NonNull;

import java.util.Objects;

/**
 * 计数器快照
 * @author liyibo
 * @date 2026-10-13 09:44
 */
@Immutable
public final class CacheStats {
    private static final CacheStats EMPTY_STATS = CacheStats.of(0L, 0L, 0L, 0L, 0L, 0L, 0L, 0L, 0L);
    private final long hitCount;
    private final long missCount;
    private final long resolveSuccessCount;
    private final long resolveFailureCount;
    private final long totalResolveTime;
    private final long revalidationSuccessCount;
    private final long revalidationFailureCount;
    private final long evictionCount;
    private final long expirationCount;

    private CacheStats(@NonNegative long hitCount,
                       @NonNegative long missCount,
                       @NonNegative long resolveSuccessCount,
                       @NonNegative long resolveFailureCount,
                       @NonNegative long totalResolveTime,
                       @NonNegative long revalidationSuccessCount,
                       @NonNegative long revalidationFailureCount,
                       @NonNegative long evictionCount,
                       @NonNegative long expirationCount) {
        if((hitCount < 0) || (missCount < 0) ||
           (resolveSuccessCount < 0) || (resolveFailureCount < 0) || (totalResolveTime < 0) ||
           (revalidationSuccessCount < 0) || (revalidationFailureCount < 0) ||
           (evictionCount < 0) || (expirationCount < 0)) {
            throw new IllegalArgumentException();
        }
        this.hitCount = hitCount;
        this.missCount = missCount;
        this.resolveSuccessCount = resolveSuccessCount;
        this.resolveFailureCount = resolveFailureCount;
        this.totalResolveTime = totalResolveTime;
        this.revalidationSuccessCount = revalidationSuccessCount;
        this.revalidationFailureCount = revalidationFailureCount;
        this.evictionCount = evictionCount;
        this.expirationCount = expirationCount;
    }

    public static CacheStats of(@NonNegative long hitCount,
                                @NonNegative long missCount,
                                @NonNegative long resolveSuccessCount,
                                @NonNegative long resolveFailureCount,
                                @NonNegative long totalResolveTime,
                                @NonNegative long revalidationSuccessCount,
                                @NonNegative long revalidationFailureCount,
                                @NonNegative long evictionCount,
                                @NonNegative long expirationCount) {
        return new CacheStats(hitCount, missCount,
                resolveSuccessCount, resolveFailureCount, totalResolveTime,
                revalidationSuccessCount, revalidationFailureCount,
                evictionCount, expirationCount);
    }

    @NonNull
    public static CacheStats empty() {
        return EMPTY_STATS;
    }

    @NonNegative
    public long requestCount() {
        return saturatedAdd(this.hitCount, this.missCount);
    }

    @NonNegative
    public long hitCount() {
        return this.hitCount;
    }

    @NonNegative
    public double hitRate() {
        long requestCount = this.requestCount();
        return (requestCount == 0) ? 1.0D : (double)this.hitCount / requestCount;
    }

    /**
     * 未命中次数，包括过期后被惰性删除的那次读取；之后resolve成功与否不影响这个计数
     */
    @NonNegative
    public long missCount() {
        return this.missCount;
    }

    @NonNegative
    public double missRate() {
        long requestCount = this.requestCount();
        return (requestCount == 0) ? 0.0D : (double)this.missCount / requestCount;
    }

    /**
     * resolve管道的执行次数（成功 + 失败），一次管道可能依次调用了多个resolver
     */
    @NonNegative
    public long resolveCount() {
        return saturatedAdd(this.resolveSuccessCount, this.resolveFailureCount);
    }

    @NonNegative
    public long resolveSuccessCount() {
        return this.resolveSuccessCount;
    }

    @NonNegative
    public long resolveFailureCount() {
        return this.resolveFailureCount;
    }

    @NonNegative
    public double resolveFailureRate() {
        long resolveCount = this.resolveCount();
        return (resolveCount == 0) ? 0.0D : (double)this.resolveFailureCount / resolveCount;
    }

    /**
     * resolve管道花费的总纳秒数
     */
    @NonNegative
    public long totalResolveTime() {
        return this.totalResolveTime;
    }

    /**
     * 返回平均resolve时长
     */
    @NonNegative
    public double averageResolvePenalty() {
        long resolveCount = this.resolveCount();
        return (resolveCount == 0) ? 0.0D : (double)this.totalResolveTime / resolveCount;
    }

    @NonNegative
    public long revalidationCount() {
        return saturatedAdd(this.revalidationSuccessCount, this.revalidationFailureCount);
    }

    @NonNegative
    public long revalidationSuccessCount() {
        return this.revalidationSuccessCount;
    }

    /**
     * revalidation没有得到值的次数，每一次都会导致对应的key被删除
     */
    @NonNegative
    public long revalidationFailureCount() {
        return this.revalidationFailureCount;
    }

    /**
     * 因容量限制被淘汰的条目数
     */
    @NonNegative
    public long evictionCount() {
        return this.evictionCount;
    }

    /**
     * 因过期被删除的条目数（读取时惰性删除 + 淘汰扫描顺带清理 + cleanUp）
     */
    @NonNegative
    public long expirationCount() {
        return this.expirationCount;
    }

    public CacheStats plus(@NonNull CacheStats other) {
        return CacheStats.of(
            saturatedAdd(this.hitCount, other.hitCount),
            saturatedAdd(this.missCount, other.missCount),
            saturatedAdd(this.resolveSuccessCount, other.resolveSuccessCount),
            saturatedAdd(this.resolveFailureCount, other.resolveFailureCount),
            saturatedAdd(this.totalResolveTime, other.totalResolveTime),
            saturatedAdd(this.revalidationSuccessCount, other.revalidationSuccessCount),
            saturatedAdd(this.revalidationFailureCount, other.revalidationFailureCount),
            saturatedAdd(this.evictionCount, other.evictionCount),
            saturatedAdd(this.expirationCount, other.expirationCount));
    }

    public CacheStats minus(@NonNull CacheStats other) {
        return CacheStats.of(
            Math.max(0L, saturatedSubtract(this.hitCount, other.hitCount)),
            Math.max(0L, saturatedSubtract(this.missCount, other.missCount)),
            Math.max(0L, saturatedSubtract(this.resolveSuccessCount, other.resolveSuccessCount)),
            Math.max(0L, saturatedSubtract(this.resolveFailureCount, other.resolveFailureCount)),
            Math.max(0L, saturatedSubtract(this.totalResolveTime, other.totalResolveTime)),
            Math.max(0L, saturatedSubtract(this.revalidationSuccessCount, other.revalidationSuccessCount)),
            Math.max(0L, saturatedSubtract(this.revalidationFailureCount, other.revalidationFailureCount)),
            Math.max(0L, saturatedSubtract(this.evictionCount, other.evictionCount)),
            Math.max(0L, saturatedSubtract(this.expirationCount, other.expirationCount)));
    }

    /**
     * 求和，如果上下溢出则返回最大或最小值
     */
    private static long saturatedAdd(long a, long b) {
        long naiveSum = a + b;
        if((a ^ b) < 0 | (a ^ naiveSum) >= 0)   // 没有溢出则直接返回计算结果
            return naiveSum;
        return Long.MAX_VALUE + ((naiveSum >>> (Long.SIZE - 1)) ^ 1);
    }

    private static long saturatedSubtract(long a, long b) {
        long naiveDifference = a - b;
        if((a ^ b) >= 0 | (a ^ naiveDifference) >= 0)
            return naiveDifference;
        return Long.MAX_VALUE + ((naiveDifference >>> (Long.SIZE - 1)) ^ 1);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.hitCount, this.missCount,
                this.resolveSuccessCount, this.resolveFailureCount, this.totalResolveTime,
                this.revalidationSuccessCount, this.revalidationFailureCount,
                this.evictionCount, this.expirationCount);
    }

    @Override
    public boolean equals(Object obj) {
        if(obj == this)
            return true;
        else if(!(obj instanceof CacheStats))
            return false;
        CacheStats other = (CacheStats)obj;
        return this.hitCount == other.hitCount &&
            this.missCount == other.missCount &&
            this.resolveSuccessCount == other.resolveSuccessCount &&
            this.resolveFailureCount == other.resolveFailureCount &&
            this.totalResolveTime == other.totalResolveTime &&
            this.revalidationSuccessCount == other.revalidationSuccessCount &&
            this.revalidationFailureCount == other.revalidationFailureCount &&
            this.evictionCount == other.evictionCount &&
            this.expirationCount == other.expirationCount;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + '{'
            + "hitCount=" + this.hitCount + ", "
            + "missCount=" + this.missCount + ", "
            + "resolveSuccessCount=" + this.resolveSuccessCount + ", "
            + "resolveFailureCount=" + this.resolveFailureCount + ", "
            + "totalResolveTime=" + this.totalResolveTime + ", "
            + "revalidationSuccessCount=" + this.revalidationSuccessCount + ", "
            + "revalidationFailureCount=" + this.revalidationFailureCount + ", "
            + "evictionCount=" + this.evictionCount + ", "
            + "expirationCount=" + this.expirationCount
            + '}';
    }
}
