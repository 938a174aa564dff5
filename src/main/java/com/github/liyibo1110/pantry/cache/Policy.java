package com.github.liyibo1110.pantry.cache;

import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Duration;
import java.util.Map;
import java.util.OptionalLong;

/**
 * 检查cache运行时配置，以及无副作用地查看条目的访问点
 * @author liyibo
 * @date 2026-10-13 11:48
 */
public interface Policy<K, V> {

    /**
     * 是否缓存开启了统计
     */
    boolean isRecordingStats();

    /**
     * 每个条目写入时使用的ttl
     */
    @NonNull
    Duration ttl();

    /**
     * 最大条目数，没有设置时为空
     */
    @NonNull
    OptionalLong maximumSize();

    boolean isResetTtlOnGet();

    boolean isRevalidateOnGet();

    /**
     * 返回key对应的条目，即使已经过期
     * 与Cache的get不同的是，此方法不会有副作用，如更新统计信息、删除过期条目、重置过期时间或触发revalidation等
     */
    @Nullable
    CacheEntry<V> getEntryQuietly(@NonNull K key);

    /**
     * 返回一个不可修改的快照，按写入时间从早到晚排序，最多limit个
     * 排在最前面的就是下一次淘汰扫描的候选（least-recently-written）
     * 注意这里是写入顺序，读取不会改变它，只有开启resetTtlOnGet时才接近按访问排序的LRU
     */
    @NonNull
    Map<@NonNull K, @NonNull V> oldest(@NonNegative int limit);
}
