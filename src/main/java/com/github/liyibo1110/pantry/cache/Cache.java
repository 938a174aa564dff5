package com.github.liyibo1110.pantry.cache;

import com.github.liyibo1110.pantry.cache.stats.CacheStats;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 带过期、容量淘汰、未命中自动resolve和后台revalidation的缓存API
 * 值不存在统一用null表示，所以key和value都不能是null
 * 此接口实现需要线程安全
 * @author liyibo
 * @date 2026-10-13 11:20
 */
public interface Cache<K, V> {

    /**
     * 写入或覆盖key对应的value，返回新写入的条目
     * 如果设置了maximumSize且已满，写入前会先做一次淘汰扫描（见{@link Pantry#maximumSize}）
     */
    @CanIgnoreReturnValue
    @NonNull
    CacheEntry<V> set(@NonNull K key, @NonNull V value);

    /**
     * 根据key返回对应的value：
     * <ol>
     *   <li>已过期的条目会在这里被删除，按未命中处理</li>
     *   <li>未命中则依次调用配置的resolver，第一个给出值的会被写入cache</li>
     *   <li>命中后按配置刷新ttl，或在后台启动revalidation</li>
     * </ol>
     * resolver的失败不会传给调用方，都没有值时future以null完成
     */
    @NonNull
    CompletableFuture<V> get(@NonNull K key);

    /**
     * 和{@link #get(Object)}一样，但本次调用用resolvers整体替换掉配置的resolver列表
     * resolvers为null或空时使用配置的列表
     */
    @NonNull
    CompletableFuture<V> get(@NonNull K key,
                             @Nullable List<? extends AsyncResolver<? super K, V>> resolvers);

    /**
     * 同时替换本次调用的resolver列表和后台revalidation使用的revalidator列表
     */
    @NonNull
    CompletableFuture<V> get(@NonNull K key,
                             @Nullable List<? extends AsyncResolver<? super K, V>> resolvers,
                             @Nullable List<? extends AsyncResolver<? super K, V>> revalidators);

    /**
     * 只做过期检查，不会resolve、刷新ttl或触发revalidation
     */
    @Nullable
    V getIfPresent(@NonNull K key);

    /**
     * 删除key对应的条目
     */
    void delete(@NonNull K key);

    /**
     * 删除所有条目
     */
    void deleteAll();

    /**
     * 依次调用配置的revalidator，得到值则写入cache，都没有值则删除这个key
     * 没有可用的revalidator时，直接抛出IllegalStateException，不会返回future
     */
    @CanIgnoreReturnValue
    @NonNull
    CompletableFuture<Void> revalidate(@NonNull K key);

    /**
     * 本次调用用revalidators整体替换掉配置的revalidator列表，为null或空时使用配置的列表
     */
    @CanIgnoreReturnValue
    @NonNull
    CompletableFuture<Void> revalidate(@NonNull K key,
                                       @Nullable List<? extends AsyncResolver<? super K, V>> revalidators);

    /**
     * 当前存储的条目数，包括已过期但还没被读取或扫描到的条目
     */
    @NonNegative
    long size();

    /**
     * 删除所有已过期的条目
     */
    void cleanUp();

    /**
     * 返回cache的统计快照，没有开启recordStats时全部为0
     */
    @NonNull
    CacheStats stats();

    /**
     * 返回对应的策略实例
     */
    @NonNull
    Policy<K, V> policy();
}
