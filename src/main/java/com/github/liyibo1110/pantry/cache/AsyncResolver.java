package com.github.liyibo1110.pantry.cache;

import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 根据key，异步地计算或检索值
 * 既用于填充未命中的条目（resolver），也用于校验已存在的条目（revalidator），两者形状完全一样
 * future以null完成表示“这个来源没有值”，异常完成也按没有值处理，不会传给cache的调用方
 * @author liyibo
 * @date 2026-10-12 10:40
 */
@FunctionalInterface
public interface AsyncResolver<K, V> {

    /**
     * 异步计算或检索key对应的value
     * @param executor cache配置的执行器，实现类可以用它来提交异步任务
     */
    @Nullable
    CompletableFuture<V> asyncResolve(@NonNull K key, @NonNull Executor executor);
}
