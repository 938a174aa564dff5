package com.github.liyibo1110.pantry.cache;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 有序的resolver管道，resolve和revalidate共用
 * 严格按顺序调用，每次都等上一个完成后才调用下一个，第一个给出非null值的胜出，后面的不再调用
 * 返回null、返回null的future、同步抛出异常或future异常完成，都按“这个来源没有值”处理，异常只记录日志
 * @author liyibo
 * @date 2026-10-13 17:05
 */
final class ResolverChain<K, V> {
    static final Logger logger = Logger.getLogger(ResolverChain.class.getName());

    final List<AsyncResolver<? super K, V>> resolvers;
    /** 用于日志，resolve或revalidation */
    final String operation;

    ResolverChain(List<? extends AsyncResolver<? super K, V>> resolvers, String operation) {
        List<AsyncResolver<? super K, V>> copy = new ArrayList<>(resolvers.size());
        for(AsyncResolver<? super K, V> resolver : resolvers)
            copy.add(Objects.requireNonNull(resolver));
        this.resolvers = Collections.unmodifiableList(copy);
        this.operation = Objects.requireNonNull(operation);
    }

    boolean isEmpty() {
        return this.resolvers.isEmpty();
    }

    /**
     * 单次调用的替换列表：为null或空时沿用自身，否则整体替换（不是追加）
     */
    ResolverChain<K, V> orOverride(List<? extends AsyncResolver<? super K, V>> override) {
        return (override == null || override.isEmpty())
                ? this
                : new ResolverChain<>(override, this.operation);
    }

    /**
     * 依次尝试，future的结果为第一个非null值，全部没有值时为null，不会异常完成
     */
    CompletableFuture<V> apply(K key, Executor executor) {
        return this.attempt(key, executor, 0);
    }

    private CompletableFuture<V> attempt(K key, Executor executor, int index) {
        if(index >= this.resolvers.size())
            return CompletableFuture.completedFuture(null);
        return this.invoke(this.resolvers.get(index), key, executor).thenCompose(value ->
                (value != null)
                        ? CompletableFuture.completedFuture(value)
                        : this.attempt(key, executor, index + 1));
    }

    /**
     * 调用单个resolver，把各种失败都折叠成null
     */
    private CompletableFuture<V> invoke(AsyncResolver<? super K, V> resolver, K key, Executor executor) {
        CompletableFuture<V> future;
        try {
            future = resolver.asyncResolve(key, executor);
        } catch (Throwable t) {
            logger.log(Level.WARNING, "Exception thrown during asynchronous " + this.operation, t);
            return CompletableFuture.completedFuture(null);
        }
        if(future == null)
            return CompletableFuture.completedFuture(null);

        return future.handle((value, error) -> {
            if(error == null)
                return value;
            if(Async.shouldLog(error))
                logger.log(Level.WARNING, "Exception thrown during asynchronous " + this.operation, Async.unwrap(error));
            return null;
        });
    }
}
