package com.github.liyibo1110.pantry.cache;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * AsyncResolver的同步版本，只需要实现resolve方法，会被放到cache的executor上执行
 * @author liyibo
 * @date 2026-10-12 10:52
 */
@FunctionalInterface
public interface Resolver<K, V> extends AsyncResolver<K, V> {

    /**
     * 计算或检索key对应的value，返回null表示没有值
     */
    V resolve(K key) throws Exception;

    @Override
    default CompletableFuture<V> asyncResolve(K key, Executor executor) {
        Objects.requireNonNull(key);
        Objects.requireNonNull(executor);

        return CompletableFuture.supplyAsync(() -> {
            try {
                return this.resolve(key);
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, executor);
    }
}
