package com.github.liyibo1110.pantry.cache;

import org.checkerframework.checker.nullness.qual.NonNull;

/**
 * 当条目被移除时，要触发的监听器，会在cache的executor上异步调用
 * 实现类应避免执行阻塞调用或在共享资源上进行同步
 * @author liyibo
 * @date 2026-10-12 11:12
 */
@FunctionalInterface
public interface RemovalListener<K, V> {

    /**
     * 当条目被移除时，会触发这个方法，并附带RemovalCause
     */
    void onRemoval(@NonNull K key, @NonNull V value, @NonNull RemovalCause cause);
}
