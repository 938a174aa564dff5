package com.github.liyibo1110.pantry.cache;

import org.checkerframework.checker.nullness.qual.NonNull;

/**
 * 时间源，返回纳秒级的时间点，条目的写入时间和过期判断都以它为准
 * 测试时可替换成手动推进的实现
 * @author liyibo
 * @date 2026-10-12 10:21
 */
@FunctionalInterface
public interface Ticker {

    /**
     * 获取时间点（纳秒）
     */
    long read();

    /**
     * 获取SystemTicker单例
     */
    static @NonNull Ticker systemTicker() {
        return SystemTicker.INSTANCE;
    }
}

/**
 * 基于System.nanoTime的Ticker实现
 */
enum SystemTicker implements Ticker {
    INSTANCE;

    @Override
    public long read() {
        return System.nanoTime();
    }
}
