package com.github.liyibo1110.pantry.cache;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 测试用的手动时钟，只有调用advance时才会前进
 * @author liyibo
 * @date 2026-10-15 09:10
 */
public final class FakeTicker implements Ticker {
    private final AtomicLong nanos = new AtomicLong();

    @Override
    public long read() {
        return this.nanos.get();
    }

    public FakeTicker advance(Duration duration) {
        this.nanos.addAndGet(duration.toNanos());
        return this;
    }

    public FakeTicker advance(long nanos) {
        this.nanos.addAndGet(nanos);
        return this;
    }
}
