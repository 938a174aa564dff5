package com.github.liyibo1110.pantry.cache.stats;

import com.github.liyibo1110.pantry.cache.RemovalCause;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 对委托的StatsCounter实现进行代理的StatsCounter实现，负责吃掉异常并log输出
 * @author liyibo
 * @date 2026-10-13 09:38
 */
final class GuardedStatsCounter implements StatsCounter {
    static final Logger logger = Logger.getLogger(GuardedStatsCounter.class.getName());

    final StatsCounter delegate;

    GuardedStatsCounter(StatsCounter delegate) {
        this.delegate = Objects.requireNonNull(delegate);
    }

    @Override
    public void recordHits(int count) {
        try {
            this.delegate.recordHits(count);
        } catch (Throwable t) {
            logger.log(Level.WARNING, "Exception thrown by stats counter", t);
        }
    }

    @Override
    public void recordMisses(int count) {
        try {
            this.delegate.recordMisses(count);
        } catch (Throwable t) {
            logger.log(Level.WARNING, "Exception thrown by stats counter", t);
        }
    }

    @Override
    public void recordResolveSuccess(long resolveTime) {
        try {
            this.delegate.recordResolveSuccess(resolveTime);
        } catch (Throwable t) {
            logger.log(Level.WARNING, "Exception thrown by stats counter", t);
        }
    }

    @Override
    public void recordResolveFailure(long resolveTime) {
        try {
            this.delegate.recordResolveFailure(resolveTime);
        } catch (Throwable t) {
            logger.log(Level.WARNING, "Exception thrown by stats counter", t);
        }
    }

    @Override
    public void recordRevalidationSuccess() {
        try {
            this.delegate.recordRevalidationSuccess();
        } catch (Throwable t) {
            logger.log(Level.WARNING, "Exception thrown by stats counter", t);
        }
    }

    @Override
    public void recordRevalidationFailure() {
        try {
            this.delegate.recordRevalidationFailure();
        } catch (Throwable t) {
            logger.log(Level.WARNING, "Exception thrown by stats counter", t);
        }
    }

    @Override
    public void recordEviction(RemovalCause cause) {
        try {
            this.delegate.recordEviction(cause);
        } catch (Throwable t) {
            logger.log(Level.WARNING, "Exception thrown by stats counter", t);
        }
    }

    @Override
    public CacheStats snapshot() {
        try {
            return this.delegate.snapshot();
        } catch (Throwable t) {
            logger.log(Level.WARNING, "Exception thrown by stats counter", t);
            return CacheStats.empty();
        }
    }

    @Override
    public String toString() {
        return this.delegate.toString();
    }
}
