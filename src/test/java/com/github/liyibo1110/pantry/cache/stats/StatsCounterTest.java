package com.github.liyibo1110.pantry.cache.stats;

import com.github.liyibo1110.pantry.cache.RemovalCause;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class StatsCounterTest {

    @Test
    public void testConcurrentStatsCounter() {
        ConcurrentStatsCounter counter = new ConcurrentStatsCounter();
        counter.recordHits(2);
        counter.recordMisses(1);
        counter.recordResolveSuccess(30L);
        counter.recordResolveFailure(10L);
        counter.recordRevalidationSuccess();
        counter.recordRevalidationFailure();
        counter.recordEviction(RemovalCause.SIZE);
        counter.recordEviction(RemovalCause.EXPIRED);
        counter.recordEviction(RemovalCause.EXPIRED);
        counter.recordEviction(RemovalCause.EXPLICIT);

        assertEquals(CacheStats.of(2L, 1L, 1L, 1L, 40L, 1L, 1L, 1L, 2L), counter.snapshot(),
                "只有SIZE和EXPIRED计入淘汰统计");
    }

    @Test
    public void testIncrementBy() {
        ConcurrentStatsCounter first = new ConcurrentStatsCounter();
        ConcurrentStatsCounter second = new ConcurrentStatsCounter();
        first.recordHits(1);
        second.recordHits(2);
        second.recordMisses(3);

        first.incrementBy(second);
        assertEquals(3L, first.snapshot().hitCount());
        assertEquals(3L, first.snapshot().missCount());
    }

    @Test
    public void testDisabledStatsCounter() {
        StatsCounter counter = StatsCounter.disabledStatsCounter();
        counter.recordHits(5);
        counter.recordEviction(RemovalCause.SIZE);
        assertEquals(CacheStats.empty(), counter.snapshot());
        assertSame(counter, StatsCounter.guardedStatsCounter(counter), "Disabled实例不需要再包装");
    }

    @Test
    public void testGuardedStatsCounterSwallowsExceptions() {
        StatsCounter broken = new ConcurrentStatsCounter() {
            @Override
            public void recordHits(int count) {
                throw new IllegalStateException("broken");
            }

            @Override
            public CacheStats snapshot() {
                throw new IllegalStateException("broken");
            }
        };
        StatsCounter guarded = StatsCounter.guardedStatsCounter(broken);

        assertDoesNotThrow(() -> guarded.recordHits(1));
        assertEquals(CacheStats.empty(), guarded.snapshot());
        assertSame(guarded, StatsCounter.guardedStatsCounter(guarded));
    }
}
