package com.github.liyibo1110.pantry.cache.stats;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CacheStatsTest {

    @Test
    public void testEmpty() {
        CacheStats stats = CacheStats.empty();
        assertEquals(0L, stats.requestCount());
        assertEquals(1.0D, stats.hitRate(), "没有请求时命中率视为1");
        assertEquals(0.0D, stats.missRate());
        assertEquals(0.0D, stats.averageResolvePenalty());
        assertEquals(stats, CacheStats.of(0L, 0L, 0L, 0L, 0L, 0L, 0L, 0L, 0L));
    }

    @Test
    public void testDerivedValues() {
        CacheStats stats = CacheStats.of(3L, 1L, 3L, 1L, 400L, 2L, 2L, 5L, 6L);

        assertEquals(4L, stats.requestCount());
        assertEquals(0.75D, stats.hitRate());
        assertEquals(0.25D, stats.missRate());
        assertEquals(4L, stats.resolveCount());
        assertEquals(0.25D, stats.resolveFailureRate());
        assertEquals(100.0D, stats.averageResolvePenalty());
        assertEquals(4L, stats.revalidationCount());
        assertEquals(5L, stats.evictionCount());
        assertEquals(6L, stats.expirationCount());
    }

    @Test
    public void testNegativeCountsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> CacheStats.of(-1L, 0L, 0L, 0L, 0L, 0L, 0L, 0L, 0L));
    }

    @Test
    public void testPlusAndMinus() {
        CacheStats one = CacheStats.of(1L, 2L, 3L, 4L, 5L, 6L, 7L, 8L, 9L);
        CacheStats two = CacheStats.of(10L, 10L, 10L, 10L, 10L, 10L, 10L, 10L, 10L);

        assertEquals(CacheStats.of(11L, 12L, 13L, 14L, 15L, 16L, 17L, 18L, 19L), one.plus(two));
        assertEquals(CacheStats.of(9L, 8L, 7L, 6L, 5L, 4L, 3L, 2L, 1L), two.minus(one));
        assertEquals(CacheStats.empty(), one.minus(two), "相减不会出现负数");
    }

    @Test
    public void testPlusSaturates() {
        CacheStats max = CacheStats.of(Long.MAX_VALUE, 0L, 0L, 0L, 0L, 0L, 0L, 0L, 0L);
        assertEquals(Long.MAX_VALUE, max.plus(max).hitCount());
    }
}
