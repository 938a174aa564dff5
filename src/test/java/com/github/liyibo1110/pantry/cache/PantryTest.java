package com.github.liyibo1110.pantry.cache;

import com.github.liyibo1110.pantry.cache.stats.ConcurrentStatsCounter;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class PantryTest {

    @Test
    public void testTtlIsRequired() {
        Pantry<String, String> builder = Pantry.newBuilder();
        IllegalStateException e = assertThrows(IllegalStateException.class, builder::build);
        assertEquals("ttl is required", e.getMessage());
    }

    @Test
    public void testOptionsCanOnlyBeSetOnce() {
        Pantry<String, String> builder = Pantry.<String, String>newBuilder()
                .ttl(1, TimeUnit.MINUTES)
                .maximumSize(10)
                .resetTtlOnGet()
                .revalidateOnGet()
                .ticker(Ticker.systemTicker())
                .recordStats();

        assertThrows(IllegalStateException.class, () -> builder.ttl(Duration.ofSeconds(1)));
        assertThrows(IllegalStateException.class, () -> builder.maximumSize(5));
        assertThrows(IllegalStateException.class, builder::resetTtlOnGet);
        assertThrows(IllegalStateException.class, builder::revalidateOnGet);
        assertThrows(IllegalStateException.class, () -> builder.ticker(Ticker.systemTicker()));
        assertThrows(IllegalStateException.class, () -> builder.recordStats());
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class,
                () -> Pantry.newBuilder().ttl(Duration.ofSeconds(-1)));
        assertThrows(IllegalArgumentException.class,
                () -> Pantry.newBuilder().maximumSize(0));
        assertThrows(NullPointerException.class,
                () -> Pantry.<String, String>newBuilder().resolver((AsyncResolver<String, String>)null));
        assertThrows(NullPointerException.class,
                () -> Pantry.newBuilder().executor(null));
    }

    @Test
    public void testResolversKeepInsertionOrder() {
        Resolver<String, String> first = key -> "1";
        Resolver<String, String> second = key -> "2";
        Pantry<String, String> builder = Pantry.<String, String>newBuilder()
                .resolver(first)
                .resolver(second);

        assertEquals(2, builder.getResolvers().size());
        assertSame(first, builder.getResolvers().get(0));
        assertSame(second, builder.getResolvers().get(1));
        assertThrows(UnsupportedOperationException.class, () -> builder.getResolvers().clear());
    }

    @Test
    public void testDefaults() {
        Pantry<String, String> builder = Pantry.<String, String>newBuilder().ttl(Duration.ofSeconds(1));

        assertFalse(builder.evicts());
        assertFalse(builder.isRecordingStats());
        assertSame(Ticker.systemTicker(), builder.getTicker());
        assertSame(KeepAlive.disabledKeepAlive(), builder.getKeepAlive());
        assertNull(builder.getRemovalListener());
        assertTrue(builder.getResolvers().isEmpty());
    }

    @Test
    public void testCustomStatsCounterIsGuarded() {
        ConcurrentStatsCounter counter = new ConcurrentStatsCounter();
        Cache<String, String> cache = Pantry.<String, String>newBuilder()
                .ttl(Duration.ofSeconds(1))
                .recordStats(() -> counter)
                .build();

        cache.set("a", "1");
        cache.getIfPresent("a");
        cache.getIfPresent("b");
        assertEquals(1L, counter.snapshot().hitCount());
        assertEquals(1L, counter.snapshot().missCount());
        assertTrue(cache.policy().isRecordingStats());
    }

    @Test
    public void testToString() {
        String description = Pantry.<String, String>newBuilder()
                .ttl(Duration.ofNanos(100))
                .maximumSize(3)
                .resetTtlOnGet()
                .toString();

        assertTrue(description.contains("ttl=100ns"), description);
        assertTrue(description.contains("maximumSize=3"), description);
        assertTrue(description.contains("resetTtlOnGet"), description);
        assertFalse(description.contains("revalidateOnGet"), description);
    }
}
