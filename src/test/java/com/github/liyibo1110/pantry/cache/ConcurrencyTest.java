package com.github.liyibo1110.pantry.cache;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 多线程下的容量上限和resolve行为
 */
public class ConcurrencyTest {

    @Test
    public void testSizeBoundUnderContention() throws InterruptedException {
        int threadCount = 8;
        int opsPerThread = 2000;
        Cache<Integer, Integer> cache = Pantry.<Integer, Integer>newBuilder()
                .ttl(Duration.ofMinutes(1))
                .maximumSize(100)
                .executor(Runnable::run)
                .build();

        ExecutorService pool = Executors.newFixedThreadPool(threadCount);
        CountDownLatch latch = new CountDownLatch(threadCount);
        AtomicInteger violations = new AtomicInteger();
        for(int i = 0; i < threadCount; i++) {
            pool.execute(() -> {
                ThreadLocalRandom random = ThreadLocalRandom.current();
                for(int j = 0; j < opsPerThread; j++) {
                    int key = random.nextInt(1000);
                    if(random.nextBoolean())
                        cache.set(key, j);
                    else
                        cache.getIfPresent(key);
                    if(cache.size() > 100)
                        violations.incrementAndGet();
                }
                latch.countDown();
            });
        }

        assertTrue(latch.await(30, TimeUnit.SECONDS));
        pool.shutdown();
        assertEquals(0, violations.get(), "size在任何时刻都不应超过maximumSize");
        assertTrue(cache.size() <= 100);
    }

    @Test
    public void testConcurrentMissesAreNotCoalesced() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        Cache<String, String> cache = Pantry.<String, String>newBuilder()
                .ttl(Duration.ofMinutes(1))
                .executor(pool)
                .resolver((Resolver<String, String>)key -> {
                    calls.incrementAndGet();
                    release.await();
                    return "v";
                })
                .build();

        List<CompletableFuture<String>> futures = new ArrayList<>();
        for(int i = 0; i < 3; i++)
            futures.add(cache.get("k"));
        release.countDown();

        for(CompletableFuture<String> future : futures)
            assertEquals("v", future.get(10, TimeUnit.SECONDS));
        assertEquals(3, calls.get(), "同一个key的并发未命中各自调用resolver");
        assertEquals(1L, cache.size());
        pool.shutdown();
    }
}
