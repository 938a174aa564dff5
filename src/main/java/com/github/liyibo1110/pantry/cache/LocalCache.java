package com.github.liyibo1110.pantry.cache;

import com.github.liyibo1110.pantry.cache.stats.CacheStats;
import com.github.liyibo1110.pantry.cache.stats.StatsCounter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Cache的本地实现
 * 所有同步部分（过期检查、淘汰扫描、写入、删除）都在lock内完成，只有resolver和revalidator的future是挂起点，
 * 回调继续在executor上执行；removal通知在释放lock之后再派发
 * 不合并同一个key的并发未命中（没有single-flight），并发的get可能各自调用一次resolver，revalidation同理
 * @author liyibo
 * @date 2026-10-14 14:20
 */
final class LocalCache<K, V> implements Cache<K, V> {
    static final Logger logger = Logger.getLogger(LocalCache.class.getName());

    static final String MISSING_REVALIDATOR =
            "revalidate requires a revalidator; configure one with Pantry.revalidator or pass one to this call";

    final ReentrantLock lock;
    /** 实际的底层容器，迭代顺序即写入顺序（覆盖写入会移到末尾） */
    final LinkedHashMap<K, CacheEntry<V>> data;

    final long ttlNanos;
    final long maximumSize;
    final boolean resetTtlOnGet;
    final boolean revalidateOnGet;

    final ResolverChain<K, V> resolvers;
    final ResolverChain<K, V> revalidators;

    final RemovalListener<? super K, ? super V> removalListener;
    final StatsCounter statsCounter;
    final boolean isRecordingStats;
    final KeepAlive keepAlive;
    final Executor executor;
    final Ticker ticker;

    transient Policy<K, V> policy;

    LocalCache(Pantry<K, V> builder) {
        this.lock = new ReentrantLock();
        this.data = new LinkedHashMap<>();
        this.ttlNanos = builder.getTtlNanos();
        this.maximumSize = builder.getMaximumSize();
        this.resetTtlOnGet = builder.resetTtlOnGet;
        this.revalidateOnGet = builder.revalidateOnGet;
        this.resolvers = new ResolverChain<>(builder.getResolvers(), "resolve");
        this.revalidators = new ResolverChain<>(builder.getRevalidators(), "revalidation");
        this.removalListener = builder.getRemovalListener();
        this.statsCounter = builder.getStatsCounterSupplier().get();
        this.isRecordingStats = builder.isRecordingStats();
        this.keepAlive = builder.getKeepAlive();
        this.executor = builder.getExecutor();
        this.ticker = builder.getTicker();
    }

    boolean evicts() {
        return this.maximumSize != Pantry.UNSET_INT;
    }

    /* --------------- 写入和淘汰 --------------- */

    @Override
    public CacheEntry<V> set(K key, V value) {
        Objects.requireNonNull(key);
        Objects.requireNonNull(value);

        List<Removal<K, V>> removals = new ArrayList<>(1);
        CacheEntry<V> entry;
        this.lock.lock();
        try {
            entry = this.write(key, value, removals);
        } finally {
            this.lock.unlock();
        }
        this.notifyRemovals(removals);
        return entry;
    }

    /**
     * 写入条目，调用方必须持有lock
     * 已满时先做淘汰扫描；覆盖写入先remove再put，保证data的迭代顺序就是写入顺序
     */
    CacheEntry<V> write(K key, V value, List<Removal<K, V>> removals) {
        if(this.evicts() && this.data.size() >= this.maximumSize)
            this.evictLeastRecentlyWritten(removals);

        CacheEntry<V> entry = new CacheEntry<>(this.ticker.read(), this.ttlNanos, value);
        CacheEntry<V> prior = this.data.remove(key);
        this.data.put(key, entry);
        if(prior != null)
            removals.add(new Removal<>(key, prior.value(), RemovalCause.REPLACED));
        return entry;
    }

    /**
     * 淘汰扫描，调用方必须持有lock
     * 一次遍历全部条目：记下writeTime最小的候选，同时把已经过期的条目顺手删掉；
     * 遍历结束后如果候选还在（没有因为过期被删），再把它删掉
     * 注意候选是按写入时间选的（least-recently-written），读取不会让条目变“新”
     */
    void evictLeastRecentlyWritten(List<Removal<K, V>> removals) {
        long now = this.ticker.read();
        K candidateKey = null;
        CacheEntry<V> candidate = null;

        Iterator<Map.Entry<K, CacheEntry<V>>> iterator = this.data.entrySet().iterator();
        while(iterator.hasNext()) {
            Map.Entry<K, CacheEntry<V>> node = iterator.next();
            CacheEntry<V> entry = node.getValue();
            // 相同writeTime时保留先遍历到的，也就是先写入的
            if(candidate == null || entry.writeTime() - candidate.writeTime() < 0) {
                candidateKey = node.getKey();
                candidate = entry;
            }
            if(entry.isExpired(now)) {
                iterator.remove();
                this.statsCounter.recordEviction(RemovalCause.EXPIRED);
                removals.add(new Removal<>(node.getKey(), entry.value(), RemovalCause.EXPIRED));
            }
        }

        if(candidateKey != null && this.data.remove(candidateKey, candidate)) {
            this.statsCounter.recordEviction(RemovalCause.SIZE);
            removals.add(new Removal<>(candidateKey, candidate.value(), RemovalCause.SIZE));
        }
    }

    /* --------------- 读取 --------------- */

    @Override
    public V getIfPresent(K key) {
        CacheEntry<V> entry = this.getIfUnexpired(key);
        return (entry == null) ? null : entry.value();
    }

    /**
     * 过期检查：不存在或已过期都算未命中，已过期的条目在这里被删除
     */
    CacheEntry<V> getIfUnexpired(K key) {
        Objects.requireNonNull(key);

        Removal<K, V> removal = null;
        CacheEntry<V> entry;
        this.lock.lock();
        try {
            entry = this.data.get(key);
            if(entry != null && entry.isExpired(this.ticker.read())) {
                this.data.remove(key);
                this.statsCounter.recordEviction(RemovalCause.EXPIRED);
                removal = new Removal<>(key, entry.value(), RemovalCause.EXPIRED);
                entry = null;
            }
        } finally {
            this.lock.unlock();
        }

        if(entry == null)
            this.statsCounter.recordMisses(1);
        else
            this.statsCounter.recordHits(1);
        if(removal != null)
            this.notifyRemovals(Collections.singletonList(removal));
        return entry;
    }

    @Override
    public CompletableFuture<V> get(K key) {
        return this.get(key, null, null);
    }

    @Override
    public CompletableFuture<V> get(K key, List<? extends AsyncResolver<? super K, V>> resolvers) {
        return this.get(key, resolvers, null);
    }

    @Override
    public CompletableFuture<V> get(K key,
                                    List<? extends AsyncResolver<? super K, V>> resolvers,
                                    List<? extends AsyncResolver<? super K, V>> revalidators) {
        ResolverChain<K, V> resolverChain = this.resolvers.orOverride(resolvers);
        ResolverChain<K, V> revalidatorChain = this.revalidators.orOverride(revalidators);

        CacheEntry<V> hit = this.getIfUnexpired(key);
        if(hit != null)
            return CompletableFuture.completedFuture(this.afterHit(key, hit, false, revalidatorChain));
        if(resolverChain.isEmpty())
            return CompletableFuture.completedFuture(null);

        long startTime = this.ticker.read();
        return resolverChain.apply(key, this.executor).thenApply(value -> {
            long resolveTime = Math.max(0L, this.ticker.read() - startTime);
            if(value == null) {
                this.statsCounter.recordResolveFailure(resolveTime);
                return null;
            }
            this.statsCounter.recordResolveSuccess(resolveTime);
            return this.afterHit(key, this.set(key, value), true, revalidatorChain);
        });
    }

    /**
     * 命中后的收尾：按配置刷新ttl，或在后台启动revalidation，返回命中的值
     * 刷新ttl对所有命中都生效，包括本次刚resolve出来的值（已满时这次重新写入同样会做淘汰扫描）
     * @param resolved 是否是本次调用刚resolve出来的值，这样的值不做revalidation
     */
    V afterHit(K key, CacheEntry<V> hit, boolean resolved, ResolverChain<K, V> revalidatorChain) {
        if(this.resetTtlOnGet)
            this.set(key, hit.value());
        if(this.revalidateOnGet && !resolved)
            this.revalidateInBackground(key, revalidatorChain);
        return hit.value();
    }

    /**
     * 把revalidation作为脱离调用方的后台任务提交到executor，调用方不等待，也看不到它的异常
     * 启动后的future交给KeepAlive钩子
     */
    void revalidateInBackground(K key, ResolverChain<K, V> revalidatorChain) {
        if(revalidatorChain.isEmpty()) {
            logger.log(Level.WARNING,
                    "revalidateOnGet is enabled but no revalidator is available; skipped {0}", key);
            return;
        }

        CompletableFuture<Void> task;
        try {
            task = CompletableFuture
                    .supplyAsync(() -> this.revalidate(key, revalidatorChain), this.executor)
                    .thenCompose(Function.identity());
        } catch (Throwable t) {
            logger.log(Level.WARNING, "Exception thrown when submitting background revalidation", t);
            return;
        }
        task.whenComplete((ignored, error) -> {
            if(error != null && Async.shouldLog(error))
                logger.log(Level.WARNING, "Exception thrown during background revalidation", Async.unwrap(error));
        });
        this.keepAlive.keepAlive(task);
    }

    /* --------------- revalidation --------------- */

    @Override
    public CompletableFuture<Void> revalidate(K key) {
        return this.revalidate(key, (List<? extends AsyncResolver<? super K, V>>)null);
    }

    @Override
    public CompletableFuture<Void> revalidate(K key, List<? extends AsyncResolver<? super K, V>> revalidators) {
        Objects.requireNonNull(key);
        return this.revalidate(key, this.revalidators.orOverride(revalidators));
    }

    /**
     * 没有revalidator时在启动任何异步操作之前就失败
     * 得到值则重新写入（刷新writeTime），否则无条件删除这个key
     */
    CompletableFuture<Void> revalidate(K key, ResolverChain<K, V> revalidatorChain) {
        Pantry.requireState(!revalidatorChain.isEmpty(), MISSING_REVALIDATOR);

        return revalidatorChain.apply(key, this.executor).thenAccept(value -> {
            if(value == null) {
                this.statsCounter.recordRevalidationFailure();
                this.remove(key, RemovalCause.INVALIDATED);
            }else {
                this.statsCounter.recordRevalidationSuccess();
                this.set(key, value);
            }
        });
    }

    /* --------------- 删除 --------------- */

    @Override
    public void delete(K key) {
        Objects.requireNonNull(key);
        this.remove(key, RemovalCause.EXPLICIT);
    }

    void remove(K key, RemovalCause cause) {
        CacheEntry<V> removed;
        this.lock.lock();
        try {
            removed = this.data.remove(key);
        } finally {
            this.lock.unlock();
        }
        if(removed != null)
            this.notifyRemovals(Collections.singletonList(new Removal<>(key, removed.value(), cause)));
    }

    @Override
    public void deleteAll() {
        List<Removal<K, V>> removals;
        this.lock.lock();
        try {
            removals = new ArrayList<>(this.data.size());
            for(Map.Entry<K, CacheEntry<V>> node : this.data.entrySet())
                removals.add(new Removal<>(node.getKey(), node.getValue().value(), RemovalCause.EXPLICIT));
            this.data.clear();
        } finally {
            this.lock.unlock();
        }
        this.notifyRemovals(removals);
    }

    @Override
    public void cleanUp() {
        List<Removal<K, V>> removals = new ArrayList<>();
        this.lock.lock();
        try {
            long now = this.ticker.read();
            Iterator<Map.Entry<K, CacheEntry<V>>> iterator = this.data.entrySet().iterator();
            while(iterator.hasNext()) {
                Map.Entry<K, CacheEntry<V>> node = iterator.next();
                if(node.getValue().isExpired(now)) {
                    iterator.remove();
                    this.statsCounter.recordEviction(RemovalCause.EXPIRED);
                    removals.add(new Removal<>(node.getKey(), node.getValue().value(), RemovalCause.EXPIRED));
                }
            }
        } finally {
            this.lock.unlock();
        }
        this.notifyRemovals(removals);
    }

    /* --------------- 观察 --------------- */

    @Override
    public long size() {
        this.lock.lock();
        try {
            return this.data.size();
        } finally {
            this.lock.unlock();
        }
    }

    @Override
    public CacheStats stats() {
        return this.statsCounter.snapshot();
    }

    @Override
    public Policy<K, V> policy() {
        return (this.policy == null) ? (this.policy = new LocalPolicy<>(this)) : this.policy;
    }

    /* --------------- removal通知 --------------- */

    boolean hasRemovalListener() {
        return this.removalListener != null;
    }

    /**
     * 异步地发送通知给RemovalListener，必须在释放lock之后调用
     */
    void notifyRemovals(List<Removal<K, V>> removals) {
        if(!this.hasRemovalListener() || removals.isEmpty())
            return;
        for(Removal<K, V> removal : removals)
            this.notifyRemoval(removal.key, removal.value, removal.cause);
    }

    void notifyRemoval(K key, V value, RemovalCause cause) {
        Pantry.requireState(this.hasRemovalListener(), "Notification should be guarded with a check");
        Runnable task = () -> {
            try {
                this.removalListener.onRemoval(key, value, cause);
            } catch (Throwable t) {
                logger.log(Level.WARNING, "Exception thrown by removal listener", t);
            }
        };
        try {
            this.executor.execute(task);
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Exception thrown when submitting removal listener", t);
            task.run(); // 同步执行
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{size=" + this.size() + ", stats=" + this.stats() + '}';
    }

    /**
     * 一次待派发的removal通知
     */
    static final class Removal<K, V> {
        final K key;
        final V value;
        final RemovalCause cause;

        Removal(K key, V value, RemovalCause cause) {
            this.key = key;
            this.value = value;
            this.cause = cause;
        }
    }

    /* --------------- Policy --------------- */

    static final class LocalPolicy<K, V> implements Policy<K, V> {
        final LocalCache<K, V> cache;

        LocalPolicy(LocalCache<K, V> cache) {
            this.cache = Objects.requireNonNull(cache);
        }

        @Override
        public boolean isRecordingStats() {
            return this.cache.isRecordingStats;
        }

        @Override
        public Duration ttl() {
            return Duration.ofNanos(this.cache.ttlNanos);
        }

        @Override
        public OptionalLong maximumSize() {
            return this.cache.evicts() ? OptionalLong.of(this.cache.maximumSize) : OptionalLong.empty();
        }

        @Override
        public boolean isResetTtlOnGet() {
            return this.cache.resetTtlOnGet;
        }

        @Override
        public boolean isRevalidateOnGet() {
            return this.cache.revalidateOnGet;
        }

        @Override
        public CacheEntry<V> getEntryQuietly(K key) {
            Objects.requireNonNull(key);
            this.cache.lock.lock();
            try {
                return this.cache.data.get(key);
            } finally {
                this.cache.lock.unlock();
            }
        }

        @Override
        public Map<K, V> oldest(int limit) {
            Pantry.requireArgument(limit >= 0, "limit cannot be negative: %s", limit);
            List<Map.Entry<K, CacheEntry<V>>> snapshot;
            this.cache.lock.lock();
            try {
                snapshot = new ArrayList<>(this.cache.data.entrySet());
            } finally {
                this.cache.lock.unlock();
            }
            // 稳定排序，writeTime相同时保持写入顺序
            snapshot.sort((a, b) -> Long.signum(a.getValue().writeTime() - b.getValue().writeTime()));

            Map<K, V> result = new LinkedHashMap<>(Math.min(limit, snapshot.size()));
            for(Map.Entry<K, CacheEntry<V>> node : snapshot) {
                if(result.size() >= limit)
                    break;
                result.put(node.getKey(), node.getValue().value());
            }
            return Collections.unmodifiableMap(result);
        }
    }
}
