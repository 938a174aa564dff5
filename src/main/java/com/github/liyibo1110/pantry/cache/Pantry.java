package com.github.liyibo1110.pantry.cache;

import com.github.liyibo1110.pantry.cache.stats.ConcurrentStatsCounter;
import com.github.liyibo1110.pantry.cache.stats.StatsCounter;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.NonNull;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Cache的builder类，以及static工具（注意Pantry本身就是Builder）
 * 每个选项只能设置一次，build之后配置即不可变
 * <pre>{@code
 * Cache<String, User> users = Pantry.<String, User>newBuilder()
 *         .ttl(Duration.ofMinutes(5))
 *         .maximumSize(10_000)
 *         .resolver(localReplica::find)
 *         .resolver(remote::fetch)
 *         .revalidator(remote::fetch)
 *         .revalidateOnGet()
 *         .build();
 * }</pre>
 * @author liyibo
 * @date 2026-10-13 15:10
 */
public final class Pantry<K, V> {
    static final Supplier<StatsCounter> ENABLED_STATS_COUNTER_SUPPLIER = ConcurrentStatsCounter::new;

    static final int UNSET_INT = -1;

    long ttlNanos = UNSET_INT;
    long maximumSize = UNSET_INT;
    boolean resetTtlOnGet;
    boolean revalidateOnGet;

    final List<AsyncResolver<? super K, V>> resolvers = new ArrayList<>();
    final List<AsyncResolver<? super K, V>> revalidators = new ArrayList<>();

    RemovalListener<? super K, ? super V> removalListener;
    Supplier<StatsCounter> statsCounterSupplier;
    KeepAlive keepAlive;
    Executor executor;
    Ticker ticker;

    private Pantry() {}

    /**
     * 确保expression为true，否则抛IllegalArgumentException异常
     */
    static void requireArgument(boolean expression, String template, Object... args) {
        if(!expression)
            throw new IllegalArgumentException(String.format(template, args));
    }

    /**
     * 确保expression为true，否则抛IllegalStateException异常（带自定义信息）
     */
    static void requireState(boolean expression, String template, Object... args) {
        if(!expression)
            throw new IllegalStateException(String.format(template, args));
    }

    /**
     * 返回空的builder
     */
    public static <K, V> Pantry<K, V> newBuilder() {
        return new Pantry<>();
    }

    /**
     * 从PantrySpec实例中生成Pantry实例，resolver等函数类的配置仍需要在代码里补充
     */
    public static <K, V> Pantry<K, V> from(PantrySpec spec) {
        return spec.toBuilder();
    }

    /**
     * 从配置字符串中生成Pantry实例
     */
    public static <K, V> Pantry<K, V> from(String spec) {
        return from(PantrySpec.parse(spec));
    }

    /* --------------- 过期 --------------- */

    @CanIgnoreReturnValue
    public Pantry<K, V> ttl(Duration duration) {
        return this.ttl(saturatedToNanos(duration), TimeUnit.NANOSECONDS);
    }

    /**
     * 每个条目写入后的存活时长，条目的ttl在写入时从这里复制，不支持单个条目覆盖
     */
    @CanIgnoreReturnValue
    public Pantry<K, V> ttl(@NonNegative long duration, TimeUnit unit) {
        Objects.requireNonNull(unit);
        requireState(this.ttlNanos == UNSET_INT, "ttl was already set to %s ns", this.ttlNanos);
        requireArgument(duration >= 0, "duration cannot be negative: %s %s", duration, unit);
        this.ttlNanos = unit.toNanos(duration);
        return this;
    }

    boolean hasTtl() {
        return this.ttlNanos != UNSET_INT;
    }

    long getTtlNanos() {
        return this.ttlNanos;
    }

    /* --------------- 容量 --------------- */

    /**
     * 最大条目数，set时如果已满，会先做一次淘汰扫描：
     * 删除所有已过期的条目，并删除写入时间最早的那个条目（least-recently-written，不是按读取排序的LRU）
     */
    @CanIgnoreReturnValue
    public Pantry<K, V> maximumSize(long maximumSize) {
        requireState(this.maximumSize == UNSET_INT,
                "maximum size was already set to %s", this.maximumSize);
        requireArgument(maximumSize >= 1, "maximum size must be positive: %s", maximumSize);
        this.maximumSize = maximumSize;
        return this;
    }

    boolean evicts() {
        return this.maximumSize != UNSET_INT;
    }

    long getMaximumSize() {
        return this.maximumSize;
    }

    /* --------------- 读取时的行为 --------------- */

    /**
     * 每次命中都重新写入一次，刷新writeTime，从而延长过期时间，也让它成为最后被淘汰的条目
     */
    @CanIgnoreReturnValue
    public Pantry<K, V> resetTtlOnGet() {
        requireState(!this.resetTtlOnGet, "resetTtlOnGet was already set");
        this.resetTtlOnGet = true;
        return this;
    }

    /**
     * 每次命中（本次get刚resolve出来的值除外）都在后台启动一次revalidation，调用方不会等待它
     */
    @CanIgnoreReturnValue
    public Pantry<K, V> revalidateOnGet() {
        requireState(!this.revalidateOnGet, "revalidateOnGet was already set");
        this.revalidateOnGet = true;
        return this;
    }

    /* --------------- resolver和revalidator --------------- */

    /**
     * 追加一个resolver，未命中时按追加的顺序依次尝试，第一个给出值的胜出
     */
    @CanIgnoreReturnValue
    public Pantry<K, V> resolver(AsyncResolver<? super K, V> resolver) {
        this.resolvers.add(Objects.requireNonNull(resolver));
        return this;
    }

    @CanIgnoreReturnValue
    public Pantry<K, V> resolver(Resolver<? super K, V> resolver) {
        return this.resolver((AsyncResolver<? super K, V>)resolver);
    }

    @CanIgnoreReturnValue
    public Pantry<K, V> resolvers(List<? extends AsyncResolver<? super K, V>> resolvers) {
        for(AsyncResolver<? super K, V> resolver : resolvers)
            this.resolver(resolver);
        return this;
    }

    List<AsyncResolver<? super K, V>> getResolvers() {
        return Collections.unmodifiableList(new ArrayList<>(this.resolvers));
    }

    /**
     * 追加一个revalidator，语义和resolver一样：依次尝试，第一个给出值的胜出；都没有值时条目会被删除
     */
    @CanIgnoreReturnValue
    public Pantry<K, V> revalidator(AsyncResolver<? super K, V> revalidator) {
        this.revalidators.add(Objects.requireNonNull(revalidator));
        return this;
    }

    @CanIgnoreReturnValue
    public Pantry<K, V> revalidator(Resolver<? super K, V> revalidator) {
        return this.revalidator((AsyncResolver<? super K, V>)revalidator);
    }

    @CanIgnoreReturnValue
    public Pantry<K, V> revalidators(List<? extends AsyncResolver<? super K, V>> revalidators) {
        for(AsyncResolver<? super K, V> revalidator : revalidators)
            this.revalidator(revalidator);
        return this;
    }

    List<AsyncResolver<? super K, V>> getRevalidators() {
        return Collections.unmodifiableList(new ArrayList<>(this.revalidators));
    }

    /* --------------- 运行环境 --------------- */

    @CanIgnoreReturnValue
    public Pantry<K, V> executor(Executor executor) {
        requireState(this.executor == null, "executor was already set to %s", this.executor);
        this.executor = Objects.requireNonNull(executor);
        return this;
    }

    Executor getExecutor() {
        return (this.executor == null) ? ForkJoinPool.commonPool() : this.executor;
    }

    /**
     * 设置Ticker实例
     */
    @CanIgnoreReturnValue
    public Pantry<K, V> ticker(Ticker ticker) {
        // 限制了只能被设置1次
        requireState(this.ticker == null, "Ticker was already set to %s", this.ticker);
        this.ticker = Objects.requireNonNull(ticker);
        return this;
    }

    Ticker getTicker() {
        return (this.ticker == null) ? Ticker.systemTicker() : this.ticker;
    }

    /**
     * 后台revalidation启动后会交给这个钩子，由宿主环境负责让它跑完
     */
    @CanIgnoreReturnValue
    public Pantry<K, V> keepAlive(KeepAlive keepAlive) {
        requireState(this.keepAlive == null, "keep-alive hook was already set to %s", this.keepAlive);
        this.keepAlive = Objects.requireNonNull(keepAlive);
        return this;
    }

    KeepAlive getKeepAlive() {
        return (this.keepAlive == null)
                ? KeepAlive.disabledKeepAlive()
                : KeepAlive.guardedKeepAlive(this.keepAlive);
    }

    @CanIgnoreReturnValue
    public Pantry<K, V> removalListener(RemovalListener<? super K, ? super V> removalListener) {
        requireState(this.removalListener == null,
                "removal listener was already set to %s", this.removalListener);
        this.removalListener = Objects.requireNonNull(removalListener);
        return this;
    }

    RemovalListener<? super K, ? super V> getRemovalListener() {
        return this.removalListener;
    }

    /* --------------- 统计 --------------- */

    @CanIgnoreReturnValue
    public Pantry<K, V> recordStats() {
        requireState(this.statsCounterSupplier == null, "Statistics recording was already set");
        this.statsCounterSupplier = ENABLED_STATS_COUNTER_SUPPLIER;
        return this;
    }

    @CanIgnoreReturnValue
    public Pantry<K, V> recordStats(Supplier<? extends StatsCounter> statsCounterSupplier) {
        requireState(this.statsCounterSupplier == null, "Statistics recording was already set");
        Objects.requireNonNull(statsCounterSupplier);
        this.statsCounterSupplier = () -> StatsCounter.guardedStatsCounter(statsCounterSupplier.get());
        return this;
    }

    boolean isRecordingStats() {
        return this.statsCounterSupplier != null;
    }

    Supplier<StatsCounter> getStatsCounterSupplier() {
        return this.statsCounterSupplier == null
                ? StatsCounter::disabledStatsCounter
                : this.statsCounterSupplier;
    }

    /* --------------- build --------------- */

    @NonNull
    public Cache<K, V> build() {
        requireState(this.hasTtl(), "ttl is required");
        return new LocalCache<>(this);
    }

    /**
     * 在不抛出异常或发生溢出的情况下，返回Duration对应的纳秒数
     * 会将异常转换成最大最小值返回
     */
    private static long saturatedToNanos(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException tooBig) {
            return duration.isNegative() ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
    }

    @Override
    public String toString() {
        StringBuilder s = new StringBuilder(75);
        s.append(getClass().getSimpleName()).append('{');
        int baseLength = s.length();
        if(this.ttlNanos != UNSET_INT)
            s.append("ttl=").append(this.ttlNanos).append("ns, ");
        if(this.maximumSize != UNSET_INT)
            s.append("maximumSize=").append(this.maximumSize).append(", ");
        if(this.resetTtlOnGet)
            s.append("resetTtlOnGet, ");
        if(this.revalidateOnGet)
            s.append("revalidateOnGet, ");
        if(!this.resolvers.isEmpty())
            s.append("resolvers=").append(this.resolvers.size()).append(", ");
        if(!this.revalidators.isEmpty())
            s.append("revalidators=").append(this.revalidators.size()).append(", ");
        if(this.removalListener != null)
            s.append("removalListener, ");
        if(this.keepAlive != null)
            s.append("keepAlive, ");
        if(this.statsCounterSupplier != null)
            s.append("recordStats, ");

        if(s.length() > baseLength)
            s.setLength(s.length() - 2);

        return s.append('}').toString();
    }
}
