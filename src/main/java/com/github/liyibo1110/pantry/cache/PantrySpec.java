package com.github.liyibo1110.pantry.cache;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Pantry实例的规范构建器，主要功能是能支持纯字符串格式的解析并构建过程
 * 格式为逗号分隔的key=value，例如：ttl=10m,maximumSize=500,resetTtlOnGet,recordStats
 * 时长支持ISO-8601（PT10M）或者数字加单位（ms、s、m、h、d）
 * resolver、revalidator等函数类的配置没法用字符串表达，只能在builder上补充
 * @author liyibo
 * @date 2026-10-14 10:05
 */
public final class PantrySpec {
    static final String SPLIT_OPTIONS = ",";
    static final String SPLIT_KEY_VALUE = "=";

    final String specification;

    long maximumSize = Pantry.UNSET_INT;
    boolean resetTtlOnGet;
    boolean revalidateOnGet;
    boolean recordStats;
    Duration ttl;

    private PantrySpec(String specification) {
        this.specification = Objects.requireNonNull(specification);
    }

    /**
     * 以自身的配置，来构建Pantry实例
     */
    <K, V> Pantry<K, V> toBuilder() {
        Pantry<K, V> builder = Pantry.newBuilder();
        if(this.ttl != null)
            builder.ttl(this.ttl);
        if(this.maximumSize != Pantry.UNSET_INT)
            builder.maximumSize(this.maximumSize);
        if(this.resetTtlOnGet)
            builder.resetTtlOnGet();
        if(this.revalidateOnGet)
            builder.revalidateOnGet();
        if(this.recordStats)
            builder.recordStats();
        return builder;
    }

    /**
     * 根据给定的配置字符串，构建PantrySpec实例
     */
    public static PantrySpec parse(String specification) {
        PantrySpec spec = new PantrySpec(specification);
        for(String option : specification.split(SPLIT_OPTIONS))
            spec.parseOption(option.trim());
        return spec;
    }

    /**
     * 解析每一个配置（即每个逗号分隔出来的部分）
     */
    void parseOption(String option) {
        if(option.isEmpty())
            return;
        String[] keyAndValue = option.split(SPLIT_KEY_VALUE);
        Pantry.requireArgument(keyAndValue.length <= 2,
                "key-value pair %s with more than one equals sign", option);

        String key = keyAndValue[0].trim();
        String value = (keyAndValue.length == 1) ? null : keyAndValue[1].trim();
        this.configure(key, value);
    }

    /**
     * 加载某个配置
     */
    void configure(String key, @Nullable String value) {
        switch(key) {
            case "ttl":
                this.ttl(key, value);
                return;
            case "maximumSize":
                this.maximumSize(key, value);
                return;
            case "resetTtlOnGet":
                this.resetTtlOnGet(key, value);
                return;
            case "revalidateOnGet":
                this.revalidateOnGet(key, value);
                return;
            case "recordStats":
                this.recordStats(value);
                return;
            default:
                throw new IllegalArgumentException("Unknown key " + key);
        }
    }

    void ttl(String key, @Nullable String value) {
        Pantry.requireArgument(this.ttl == null, "ttl was already set");
        this.ttl = parseDuration(key, value);
    }

    void maximumSize(String key, @Nullable String value) {
        Pantry.requireArgument(this.maximumSize == Pantry.UNSET_INT,
                "maximum size was already set to %,d", this.maximumSize);
        this.maximumSize = parseLong(key, value);
    }

    void resetTtlOnGet(String key, @Nullable String value) {
        Pantry.requireArgument(value == null, "%s does not take a value", key);
        Pantry.requireArgument(!this.resetTtlOnGet, "%s was already set", key);
        this.resetTtlOnGet = true;
    }

    void revalidateOnGet(String key, @Nullable String value) {
        Pantry.requireArgument(value == null, "%s does not take a value", key);
        Pantry.requireArgument(!this.revalidateOnGet, "%s was already set", key);
        this.revalidateOnGet = true;
    }

    void recordStats(@Nullable String value) {
        Pantry.requireArgument(value == null, "record stats does not take a value");
        Pantry.requireArgument(!this.recordStats, "record stats was already set");
        this.recordStats = true;
    }

    /**
     * 将value转换成long
     */
    static long parseLong(String key, @Nullable String value) {
        Pantry.requireArgument(value != null && !value.isEmpty(), "value of key %s was omitted", key);
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("key %s value was set to %s, must be a long", key, value), e);
        }
    }

    /**
     * 将value转换成Duration实例
     */
    static Duration parseDuration(String key, @Nullable String value) {
        Pantry.requireArgument(value != null && !value.isEmpty(), "value of key %s was omitted", key);
        boolean isIsoFormat = value.contains("p") || value.contains("P");
        if(isIsoFormat) {
            Duration duration = Duration.parse(value);
            Pantry.requireArgument(!duration.isNegative(),
                    "key %s invalid format; was %s, but the duration cannot be negative", key, value);
            return duration;
        }

        TimeUnit unit = parseTimeUnit(key, value);
        int suffixLength = (unit == TimeUnit.MILLISECONDS) ? 2 : 1;
        long duration = parseLong(key, value.substring(0, value.length() - suffixLength));
        Pantry.requireArgument(duration >= 0,
                "key %s invalid format; was %s, but the duration cannot be negative", key, value);
        return Duration.ofNanos(unit.toNanos(duration));
    }

    /**
     * 将value转换成TimeUnit实例
     */
    static TimeUnit parseTimeUnit(String key, @Nullable String value) {
        Pantry.requireArgument((value != null) && !value.isEmpty(), "value of key %s omitted", key);
        String lower = value.toLowerCase(Locale.US);
        if(lower.endsWith("ms"))
            return TimeUnit.MILLISECONDS;
        char lastChar = lower.charAt(lower.length() - 1);
        switch(lastChar) {
            case 'd':
                return TimeUnit.DAYS;
            case 'h':
                return TimeUnit.HOURS;
            case 'm':
                return TimeUnit.MINUTES;
            case 's':
                return TimeUnit.SECONDS;
            default:
                throw new IllegalArgumentException(String.format(
                        "key %s invalid format; was %s, must end with one of [ms, s, m, h, d]", key, value));
        }
    }

    public String toParsableString() {
        return this.specification;
    }

    @Override
    public boolean equals(Object obj) {
        if(this == obj)
            return true;
        else if(!(obj instanceof PantrySpec))
            return false;
        PantrySpec spec = (PantrySpec)obj;
        return Objects.equals(this.ttl, spec.ttl)
                && (this.maximumSize == spec.maximumSize)
                && (this.resetTtlOnGet == spec.resetTtlOnGet)
                && (this.revalidateOnGet == spec.revalidateOnGet)
                && (this.recordStats == spec.recordStats);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.ttl, this.maximumSize, this.resetTtlOnGet, this.revalidateOnGet, this.recordStats);
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + '{' + this.toParsableString() + '}';
    }
}
