package org.Aayush.roadnet.cache;

import com.google.common.base.Throwables;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.util.concurrent.ExecutionError;
import com.google.common.util.concurrent.UncheckedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Time-bounded, size-bounded cache of derived analysis results.
 *
 * <p>Backed by a Guava {@link Cache}: entries expire {@code ttl} after they were written,
 * measured on the injected {@link Clock}, and the least recently used entries are evicted
 * once {@code maxEntries} is reached. Concurrent misses on one key run the producer once;
 * the other callers wait for its value. A failed producer stores nothing.</p>
 *
 * @param <V> cached value type.
 */
public final class AnalysisCache<V> {
    private static final Logger logger = LoggerFactory.getLogger(AnalysisCache.class);

    private final Cache<String, V> entries;

    public AnalysisCache(Clock clock, Duration ttl, long maxEntries) {
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be > 0");
        }
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be > 0, got " + maxEntries);
        }
        this.entries = CacheBuilder.newBuilder()
                .ticker(new ClockTicker(clock))
                .expireAfterWrite(ttl)
                .maximumSize(maxEntries)
                .recordStats()
                .build();
    }

    /**
     * Returns the live entry for {@code key}, or computes, stores and returns a new one.
     *
     * @param key cache key.
     * @param compute producer invoked on miss or expiry; must not return {@code null}.
     */
    public V getOrCompute(String key, Supplier<? extends V> compute) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(compute, "compute");
        try {
            return entries.get(key, () -> {
                logger.debug("Analysis cache miss for {}", key);
                return Objects.requireNonNull(compute.get(), "compute returned null");
            });
        } catch (UncheckedExecutionException | ExecutionError ex) {
            Throwables.throwIfUnchecked(ex.getCause());
            throw ex;
        } catch (ExecutionException ex) {
            Throwables.throwIfUnchecked(ex.getCause());
            throw new IllegalStateException("analysis for " + key + " failed", ex.getCause());
        }
    }

    public boolean invalidate(String key) {
        return entries.asMap().remove(key) != null;
    }

    /**
     * Drops {@code key} only while it still maps to {@code value}.
     */
    public boolean invalidate(String key, V value) {
        return entries.asMap().remove(key, value);
    }

    public void clear() {
        entries.invalidateAll();
    }

    public int size() {
        entries.cleanUp();
        return Math.toIntExact(entries.size());
    }

    /**
     * Number of times a producer has been invoked.
     */
    public long computeCount() {
        return entries.stats().loadCount();
    }

    /**
     * Cache key for a network analysis: location rounded to {@code precision} decimals
     * plus the radius truncated to whole meters.
     */
    public static String analysisKey(double latitude, double longitude, double radiusMeters, int precision) {
        if (precision < 0) {
            throw new IllegalArgumentException("precision must be >= 0, got " + precision);
        }
        String coordinate = "%." + precision + "f";
        return String.format(
                Locale.ROOT,
                "geometry_analysis:" + coordinate + ":" + coordinate + ":%d",
                latitude,
                longitude,
                (long) radiusMeters
        );
    }
}
