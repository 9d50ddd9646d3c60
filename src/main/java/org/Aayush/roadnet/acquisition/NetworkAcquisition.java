package org.Aayush.roadnet.acquisition;

import com.google.common.base.Throwables;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.util.concurrent.ExecutionError;
import com.google.common.util.concurrent.UncheckedExecutionException;
import lombok.Builder;
import org.Aayush.roadnet.cache.ClockTicker;
import org.Aayush.roadnet.geo.GeoPoint;
import org.Aayush.roadnet.graph.RoadNetwork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Obtains a {@link RoadNetwork} for a (center, radius) query and caches it per
 * {@link NetworkCacheKey}.
 *
 * <p>Execution flow on a miss:</p>
 * <ul>
 * <li>Try the primary (provider-backed) source when one is configured.</li>
 * <li>On {@link MapDataProviderException} log and fall back to the synthesized grid.</li>
 * <li>Publish the network to every caller waiting on the same key.</li>
 * </ul>
 *
 * <p>Concurrency contract: the Guava cache holds one future per key, so concurrent callers
 * for a key share a single build. Builds run on the acquisition I/O executor and callers
 * only receive futures; no caller thread waits on provider I/O unless it joins. Entries
 * expire {@code networkTtl} after they were created, measured on the injected clock. A
 * failed build is dropped so the next request retries.</p>
 */
public final class NetworkAcquisition implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(NetworkAcquisition.class);

    public static final Duration DEFAULT_NETWORK_TTL = Duration.ofHours(1);
    public static final int DEFAULT_COORDINATE_PRECISION = 4;

    private final NetworkSource primarySource;
    private final NetworkSource fallbackSource;
    private final int coordinatePrecision;
    private final Executor ioExecutor;
    private final ExecutorService ownedIoExecutor;

    private final Cache<NetworkCacheKey, CompletableFuture<RoadNetwork>> networks;
    private final AtomicLong buildCount = new AtomicLong();
    private final AtomicLong fallbackCount = new AtomicLong();

    /**
     * @param primarySource live map-data source; {@code null} means always synthesize.
     * @param fallbackSource deterministic source; defaults to a default-shaped grid.
     * @param clock time source for expiry; defaults to the UTC system clock.
     * @param networkTtl cache lifetime per network; defaults to one hour.
     * @param coordinatePrecision decimal degrees kept in cache keys; defaults to 4.
     * @param ioExecutor executor running builds; when {@code null} an owned daemon pool is used.
     */
    @Builder
    public NetworkAcquisition(
            NetworkSource primarySource,
            NetworkSource fallbackSource,
            Clock clock,
            Duration networkTtl,
            Integer coordinatePrecision,
            Executor ioExecutor
    ) {
        this.primarySource = primarySource;
        this.fallbackSource = fallbackSource == null ? new GridNetworkSynthesizer() : fallbackSource;
        this.coordinatePrecision = coordinatePrecision == null ? DEFAULT_COORDINATE_PRECISION : coordinatePrecision;
        Duration ttl = networkTtl == null ? DEFAULT_NETWORK_TTL : networkTtl;
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("networkTtl must be > 0");
        }
        this.networks = CacheBuilder.newBuilder()
                .ticker(new ClockTicker(clock == null ? Clock.systemUTC() : clock))
                .expireAfterWrite(ttl)
                .build();

        if (ioExecutor == null) {
            this.ownedIoExecutor = Executors.newCachedThreadPool(acquisitionThreads());
            this.ioExecutor = ownedIoExecutor;
        } else {
            this.ownedIoExecutor = null;
            this.ioExecutor = ioExecutor;
        }
    }

    /**
     * Returns a future of the cached network for the query's key, starting a build on
     * first use.
     *
     * <p>Never fails because of provider problems; the fallback grid is used instead.
     * The returned future is private to the caller; completing or cancelling it does not
     * affect the cached entry.</p>
     */
    public CompletableFuture<RoadNetwork> acquireAsync(GeoPoint center, double radiusMeters) {
        Objects.requireNonNull(center, "center");
        NetworkCacheKey key = NetworkCacheKey.of(center, radiusMeters, coordinatePrecision);
        CompletableFuture<RoadNetwork> shared = sharedBuild(key, radiusMeters);
        return shared.whenComplete((network, failure) -> {
            if (failure != null) {
                networks.asMap().remove(key, shared);
            }
        });
    }

    /**
     * Blocking form of {@link #acquireAsync(GeoPoint, double)}.
     */
    public RoadNetwork acquire(GeoPoint center, double radiusMeters) {
        try {
            return acquireAsync(center, radiusMeters).join();
        } catch (CompletionException ex) {
            Throwables.throwIfUnchecked(ex.getCause());
            throw ex;
        }
    }

    private CompletableFuture<RoadNetwork> sharedBuild(NetworkCacheKey key, double radiusMeters) {
        CompletableFuture<RoadNetwork> cached = networks.getIfPresent(key);
        if (cached != null) {
            logger.debug("Network cache hit for {}", key);
            return cached;
        }
        try {
            return networks.get(key, () -> {
                logger.debug("Network cache miss for {}", key);
                return CompletableFuture.supplyAsync(() -> build(key, radiusMeters), ioExecutor);
            });
        } catch (UncheckedExecutionException | ExecutionError ex) {
            Throwables.throwIfUnchecked(ex.getCause());
            throw ex;
        } catch (ExecutionException ex) {
            Throwables.throwIfUnchecked(ex.getCause());
            throw new IllegalStateException("could not start network build for " + key, ex.getCause());
        }
    }

    private RoadNetwork build(NetworkCacheKey key, double radiusMeters) {
        buildCount.incrementAndGet();
        GeoPoint center = key.center();
        if (primarySource != null) {
            try {
                logger.info("Downloading road network for {}", key);
                return primarySource.load(center, radiusMeters);
            } catch (MapDataProviderException ex) {
                logger.warn("Map-data provider unavailable for {}, synthesizing grid: {}", key, ex.getMessage());
            }
        } else {
            logger.debug("No map-data provider configured, synthesizing grid for {}", key);
        }
        fallbackCount.incrementAndGet();
        return fallbackSource.load(center, radiusMeters);
    }

    /**
     * Drops one cached network. Returns whether an entry was present.
     */
    public boolean invalidate(GeoPoint center, double radiusMeters) {
        return networks.asMap().remove(NetworkCacheKey.of(center, radiusMeters, coordinatePrecision)) != null;
    }

    public void clear() {
        networks.invalidateAll();
    }

    /**
     * Number of cached or in-flight keys.
     */
    public int size() {
        networks.cleanUp();
        return Math.toIntExact(networks.size());
    }

    /**
     * Number of underlying builds started (cache misses).
     */
    public long buildCount() {
        return buildCount.get();
    }

    /**
     * Number of builds served by the fallback grid.
     */
    public long fallbackCount() {
        return fallbackCount.get();
    }

    @Override
    public void close() {
        if (ownedIoExecutor != null) {
            ownedIoExecutor.shutdownNow();
        }
    }

    private static ThreadFactory acquisitionThreads() {
        AtomicInteger sequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "roadnet-acquire-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
