package org.Aayush.roadnet.acquisition;

import org.Aayush.roadnet.capacity.CapacityModel;
import org.Aayush.roadnet.core.RoadNetworkException;
import org.Aayush.roadnet.geo.GeoPoint;
import org.Aayush.roadnet.graph.RoadNetwork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link NetworkSource} backed by a live {@link MapDataProvider}.
 *
 * <p>The provider call runs on a dedicated I/O pool and is bounded by {@code timeout}; a
 * timeout cancels the call and surfaces as {@link MapDataProviderException}. Returned raw
 * graphs are augmented with imputed speeds, travel times and capacities.</p>
 */
public final class ProviderNetworkSource implements NetworkSource, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ProviderNetworkSource.class);

    private final MapDataProvider provider;
    private final EdgeSpeedImputer speedImputer;
    private final CapacityModel capacityModel;
    private final Duration timeout;
    private final ExecutorService ioExecutor;

    public ProviderNetworkSource(
            MapDataProvider provider,
            EdgeSpeedImputer speedImputer,
            CapacityModel capacityModel,
            Duration timeout
    ) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.speedImputer = Objects.requireNonNull(speedImputer, "speedImputer");
        this.capacityModel = Objects.requireNonNull(capacityModel, "capacityModel").validate();
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
        this.ioExecutor = Executors.newCachedThreadPool(daemonThreads());
    }

    @Override
    public RoadNetwork load(GeoPoint center, double radiusMeters) {
        RawRoadGraph raw = fetchWithTimeout(center, radiusMeters);
        try {
            return toNetwork(raw, center, radiusMeters);
        } catch (RoadNetworkException ex) {
            throw new MapDataProviderException(
                    MapDataProviderException.REASON_BAD_RESPONSE,
                    "provider returned an inconsistent graph: " + ex.getMessage(),
                    ex
            );
        }
    }

    private RawRoadGraph fetchWithTimeout(GeoPoint center, double radiusMeters) {
        Future<RawRoadGraph> call = ioExecutor.submit(() -> provider.fetchDrivableNetwork(center, radiusMeters));
        try {
            RawRoadGraph raw = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (raw == null) {
                throw new MapDataProviderException(MapDataProviderException.REASON_BAD_RESPONSE, "provider returned null");
            }
            return raw;
        } catch (TimeoutException ex) {
            call.cancel(true);
            throw new MapDataProviderException(
                    MapDataProviderException.REASON_TIMEOUT,
                    "provider did not answer within " + timeout.toMillis() + " ms",
                    ex
            );
        } catch (InterruptedException ex) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new MapDataProviderException(MapDataProviderException.REASON_UNAVAILABLE, "interrupted while fetching", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof MapDataProviderException providerException) {
                throw providerException;
            }
            throw new MapDataProviderException(
                    MapDataProviderException.REASON_UNAVAILABLE,
                    "provider call failed: " + cause,
                    cause
            );
        }
    }

    RoadNetwork toNetwork(RawRoadGraph raw, GeoPoint center, double radiusMeters) {
        RoadNetwork.Builder builder = RoadNetwork.builder(center, radiusMeters, capacityModel);
        for (RawRoadGraph.RawNode node : raw.nodes()) {
            builder.addNode(node.id(), node.latitude(), node.longitude());
        }

        List<RawRoadGraph.RawEdge> edges = raw.edges();
        double[] speeds = speedImputer.imputeSpeeds(edges);
        for (int i = 0; i < edges.size(); i++) {
            RawRoadGraph.RawEdge edge = edges.get(i);
            builder.addEdge(edge.fromId(), edge.toId(), edge.lengthMeters(), speeds[i]);
        }

        RoadNetwork network = builder.build();
        logger.info("Network loaded from provider: {} nodes, {} edges", network.nodeCount(), network.edgeCount());
        return network;
    }

    @Override
    public void close() {
        ioExecutor.shutdownNow();
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "map-provider-io-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
