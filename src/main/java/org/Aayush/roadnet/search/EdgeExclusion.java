package org.Aayush.roadnet.search;

import org.Aayush.roadnet.graph.RoadNetwork;

import java.util.BitSet;
import java.util.Objects;

/**
 * Immutable set of edge indices hidden from a search over one {@link RoadNetwork}.
 *
 * <p>This is the "removed edge" representation: the shared network stays untouched and
 * searches simply skip excluded indices, so concurrent readers of the same cached network
 * are never affected.</p>
 */
public final class EdgeExclusion {
    private static final EdgeExclusion NONE = new EdgeExclusion(new BitSet(0));

    private final BitSet excluded;

    private EdgeExclusion(BitSet excluded) {
        this.excluded = excluded;
    }

    /**
     * Overlay that excludes nothing.
     */
    public static EdgeExclusion none() {
        return NONE;
    }

    /**
     * Overlay excluding the given edge indices of {@code network}.
     *
     * @throws IndexOutOfBoundsException when an index does not belong to the network.
     */
    public static EdgeExclusion of(RoadNetwork network, int... edgeIndices) {
        Objects.requireNonNull(network, "network");
        BitSet bits = new BitSet(network.edgeCount());
        for (int edgeIndex : edgeIndices) {
            if (edgeIndex < 0 || edgeIndex >= network.edgeCount()) {
                throw new IndexOutOfBoundsException(
                        "Edge " + edgeIndex + " out of bounds [0, " + network.edgeCount() + ")");
            }
            bits.set(edgeIndex);
        }
        return new EdgeExclusion(bits);
    }

    public boolean isExcluded(int edgeIndex) {
        return excluded.get(edgeIndex);
    }

    public int excludedCount() {
        return excluded.cardinality();
    }

    public boolean isEmpty() {
        return excluded.isEmpty();
    }
}
