package org.Aayush.roadnet.search;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Arrays;

/**
 * Indexed binary min-heap over dense node indices, keyed by a {@code double} priority.
 * <p>
 * <strong>Key Features:</strong>
 * <ul>
 * <li><strong>Primitive storage:</strong> heap slots, priorities and positions are plain arrays,
 * so a search allocates once per query rather than once per relaxation.</li>
 * <li><strong>Decrease-Key Support:</strong> O(log n) priority updates for nodes already queued,
 * via a position tracking array.</li>
 * <li><strong>Deterministic ties:</strong> equal priorities are ordered by node index.</li>
 * </ul>
 * </p>
 * <p><strong>Usage Warning:</strong> This class is NOT thread-safe. One instance per search.</p>
 */
public final class NodeHeap {

    // The Binary Heap (1-based indexing for easier parent/child math)
    private final int[] heap;
    private final double[] priority;
    // positions[node] = heap index, 0 when absent
    private final int[] positions;

    @Getter
    @Accessors(fluent = true)
    private int size = 0;

    /**
     * @param nodeCount number of addressable node indices; must be non-negative.
     */
    public NodeHeap(int nodeCount) {
        if (nodeCount < 0) {
            throw new IllegalArgumentException("nodeCount must be non-negative");
        }
        this.heap = new int[nodeCount + 1];
        this.priority = new double[nodeCount];
        this.positions = new int[nodeCount];
    }

    /**
     * Inserts a node, or lowers its priority when it is already queued with a higher one.
     *
     * @return {@code true} when the heap changed.
     * @throws IllegalArgumentException if node is out of bounds or priority is NaN.
     */
    public boolean insertOrDecrease(int node, double newPriority) {
        if (node < 0 || node >= positions.length) {
            throw new IllegalArgumentException("node " + node + " out of bounds (max: " + (positions.length - 1) + ")");
        }
        if (Double.isNaN(newPriority)) {
            throw new IllegalArgumentException("priority must not be NaN");
        }

        int existing = positions[node];
        if (existing > 0) {
            if (newPriority < priority[node]) {
                priority[node] = newPriority;
                swim(existing);
                return true;
            }
            return false;
        }

        size++;
        heap[size] = node;
        priority[node] = newPriority;
        positions[node] = size;
        swim(size);
        return true;
    }

    /**
     * Removes and returns the node with the lowest priority.
     *
     * @throws EmptyHeapException if the heap is empty.
     */
    public int pollMin() {
        if (isEmpty()) {
            throw new EmptyHeapException("Heap is empty");
        }
        int min = heap[1];
        int last = heap[size];
        heap[1] = last;
        positions[last] = 1;
        heap[size] = 0;
        size--;
        positions[min] = 0;
        if (size > 0) {
            sink(1);
        }
        return min;
    }

    /**
     * Priority of the current minimum without removing it.
     */
    public double peekPriority() {
        if (isEmpty()) {
            throw new EmptyHeapException("Heap is empty");
        }
        return priority[heap[1]];
    }

    public boolean contains(int node) {
        return node >= 0 && node < positions.length && positions[node] > 0;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Empties the heap so the instance can serve another search over the same graph.
     */
    public void clear() {
        for (int i = 1; i <= size; i++) {
            positions[heap[i]] = 0;
        }
        Arrays.fill(heap, 0, size + 1, 0);
        size = 0;
    }

    // --- Heap Helper Methods ---

    private void swim(int k) {
        while (k > 1 && greater(k / 2, k)) {
            swap(k, k / 2);
            k = k / 2;
        }
    }

    private void sink(int k) {
        while (2 * k <= size) {
            int j = 2 * k;
            if (j < size && greater(j, j + 1)) j++;
            if (!greater(k, j)) break;
            swap(k, j);
            k = j;
        }
    }

    private boolean greater(int i, int j) {
        int a = heap[i];
        int b = heap[j];
        int cmp = Double.compare(priority[a], priority[b]);
        return cmp > 0 || (cmp == 0 && a > b);
    }

    private void swap(int i, int j) {
        int a = heap[i];
        int b = heap[j];
        heap[i] = b;
        heap[j] = a;
        positions[a] = j;
        positions[b] = i;
    }
}
