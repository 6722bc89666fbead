package org.rescuenet.routing.search;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Arrays;

/**
 * Node-keyed min-priority queue for A* and Dijkstra.
 *
 * <ul>
 * <li>Decrease-key in O(log n) through a position table.</li>
 * <li>Entries are ordered by priority, then by node index. Node indices follow persisted id order, so equal
 * priorities expand the smaller node id first.</li>
 * <li>No allocation after construction.</li>
 * </ul>
 *
 * <p>Not thread-safe. One instance per search.</p>
 */
public class SearchQueue {

    // 1-based binary heap of node indices
    private final int[] heap;
    private final double[] priorities;
    // positions[node] = heap slot, 0 when absent
    private final int[] positions;

    @Getter
    @Accessors(fluent = true)
    private int size = 0;
    @Getter
    private int peakSize = 0;

    /**
     * @param nodeCount number of distinct node indices the queue may hold.
     */
    public SearchQueue(int nodeCount) {
        if (nodeCount < 0) {
            throw new IllegalArgumentException("nodeCount must be non-negative");
        }
        this.heap = new int[nodeCount + 1];
        this.priorities = new double[nodeCount];
        this.positions = new int[nodeCount];
    }

    /**
     * Inserts a node, or lowers its priority when it is already queued with a higher one.
     *
     * @return true when the queue changed.
     */
    public boolean insertOrDecrease(int node, double priority) {
        if (node < 0 || node >= positions.length) {
            throw new IllegalArgumentException("node " + node + " out of bounds (max: " + (positions.length - 1) + ")");
        }
        if (Double.isNaN(priority)) {
            throw new IllegalArgumentException("priority must not be NaN");
        }
        int existing = positions[node];
        if (existing > 0) {
            if (priority < priorities[node]) {
                priorities[node] = priority;
                swim(existing);
                return true;
            }
            return false;
        }
        size++;
        heap[size] = node;
        priorities[node] = priority;
        positions[node] = size;
        swim(size);
        if (size > peakSize) {
            peakSize = size;
        }
        return true;
    }

    /**
     * Removes and returns the node with the smallest priority.
     *
     * @throws EmptyQueueException if the queue is empty.
     */
    public int extractMin() {
        if (isEmpty()) {
            throw new EmptyQueueException("Queue is empty");
        }
        int min = heap[1];
        positions[min] = 0;
        if (size == 1) {
            size = 0;
            return min;
        }
        int last = heap[size];
        heap[1] = last;
        positions[last] = 1;
        size--;
        sink(1);
        return min;
    }

    /**
     * Priority of the head entry.
     */
    public double peekPriority() {
        if (isEmpty()) {
            throw new EmptyQueueException("Queue is empty");
        }
        return priorities[heap[1]];
    }

    public boolean contains(int node) {
        return node >= 0 && node < positions.length && positions[node] > 0;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public void clear() {
        for (int i = 1; i <= size; i++) {
            positions[heap[i]] = 0;
        }
        size = 0;
        Arrays.fill(priorities, 0.0d);
    }

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

    /**
     * Returns whether heap slot {@code i} ranks after slot {@code j}.
     */
    private boolean greater(int i, int j) {
        int a = heap[i];
        int b = heap[j];
        int byPriority = Double.compare(priorities[a], priorities[b]);
        if (byPriority != 0) {
            return byPriority > 0;
        }
        return a > b;
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
