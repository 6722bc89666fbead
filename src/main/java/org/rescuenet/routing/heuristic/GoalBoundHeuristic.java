package org.rescuenet.routing.heuristic;

/**
 * Immutable goal-bound heuristic estimator.
 *
 * <p>Hot path contract: {@link #estimateFromNode(int)} must avoid allocations.</p>
 */
@FunctionalInterface
public interface GoalBoundHeuristic {

    /**
     * Estimates remaining cost from a node to a pre-bound goal.
     *
     * @param nodeIndex source node index in the loaded subgraph.
     * @return admissible lower-bound estimate.
     */
    double estimateFromNode(int nodeIndex);
}
