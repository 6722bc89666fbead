package org.rescuenet.routing.core;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.rescuenet.routing.graph.RoadGraph;
import org.rescuenet.routing.heuristic.GoalBoundHeuristic;
import org.rescuenet.routing.search.SearchQueue;

import java.util.Arrays;

/**
 * Node-based A* over a loaded subgraph with precomputed arc costs.
 *
 * <p>Determinism:</p>
 * <ul>
 * <li>The frontier is ordered by {@code (g + h, node index)}; node index order is persisted id order.</li>
 * <li>A label is replaced only by a strictly lower {@code g}, so among equal-cost predecessors the first
 * discovered one is kept.</li>
 * <li>Arcs are expanded in edge id order.</li>
 * </ul>
 *
 * <p>The heuristic must be consistent; settled nodes are never reopened.</p>
 */
final class AStarSearch {
    private static final int NO_ARC = -1;

    private AStarSearch() {
    }

    /**
     * @param arcCosts cost per arc; non-finite entries are skipped.
     */
    static SearchOutcome run(
            RoadGraph graph,
            double[] arcCosts,
            GoalBoundHeuristic heuristic,
            int sourceNode,
            int targetNode
    ) {
        if (sourceNode == targetNode) {
            return new SearchOutcome(true, 0.0d, 1, new int[0]);
        }

        int nodeCount = graph.nodeCount();
        double[] gScore = new double[nodeCount];
        Arrays.fill(gScore, Double.POSITIVE_INFINITY);
        int[] parentArc = new int[nodeCount];
        Arrays.fill(parentArc, NO_ARC);
        boolean[] settled = new boolean[nodeCount];

        SearchQueue frontier = new SearchQueue(nodeCount);
        RoadGraph.ArcIterator arcs = graph.iterator();

        gScore[sourceNode] = 0.0d;
        frontier.insertOrDecrease(sourceNode, heuristic.estimateFromNode(sourceNode));

        int settledNodes = 0;
        while (!frontier.isEmpty()) {
            int node = frontier.extractMin();
            settled[node] = true;
            settledNodes++;
            if (node == targetNode) {
                return new SearchOutcome(true, gScore[node], settledNodes, buildArcPath(graph, parentArc, sourceNode, targetNode));
            }

            double g = gScore[node];
            arcs.resetForNode(node);
            while (arcs.hasNext()) {
                int arc = arcs.next();
                double arcCost = arcCosts[arc];
                if (!Double.isFinite(arcCost)) {
                    continue;
                }
                int next = graph.arcTarget(arc);
                if (settled[next]) {
                    continue;
                }
                double nextG = g + arcCost;
                if (nextG < gScore[next]) {
                    gScore[next] = nextG;
                    parentArc[next] = arc;
                    frontier.insertOrDecrease(next, nextG + heuristic.estimateFromNode(next));
                }
            }
        }
        return SearchOutcome.unreachable(settledNodes);
    }

    private static int[] buildArcPath(RoadGraph graph, int[] parentArc, int sourceNode, int targetNode) {
        IntArrayList reversed = new IntArrayList();
        int node = targetNode;
        while (node != sourceNode) {
            int arc = parentArc[node];
            if (arc == NO_ARC) {
                throw new IllegalStateException("broken predecessor chain at node index " + node);
            }
            reversed.add(arc);
            node = arcSource(graph, arc);
        }
        int[] path = new int[reversed.size()];
        for (int i = 0; i < path.length; i++) {
            path[i] = reversed.getInt(path.length - 1 - i);
        }
        return path;
    }

    /**
     * Origin node of an arc: the edge endpoint opposite to the arc target.
     */
    static int arcSource(RoadGraph graph, int arc) {
        var edge = graph.edge(graph.arcEdge(arc));
        long sourceId = graph.arcReversed(arc) ? edge.getToNodeId() : edge.getFromNodeId();
        return graph.nodeIndex(sourceId);
    }
}
