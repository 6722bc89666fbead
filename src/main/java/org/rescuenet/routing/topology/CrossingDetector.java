package org.rescuenet.routing.topology;

import lombok.experimental.UtilityClass;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.index.strtree.STRtree;
import org.rescuenet.routing.geo.GeoPoint;
import org.rescuenet.routing.graph.RoadEdge;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;

/**
 * Finds edges whose geometries cross without a node at the crossing.
 *
 * <p>A pair qualifies when the lines intersect in exactly one point, neither line merely touches the
 * other at an end, and no endpoint node is shared. Pairs come out ordered by (first id, second id).</p>
 */
@UtilityClass
public class CrossingDetector {

    /**
     * Detects crossings for one repair batch. Each edge appears in at most one pair so that every edge is
     * split at most once per batch; remaining crossings surface again in the next batch.
     *
     * @param edges accessible edges ordered by id.
     * @param limit maximum pairs to return.
     */
    public List<EdgeCrossing> detectBatch(List<RoadEdge> edges, int limit) {
        return scan(edges, limit, true);
    }

    /**
     * Counts every crossing pair, an edge may take part in several.
     */
    public int countAll(List<RoadEdge> edges) {
        return scan(edges, Integer.MAX_VALUE, false).size();
    }

    private List<EdgeCrossing> scan(List<RoadEdge> edges, int limit, boolean disjointPairs) {
        List<EdgeCrossing> crossings = new ArrayList<>();
        if (edges.size() < 2 || limit <= 0) {
            return crossings;
        }
        STRtree index = new STRtree();
        for (int i = 0; i < edges.size(); i++) {
            index.insert(edges.get(i).getGeometry().getEnvelopeInternal(), i);
        }
        BitSet used = new BitSet(edges.size());
        for (int i = 0; i < edges.size(); i++) {
            if (disjointPairs && used.get(i)) {
                continue;
            }
            RoadEdge first = edges.get(i);
            int self = i;
            @SuppressWarnings("unchecked")
            List<Integer> hits = index.query(first.getGeometry().getEnvelopeInternal());
            int[] candidates = hits.stream().mapToInt(Integer::intValue).filter(j -> j > self).toArray();
            Arrays.sort(candidates);
            for (int j : candidates) {
                if (disjointPairs && used.get(j)) {
                    continue;
                }
                RoadEdge second = edges.get(j);
                if (sharesEndpoint(first, second)) {
                    continue;
                }
                GeoPoint point = singleCrossing(first.getGeometry(), second.getGeometry());
                if (point == null) {
                    continue;
                }
                crossings.add(new EdgeCrossing(first, second, point));
                if (crossings.size() >= limit) {
                    return crossings;
                }
                if (disjointPairs) {
                    used.set(i);
                    used.set(j);
                    break;
                }
            }
        }
        return crossings;
    }

    static boolean sharesEndpoint(RoadEdge a, RoadEdge b) {
        return a.getFromNodeId() == b.getFromNodeId()
                || a.getFromNodeId() == b.getToNodeId()
                || a.getToNodeId() == b.getFromNodeId()
                || a.getToNodeId() == b.getToNodeId();
    }

    /**
     * @return the crossing point, or {@code null} unless the lines meet in exactly one interior point.
     */
    static GeoPoint singleCrossing(Geometry a, Geometry b) {
        if (!a.intersects(b) || a.touches(b)) {
            return null;
        }
        Geometry intersection = a.intersection(b);
        if (intersection.isEmpty() || !(intersection instanceof Point)) {
            return null;
        }
        return GeoPoint.of(intersection.getCoordinate());
    }
}
