package org.rescuenet.routing.graph;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.locationtech.jts.geom.LineString;

import java.util.Map;

/**
 * Persisted road edge.
 *
 * <p>Geometry runs from {@code fromNodeId} to {@code toNodeId} in lon/lat degrees. Nullable numeric
 * attributes mean "unknown": the cost model treats them as neutral and feasibility checks skip
 * them.</p>
 */
@Value
@Builder(toBuilder = true)
public class RoadEdge {
    long id;
    long fromNodeId;
    long toNodeId;
    LineString geometry;
    /** OSM-style road class, e.g. {@code primary} or {@code track}. */
    String roadClass;
    boolean oneway;
    /** Posted or inferred speed limit in km/h. */
    Double maxSpeedKmh;
    double lengthMeters;
    Double elevationGainMeters;
    Double elevationLossMeters;
    Double avgGradientPercent;
    Double maxGradientPercent;
    String terrainType;
    /** Pre-computed multiplicative terrain penalty (>= 1.0). */
    Double terrainCostFactor;
    /** Pre-computed multiplicative gradient penalty (>= 1.0). */
    Double gradientCostFactor;
    /** Speed factor per vehicle class code. */
    @Singular
    Map<String, Double> speedFactors;
    double baseCost;
    @Builder.Default
    boolean accessible = true;
    Double widthMeters;
    Double clearanceHeightMeters;
    Double maxWeightTons;
    /** Depth of water to wade through on this edge (fords, flooded sections). */
    Double waterDepthMeters;
    @Singular
    Map<String, String> properties;

    public String property(String key) {
        return properties.get(key);
    }
}
