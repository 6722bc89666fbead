package org.rescuenet.routing.cost;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.rescuenet.routing.graph.RoadEdge;
import org.rescuenet.routing.hazard.HazardExposure;
import org.rescuenet.routing.vehicle.VehicleCapability;
import org.rescuenet.routing.vehicle.VehicleClassCatalog;

import java.util.Objects;

/**
 * Vehicle- and hazard-aware edge costing.
 *
 * <p>Evaluation order:</p>
 * <ol>
 * <li>Hard checks exclude the edge: gradient, water depth, width, clearance, weight, terrain.</li>
 * <li>Speed = min(vehicle max, edge limit or road-class default) x class factor x edge factor x global factor,
 * reduced by the hazard zone and floored at the configured minimum.</li>
 * <li>Traversal time is scaled by terrain and gradient factors (each at least 1.0).</li>
 * <li>Cost is the traversal time multiplied by high-risk and reconnaissance penalties.</li>
 * </ol>
 *
 * <p>Stateless and deterministic; safe to share between threads.</p>
 */
public final class CostModel {
    /** Smallest cost ever returned for a feasible edge. */
    public static final double MIN_EDGE_COST = 1.0e-6d;

    private static final double KMH_TO_MPS = 1.0d / 3.6d;

    @Getter
    @Accessors(fluent = true)
    private final CostModelConfig config;
    private final VehicleClassCatalog classCatalog;

    public CostModel(CostModelConfig config, VehicleClassCatalog classCatalog) {
        this.config = Objects.requireNonNull(config, "config").validate();
        this.classCatalog = Objects.requireNonNull(classCatalog, "classCatalog");
    }

    public static CostModel defaults() {
        return new CostModel(CostModelConfig.defaults(), VehicleClassCatalog.defaultCatalog());
    }

    /**
     * Costs one edge for one vehicle.
     *
     * @param exposure merged hazard exposure of the edge, {@link HazardExposure#NONE} when unaffected.
     */
    public EdgeCost evaluate(RoadEdge edge, VehicleCapability vehicle, HazardExposure exposure) {
        Objects.requireNonNull(edge, "edge");
        Objects.requireNonNull(vehicle, "vehicle");
        HazardExposure hazard = exposure == null ? HazardExposure.NONE : exposure;

        Infeasibility violation = checkFeasibility(edge, vehicle);
        if (violation != null) {
            return EdgeCost.infeasible(violation);
        }

        double speedKmh = baseSpeedKmh(edge, vehicle);
        if (speedKmh <= 0.0d) {
            return EdgeCost.infeasible(Infeasibility.ROAD_CLASS_PROHIBITED);
        }
        speedKmh *= 1.0d - (hazard.speedReductionPercent() / 100.0d);
        speedKmh = Math.max(speedKmh, config.getMinSpeedKmh());

        double etaSeconds = edge.getLengthMeters() / (speedKmh * KMH_TO_MPS);
        etaSeconds *= terrainFactor(edge, vehicle) * gradientFactor(edge, vehicle);

        double cost = etaSeconds;
        if (hazard.maxRiskLevel() > config.getRiskThreshold()) {
            cost *= config.getHighRiskPenalty();
        }
        if (hazard.unverified()) {
            cost *= config.getReconnaissancePenalty();
        }
        return EdgeCost.feasible(Math.max(cost, MIN_EDGE_COST), etaSeconds, speedKmh);
    }

    /**
     * Returns the first violated hard constraint, or {@code null} when the vehicle fits the edge.
     */
    Infeasibility checkFeasibility(RoadEdge edge, VehicleCapability vehicle) {
        if (!edge.isAccessible()) {
            return Infeasibility.EDGE_INACCESSIBLE;
        }
        Double gradient = edge.getMaxGradientPercent() != null
                ? edge.getMaxGradientPercent()
                : edge.getAvgGradientPercent();
        if (exceeds(gradient == null ? null : Math.abs(gradient), vehicle.getMaxGradientPercent())) {
            return Infeasibility.GRADIENT_EXCEEDED;
        }
        if (exceeds(edge.getWaterDepthMeters(), vehicle.getMaxWadingDepthMeters())) {
            return Infeasibility.WATER_TOO_DEEP;
        }
        if (exceeds(vehicle.getWidthMeters(), edge.getWidthMeters())) {
            return Infeasibility.TOO_WIDE;
        }
        if (exceeds(vehicle.getHeightMeters(), edge.getClearanceHeightMeters())) {
            return Infeasibility.TOO_TALL;
        }
        Double weightTons = vehicle.getWeightKg() == null ? null : vehicle.getWeightKg() / 1000.0d;
        if (exceeds(weightTons, edge.getMaxWeightTons())) {
            return Infeasibility.TOO_HEAVY;
        }
        if (!vehicle.permitsTerrain(edge.getTerrainType())) {
            return Infeasibility.TERRAIN_NOT_SUPPORTED;
        }
        return null;
    }

    double baseSpeedKmh(RoadEdge edge, VehicleCapability vehicle) {
        Double limit = edge.getMaxSpeedKmh();
        double roadSpeed = limit != null && limit > 0.0d ? limit : RoadClassSpeeds.defaultSpeedKmh(edge.getRoadClass());
        double speed = Math.min(vehicle.getMaxSpeedKmh(), roadSpeed);
        speed *= classCatalog.speedFactor(vehicle.getVehicleClass(), edge.getRoadClass());
        Double edgeFactor = edge.getSpeedFactors().get(vehicle.getVehicleClass());
        if (edgeFactor != null) {
            speed *= edgeFactor;
        }
        return speed * config.getSpeedFactor();
    }

    static double terrainFactor(RoadEdge edge, VehicleCapability vehicle) {
        Double override = vehicle.terrainCostOverride(edge.getTerrainType());
        return penalty(override != null ? override : edge.getTerrainCostFactor());
    }

    static double gradientFactor(RoadEdge edge, VehicleCapability vehicle) {
        if (vehicle.getGradientCostOverride() != null) {
            return penalty(vehicle.getGradientCostOverride());
        }
        if (edge.getGradientCostFactor() != null) {
            return penalty(edge.getGradientCostFactor());
        }
        if (edge.getAvgGradientPercent() == null) {
            return 1.0d;
        }
        double gradient = Math.abs(edge.getAvgGradientPercent());
        if (gradient > 15.0d) {
            return 2.0d;
        }
        if (gradient > 10.0d) {
            return 1.0d / 0.65d;
        }
        if (gradient > 5.0d) {
            return 1.25d;
        }
        return 1.0d;
    }

    private static double penalty(Double factor) {
        if (factor == null || !Double.isFinite(factor) || factor < 1.0d) {
            return 1.0d;
        }
        return factor;
    }

    private static boolean exceeds(Double value, Double limit) {
        return value != null && limit != null && value > limit;
    }
}
