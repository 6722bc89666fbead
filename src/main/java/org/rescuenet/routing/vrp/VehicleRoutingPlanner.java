package org.rescuenet.routing.vrp;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import lombok.extern.slf4j.Slf4j;
import org.rescuenet.routing.core.SingleRoutePlanner;
import org.rescuenet.routing.geo.GeoPoint;
import org.rescuenet.routing.vehicle.VehicleCapability;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Anytime multi-vehicle planner.
 *
 * <p>A priority-ordered cheapest-insertion construction is refined by local search (reinsertion,
 * relocate, swap, 2-opt) until no move helps, then by a fixed jsprit ruin-and-recreate schedule, while
 * the time budget and iteration cap last. Neither phase depends on the size of the budget, which only
 * decides where the candidate sequence is cut. A candidate replaces the incumbent only when it serves
 * more tasks, or more urgent tasks at equal coverage, or the same tasks at lower cost. Coverage therefore
 * never drops as the iteration cap grows. Interrupting the calling thread ends the search with the best
 * assignment found so far.</p>
 *
 * <p>In road-network mode the travel matrix is built inside the same deadline; pairs still missing when
 * it passes fall back to great-circle distances and the solution carries a warning.</p>
 *
 * <p>Tasks no vehicle can serve are reported unserved with a reason; they never fail the solve.</p>
 */
@Slf4j
public class VehicleRoutingPlanner {
    public static final String WARNING_UNKNOWN_DEPOT = "vehicle references unknown depot";
    public static final String WARNING_MATRIX_INCOMPLETE = "road travel matrix incomplete";
    public static final String WARNING_UNREACHABLE_PAIRS = "road travel matrix has unreachable pairs";
    public static final String WARNING_ESTIMATED_PAIRS = "road travel matrix has straight-line estimates";

    private final SingleRoutePlanner roadPlanner;

    /**
     * Planner limited to great-circle travel distances.
     */
    public VehicleRoutingPlanner() {
        this(null);
    }

    /**
     * @param roadPlanner planner backing {@link TravelMode#ROAD_NETWORK}, may be {@code null}.
     */
    public VehicleRoutingPlanner(SingleRoutePlanner roadPlanner) {
        this.roadPlanner = roadPlanner;
    }

    /**
     * Solves one multi-vehicle instance.
     *
     * @param problem depots, tasks, fleet and constraints.
     * @return best solution found within the budget.
     * @throws IllegalArgumentException when the instance is malformed.
     */
    public VrpSolution solve(VrpProblem problem) {
        validate(problem);
        VrpConstraints constraints = problem.getConstraints();
        SolveBudget budget = SolveBudget.start(constraints.getTimeLimit(), constraints.getMaxIterations());
        List<String> warnings = new ArrayList<>();

        Set<String> depotIds = new HashSet<>();
        problem.getDepots().forEach(d -> depotIds.add(d.getId()));
        List<VrpVehicle> usable = new ArrayList<>();
        IntArrayList inputIndex = new IntArrayList();
        for (int i = 0; i < problem.getVehicles().size(); i++) {
            VrpVehicle vehicle = problem.getVehicles().get(i);
            if (!depotIds.contains(vehicle.getDepotId())) {
                log.warn("Vehicle {} references unknown depot {}, left idle", vehicle.getId(), vehicle.getDepotId());
                warnings.add(WARNING_UNKNOWN_DEPOT + ": " + vehicle.getId());
                continue;
            }
            usable.add(vehicle);
            inputIndex.add(i);
        }

        TravelMatrix[] matrices = travelMatrices(problem, usable, budget, warnings);
        VrpInstance instance = new VrpInstance(
                problem.getDepots(), problem.getTasks(), usable, inputIndex.toIntArray(), matrices, constraints);

        Assignment best = NeighborhoodSearch.construct(instance);
        NeighborhoodSearch.improve(best, budget);

        if (instance.vehicleCount() > 0 && instance.taskCount() > 0 && !budget.exhausted()) {
            JspritSearch search = new JspritSearch(instance, servableAlone(instance), best);
            try {
                search.search(budget, constraints.getSeed());
            } catch (RuntimeException ex) {
                log.warn("Ruin-and-recreate search failed, keeping best assignment so far: {}", ex.getMessage(), ex);
                warnings.add("ruin-and-recreate search failed: " + ex.getMessage());
            }
            best = search.best();
        }

        VrpSolution solution = describe(problem, instance, best, budget.iterations(), warnings);
        log.info("VRP solved: {}/{} tasks served by {} vehicles, {} iterations",
                solution.getServedTasks(), solution.getTotalTasks(), solution.getVehiclesUsed(), solution.getIterations());
        return solution;
    }

    private TravelMatrix[] travelMatrices(
            VrpProblem problem,
            List<VrpVehicle> vehicles,
            SolveBudget budget,
            List<String> warnings
    ) {
        List<GeoPoint> locations = VrpInstance.locations(problem.getDepots(), problem.getTasks());
        VrpConstraints constraints = problem.getConstraints();
        TravelMatrix[] matrices = new TravelMatrix[vehicles.size()];
        if (constraints.getTravelMode() == TravelMode.GREAT_CIRCLE) {
            TravelMatrix shared = GreatCircleTravelMatrix.of(locations);
            Arrays.fill(matrices, shared);
            return matrices;
        }
        if (roadPlanner == null) {
            throw new IllegalStateException("road-network travel mode requires a single-route planner");
        }
        Map<VehicleCapability, RoadNetworkTravelMatrix> byCapability = new LinkedHashMap<>();
        for (int v = 0; v < vehicles.size(); v++) {
            VehicleCapability capability = vehicles.get(v).getCapability() == null
                    ? VehicleCapability.defaultVehicle()
                    : vehicles.get(v).getCapability();
            matrices[v] = byCapability.computeIfAbsent(capability, c -> RoadNetworkTravelMatrix.build(
                    locations, roadPlanner, c, constraints.getScenarioId(), constraints.getPolicy(), budget));
        }
        for (Map.Entry<VehicleCapability, RoadNetworkTravelMatrix> entry : byCapability.entrySet()) {
            RoadNetworkTravelMatrix matrix = entry.getValue();
            String vehicle = entry.getKey().getCode();
            if (matrix.greatCirclePairs() > 0) {
                warnings.add(WARNING_MATRIX_INCOMPLETE + ": " + matrix.greatCirclePairs()
                        + " pairs use great-circle distances for " + vehicle);
            }
            if (matrix.unreachablePairs() > 0) {
                warnings.add(WARNING_UNREACHABLE_PAIRS + ": " + matrix.unreachablePairs() + " for " + vehicle);
            }
            if (matrix.estimatedPairs() > 0) {
                warnings.add(WARNING_ESTIMATED_PAIRS + ": " + matrix.estimatedPairs() + " for " + vehicle);
            }
        }
        return matrices;
    }

    private static boolean[] servableAlone(VrpInstance instance) {
        boolean[] servable = new boolean[instance.taskCount()];
        for (int t = 0; t < servable.length; t++) {
            IntList single = IntList.of(t);
            for (int v = 0; v < instance.vehicleCount() && !servable[t]; v++) {
                servable[t] = instance.evaluate(v, single).feasible();
            }
        }
        return servable;
    }

    private static UnservedReason unservedReason(VrpInstance instance, int task) {
        int demand = instance.tasks().get(task).getDemand();
        boolean fits = false;
        for (VrpVehicle vehicle : instance.vehicles()) {
            fits |= demand <= vehicle.getCapacity();
        }
        if (!fits && instance.vehicleCount() > 0) {
            return UnservedReason.EXCEEDS_CAPACITY;
        }
        IntList single = IntList.of(task);
        boolean reachable = false;
        boolean inWindow = false;
        for (int v = 0; v < instance.vehicleCount(); v++) {
            reachable |= instance.evaluate(v, single, false).feasible();
            inWindow |= instance.evaluate(v, single).feasible();
        }
        if (!reachable) {
            return UnservedReason.UNREACHABLE;
        }
        if (!inWindow) {
            return UnservedReason.TIME_WINDOW;
        }
        return UnservedReason.FLEET_EXHAUSTED;
    }

    private static VrpSolution describe(
            VrpProblem problem,
            VrpInstance instance,
            Assignment assignment,
            int iterations,
            List<String> warnings
    ) {
        VehicleRoute[] routes = new VehicleRoute[problem.getVehicles().size()];
        for (int v = 0; v < instance.vehicleCount(); v++) {
            routes[instance.vehicleInputIndex(v)] = describeRoute(instance, v, assignment.route(v), assignment.evaluation(v));
        }
        VrpSolution.VrpSolutionBuilder solution = VrpSolution.builder();
        double distance = 0.0d;
        double makespan = 0.0d;
        double cost = 0.0d;
        int used = 0;
        for (int i = 0; i < routes.length; i++) {
            VehicleRoute route = routes[i];
            if (route == null) {
                VrpVehicle idle = problem.getVehicles().get(i);
                route = VehicleRoute.builder().vehicleId(idle.getId()).depotId(idle.getDepotId()).build();
            }
            solution.route(route);
            distance += route.getTotalDistanceKm();
            makespan = Math.max(makespan, route.getTotalDurationMinutes());
            cost += route.getCost();
            if (route.isUsed()) {
                used++;
            }
        }
        for (int t = 0; t < instance.taskCount(); t++) {
            if (!assignment.isServed(t)) {
                solution.unserved(new UnservedTask(instance.tasks().get(t).getId(), unservedReason(instance, t)));
            }
        }
        int total = instance.taskCount();
        int served = assignment.served();
        return solution
                .servedTasks(served)
                .totalTasks(total)
                .coverageRate(total == 0 ? 1.0d : (double) served / total)
                .vehiclesUsed(used)
                .totalDistanceKm(distance)
                .makespanMinutes(makespan)
                .totalCost(cost)
                .iterations(iterations)
                .warnings(warnings)
                .build();
    }

    private static VehicleRoute describeRoute(VrpInstance instance, int v, IntList sequence, RouteEvaluation evaluation) {
        VrpVehicle vehicle = instance.vehicles().get(v);
        boolean windows = instance.constraints().isUseTimeWindows();
        VehicleRoute.VehicleRouteBuilder route = VehicleRoute.builder()
                .vehicleId(vehicle.getId())
                .depotId(vehicle.getDepotId());
        int previous = instance.depotLocation(v);
        double clock = 0.0d;
        int load = 0;
        for (int k = 0; k < sequence.size(); k++) {
            int task = sequence.getInt(k);
            VrpTask visit = instance.tasks().get(task);
            int location = instance.taskLocation(task);
            double leg = instance.distanceKm(v, previous, location);
            clock += instance.travelMinutes(v, leg);
            double arrival = clock;
            if (windows && visit.getTimeWindow() != null) {
                clock = Math.max(clock, visit.getTimeWindow().startMinute());
            }
            double serviceStart = clock;
            clock += visit.getServiceMinutes();
            load += visit.getDemand();
            route.stop(RouteStop.builder()
                    .sequence(k + 1)
                    .taskId(visit.getId())
                    .location(visit.getLocation())
                    .demand(visit.getDemand())
                    .arrivalMinute(arrival)
                    .serviceStartMinute(serviceStart)
                    .departureMinute(clock)
                    .cumulativeLoad(load)
                    .legDistanceKm(leg)
                    .build());
            previous = location;
        }
        return route
                .totalDistanceKm(evaluation.distanceKm())
                .totalDurationMinutes(evaluation.durationMinutes())
                .totalLoad(evaluation.load())
                .cost(evaluation.cost())
                .build();
    }

    private static void validate(VrpProblem problem) {
        Objects.requireNonNull(problem, "problem");
        VrpConstraints constraints = Objects.requireNonNull(problem.getConstraints(), "constraints");
        if (constraints.getTimeLimit() == null || constraints.getTimeLimit().isNegative()) {
            throw new IllegalArgumentException("timeLimit must be non-negative");
        }
        if (constraints.getMaxIterations() < 0) {
            throw new IllegalArgumentException("maxIterations must be >= 0");
        }
        if (constraints.getDistanceWeight() < 0.0d || constraints.getTimeWeight() < 0.0d) {
            throw new IllegalArgumentException("cost weights must be >= 0");
        }
        Set<String> ids = new HashSet<>();
        for (VrpDepot depot : problem.getDepots()) {
            requireId(depot.getId(), "depot", ids);
            Objects.requireNonNull(depot.getLocation(), "depot location");
        }
        ids.clear();
        for (VrpTask task : problem.getTasks()) {
            requireId(task.getId(), "task", ids);
            Objects.requireNonNull(task.getLocation(), "task location");
            if (task.getDemand() < 0) {
                throw new IllegalArgumentException("task " + task.getId() + " demand must be >= 0");
            }
            if (!(task.getServiceMinutes() >= 0.0d)) {
                throw new IllegalArgumentException("task " + task.getId() + " serviceMinutes must be >= 0");
            }
        }
        ids.clear();
        for (VrpVehicle vehicle : problem.getVehicles()) {
            requireId(vehicle.getId(), "vehicle", ids);
            if (vehicle.getCapacity() < 0) {
                throw new IllegalArgumentException("vehicle " + vehicle.getId() + " capacity must be >= 0");
            }
            if (!(vehicle.getSpeedKmh() > 0.0d)) {
                throw new IllegalArgumentException("vehicle " + vehicle.getId() + " speedKmh must be > 0");
            }
            if (vehicle.getMaxDistanceKm() < 0.0d || vehicle.getMaxTimeMinutes() < 0.0d) {
                throw new IllegalArgumentException("vehicle " + vehicle.getId() + " limits must be >= 0");
            }
        }
    }

    private static void requireId(String id, String kind, Set<String> seen) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException(kind + " id must be non-blank");
        }
        if (!seen.add(id)) {
            throw new IllegalArgumentException("duplicate " + kind + " id: " + id);
        }
    }
}
