package org.rescuenet.routing.vrp;

import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.rescuenet.routing.geo.GeoPoint;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Indexed view of a {@link VrpProblem} shared by the construction and improvement phases.
 *
 * <p>Location indexes put depots first, then tasks in input order. Only vehicles with a known depot
 * take part; {@link #vehicleInputIndex(int)} maps them back to the input list.</p>
 */
@Getter
@Accessors(fluent = true)
final class VrpInstance {
    private static final double EPSILON = 1e-9d;

    private final List<VrpDepot> depots;
    private final List<VrpTask> tasks;
    private final List<VrpVehicle> vehicles;
    private final VrpConstraints constraints;
    private final int[] vehicleInputIndex;
    private final int[] vehicleDepotLocation;
    private final TravelMatrix[] vehicleMatrix;
    /** Rank of each task's priority, 0 for the most urgent level. */
    private final int[] priorityRank;
    private final int priorityLevels;

    VrpInstance(
            List<VrpDepot> depots,
            List<VrpTask> tasks,
            List<VrpVehicle> vehicles,
            int[] vehicleInputIndex,
            TravelMatrix[] vehicleMatrix,
            VrpConstraints constraints
    ) {
        this.depots = List.copyOf(depots);
        this.tasks = List.copyOf(tasks);
        this.vehicles = List.copyOf(vehicles);
        this.constraints = Objects.requireNonNull(constraints, "constraints");
        this.vehicleInputIndex = vehicleInputIndex;
        this.vehicleMatrix = vehicleMatrix;

        Object2IntOpenHashMap<String> depotIndex = new Object2IntOpenHashMap<>();
        depotIndex.defaultReturnValue(-1);
        for (int i = 0; i < depots.size(); i++) {
            depotIndex.put(depots.get(i).getId(), i);
        }
        this.vehicleDepotLocation = new int[vehicles.size()];
        for (int v = 0; v < vehicles.size(); v++) {
            int depot = depotIndex.getInt(vehicles.get(v).getDepotId());
            if (depot < 0) {
                throw new IllegalArgumentException("vehicle " + vehicles.get(v).getId() + " has unknown depot");
            }
            vehicleDepotLocation[v] = depot;
        }

        int[] distinct = tasks.stream().mapToInt(VrpTask::getPriority).distinct().sorted().toArray();
        this.priorityLevels = distinct.length;
        this.priorityRank = new int[tasks.size()];
        for (int t = 0; t < tasks.size(); t++) {
            int p = tasks.get(t).getPriority();
            int ascending = Arrays.binarySearch(distinct, p);
            priorityRank[t] = distinct.length - 1 - ascending;
        }
    }

    /**
     * @return depot locations followed by task locations.
     */
    static List<GeoPoint> locations(List<VrpDepot> depots, List<VrpTask> tasks) {
        List<GeoPoint> points = new ArrayList<>(depots.size() + tasks.size());
        depots.forEach(d -> points.add(d.getLocation()));
        tasks.forEach(t -> points.add(t.getLocation()));
        return points;
    }

    int taskCount() {
        return tasks.size();
    }

    int vehicleCount() {
        return vehicles.size();
    }

    int taskLocation(int task) {
        return depots.size() + task;
    }

    int vehicleInputIndex(int vehicle) {
        return vehicleInputIndex[vehicle];
    }

    int depotLocation(int vehicle) {
        return vehicleDepotLocation[vehicle];
    }

    double distanceKm(int vehicle, int fromLocation, int toLocation) {
        return vehicleMatrix[vehicle].distanceMeters(fromLocation, toLocation) / 1000.0d;
    }

    double travelMinutes(int vehicle, double distanceKm) {
        return distanceKm / vehicles.get(vehicle).getSpeedKmh() * 60.0d;
    }

    double cost(double distanceKm, double durationMinutes) {
        return constraints.getDistanceWeight() * distanceKm + constraints.getTimeWeight() * durationMinutes;
    }

    /**
     * Evaluates a stop sequence against capacity, reachability, distance, duration and, when enabled,
     * time windows.
     *
     * @param vehicle vehicle index.
     * @param sequence task indexes in visiting order.
     * @param timeWindows whether task windows are enforced.
     * @return totals, {@link RouteEvaluation#INFEASIBLE} when a limit is broken.
     */
    RouteEvaluation evaluate(int vehicle, IntList sequence, boolean timeWindows) {
        if (sequence.isEmpty()) {
            return RouteEvaluation.EMPTY;
        }
        VrpVehicle spec = vehicles.get(vehicle);
        int previous = vehicleDepotLocation[vehicle];
        double km = 0.0d;
        double clock = 0.0d;
        int load = 0;
        for (int k = 0; k < sequence.size(); k++) {
            int task = sequence.getInt(k);
            VrpTask visit = tasks.get(task);
            int location = taskLocation(task);
            double leg = distanceKm(vehicle, previous, location);
            if (!Double.isFinite(leg)) {
                return RouteEvaluation.INFEASIBLE;
            }
            km += leg;
            clock += travelMinutes(vehicle, leg);
            TimeWindow window = visit.getTimeWindow();
            if (timeWindows && window != null) {
                if (clock > window.endMinute() + EPSILON) {
                    return RouteEvaluation.INFEASIBLE;
                }
                clock = Math.max(clock, window.startMinute());
            }
            clock += visit.getServiceMinutes();
            load += visit.getDemand();
            previous = location;
        }
        if (constraints.isReturnToDepot()) {
            double leg = distanceKm(vehicle, previous, vehicleDepotLocation[vehicle]);
            if (!Double.isFinite(leg)) {
                return RouteEvaluation.INFEASIBLE;
            }
            km += leg;
            clock += travelMinutes(vehicle, leg);
        }
        if (load > spec.getCapacity()
                || km > spec.getMaxDistanceKm() + EPSILON
                || clock > spec.getMaxTimeMinutes() + EPSILON) {
            return RouteEvaluation.INFEASIBLE;
        }
        return new RouteEvaluation(true, km, clock, load, cost(km, clock));
    }

    RouteEvaluation evaluate(int vehicle, IntList sequence) {
        return evaluate(vehicle, sequence, constraints.isUseTimeWindows());
    }
}
