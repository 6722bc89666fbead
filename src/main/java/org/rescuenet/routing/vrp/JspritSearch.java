package org.rescuenet.routing.vrp;

import com.graphhopper.jsprit.core.algorithm.VehicleRoutingAlgorithm;
import com.graphhopper.jsprit.core.algorithm.box.Jsprit;
import com.graphhopper.jsprit.core.algorithm.listener.IterationStartsListener;
import com.graphhopper.jsprit.core.problem.Location;
import com.graphhopper.jsprit.core.problem.VehicleRoutingProblem;
import com.graphhopper.jsprit.core.problem.cost.AbstractForwardVehicleRoutingTransportCosts;
import com.graphhopper.jsprit.core.problem.driver.Driver;
import com.graphhopper.jsprit.core.problem.job.Job;
import com.graphhopper.jsprit.core.problem.job.Service;
import com.graphhopper.jsprit.core.problem.solution.SolutionCostCalculator;
import com.graphhopper.jsprit.core.problem.solution.VehicleRoutingProblemSolution;
import com.graphhopper.jsprit.core.problem.solution.route.activity.TourActivity;
import com.graphhopper.jsprit.core.problem.vehicle.Vehicle;
import com.graphhopper.jsprit.core.problem.vehicle.VehicleImpl;
import com.graphhopper.jsprit.core.problem.vehicle.VehicleTypeImpl;
import com.graphhopper.jsprit.core.util.Coordinate;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import lombok.extern.slf4j.Slf4j;
import org.rescuenet.routing.geo.GeoPoint;

import java.util.List;
import java.util.Random;

/**
 * Ruin-and-recreate search delegated to jsprit.
 *
 * <p>jsprit only proposes. Its initial solution and every solution discovered afterwards are re-checked
 * with {@link VrpInstance#evaluate}, trimmed where a vehicle limit jsprit does not model is broken, topped
 * up with unserved tasks and kept when better than the best so far.</p>
 *
 * <p>jsprit always runs the same fixed schedule; the solve budget only cuts it short. A larger budget
 * therefore sees a longer prefix of the same candidate sequence and never ends with a worse assignment.</p>
 */
@Slf4j
final class JspritSearch {
    private static final double UNASSIGNED_BASE_PENALTY = 1_000_000.0d;
    private static final double OVER_DISTANCE_PENALTY_PER_KM = 10_000.0d;
    private static final int SCHEDULE_ITERATIONS = 5_000;

    private final VrpInstance instance;
    private final boolean[] candidates;
    private final Object2IntMap<String> locationIndex = new Object2IntOpenHashMap<>();
    private final Object2IntMap<String> vehicleIndex = new Object2IntOpenHashMap<>();
    private final Object2IntMap<String> taskIndex = new Object2IntOpenHashMap<>();
    private final double[] unassignedPenalty;
    private Assignment best;
    private int candidatesSeen;

    /**
     * @param instance indexed problem.
     * @param candidates tasks some vehicle can serve on its own; the rest are never handed to jsprit.
     * @param incumbent best assignment before jsprit runs.
     */
    JspritSearch(VrpInstance instance, boolean[] candidates, Assignment incumbent) {
        this.instance = instance;
        this.candidates = candidates;
        this.best = incumbent;
        locationIndex.defaultReturnValue(-1);
        vehicleIndex.defaultReturnValue(-1);
        taskIndex.defaultReturnValue(-1);
        int levels = instance.priorityLevels();
        this.unassignedPenalty = new double[instance.taskCount()];
        // one more unassigned task always outweighs any mix of urgency bonuses
        for (int t = 0; t < unassignedPenalty.length; t++) {
            double urgency = (levels - 1 - instance.priorityRank()[t]) / (double) levels;
            unassignedPenalty[t] = UNASSIGNED_BASE_PENALTY * (instance.taskCount() + 1.0d + urgency);
        }
    }

    /**
     * Runs jsprit until its schedule ends or the budget is exhausted, one budget tick per iteration.
     */
    void search(SolveBudget budget, long seed) {
        VehicleRoutingProblem problem = buildProblem();
        if (problem.getJobs().isEmpty()) {
            return;
        }
        VehicleRoutingAlgorithm algorithm = Jsprit.Builder.newInstance(problem)
                .setRandom(new Random(seed))
                .setObjectiveFunction(objective())
                .buildAlgorithm();
        algorithm.setMaxIterations(SCHEDULE_ITERATIONS);
        algorithm.addListener((IterationStartsListener) (iteration, vrp, solutions) -> {
            if (iteration == 1) {
                solutions.forEach(this::consider);
            }
        });
        algorithm.setPrematureAlgorithmTermination(discovered -> {
            consider(discovered.getSolution());
            budget.tick();
            return budget.exhausted();
        });
        algorithm.searchSolutions();
        log.debug("jsprit re-checked {} candidate solutions", candidatesSeen);
    }

    /**
     * Best of the incumbent and every re-checked jsprit candidate.
     */
    Assignment best() {
        return best;
    }

    private void consider(VehicleRoutingProblemSolution solution) {
        if (solution == null) {
            return;
        }
        candidatesSeen++;
        Assignment candidate = toAssignment(solution);
        if (candidate.compareQuality(best) > 0) {
            best = candidate;
        }
    }

    private VehicleRoutingProblem buildProblem() {
        List<GeoPoint> points = VrpInstance.locations(instance.depots(), instance.tasks());
        Location[] locations = new Location[points.size()];
        for (int i = 0; i < points.size(); i++) {
            String id = "loc-" + i;
            locations[i] = Location.Builder.newInstance()
                    .setId(id)
                    .setCoordinate(Coordinate.newInstance(points.get(i).lon(), points.get(i).lat()))
                    .build();
            locationIndex.put(id, i);
        }

        VehicleRoutingProblem.Builder builder = VehicleRoutingProblem.Builder.newInstance();
        for (int v = 0; v < instance.vehicleCount(); v++) {
            VrpVehicle vehicle = instance.vehicles().get(v);
            VehicleTypeImpl type = VehicleTypeImpl.Builder.newInstance("type-" + vehicle.getId())
                    .addCapacityDimension(0, vehicle.getCapacity())
                    .build();
            Location depot = locations[instance.depotLocation(v)];
            VehicleImpl.Builder vehicleBuilder = VehicleImpl.Builder.newInstance(vehicle.getId())
                    .setType(type)
                    .setStartLocation(depot)
                    .setReturnToDepot(instance.constraints().isReturnToDepot())
                    .setEarliestStart(0.0d)
                    .setLatestArrival(vehicle.getMaxTimeMinutes());
            if (instance.constraints().isReturnToDepot()) {
                vehicleBuilder.setEndLocation(depot);
            }
            builder.addVehicle(vehicleBuilder.build());
            vehicleIndex.put(vehicle.getId(), v);
        }
        for (int t = 0; t < instance.taskCount(); t++) {
            if (!candidates[t]) {
                continue;
            }
            VrpTask task = instance.tasks().get(t);
            Service.Builder service = Service.Builder.newInstance(task.getId())
                    .setName(task.getId())
                    .addSizeDimension(0, task.getDemand())
                    .setServiceTime(task.getServiceMinutes())
                    .setLocation(locations[instance.taskLocation(t)]);
            TimeWindow window = task.getTimeWindow();
            if (instance.constraints().isUseTimeWindows() && window != null) {
                service.setTimeWindow(com.graphhopper.jsprit.core.problem.solution.route.activity.TimeWindow
                        .newInstance(window.startMinute(), window.endMinute()));
            }
            builder.addJob(service.build());
            taskIndex.put(task.getId(), t);
        }
        builder.setFleetSize(VehicleRoutingProblem.FleetSize.FINITE);
        builder.setRoutingCost(new InstanceCosts());
        return builder.build();
    }

    private SolutionCostCalculator objective() {
        return solution -> {
            double total = 0.0d;
            for (com.graphhopper.jsprit.core.problem.solution.route.VehicleRoute route : solution.getRoutes()) {
                total += routeObjective(route);
            }
            for (Job job : solution.getUnassignedJobs()) {
                total += unassignedPenalty[taskIndex.getInt(job.getId())];
            }
            return total;
        };
    }

    private double routeObjective(com.graphhopper.jsprit.core.problem.solution.route.VehicleRoute route) {
        int v = vehicleIndex.getInt(route.getVehicle().getId());
        int previous = instance.depotLocation(v);
        double km = 0.0d;
        double minutes = 0.0d;
        for (TourActivity activity : route.getActivities()) {
            int location = locationIndex.getInt(activity.getLocation().getId());
            km += instance.distanceKm(v, previous, location);
            minutes = activity.getEndTime();
            previous = location;
        }
        if (instance.constraints().isReturnToDepot()) {
            km += instance.distanceKm(v, previous, instance.depotLocation(v));
            minutes = route.getEnd().getArrTime();
        }
        double over = Math.max(0.0d, km - instance.vehicles().get(v).getMaxDistanceKm());
        return instance.cost(km, minutes) + over * OVER_DISTANCE_PENALTY_PER_KM;
    }

    private Assignment toAssignment(VehicleRoutingProblemSolution solution) {
        Assignment assignment = new Assignment(instance);
        for (com.graphhopper.jsprit.core.problem.solution.route.VehicleRoute route : solution.getRoutes()) {
            int v = vehicleIndex.getInt(route.getVehicle().getId());
            IntArrayList sequence = new IntArrayList();
            for (TourActivity activity : route.getActivities()) {
                if (activity instanceof TourActivity.JobActivity) {
                    Job job = ((TourActivity.JobActivity) activity).getJob();
                    sequence.add(taskIndex.getInt(job.getId()));
                }
            }
            RouteEvaluation evaluation = instance.evaluate(v, sequence);
            while (!evaluation.feasible() && !sequence.isEmpty()) {
                sequence.removeInt(sequence.size() - 1);
                evaluation = instance.evaluate(v, sequence);
            }
            assignment.setRoute(v, sequence, evaluation);
        }
        NeighborhoodSearch.reinsertUnserved(assignment, NeighborhoodSearch.insertionOrder(instance),
                SolveBudget.iterations(instance.taskCount()));
        return assignment;
    }

    /**
     * Distances and travel times straight from the instance matrices, in kilometers and minutes.
     */
    private final class InstanceCosts extends AbstractForwardVehicleRoutingTransportCosts {

        @Override
        public double getTransportTime(Location from, Location to, double departureTime, Driver driver, Vehicle vehicle) {
            int v = vehicle == null ? -1 : vehicleIndex.getInt(vehicle.getId());
            return v < 0 ? fastestMinutes(from, to) : instance.travelMinutes(v, km(v, from, to));
        }

        @Override
        public double getTransportCost(Location from, Location to, double departureTime, Driver driver, Vehicle vehicle) {
            int v = vehicle == null ? -1 : vehicleIndex.getInt(vehicle.getId());
            if (v < 0) {
                return instance.cost(shortestKm(from, to), fastestMinutes(from, to));
            }
            double km = km(v, from, to);
            return instance.cost(km, instance.travelMinutes(v, km));
        }

        public double getDistance(Location from, Location to, double departureTime, Vehicle vehicle) {
            int v = vehicle == null ? -1 : vehicleIndex.getInt(vehicle.getId());
            return v < 0 ? shortestKm(from, to) : km(v, from, to);
        }

        private double km(int v, Location from, Location to) {
            return instance.distanceKm(v, locationIndex.getInt(from.getId()), locationIndex.getInt(to.getId()));
        }

        private double shortestKm(Location from, Location to) {
            double best = Double.POSITIVE_INFINITY;
            for (int v = 0; v < instance.vehicleCount(); v++) {
                best = Math.min(best, km(v, from, to));
            }
            return best;
        }

        private double fastestMinutes(Location from, Location to) {
            double best = Double.POSITIVE_INFINITY;
            for (int v = 0; v < instance.vehicleCount(); v++) {
                best = Math.min(best, instance.travelMinutes(v, km(v, from, to)));
            }
            return best;
        }
    }
}
