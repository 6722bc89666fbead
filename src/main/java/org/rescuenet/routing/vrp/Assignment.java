package org.rescuenet.routing.vrp;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.Arrays;

/**
 * Mutable task-to-vehicle assignment with cached route evaluations.
 *
 * <p>Quality is lexicographic: served count, then served tasks per priority level from the most urgent
 * level down, then lower cost.</p>
 */
final class Assignment {
    private static final double COST_EPSILON = 1e-9d;

    private final VrpInstance instance;
    private final IntArrayList[] routes;
    private final RouteEvaluation[] evaluations;
    private final int[] taskVehicle;
    private final int[] servedByRank;
    private int served;

    Assignment(VrpInstance instance) {
        this.instance = instance;
        this.routes = new IntArrayList[instance.vehicleCount()];
        this.evaluations = new RouteEvaluation[instance.vehicleCount()];
        for (int v = 0; v < routes.length; v++) {
            routes[v] = new IntArrayList();
            evaluations[v] = RouteEvaluation.EMPTY;
        }
        this.taskVehicle = new int[instance.taskCount()];
        Arrays.fill(taskVehicle, -1);
        this.servedByRank = new int[instance.priorityLevels()];
    }

    Assignment copy() {
        Assignment copy = new Assignment(instance);
        for (int v = 0; v < routes.length; v++) {
            copy.routes[v].addAll(routes[v]);
            copy.evaluations[v] = evaluations[v];
        }
        System.arraycopy(taskVehicle, 0, copy.taskVehicle, 0, taskVehicle.length);
        System.arraycopy(servedByRank, 0, copy.servedByRank, 0, servedByRank.length);
        copy.served = served;
        return copy;
    }

    VrpInstance instance() {
        return instance;
    }

    IntList route(int vehicle) {
        return routes[vehicle];
    }

    RouteEvaluation evaluation(int vehicle) {
        return evaluations[vehicle];
    }

    boolean isServed(int task) {
        return taskVehicle[task] >= 0;
    }

    int served() {
        return served;
    }

    double cost() {
        double total = 0.0d;
        for (RouteEvaluation evaluation : evaluations) {
            total += evaluation.cost();
        }
        return total;
    }

    /**
     * Replaces a vehicle's sequence. The caller guarantees the evaluation belongs to the sequence.
     */
    void setRoute(int vehicle, IntList sequence, RouteEvaluation evaluation) {
        IntArrayList previous = routes[vehicle];
        for (int k = 0; k < previous.size(); k++) {
            unmark(previous.getInt(k), vehicle);
        }
        IntArrayList next = new IntArrayList(sequence);
        for (int k = 0; k < next.size(); k++) {
            mark(next.getInt(k), vehicle);
        }
        routes[vehicle] = next;
        evaluations[vehicle] = evaluation;
    }

    /**
     * Inserts a task at its cheapest feasible position over all vehicles.
     *
     * @return {@code true} when the task was placed.
     */
    boolean insertCheapest(int task) {
        int bestVehicle = -1;
        IntArrayList bestSequence = null;
        RouteEvaluation bestEvaluation = null;
        double bestDelta = Double.POSITIVE_INFINITY;
        for (int v = 0; v < routes.length; v++) {
            IntArrayList route = routes[v];
            for (int position = 0; position <= route.size(); position++) {
                IntArrayList candidate = new IntArrayList(route.size() + 1);
                candidate.addAll(route);
                candidate.add(position, task);
                RouteEvaluation evaluation = instance.evaluate(v, candidate);
                if (!evaluation.feasible()) {
                    continue;
                }
                double delta = evaluation.cost() - evaluations[v].cost();
                if (delta < bestDelta - COST_EPSILON) {
                    bestDelta = delta;
                    bestVehicle = v;
                    bestSequence = candidate;
                    bestEvaluation = evaluation;
                }
            }
        }
        if (bestVehicle < 0) {
            return false;
        }
        setRoute(bestVehicle, bestSequence, bestEvaluation);
        return true;
    }

    /**
     * Compares quality with another assignment of the same instance.
     *
     * @return positive when this assignment is strictly better, negative when worse, 0 when equal.
     */
    int compareQuality(Assignment other) {
        int servedDiff = Integer.compare(served, other.served);
        if (servedDiff != 0) {
            return servedDiff;
        }
        for (int rank = 0; rank < servedByRank.length; rank++) {
            int diff = Integer.compare(servedByRank[rank], other.servedByRank[rank]);
            if (diff != 0) {
                return diff;
            }
        }
        double mine = cost();
        double theirs = other.cost();
        if (mine < theirs - COST_EPSILON) {
            return 1;
        }
        if (theirs < mine - COST_EPSILON) {
            return -1;
        }
        return 0;
    }

    private void mark(int task, int vehicle) {
        if (taskVehicle[task] < 0) {
            served++;
            servedByRank[instance.priorityRank()[task]]++;
        }
        taskVehicle[task] = vehicle;
    }

    private void unmark(int task, int vehicle) {
        // the task may already have moved to another vehicle
        if (taskVehicle[task] != vehicle) {
            return;
        }
        served--;
        servedByRank[instance.priorityRank()[task]]--;
        taskVehicle[task] = -1;
    }
}
