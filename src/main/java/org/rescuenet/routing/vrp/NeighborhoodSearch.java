package org.rescuenet.routing.vrp;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import lombok.experimental.UtilityClass;

import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Priority-ordered cheapest insertion and first-improvement local search.
 *
 * <p>Every accepted move strictly improves {@link Assignment#compareQuality(Assignment)}, so the
 * assignment only gets better as the budget grows.</p>
 */
@UtilityClass
class NeighborhoodSearch {
    private static final double COST_EPSILON = 1e-9d;

    /**
     * Task order for insertion: most urgent first, then earliest window close, then largest demand,
     * then input order.
     */
    int[] insertionOrder(VrpInstance instance) {
        boolean windows = instance.constraints().isUseTimeWindows();
        return IntStream.range(0, instance.taskCount())
                .boxed()
                .sorted(Comparator.<Integer>comparingInt(t -> instance.priorityRank()[t])
                        .thenComparingDouble(t -> windowClose(instance.tasks().get(t), windows))
                        .thenComparing(Comparator.<Integer>comparingInt(t -> instance.tasks().get(t).getDemand()).reversed())
                        .thenComparingInt(t -> t))
                .mapToInt(Integer::intValue)
                .toArray();
    }

    Assignment construct(VrpInstance instance) {
        Assignment assignment = new Assignment(instance);
        for (int task : insertionOrder(instance)) {
            assignment.insertCheapest(task);
        }
        return assignment;
    }

    /**
     * Applies reinsertion, relocate, swap and 2-opt moves until none improves or the budget runs out.
     */
    void improve(Assignment assignment, SolveBudget budget) {
        int[] order = insertionOrder(assignment.instance());
        while (!budget.exhausted()) {
            boolean improved = reinsertUnserved(assignment, order, budget)
                    || relocate(assignment, budget)
                    || swap(assignment, budget)
                    || twoOpt(assignment, budget);
            if (!improved) {
                return;
            }
        }
    }

    /**
     * Places unserved tasks, evicting a less urgent task when that is the only way in.
     */
    boolean reinsertUnserved(Assignment assignment, int[] order, SolveBudget budget) {
        boolean improved = false;
        for (int task : order) {
            if (budget.exhausted()) {
                break;
            }
            if (assignment.isServed(task)) {
                continue;
            }
            if (assignment.insertCheapest(task) || exchange(assignment, task)) {
                budget.tick();
                improved = true;
            }
        }
        return improved;
    }

    boolean relocate(Assignment assignment, SolveBudget budget) {
        VrpInstance instance = assignment.instance();
        int vehicles = instance.vehicleCount();
        for (int v1 = 0; v1 < vehicles && !budget.exhausted(); v1++) {
            IntList source = assignment.route(v1);
            double sourceCost = assignment.evaluation(v1).cost();
            for (int i = 0; i < source.size(); i++) {
                int task = source.getInt(i);
                IntArrayList removed = new IntArrayList(source);
                removed.removeInt(i);
                RouteEvaluation shortened = instance.evaluate(v1, removed);
                if (!shortened.feasible()) {
                    continue;
                }
                for (int v2 = 0; v2 < vehicles; v2++) {
                    IntList base = v2 == v1 ? removed : assignment.route(v2);
                    for (int j = 0; j <= base.size(); j++) {
                        if (v2 == v1 && j == i) {
                            continue;
                        }
                        IntArrayList candidate = new IntArrayList(base);
                        candidate.add(j, task);
                        RouteEvaluation extended = instance.evaluate(v2, candidate);
                        if (!extended.feasible()) {
                            continue;
                        }
                        double delta = v2 == v1
                                ? extended.cost() - sourceCost
                                : extended.cost() - assignment.evaluation(v2).cost() + shortened.cost() - sourceCost;
                        if (delta < -COST_EPSILON) {
                            if (v2 != v1) {
                                assignment.setRoute(v1, removed, shortened);
                            }
                            assignment.setRoute(v2, candidate, extended);
                            budget.tick();
                            return true;
                        }
                    }
                }
            }
        }
        return false;
    }

    boolean swap(Assignment assignment, SolveBudget budget) {
        VrpInstance instance = assignment.instance();
        int vehicles = instance.vehicleCount();
        for (int v1 = 0; v1 < vehicles && !budget.exhausted(); v1++) {
            IntList first = assignment.route(v1);
            for (int v2 = v1 + 1; v2 < vehicles; v2++) {
                IntList second = assignment.route(v2);
                double before = assignment.evaluation(v1).cost() + assignment.evaluation(v2).cost();
                for (int i = 0; i < first.size(); i++) {
                    for (int j = 0; j < second.size(); j++) {
                        IntArrayList a = new IntArrayList(first);
                        IntArrayList b = new IntArrayList(second);
                        a.set(i, second.getInt(j));
                        b.set(j, first.getInt(i));
                        RouteEvaluation ea = instance.evaluate(v1, a);
                        if (!ea.feasible()) {
                            continue;
                        }
                        RouteEvaluation eb = instance.evaluate(v2, b);
                        if (!eb.feasible()) {
                            continue;
                        }
                        if (ea.cost() + eb.cost() < before - COST_EPSILON) {
                            assignment.setRoute(v1, a, ea);
                            assignment.setRoute(v2, b, eb);
                            budget.tick();
                            return true;
                        }
                    }
                }
            }
        }
        return false;
    }

    boolean twoOpt(Assignment assignment, SolveBudget budget) {
        VrpInstance instance = assignment.instance();
        for (int v = 0; v < instance.vehicleCount() && !budget.exhausted(); v++) {
            IntList route = assignment.route(v);
            double before = assignment.evaluation(v).cost();
            for (int i = 0; i < route.size() - 1; i++) {
                for (int j = i + 1; j < route.size(); j++) {
                    IntArrayList candidate = new IntArrayList(route);
                    for (int lo = i, hi = j; lo < hi; lo++, hi--) {
                        int tmp = candidate.getInt(lo);
                        candidate.set(lo, candidate.getInt(hi));
                        candidate.set(hi, tmp);
                    }
                    RouteEvaluation evaluation = instance.evaluate(v, candidate);
                    if (evaluation.feasible() && evaluation.cost() < before - COST_EPSILON) {
                        assignment.setRoute(v, candidate, evaluation);
                        budget.tick();
                        return true;
                    }
                }
            }
        }
        return false;
    }

    /**
     * Swaps an unserved task in for the least urgent served task it outranks, cheapest exchange first.
     * The evicted task is offered to every other vehicle afterwards.
     */
    private boolean exchange(Assignment assignment, int task) {
        VrpInstance instance = assignment.instance();
        int[] rank = instance.priorityRank();
        int bestVehicle = -1;
        int bestEvicted = -1;
        IntArrayList bestSequence = null;
        RouteEvaluation bestEvaluation = null;
        double bestDelta = Double.POSITIVE_INFINITY;
        for (int v = 0; v < instance.vehicleCount(); v++) {
            IntList route = assignment.route(v);
            for (int k = 0; k < route.size(); k++) {
                int evicted = route.getInt(k);
                if (rank[evicted] <= rank[task]) {
                    continue;
                }
                if (bestEvicted >= 0 && rank[evicted] < rank[bestEvicted]) {
                    continue;
                }
                IntArrayList base = new IntArrayList(route);
                base.removeInt(k);
                for (int position = 0; position <= base.size(); position++) {
                    IntArrayList candidate = new IntArrayList(base);
                    candidate.add(position, task);
                    RouteEvaluation evaluation = instance.evaluate(v, candidate);
                    if (!evaluation.feasible()) {
                        continue;
                    }
                    double delta = evaluation.cost() - assignment.evaluation(v).cost();
                    boolean lessUrgent = bestEvicted < 0 || rank[evicted] > rank[bestEvicted];
                    if (lessUrgent || delta < bestDelta - COST_EPSILON) {
                        bestVehicle = v;
                        bestEvicted = evicted;
                        bestSequence = candidate;
                        bestEvaluation = evaluation;
                        bestDelta = delta;
                    }
                }
            }
        }
        if (bestVehicle < 0) {
            return false;
        }
        assignment.setRoute(bestVehicle, bestSequence, bestEvaluation);
        assignment.insertCheapest(bestEvicted);
        return true;
    }

    private double windowClose(VrpTask task, boolean windows) {
        TimeWindow window = task.getTimeWindow();
        return windows && window != null ? window.endMinute() : Double.POSITIVE_INFINITY;
    }
}
