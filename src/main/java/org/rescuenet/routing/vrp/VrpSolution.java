package org.rescuenet.routing.vrp;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Result of a multi-vehicle solve. Routes are listed in the input vehicle order.
 */
@Value
@Builder
public class VrpSolution {
    @Singular
    List<VehicleRoute> routes;
    @Singular("unserved")
    List<UnservedTask> unserved;
    int servedTasks;
    int totalTasks;
    /** served / total, {@code 1.0} for an instance without tasks. */
    double coverageRate;
    int vehiclesUsed;
    double totalDistanceKm;
    /** Longest route duration, the time until the last vehicle is done. */
    double makespanMinutes;
    double totalCost;
    /** Improvement iterations run. */
    int iterations;
    @Singular
    List<String> warnings;
}
