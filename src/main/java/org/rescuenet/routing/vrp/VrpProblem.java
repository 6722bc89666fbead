package org.rescuenet.routing.vrp;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Multi-vehicle routing instance.
 */
@Value
@Builder
public class VrpProblem {
    @Singular
    List<VrpDepot> depots;
    @Singular
    List<VrpTask> tasks;
    @Singular
    List<VrpVehicle> vehicles;
    @Builder.Default
    VrpConstraints constraints = VrpConstraints.defaults();
}
