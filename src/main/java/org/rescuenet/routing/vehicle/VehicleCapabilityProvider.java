package org.rescuenet.routing.vehicle;

import java.util.Optional;

/**
 * Read-only source of vehicle capability records, keyed by vehicle id.
 */
public interface VehicleCapabilityProvider {

    Optional<VehicleCapability> findById(long vehicleId);
}
