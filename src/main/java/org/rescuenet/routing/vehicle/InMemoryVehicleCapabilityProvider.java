package org.rescuenet.routing.vehicle;

import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;

import java.util.Collection;
import java.util.Objects;
import java.util.Optional;

/**
 * Fixed in-process vehicle table.
 */
public final class InMemoryVehicleCapabilityProvider implements VehicleCapabilityProvider {
    private final Long2ObjectOpenHashMap<VehicleCapability> vehicles;

    public InMemoryVehicleCapabilityProvider(Collection<VehicleCapability> vehicles) {
        Objects.requireNonNull(vehicles, "vehicles");
        this.vehicles = new Long2ObjectOpenHashMap<>(vehicles.size());
        for (VehicleCapability vehicle : vehicles) {
            if (this.vehicles.put(vehicle.getId(), vehicle) != null) {
                throw new IllegalArgumentException("duplicate vehicle id " + vehicle.getId());
            }
        }
    }

    @Override
    public Optional<VehicleCapability> findById(long vehicleId) {
        return Optional.ofNullable(vehicles.get(vehicleId));
    }
}
