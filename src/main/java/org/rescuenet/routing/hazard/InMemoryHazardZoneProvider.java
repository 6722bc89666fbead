package org.rescuenet.routing.hazard;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Mutable in-process zone table. Updates are visible to the next planning call.
 */
public final class InMemoryHazardZoneProvider implements HazardZoneProvider {
    private final CopyOnWriteArrayList<HazardZone> zones = new CopyOnWriteArrayList<>();

    public InMemoryHazardZoneProvider() {
    }

    public InMemoryHazardZoneProvider(Collection<HazardZone> zones) {
        this.zones.addAll(zones);
    }

    public void put(HazardZone zone) {
        Objects.requireNonNull(zone, "zone");
        zones.removeIf(existing -> existing.getId() == zone.getId());
        zones.add(zone);
    }

    public void remove(long zoneId) {
        zones.removeIf(existing -> existing.getId() == zoneId);
    }

    @Override
    public List<HazardZone> findActiveZones(String scenarioId, Instant now) {
        List<HazardZone> result = new ArrayList<>();
        if (scenarioId == null) {
            return result;
        }
        for (HazardZone zone : zones) {
            if (scenarioId.equals(zone.getScenarioId()) && zone.isActiveAt(now)) {
                result.add(zone);
            }
        }
        result.sort(Comparator.comparingLong(HazardZone::getId));
        return result;
    }
}
