package org.rescuenet.routing.hazard;

import java.time.Instant;
import java.util.List;

/**
 * Read-only source of hazard zones.
 */
public interface HazardZoneProvider {

    /**
     * Returns zones of the scenario still active at {@code now}, ordered by zone id.
     */
    List<HazardZone> findActiveZones(String scenarioId, Instant now);
}
