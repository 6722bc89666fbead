package org.rescuenet.routing.hazard;

import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import org.locationtech.jts.index.strtree.STRtree;
import org.rescuenet.routing.graph.RoadEdge;
import org.rescuenet.routing.vehicle.VehicleCapability;

import java.time.Clock;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Resolves a risk policy into blocked edges and per-edge exposure for one planning call.
 *
 * <p>Zones are read from the provider on every call. An edge overlapping several zones is blocked when any
 * of them blocks it; otherwise the exposures of the non-clear zones are merged.</p>
 */
@Slf4j
public final class HazardFilter {
    private final HazardZoneProvider zoneProvider;
    private final Clock clock;

    public HazardFilter(HazardZoneProvider zoneProvider) {
        this(zoneProvider, Clock.systemUTC());
    }

    public HazardFilter(HazardZoneProvider zoneProvider, Clock clock) {
        this.zoneProvider = Objects.requireNonNull(zoneProvider, "zoneProvider");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @param scenarioId hazard scenario, {@code null} for none.
     * @param policy risk policy of this call.
     * @param vehicle vehicle used for type exemptions, {@code null} to apply no exemption.
     * @param edges candidate edges.
     */
    public HazardContext resolve(
            String scenarioId,
            RiskPolicy policy,
            VehicleCapability vehicle,
            Collection<RoadEdge> edges
    ) {
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(edges, "edges");
        if (scenarioId == null) {
            return HazardContext.none(policy);
        }
        List<HazardZone> zones = zoneProvider.findActiveZones(scenarioId, clock.instant());
        if (zones.isEmpty()) {
            return HazardContext.none(policy);
        }

        STRtree index = new STRtree();
        for (HazardZone zone : zones) {
            if (zone.getArea() == null || zone.getArea().isEmpty()) {
                continue;
            }
            index.insert(zone.getArea().getEnvelopeInternal(), new IndexedZone(zone));
        }

        LongOpenHashSet blocked = new LongOpenHashSet();
        Long2ObjectOpenHashMap<HazardExposure> exposures = new Long2ObjectOpenHashMap<>();
        for (RoadEdge edge : edges) {
            @SuppressWarnings("unchecked")
            List<IndexedZone> candidates = index.query(edge.getGeometry().getEnvelopeInternal());
            if (candidates.isEmpty()) {
                continue;
            }
            candidates.sort(Comparator.comparingLong(candidate -> candidate.zone.getId()));
            HazardExposure exposure = HazardExposure.NONE;
            boolean edgeBlocked = false;
            for (IndexedZone candidate : candidates) {
                if (!candidate.prepared.intersects(edge.getGeometry())) {
                    continue;
                }
                HazardZone zone = candidate.zone;
                if (zone.blocks(policy, vehicle)) {
                    edgeBlocked = true;
                    break;
                }
                if (zone.getPassageStatus() != PassageStatus.CLEAR) {
                    exposure = exposure.merge(HazardExposure.of(zone));
                }
            }
            if (edgeBlocked) {
                blocked.add(edge.getId());
            } else if (!exposure.isNone()) {
                exposures.put(edge.getId(), exposure);
            }
        }
        log.debug("Scenario {} under {}: {} zone(s), {} blocked edge(s), {} exposed edge(s)",
                scenarioId, policy, zones.size(), blocked.size(), exposures.size());
        return new HazardContext(policy, zones.size(), blocked, exposures);
    }

    private static final class IndexedZone {
        private final HazardZone zone;
        private final PreparedGeometry prepared;

        private IndexedZone(HazardZone zone) {
            this.zone = zone;
            this.prepared = PreparedGeometryFactory.prepare(zone.getArea());
        }
    }
}
