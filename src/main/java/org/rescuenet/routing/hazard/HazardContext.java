package org.rescuenet.routing.hazard;

import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectMaps;
import it.unimi.dsi.fastutil.longs.LongSet;
import it.unimi.dsi.fastutil.longs.LongSets;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Hazard view resolved for one planning call: which edges are excluded and how the rest are exposed.
 *
 * <p>Built fresh per call and never shared across calls.</p>
 */
public final class HazardContext {
    @Getter
    @Accessors(fluent = true)
    private final RiskPolicy policy;
    @Getter
    @Accessors(fluent = true)
    private final int zoneCount;
    private final LongSet blockedEdgeIds;
    private final Long2ObjectMap<HazardExposure> exposures;

    HazardContext(RiskPolicy policy, int zoneCount, LongSet blockedEdgeIds, Long2ObjectMap<HazardExposure> exposures) {
        this.policy = policy;
        this.zoneCount = zoneCount;
        this.blockedEdgeIds = LongSets.unmodifiable(blockedEdgeIds);
        this.exposures = Long2ObjectMaps.unmodifiable(exposures);
    }

    /**
     * Context without any zone in effect.
     */
    public static HazardContext none(RiskPolicy policy) {
        return new HazardContext(policy, 0, LongSets.EMPTY_SET, Long2ObjectMaps.emptyMap());
    }

    public boolean isBlocked(long edgeId) {
        return blockedEdgeIds.contains(edgeId);
    }

    public HazardExposure exposure(long edgeId) {
        HazardExposure exposure = exposures.get(edgeId);
        return exposure == null ? HazardExposure.NONE : exposure;
    }

    public LongSet blockedEdgeIds() {
        return blockedEdgeIds;
    }

    public int exposedEdgeCount() {
        return exposures.size();
    }
}
