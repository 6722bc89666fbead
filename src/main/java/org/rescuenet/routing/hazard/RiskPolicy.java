package org.rescuenet.routing.hazard;

/**
 * How aggressively unverified hazard zones are avoided.
 */
public enum RiskPolicy {
    /** Avoid confirmed-blocked, needs-reconnaissance and impassable unknown zones. */
    STRICT,
    /** Avoid confirmed-blocked and impassable unknown zones; needs-reconnaissance zones are penalized instead. */
    RELAXED
}
