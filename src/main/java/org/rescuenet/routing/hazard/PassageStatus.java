package org.rescuenet.routing.hazard;

/**
 * Verification-driven traversability classification of a hazard zone.
 */
public enum PassageStatus {
    CLEAR,
    PASSABLE_WITH_CAUTION,
    NEEDS_RECONNAISSANCE,
    CONFIRMED_BLOCKED,
    UNKNOWN
}
