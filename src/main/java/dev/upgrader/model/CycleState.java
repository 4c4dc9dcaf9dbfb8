package dev.upgrader.model;

/**
 * Terminal state of one catalog cycle.
 */
public enum CycleState {
    /** Kind not enabled in configuration. */
    DISABLED,
    /** Every monitored item carried the tag; it was removed from all of them. */
    FULL_CYCLE,
    /** Candidates were selected, tagged and searched. */
    HAS_CANDIDATES,
    NO_CANDIDATES,
    FAILED
}
