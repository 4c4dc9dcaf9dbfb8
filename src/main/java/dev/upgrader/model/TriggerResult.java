package dev.upgrader.model;

public enum TriggerResult {
    ACCEPTED,
    /** Another run holds the run permit. */
    CONFLICT
}
