package dev.upgrader.model;

import java.time.Instant;

/**
 * A discrete progress message on the event stream. Sequence numbers are strictly
 * increasing across the process lifetime.
 */
public record ProgressEvent(long sequence, EventType type, String data, Instant timestamp) {
}
