package dev.upgrader.model;

import java.time.Instant;

/**
 * Process-wide run status as reported by {@code /api/status}.
 */
public record RunStatus(Instant started, Instant finished, boolean running, RunResult lastResult) {

    public static RunStatus idle() {
        return new RunStatus(null, null, false, null);
    }

    public RunStatus start(Instant startedAt) {
        return new RunStatus(startedAt, null, true, null);
    }

    public RunStatus finish(Instant finishedAt, RunResult result) {
        return new RunStatus(started, finishedAt, false, result);
    }
}
