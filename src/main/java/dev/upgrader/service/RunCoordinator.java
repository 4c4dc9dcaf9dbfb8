package dev.upgrader.service;

import dev.upgrader.config.UpgraderBeans;
import dev.upgrader.model.CatalogKind;
import dev.upgrader.model.CycleOutcome;
import dev.upgrader.model.RunResult;
import dev.upgrader.model.RunTarget;
import dev.upgrader.model.TriggerResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Single entry point for starting upgrade runs, shared by the HTTP trigger, the
 * scheduler and run-once mode. At most one run is in flight at any time.
 */
@Slf4j
@Service
public class RunCoordinator {

    private static final String SEPARATOR = "========================================";

    private final UpgradeCycleService cycleService;
    private final RunStateStore stateStore;
    private final EventBroadcaster events;
    private final Executor runExecutor;
    private final Clock clock;

    public RunCoordinator(UpgradeCycleService cycleService,
                          RunStateStore stateStore,
                          EventBroadcaster events,
                          @Qualifier(UpgraderBeans.RUN_EXECUTOR) Executor runExecutor,
                          Clock clock) {
        this.cycleService = cycleService;
        this.stateStore = stateStore;
        this.events = events;
        this.runExecutor = runExecutor;
        this.clock = clock;
    }

    /**
     * Start a run in the background.
     *
     * @return {@link TriggerResult#CONFLICT} when a run is already in progress
     */
    public TriggerResult trigger(RunTarget target) {
        Instant startedAt = clock.instant();
        if (!stateStore.tryBeginRun(startedAt)) {
            log.info("Trigger for '{}' rejected: run already in progress", target.wireName());
            return TriggerResult.CONFLICT;
        }

        try {
            runExecutor.execute(() -> runHoldingPermit(target, startedAt));
        } catch (RejectedExecutionException e) {
            log.error("Could not schedule upgrade run: {}", e.getMessage(), e);
            stateStore.completeRun(clock.instant(), RunResult.failed("Run could not be scheduled", Map.of()));
            throw new IllegalStateException("Upgrade run could not be scheduled", e);
        }
        log.info("Upgrade run for '{}' accepted", target.wireName());
        return TriggerResult.ACCEPTED;
    }

    /**
     * Run on the calling thread.
     *
     * @return empty when a run is already in progress
     */
    public Optional<RunResult> runNow(RunTarget target) {
        Instant startedAt = clock.instant();
        if (!stateStore.tryBeginRun(startedAt)) {
            log.info("Run for '{}' skipped: run already in progress", target.wireName());
            return Optional.empty();
        }
        return Optional.of(runHoldingPermit(target, startedAt));
    }

    public boolean isRunning() {
        return stateStore.isRunning();
    }

    private RunResult runHoldingPermit(RunTarget target, Instant startedAt) {
        RunResult result = RunResult.failed("Run aborted", Map.of());
        try {
            result = runAndPublish(target, startedAt);
            return result;
        } finally {
            stateStore.completeRun(clock.instant(), result);
        }
    }

    private RunResult runAndPublish(RunTarget target, Instant startedAt) {
        log.info(SEPARATOR);
        log.info("Upgrade run starting (target: {})", target.wireName());
        log.info(SEPARATOR);
        events.info("run_start " + target.wireName() + " " + startedAt);

        Map<String, CycleOutcome> cycles = new LinkedHashMap<>();
        for (CatalogKind kind : target.kinds()) {
            events.info("starting " + kind.wireName());
            CycleOutcome outcome = cycleService.runCycleSafely(kind);
            cycles.put(kind.wireName(), outcome);
            if (outcome.isFailed()) {
                events.error(kind.wireName() + " failed: " + outcome.error());
            } else {
                events.info("finished " + kind.wireName() + " " + outcome.state().name().toLowerCase(Locale.ROOT));
            }
        }

        List<String> failures = cycles.values().stream()
                .filter(CycleOutcome::isFailed)
                .map(outcome -> outcome.kind().wireName() + ": " + outcome.error())
                .toList();

        RunResult result = failures.isEmpty()
                ? RunResult.ok(cycles)
                : RunResult.failed(String.join("; ", failures), cycles);

        log.info(SEPARATOR);
        log.info("Upgrade run finished: {}", result.ok() ? "ok" : "failed");
        cycles.values().forEach(outcome -> log.info("  {} -> {} (tagged: {}, searched: {})",
                outcome.kind().wireName(), outcome.state(),
                outcome.selectedIds().size(), outcome.searchedIds().size()));
        log.info(SEPARATOR);

        events.done(result.ok() ? "ok" : "failed");
        return result;
    }
}
