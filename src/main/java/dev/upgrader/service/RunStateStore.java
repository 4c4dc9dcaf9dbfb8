package dev.upgrader.service;

import dev.upgrader.model.CatalogKind;
import dev.upgrader.model.RecentUpgrade;
import dev.upgrader.model.RunResult;
import dev.upgrader.model.RunStatus;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Semaphore;

/**
 * Process-wide run state: the run permit, the current {@link RunStatus} and the
 * items tagged by the latest selection step of each catalog.
 * <p>
 * Created once at application start and never replaced. Status and recent upgrades
 * are written only by the holder of the run permit, between {@link #tryBeginRun}
 * and {@link #completeRun}; all other callers read copies.
 */
@Component
public class RunStateStore {

    private final Semaphore runPermit = new Semaphore(1);
    private volatile RunStatus status = RunStatus.idle();

    // guarded by this
    private final Map<CatalogKind, List<RecentUpgrade>> recentUpgrades = new EnumMap<>(CatalogKind.class);

    public RunStateStore() {
        for (CatalogKind kind : CatalogKind.values()) {
            recentUpgrades.put(kind, new ArrayList<>());
        }
    }

    /**
     * Take the run permit and mark the run as started.
     *
     * @return {@code false} when another run holds the permit
     */
    public boolean tryBeginRun(Instant startedAt) {
        if (!runPermit.tryAcquire()) {
            return false;
        }
        status = status.start(startedAt);
        return true;
    }

    /**
     * Record the result and hand the permit back.
     */
    public void completeRun(Instant finishedAt, RunResult result) {
        if (runPermit.availablePermits() > 0) {
            throw new IllegalStateException("No run in progress");
        }
        status = status.finish(finishedAt, result);
        runPermit.release();
    }

    public boolean isRunning() {
        return runPermit.availablePermits() == 0;
    }

    public RunStatus getStatus() {
        return status;
    }

    public synchronized void resetRecentUpgrades(CatalogKind kind) {
        recentUpgrades.get(kind).clear();
    }

    public synchronized void recordRecentUpgrade(CatalogKind kind, RecentUpgrade upgrade) {
        recentUpgrades.get(kind).add(upgrade);
    }

    public synchronized List<RecentUpgrade> getRecentUpgrades(CatalogKind kind) {
        return List.copyOf(recentUpgrades.get(kind));
    }

    /**
     * Copy of every list keyed by catalog wire name.
     */
    public synchronized Map<String, List<RecentUpgrade>> recentUpgradesByCatalog() {
        Map<String, List<RecentUpgrade>> copy = new LinkedHashMap<>();
        recentUpgrades.forEach((kind, list) -> copy.put(kind.wireName(), List.copyOf(list)));
        return copy;
    }
}
