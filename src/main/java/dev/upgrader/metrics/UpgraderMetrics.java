package dev.upgrader.metrics;

import dev.upgrader.model.CatalogKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus metrics for upgrade cycles and catalog calls.
 */
@Component
public class UpgraderMetrics {

    private static final String TAG_CATALOG = "catalog";
    private final MeterRegistry registry;

    // Counters
    private final Counter httpRetriesCounter;
    private final Counter fetchFailuresCounter;

    // Timers (per catalog)
    private final ConcurrentHashMap<String, Timer> cycleTimers = new ConcurrentHashMap<>();

    // Gauges
    private final Map<CatalogKind, AtomicInteger> lastRunCandidates = new EnumMap<>(CatalogKind.class);
    private final Map<CatalogKind, AtomicInteger> lastRunTagged = new EnumMap<>(CatalogKind.class);

    public UpgraderMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.httpRetriesCounter = Counter.builder("upgrader_http_retries_total")
                .description("Catalog HTTP calls retried after a retryable failure")
                .register(registry);

        this.fetchFailuresCounter = Counter.builder("upgrader_fetch_failures_total")
                .description("Per-item fetches that failed and were excluded from a cycle")
                .register(registry);

        for (CatalogKind kind : CatalogKind.values()) {
            AtomicInteger candidates = new AtomicInteger(0);
            AtomicInteger tagged = new AtomicInteger(0);
            lastRunCandidates.put(kind, candidates);
            lastRunTagged.put(kind, tagged);

            Gauge.builder("upgrader_last_run_candidates", candidates, AtomicInteger::get)
                    .description("Candidates found in the last cycle")
                    .tag(TAG_CATALOG, kind.wireName())
                    .register(registry);

            Gauge.builder("upgrader_last_run_tagged", tagged, AtomicInteger::get)
                    .description("Items tagged in the last cycle")
                    .tag(TAG_CATALOG, kind.wireName())
                    .register(registry);
        }
    }

    /**
     * Get or create the cycle duration timer for a catalog.
     */
    public Timer getCycleTimer(CatalogKind kind) {
        return cycleTimers.computeIfAbsent(kind.wireName(), name ->
                Timer.builder("upgrader_cycle_duration")
                        .description("Time to run one upgrade cycle")
                        .tag(TAG_CATALOG, name)
                        .register(registry)
        );
    }

    public void recordCycleDuration(CatalogKind kind, Duration duration) {
        getCycleTimer(kind).record(duration);
    }

    public void recordHttpRetry() {
        httpRetriesCounter.increment();
    }

    public void recordFetchFailure(CatalogKind kind) {
        fetchFailuresCounter.increment();
        byCatalog("upgrader_fetch_failures_by_catalog_total", kind).increment();
    }

    public void recordCandidatesFound(CatalogKind kind, int count) {
        byCatalog("upgrader_candidates_found_total", kind).increment(count);
        lastRunCandidates.get(kind).set(count);
    }

    public void recordItemsTagged(CatalogKind kind, int count) {
        byCatalog("upgrader_items_tagged_total", kind).increment(count);
        lastRunTagged.get(kind).set(count);
    }

    public void recordSearchIssued(CatalogKind kind) {
        byCatalog("upgrader_searches_issued_total", kind).increment();
    }

    public void recordTagReset(CatalogKind kind) {
        byCatalog("upgrader_tag_resets_total", kind).increment();
    }

    public void recordCycleFailure(CatalogKind kind) {
        byCatalog("upgrader_cycle_failures_total", kind).increment();
    }

    private Counter byCatalog(String name, CatalogKind kind) {
        return Counter.builder(name)
                .tag(TAG_CATALOG, kind.wireName())
                .register(registry);
    }
}
