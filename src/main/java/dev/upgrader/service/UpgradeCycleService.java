package dev.upgrader.service;

import dev.upgrader.catalog.CatalogClientFactory;
import dev.upgrader.catalog.impl.EpisodeCatalogClient;
import dev.upgrader.catalog.impl.MovieCatalogClient;
import dev.upgrader.config.CatalogConfig;
import dev.upgrader.error.ResolutionException;
import dev.upgrader.metrics.UpgraderMetrics;
import dev.upgrader.model.Candidate;
import dev.upgrader.model.CatalogItem;
import dev.upgrader.model.CatalogKind;
import dev.upgrader.model.CycleOutcome;
import dev.upgrader.model.RecentUpgrade;
import dev.upgrader.model.RunTarget;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Runs the tag cycle for each catalog: ensure tag, reset when every monitored movie is
 * tagged, otherwise pick random candidates, tag them and trigger a search.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UpgradeCycleService {

    private static final String SEPARATOR = "----------------------------------------";

    private final CatalogClientFactory clientFactory;
    private final CandidateCollector candidateCollector;
    private final CatalogConfig catalogConfig;
    private final RunStateStore stateStore;
    private final UpgraderMetrics metrics;
    private final Random random;

    /**
     * Run the requested kinds one after another. A failing kind never stops the other.
     */
    public Map<CatalogKind, CycleOutcome> runCycles(RunTarget target) {
        Map<CatalogKind, CycleOutcome> outcomes = new EnumMap<>(CatalogKind.class);
        for (CatalogKind kind : target.kinds()) {
            outcomes.put(kind, runCycleSafely(kind));
        }
        return outcomes;
    }

    /**
     * Run one kind, converting any exception into a {@code FAILED} outcome.
     */
    public CycleOutcome runCycleSafely(CatalogKind kind) {
        long start = System.nanoTime();
        try {
            return runCycle(kind);
        } catch (RuntimeException e) {
            log.error("{} upgrade cycle failed: {}", kind.wireName(), e.getMessage(), e);
            metrics.recordCycleFailure(kind);
            return CycleOutcome.failed(kind, e);
        } finally {
            metrics.recordCycleDuration(kind, Duration.ofNanos(System.nanoTime() - start));
        }
    }

    public CycleOutcome runCycle(CatalogKind kind) {
        return switch (kind) {
            case MOVIES -> runMovieCycle();
            case EPISODES -> runEpisodeCycle();
        };
    }

    public CycleOutcome runMovieCycle() {
        if (!clientFactory.isEnabled(CatalogKind.MOVIES)) {
            log.info("Movie catalog disabled (catalog.movies.enabled=false)");
            return CycleOutcome.disabled(CatalogKind.MOVIES);
        }

        log.info(SEPARATOR);
        log.info("Starting movie upgrade cycle...");
        MovieCatalogClient client = clientFactory.movieClient();
        int tagId = client.getOrCreateTag(catalogConfig.getTagName()).id();

        List<CatalogItem> movies = client.listMovies();
        if (movies.isEmpty()) {
            log.info("Movie catalog returned 0 movies.");
            return CycleOutcome.noCandidates(CatalogKind.MOVIES);
        }

        if (allMonitoredTagged(movies, tagId)) {
            resetMovieTags(client, movies, tagId);
            return CycleOutcome.fullCycle(CatalogKind.MOVIES);
        }

        Map<Integer, Candidate> candidates = candidateCollector.collectMovieCandidates(client, tagId, movies);
        if (candidates.isEmpty()) {
            log.info("No movies found for upgrade.");
            return CycleOutcome.noCandidates(CatalogKind.MOVIES);
        }

        List<Integer> selected = selectRandom(candidates.keySet(),
                catalogConfig.getMovies().getNumToUpgrade(), random);
        log.info("Selected movie IDs for upgrade: {}", selected);

        stateStore.resetRecentUpgrades(CatalogKind.MOVIES);
        for (int movieId : selected) {
            // Re-fetch: the listing may be stale by now
            CatalogItem movie = client.getMovie(movieId);
            client.updateMovie(movie.withTag(tagId));
            String title = candidates.get(movieId).title();
            stateStore.recordRecentUpgrade(CatalogKind.MOVIES, new RecentUpgrade(movieId, title, null));
            log.info("Tagged movie '{}' with '{}'", title, catalogConfig.getTagName());
        }
        metrics.recordItemsTagged(CatalogKind.MOVIES, selected.size());

        client.searchMovies(selected);
        metrics.recordSearchIssued(CatalogKind.MOVIES);
        log.info("Triggered MoviesSearch for {} movies.", selected.size());
        return CycleOutcome.upgraded(CatalogKind.MOVIES, selected, selected);
    }

    public CycleOutcome runEpisodeCycle() {
        if (!clientFactory.isEnabled(CatalogKind.EPISODES)) {
            log.info("Episode catalog disabled (catalog.episodes.enabled=false)");
            return CycleOutcome.disabled(CatalogKind.EPISODES);
        }

        log.info(SEPARATOR);
        log.info("Starting episode upgrade cycle...");
        EpisodeCatalogClient client = clientFactory.episodeClient();
        int tagId = client.getOrCreateTag(catalogConfig.getTagName()).id();

        Map<Integer, Candidate> candidates = candidateCollector.collectEpisodeCandidates(client, tagId);
        if (candidates.isEmpty()) {
            log.info("No episodes found for upgrade.");
            return CycleOutcome.noCandidates(CatalogKind.EPISODES);
        }

        List<Integer> selected = selectRandom(candidates.keySet(),
                catalogConfig.getEpisodes().getNumToUpgrade(), random);
        log.info("Selected episode-file IDs for upgrade: {}", selected);

        stateStore.resetRecentUpgrades(CatalogKind.EPISODES);
        Set<Integer> taggedSeries = new HashSet<>();
        for (int fileId : selected) {
            Candidate candidate = candidates.get(fileId);
            int seriesId = candidate.seriesId();
            if (taggedSeries.add(seriesId)) {
                CatalogItem series = client.getSeries(seriesId);
                client.updateSeries(series.withTag(tagId));
                log.info("Tagged series '{}' for episode file {} with '{}'",
                        series.getTitle(), fileId, catalogConfig.getTagName());
            }
            stateStore.recordRecentUpgrade(CatalogKind.EPISODES,
                    new RecentUpgrade(fileId, candidate.title(), seriesId));
        }
        metrics.recordItemsTagged(CatalogKind.EPISODES, selected.size());

        // The search needs episode IDs; files that cannot be mapped are dropped, their series stay tagged
        SortedSet<Integer> episodeIds = new TreeSet<>();
        for (int fileId : selected) {
            try {
                List<Integer> resolved = resolveEpisodeIds(client, fileId);
                if (resolved.isEmpty()) {
                    log.warn("No episode found for episode file {}; dropped from search", fileId);
                }
                episodeIds.addAll(resolved);
            } catch (ResolutionException e) {
                log.warn("{}; dropped from search", e.getMessage());
            }
        }

        if (episodeIds.isEmpty()) {
            log.info("Could not resolve any episode IDs from episode-file IDs; skipping EpisodeSearch.");
            return CycleOutcome.upgraded(CatalogKind.EPISODES, selected, List.of());
        }

        List<Integer> searched = List.copyOf(episodeIds);
        client.searchEpisodes(searched);
        metrics.recordSearchIssued(CatalogKind.EPISODES);
        log.info("Triggered EpisodeSearch for {} episodes.", searched.size());
        return CycleOutcome.upgraded(CatalogKind.EPISODES, selected, searched);
    }

    /**
     * Pick {@code min(count, keys.size())} distinct keys uniformly at random.
     */
    public static List<Integer> selectRandom(Collection<Integer> keys, int count, Random random) {
        List<Integer> pool = new ArrayList<>(keys);
        int k = Math.min(Math.max(count, 0), pool.size());
        Collections.shuffle(pool, random);
        return List.copyOf(pool.subList(0, k));
    }

    private boolean allMonitoredTagged(List<CatalogItem> movies, int tagId) {
        List<CatalogItem> monitored = movies.stream().filter(CatalogItem::isMonitored).toList();
        return !monitored.isEmpty() && monitored.stream().allMatch(movie -> movie.hasTag(tagId));
    }

    private void resetMovieTags(MovieCatalogClient client, List<CatalogItem> movies, int tagId) {
        log.info("All monitored movies have the upgrade tag. Removing it to restart the cycle...");
        int cleared = 0;
        for (CatalogItem movie : movies) {
            if (movie.hasTag(tagId)) {
                client.updateMovie(movie.withoutTag(tagId));
                cleared++;
            }
        }
        metrics.recordTagReset(CatalogKind.MOVIES);
        log.info("Upgrade tag removed from {} movies.", cleared);
    }

    private List<Integer> resolveEpisodeIds(EpisodeCatalogClient client, int episodeFileId) {
        try {
            return client.episodeIdsForFile(episodeFileId);
        } catch (RuntimeException e) {
            throw new ResolutionException("Failed to resolve episode IDs for episode file " + episodeFileId
                    + ": " + e.getMessage(), e);
        }
    }
}
