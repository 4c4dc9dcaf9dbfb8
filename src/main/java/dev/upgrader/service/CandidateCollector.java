package dev.upgrader.service;

import dev.upgrader.catalog.impl.EpisodeCatalogClient;
import dev.upgrader.catalog.impl.MovieCatalogClient;
import dev.upgrader.config.HttpConfig;
import dev.upgrader.metrics.UpgraderMetrics;
import dev.upgrader.model.Candidate;
import dev.upgrader.model.CatalogItem;
import dev.upgrader.model.CatalogKind;
import dev.upgrader.model.EpisodeFile;
import dev.upgrader.model.ScoredEpisodeFile;
import dev.upgrader.model.ScoredMovie;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes the upgrade candidates of a catalog: monitored, has a file, scored below
 * its profile cutoff and not carrying the engine tag (series-level for episodes).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CandidateCollector {

    private final HttpConfig httpConfig;
    private final UpgraderMetrics metrics;

    /**
     * Movie ID to candidate, listing movies from the catalog.
     */
    public Map<Integer, Candidate> collectMovieCandidates(MovieCatalogClient client, int tagId) {
        return collectMovieCandidates(client, tagId, client.listMovies());
    }

    /**
     * Movie ID to candidate for an already fetched movie list.
     */
    public Map<Integer, Candidate> collectMovieCandidates(MovieCatalogClient client, int tagId,
                                                          List<CatalogItem> movies) {
        Map<Integer, Integer> cutoffs = client.qualityProfileCutoffs();
        List<ScoredMovie> scored = scoreMovies(client, cutoffs, movies);

        Map<Integer, Candidate> candidates = new LinkedHashMap<>();
        int tagged = 0;
        for (ScoredMovie entry : scored) {
            CatalogItem movie = entry.movie();
            if (movie.hasTag(tagId)) {
                tagged++;
                continue;
            }
            if (entry.belowCutoff()) {
                candidates.put(movie.getId(), Candidate.builder()
                        .itemId(movie.getId())
                        .title(movie.getTitle())
                        .currentScore(entry.score())
                        .requiredScore(entry.cutoff())
                        .build());
            }
        }

        log.info("Movies: scored={} below_cutoff_untagged={} already_tagged={}",
                scored.size(), candidates.size(), tagged);
        metrics.recordCandidatesFound(CatalogKind.MOVIES, candidates.size());
        return candidates;
    }

    /**
     * Episode-file ID to candidate. Series already carrying the tag contribute nothing.
     */
    public Map<Integer, Candidate> collectEpisodeCandidates(EpisodeCatalogClient client, int tagId) {
        Map<Integer, Integer> cutoffs = client.qualityProfileCutoffs();
        List<CatalogItem> seriesList = client.listSeries();

        Map<Integer, Candidate> candidates = new LinkedHashMap<>();
        for (ScoredEpisodeFile entry : scoreEpisodeFiles(client, cutoffs, seriesList, tagId, true)) {
            if (entry.belowCutoff()) {
                candidates.put(entry.file().id(), Candidate.builder()
                        .itemId(entry.file().id())
                        .title(entry.displayTitle())
                        .seriesId(entry.series().getId())
                        .currentScore(entry.file().customFormatScore())
                        .requiredScore(entry.cutoff())
                        .build());
            }
        }

        log.info("Episodes: series={} below_cutoff_untagged_episode_files={}",
                seriesList.size(), candidates.size());
        metrics.recordCandidatesFound(CatalogKind.EPISODES, candidates.size());
        return candidates;
    }

    /**
     * Fetch file scores of monitored movies with a file, in parallel.
     * <p>
     * Runs on a bounded pool created for this call and disposed afterwards. A failed
     * fetch drops that movie only. Results keep the input order.
     */
    public List<ScoredMovie> scoreMovies(MovieCatalogClient client, Map<Integer, Integer> cutoffs,
                                         List<CatalogItem> movies) {
        List<CatalogItem> withFile = movies.stream()
                .filter(CatalogItem::isMonitored)
                .filter(CatalogItem::hasFile)
                .toList();
        if (withFile.isEmpty()) {
            return List.of();
        }

        int parallelism = httpConfig.getEffectiveParallelism();
        Scheduler scheduler = Schedulers.newBoundedElastic(parallelism, Integer.MAX_VALUE, "score-fetch");
        try {
            List<ScoredMovie> scored = Flux.fromIterable(withFile)
                    .flatMapSequential(movie -> Mono.fromCallable(() -> new ScoredMovie(
                                            movie,
                                            client.movieFileScore(movie.getFileId()),
                                            cutoffs.getOrDefault(movie.getQualityProfileId(), 0)))
                                    .subscribeOn(scheduler)
                                    .onErrorResume(e -> {
                                        log.warn("Movies: score fetch failed for movie {} ('{}'): {}",
                                                movie.getId(), movie.getTitle(), e.getMessage());
                                        metrics.recordFetchFailure(CatalogKind.MOVIES);
                                        return Mono.empty();
                                    }),
                            parallelism)
                    .collectList()
                    .block();
            return scored != null ? scored : List.of();
        } finally {
            scheduler.dispose();
        }
    }

    /**
     * Episode files of every series that has files on disk, paired with the series cutoff.
     *
     * @param skipTaggedSeries leave out series carrying the tag without listing their files
     */
    public List<ScoredEpisodeFile> scoreEpisodeFiles(EpisodeCatalogClient client, Map<Integer, Integer> cutoffs,
                                                     List<CatalogItem> seriesList, int tagId,
                                                     boolean skipTaggedSeries) {
        List<ScoredEpisodeFile> scored = new ArrayList<>();
        for (CatalogItem series : seriesList) {
            if (series.getEpisodeFileCount() == 0) {
                continue;
            }
            boolean seriesTagged = series.hasTag(tagId);
            if (seriesTagged && skipTaggedSeries) {
                continue;
            }

            List<EpisodeFile> files;
            try {
                files = client.listEpisodeFiles(series.getId());
            } catch (RuntimeException e) {
                log.warn("Episodes: failed to fetch episode files for series {} ('{}'): {}",
                        series.getId(), series.getTitle(), e.getMessage());
                metrics.recordFetchFailure(CatalogKind.EPISODES);
                continue;
            }

            int cutoff = cutoffs.getOrDefault(series.getQualityProfileId(), 0);
            for (EpisodeFile file : files) {
                scored.add(new ScoredEpisodeFile(series, file, cutoff, seriesTagged));
            }
        }
        return scored;
    }
}
