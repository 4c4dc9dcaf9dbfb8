package dev.upgrader.service;

import com.fasterxml.jackson.databind.JsonNode;
import dev.upgrader.catalog.CatalogClientFactory;
import dev.upgrader.catalog.impl.EpisodeCatalogClient;
import dev.upgrader.catalog.impl.MovieCatalogClient;
import dev.upgrader.config.CatalogConfig;
import dev.upgrader.error.UpgraderException;
import dev.upgrader.model.CatalogItem;
import dev.upgrader.model.CatalogKind;
import dev.upgrader.model.EligibleItem;
import dev.upgrader.model.KindSummary;
import dev.upgrader.model.KindSummary.SummaryRow;
import dev.upgrader.model.QueueEntry;
import dev.upgrader.model.RecentUpgrade;
import dev.upgrader.model.ScoredEpisodeFile;
import dev.upgrader.model.ScoredMovie;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only views over the catalogs for the dashboard endpoints. Each catalog is
 * reported independently: a failing catalog yields a {@code <kind>_error} entry
 * next to the other catalog's data.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LibraryReportService {

    private static final double BYTES_PER_GIB = 1024d * 1024d * 1024d;
    private static final String MISSING = "-";

    private final CatalogClientFactory clientFactory;
    private final CandidateCollector candidateCollector;
    private final CatalogConfig catalogConfig;
    private final RunStateStore stateStore;

    /**
     * Below-cutoff and eligible counts per catalog. Detailed rows list every scored
     * movie and every below-cutoff episode file.
     */
    public Map<String, Object> upgradeSummary(boolean detailed) {
        log.info("Collecting upgrade statistics... detailed={}", detailed);
        Map<String, Object> summary = new LinkedHashMap<>();
        for (CatalogKind kind : CatalogKind.values()) {
            summary.put(kind.wireName(), new KindSummary(0, 0, List.of()));
        }
        for (CatalogKind kind : CatalogKind.values()) {
            if (!clientFactory.isEnabled(kind)) {
                log.info("{} catalog disabled.", kind.wireName());
                continue;
            }
            try {
                KindSummary kindSummary = switch (kind) {
                    case MOVIES -> summarizeMovies(detailed);
                    case EPISODES -> summarizeEpisodes(detailed);
                };
                summary.put(kind.wireName(), kindSummary);
                log.info("{} stats: below={} eligible={}", kind.wireName(),
                        kindSummary.totalBelowCutoff(), kindSummary.eligibleForUpgrade());
            } catch (RuntimeException e) {
                log.error("Error fetching {} stats: {}", kind.wireName(), e.getMessage(), e);
                summary.put(errorKey(kind), e.getMessage());
            }
        }
        return summary;
    }

    /**
     * Items below cutoff and not tagged, i.e. what the next cycle may pick.
     */
    public Map<String, Object> eligibleItems() {
        Map<String, Object> eligible = new LinkedHashMap<>();
        for (CatalogKind kind : CatalogKind.values()) {
            eligible.put(kind.wireName(), List.of());
        }
        for (CatalogKind kind : CatalogKind.values()) {
            if (!clientFactory.isEnabled(kind)) {
                continue;
            }
            try {
                eligible.put(kind.wireName(), switch (kind) {
                    case MOVIES -> eligibleMovies();
                    case EPISODES -> eligibleEpisodeFiles();
                });
            } catch (RuntimeException e) {
                log.error("Eligible {} fetch failed: {}", kind.wireName(), e.getMessage(), e);
                eligible.put(errorKey(kind), e.getMessage());
            }
        }
        return eligible;
    }

    /**
     * Live download queues with sizes converted to GiB.
     */
    public Map<String, Object> downloadQueue() {
        Map<String, Object> queues = new LinkedHashMap<>();
        for (CatalogKind kind : CatalogKind.values()) {
            queues.put(kind.wireName(), List.of());
        }
        for (CatalogKind kind : CatalogKind.values()) {
            if (!clientFactory.isEnabled(kind)) {
                continue;
            }
            try {
                List<QueueEntry> entries = switch (kind) {
                    case MOVIES -> movieQueue();
                    case EPISODES -> episodeQueue();
                };
                queues.put(kind.wireName(), entries);
                log.info("Fetched {} {} queue items", entries.size(), kind.wireName());
            } catch (RuntimeException e) {
                log.error("{} queue fetch failed: {}", kind.wireName(), e.getMessage(), e);
                queues.put(errorKey(kind), e.getMessage());
            }
        }
        return queues;
    }

    public Map<String, List<RecentUpgrade>> recentUpgrades() {
        return stateStore.recentUpgradesByCatalog();
    }

    private KindSummary summarizeMovies(boolean detailed) {
        MovieCatalogClient client = clientFactory.movieClient();
        int tagId = client.getOrCreateTag(catalogConfig.getTagName()).id();
        Map<Integer, Integer> cutoffs = client.qualityProfileCutoffs();

        int below = 0;
        int eligible = 0;
        List<SummaryRow> rows = new ArrayList<>();
        for (ScoredMovie entry : candidateCollector.scoreMovies(client, cutoffs, client.listMovies())) {
            CatalogItem movie = entry.movie();
            boolean tagged = movie.hasTag(tagId);
            if (entry.belowCutoff()) {
                below++;
                if (!tagged) {
                    eligible++;
                }
            }
            if (detailed) {
                rows.add(new SummaryRow(movie.getId(), movie.getTitle(), null, null,
                        entry.score(), entry.cutoff(), tagged));
            }
        }
        return new KindSummary(below, eligible, rows);
    }

    private KindSummary summarizeEpisodes(boolean detailed) {
        EpisodeCatalogClient client = clientFactory.episodeClient();
        int tagId = client.getOrCreateTag(catalogConfig.getTagName()).id();
        Map<Integer, Integer> cutoffs = client.qualityProfileCutoffs();

        int below = 0;
        int eligible = 0;
        List<SummaryRow> rows = new ArrayList<>();
        for (ScoredEpisodeFile entry : candidateCollector.scoreEpisodeFiles(
                client, cutoffs, client.listSeries(), tagId, false)) {
            if (!entry.belowCutoff()) {
                continue;
            }
            below++;
            if (!entry.seriesTagged()) {
                eligible++;
            }
            if (detailed) {
                int fileId = entry.file().id();
                rows.add(new SummaryRow(fileId, null, entry.series().getTitle(), fileId,
                        entry.file().customFormatScore(), entry.cutoff(), entry.seriesTagged()));
            }
        }
        return new KindSummary(below, eligible, rows);
    }

    private List<EligibleItem> eligibleMovies() {
        MovieCatalogClient client = clientFactory.movieClient();
        int tagId = client.getOrCreateTag(catalogConfig.getTagName()).id();
        Map<Integer, Integer> cutoffs = client.qualityProfileCutoffs();

        return candidateCollector.scoreMovies(client, cutoffs, client.listMovies()).stream()
                .filter(ScoredMovie::belowCutoff)
                .filter(entry -> !entry.movie().hasTag(tagId))
                .map(entry -> EligibleItem.movie(entry.movie().getId(), entry.movie().getTitle(),
                        entry.score(), entry.cutoff()))
                .toList();
    }

    private List<EligibleItem> eligibleEpisodeFiles() {
        EpisodeCatalogClient client = clientFactory.episodeClient();
        int tagId = client.getOrCreateTag(catalogConfig.getTagName()).id();
        Map<Integer, Integer> cutoffs = client.qualityProfileCutoffs();

        return candidateCollector.scoreEpisodeFiles(client, cutoffs, client.listSeries(), tagId, true).stream()
                .filter(ScoredEpisodeFile::belowCutoff)
                .map(entry -> EligibleItem.episodeFile(entry.file().id(), entry.series().getTitle(),
                        entry.file().customFormatScore(), entry.cutoff()))
                .toList();
    }

    private List<QueueEntry> movieQueue() {
        List<QueueEntry> entries = new ArrayList<>();
        for (JsonNode item : clientFactory.movieClient().queue()) {
            if (!item.isObject()) {
                continue;
            }
            entries.add(QueueEntry.builder()
                    .title(text(item, "title", null))
                    .status(text(item, "status", null))
                    .protocol(text(item, "protocol", null))
                    .size(toGib(item.path("size").asDouble(0)))
                    .sizeleft(toGib(item.path("sizeleft").asDouble(0)))
                    .timeleft(text(item, "timeleft", null))
                    .errorMessage(text(item, "errorMessage", null))
                    .indexer(text(item, "indexer", null))
                    .downloadId(text(item, "downloadId", null))
                    .build());
        }
        return entries;
    }

    private List<QueueEntry> episodeQueue() {
        EpisodeCatalogClient client = clientFactory.episodeClient();
        Map<Integer, String> seriesTitles = new HashMap<>();
        List<QueueEntry> entries = new ArrayList<>();
        for (JsonNode item : client.queue()) {
            if (!item.isObject()) {
                continue;
            }
            int seriesId = item.path("seriesId").asInt(0);
            if (seriesId == 0) {
                continue;
            }
            String seriesTitle = seriesTitles.computeIfAbsent(seriesId, id -> seriesTitle(client, id));

            entries.add(QueueEntry.builder()
                    .series(seriesTitle)
                    .episode(episodeLabel(item))
                    .status(text(item, "status", MISSING))
                    .protocol(text(item, "protocol", MISSING))
                    .size(toGib(item.path("size").asDouble(0)))
                    .sizeleft(toGib(item.path("sizeleft").asDouble(0)))
                    .timeleft(text(item, "timeleft", MISSING))
                    .indexer(text(item, "indexer", MISSING))
                    .downloadId(text(item, "downloadId", null))
                    .build());
        }
        return entries;
    }

    private String seriesTitle(EpisodeCatalogClient client, int seriesId) {
        try {
            String title = client.getSeries(seriesId).getTitle();
            return title != null ? title : MISSING;
        } catch (UpgraderException e) {
            log.warn("Failed to fetch series {}: {}", seriesId, e.getMessage());
            return "Series " + seriesId;
        }
    }

    /**
     * {@code SxxEyy} when season and episode number are known, {@code Sxx} with the
     * season only, {@code -} otherwise.
     */
    static String episodeLabel(JsonNode queueItem) {
        JsonNode season = queueItem.path("seasonNumber");
        JsonNode episodeNumber = queueItem.path("episode").path("episodeNumber");
        if (!season.isNumber()) {
            return MISSING;
        }
        if (episodeNumber.isNumber()) {
            return String.format("S%02dE%02d", season.asInt(), episodeNumber.asInt());
        }
        return String.format("S%02d", season.asInt());
    }

    static double toGib(double bytes) {
        return Math.round(bytes / BYTES_PER_GIB * 100.0) / 100.0;
    }

    private static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? fallback : value.asText();
    }

    private static String errorKey(CatalogKind kind) {
        return kind.wireName() + "_error";
    }
}
