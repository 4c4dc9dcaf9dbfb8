package dev.upgrader.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.upgrader.catalog.CatalogClientFactory;
import dev.upgrader.catalog.impl.EpisodeCatalogClient;
import dev.upgrader.catalog.impl.MovieCatalogClient;
import dev.upgrader.config.CatalogConfig;
import dev.upgrader.error.HttpStatusException;
import dev.upgrader.error.TransportException;
import dev.upgrader.model.CatalogItem;
import dev.upgrader.model.CatalogKind;
import dev.upgrader.model.EligibleItem;
import dev.upgrader.model.EpisodeFile;
import dev.upgrader.model.KindSummary;
import dev.upgrader.model.QueueEntry;
import dev.upgrader.model.RecentUpgrade;
import dev.upgrader.model.ScoredEpisodeFile;
import dev.upgrader.model.ScoredMovie;
import dev.upgrader.model.Tag;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LibraryReportServiceTest {

    private static final int TAG_ID = 5;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Mock
    private CatalogClientFactory clientFactory;

    @Mock
    private CandidateCollector candidateCollector;

    @Mock
    private MovieCatalogClient movieClient;

    @Mock
    private EpisodeCatalogClient episodeClient;

    private RunStateStore stateStore;
    private LibraryReportService service;

    @BeforeEach
    void setUp() {
        stateStore = new RunStateStore();
        service = new LibraryReportService(clientFactory, candidateCollector, new CatalogConfig(), stateStore);
    }

    private static CatalogItem item(int id, String title, Integer... tags) {
        return CatalogItem.builder()
                .id(id)
                .title(title)
                .monitored(true)
                .qualityProfileId(1)
                .fileId(100 + id)
                .episodeFileCount(3)
                .tags(new TreeSet<>(List.of(tags)))
                .build();
    }

    private static List<JsonNode> records(String json) throws JsonProcessingException {
        List<JsonNode> records = new ArrayList<>();
        MAPPER.readTree(json).forEach(records::add);
        return records;
    }

    private void moviesOnly() {
        when(clientFactory.isEnabled(CatalogKind.MOVIES)).thenReturn(true);
        when(clientFactory.isEnabled(CatalogKind.EPISODES)).thenReturn(false);
        when(clientFactory.movieClient()).thenReturn(movieClient);
    }

    private void episodesOnly() {
        when(clientFactory.isEnabled(CatalogKind.MOVIES)).thenReturn(false);
        when(clientFactory.isEnabled(CatalogKind.EPISODES)).thenReturn(true);
        when(clientFactory.episodeClient()).thenReturn(episodeClient);
    }

    @Nested
    @DisplayName("Upgrade summary")
    class SummaryTests {

        @Test
        @DisplayName("Should count below-cutoff and eligible movies")
        void shouldSummarizeMovies() {
            moviesOnly();
            when(movieClient.getOrCreateTag("upgrade-cf")).thenReturn(new Tag(TAG_ID, "upgrade-cf"));
            when(movieClient.qualityProfileCutoffs()).thenReturn(Map.of(1, 80));
            when(movieClient.listMovies()).thenReturn(List.of());
            when(candidateCollector.scoreMovies(eq(movieClient), anyMap(), anyList())).thenReturn(List.of(
                    new ScoredMovie(item(1, "Low"), 10, 80),
                    new ScoredMovie(item(2, "Low tagged", TAG_ID), 20, 80),
                    new ScoredMovie(item(3, "Fine"), 90, 80)));

            Map<String, Object> summary = service.upgradeSummary(true);

            KindSummary movies = (KindSummary) summary.get("movies");
            assertThat(movies.totalBelowCutoff()).isEqualTo(2);
            assertThat(movies.eligibleForUpgrade()).isEqualTo(1);
            assertThat(movies.items()).hasSize(3);
            assertThat(movies.items().get(1).tagged()).isTrue();
            assertThat(summary.get("episodes")).isEqualTo(new KindSummary(0, 0, List.of()));
        }

        @Test
        @DisplayName("Should leave out detail rows unless asked")
        void shouldOmitRowsByDefault() {
            moviesOnly();
            when(movieClient.getOrCreateTag("upgrade-cf")).thenReturn(new Tag(TAG_ID, "upgrade-cf"));
            when(movieClient.qualityProfileCutoffs()).thenReturn(Map.of(1, 80));
            when(movieClient.listMovies()).thenReturn(List.of());
            when(candidateCollector.scoreMovies(eq(movieClient), anyMap(), anyList()))
                    .thenReturn(List.of(new ScoredMovie(item(1, "Low"), 10, 80)));

            KindSummary movies = (KindSummary) service.upgradeSummary(false).get("movies");

            assertThat(movies.totalBelowCutoff()).isEqualTo(1);
            assertThat(movies.items()).isEmpty();
        }

        @Test
        @DisplayName("Should count episode files per series tag state")
        void shouldSummarizeEpisodes() {
            episodesOnly();
            CatalogItem tagged = item(7, "Tagged Show", TAG_ID);
            CatalogItem untagged = item(8, "Other Show");
            when(episodeClient.getOrCreateTag("upgrade-cf")).thenReturn(new Tag(TAG_ID, "upgrade-cf"));
            when(episodeClient.qualityProfileCutoffs()).thenReturn(Map.of(1, 50));
            when(episodeClient.listSeries()).thenReturn(List.of(tagged, untagged));
            when(candidateCollector.scoreEpisodeFiles(eq(episodeClient), anyMap(), anyList(), eq(TAG_ID), eq(false)))
                    .thenReturn(List.of(
                            new ScoredEpisodeFile(tagged, new EpisodeFile(70, 7, 10), 50, true),
                            new ScoredEpisodeFile(untagged, new EpisodeFile(80, 8, 10), 50, false),
                            new ScoredEpisodeFile(untagged, new EpisodeFile(81, 8, 60), 50, false)));

            KindSummary episodes = (KindSummary) service.upgradeSummary(true).get("episodes");

            assertThat(episodes.totalBelowCutoff()).isEqualTo(2);
            assertThat(episodes.eligibleForUpgrade()).isEqualTo(1);
            assertThat(episodes.items()).extracting(KindSummary.SummaryRow::episodeFileId).containsExactly(70, 80);
            assertThat(episodes.items().get(0).series()).isEqualTo("Tagged Show");
        }

        @Test
        @DisplayName("Should report a failing catalog under its error key")
        void shouldReportErrorKey() {
            moviesOnly();
            when(movieClient.getOrCreateTag("upgrade-cf")).thenThrow(new TransportException("connection refused", null));

            Map<String, Object> summary = service.upgradeSummary(false);

            assertThat(summary).containsEntry("movies_error", "connection refused");
            assertThat(summary.get("movies")).isEqualTo(new KindSummary(0, 0, List.of()));
        }
    }

    @Nested
    @DisplayName("Eligible items")
    class EligibleTests {

        @Test
        @DisplayName("Should list untagged below-cutoff movies only")
        void shouldListEligibleMovies() {
            moviesOnly();
            when(movieClient.getOrCreateTag("upgrade-cf")).thenReturn(new Tag(TAG_ID, "upgrade-cf"));
            when(movieClient.qualityProfileCutoffs()).thenReturn(Map.of(1, 80));
            when(movieClient.listMovies()).thenReturn(List.of());
            when(candidateCollector.scoreMovies(eq(movieClient), anyMap(), anyList())).thenReturn(List.of(
                    new ScoredMovie(item(1, "Low"), 10, 80),
                    new ScoredMovie(item(2, "Tagged", TAG_ID), 10, 80),
                    new ScoredMovie(item(3, "Fine"), 80, 80)));

            Map<String, Object> eligible = service.eligibleItems();

            assertThat(eligible.get("movies")).isEqualTo(List.of(EligibleItem.movie(1, "Low", 10, 80)));
            assertThat(EligibleItem.movie(1, "Low", 10, 80).status()).isEqualTo("Score 10 / 80");
            assertThat(eligible.get("episodes")).isEqualTo(List.of());
        }

        @Test
        @DisplayName("Should skip tagged series when listing eligible episode files")
        void shouldListEligibleEpisodeFiles() {
            episodesOnly();
            CatalogItem series = item(8, "Show");
            when(episodeClient.getOrCreateTag("upgrade-cf")).thenReturn(new Tag(TAG_ID, "upgrade-cf"));
            when(episodeClient.qualityProfileCutoffs()).thenReturn(Map.of(1, 50));
            when(episodeClient.listSeries()).thenReturn(List.of(series));
            when(candidateCollector.scoreEpisodeFiles(eq(episodeClient), anyMap(), anyList(), eq(TAG_ID), eq(true)))
                    .thenReturn(List.of(new ScoredEpisodeFile(series, new EpisodeFile(80, 8, 10), 50, false)));

            Map<String, Object> eligible = service.eligibleItems();

            assertThat(eligible.get("episodes")).isEqualTo(List.of(EligibleItem.episodeFile(80, "Show", 10, 50)));
        }
    }

    @Nested
    @DisplayName("Download queue")
    class QueueTests {

        @Test
        @DisplayName("Should convert movie queue sizes to GiB")
        void shouldFormatMovieQueue() throws Exception {
            moviesOnly();
            when(movieClient.queue()).thenReturn(records("""
                    [{"title": "Film", "status": "downloading", "protocol": "torrent",
                      "size": 2147483648, "sizeleft": 536870912, "timeleft": "00:10:00",
                      "indexer": "idx", "downloadId": "abc"},
                     "not an object"]
                    """));

            @SuppressWarnings("unchecked")
            List<QueueEntry> entries = (List<QueueEntry>) service.downloadQueue().get("movies");

            assertThat(entries).hasSize(1);
            QueueEntry entry = entries.get(0);
            assertThat(entry.title()).isEqualTo("Film");
            assertThat(entry.size()).isEqualTo(2.0);
            assertThat(entry.sizeleft()).isEqualTo(0.5);
            assertThat(entry.errorMessage()).isNull();
            assertThat(entry.downloadId()).isEqualTo("abc");
        }

        @Test
        @DisplayName("Should resolve series titles once and fall back when lookup fails")
        void shouldFormatEpisodeQueue() throws Exception {
            episodesOnly();
            when(episodeClient.queue()).thenReturn(records("""
                    [{"seriesId": 3, "seasonNumber": 1, "episode": {"episodeNumber": 4}, "size": 0},
                     {"seriesId": 3, "seasonNumber": 2},
                     {"seriesId": 0, "seasonNumber": 1},
                     {"seriesId": 9}]
                    """));
            when(episodeClient.getSeries(3)).thenReturn(item(3, "Known Show"));
            when(episodeClient.getSeries(9)).thenThrow(new HttpStatusException("GET", "http://x/series/9", 404, ""));

            @SuppressWarnings("unchecked")
            List<QueueEntry> entries = (List<QueueEntry>) service.downloadQueue().get("episodes");

            assertThat(entries).extracting(QueueEntry::series).containsExactly("Known Show", "Known Show", "Series 9");
            assertThat(entries).extracting(QueueEntry::episode).containsExactly("S01E04", "S02", "-");
            assertThat(entries.get(0).status()).isEqualTo("-");
            verify(episodeClient, times(1)).getSeries(3);
        }

        @Test
        @DisplayName("Should report a failing queue under its error key")
        void shouldReportQueueError() {
            moviesOnly();
            when(movieClient.queue()).thenThrow(new TransportException("timeout", null));

            Map<String, Object> queues = service.downloadQueue();

            assertThat(queues).containsEntry("movies_error", "timeout");
            assertThat(queues.get("movies")).isEqualTo(List.of());
        }

        @Test
        @DisplayName("Should round sizes to two decimals")
        void shouldRoundGib() {
            assertThat(LibraryReportService.toGib(0)).isEqualTo(0.0);
            assertThat(LibraryReportService.toGib(1610612736d)).isEqualTo(1.5);
            assertThat(LibraryReportService.toGib(1234567890d)).isEqualTo(1.15);
        }
    }

    @Test
    @DisplayName("Should expose recent upgrades for both catalogs")
    void shouldExposeRecentUpgrades() {
        stateStore.recordRecentUpgrade(CatalogKind.EPISODES, new RecentUpgrade(80, "Show", 8));

        Map<String, List<RecentUpgrade>> recent = service.recentUpgrades();

        assertThat(recent).containsOnlyKeys("movies", "episodes");
        assertThat(recent.get("episodes")).containsExactly(new RecentUpgrade(80, "Show", 8));
    }
}
