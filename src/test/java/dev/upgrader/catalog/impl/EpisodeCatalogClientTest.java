package dev.upgrader.catalog.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.upgrader.error.ResolutionException;
import dev.upgrader.http.ResilientFetcher;
import dev.upgrader.http.RetryPolicy;
import dev.upgrader.metrics.UpgraderMetrics;
import dev.upgrader.model.CatalogItem;
import dev.upgrader.model.Episode;
import dev.upgrader.model.EpisodeFile;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EpisodeCatalogClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer mockWebServer;
    private EpisodeCatalogClient client;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();

        ResilientFetcher fetcher = new ResilientFetcher(WebClient.builder().build(),
                new RetryPolicy(0, Duration.ofMillis(1), Duration.ofMillis(1)), Duration.ofSeconds(5),
                delay -> { }, objectMapper, new UpgraderMetrics(new SimpleMeterRegistry()));
        client = new EpisodeCatalogClient(fetcher, mockWebServer.url("/sonarr/").toString(), "/api/v3/");
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    private void enqueueJson(String body) {
        mockWebServer.enqueue(new MockResponse().setBody(body).addHeader("Content-Type", "application/json"));
    }

    @Test
    void shouldReadEpisodeFileCountFromStatistics() {
        enqueueJson("[{\"id\": 4, \"title\": \"Dark\", \"qualityProfileId\": 1, \"tags\": [],"
                + " \"statistics\": {\"episodeFileCount\": 26}}]");

        List<CatalogItem> series = client.listSeries();

        assertThat(series).singleElement()
                .satisfies(s -> assertThat(s.getEpisodeFileCount()).isEqualTo(26));
    }

    @Test
    void shouldListEpisodeFilesOfOneSeries() throws InterruptedException {
        enqueueJson("[{\"id\": 100, \"seriesId\": 4, \"customFormatScore\": 50},"
                + " {\"id\": 101, \"seriesId\": 4}]");

        List<EpisodeFile> files = client.listEpisodeFiles(4);

        assertThat(files).containsExactly(new EpisodeFile(100, 4, 50), new EpisodeFile(101, 4, 0));
        assertThat(mockWebServer.takeRequest().getPath()).isEqualTo("/sonarr/api/v3/episodefile?seriesId=4");
    }

    @Test
    void shouldTakeFirstElementOfListEpisodeResponse() {
        enqueueJson("[{\"id\": 55, \"seriesId\": 4, \"episodeFileId\": 100}]");

        Episode episode = client.getEpisode(55);

        assertThat(episode).isEqualTo(new Episode(55, 4, 100));
    }

    @Test
    void shouldFailOnEmptyEpisodeList() {
        enqueueJson("[]");

        assertThatThrownBy(() -> client.getEpisode(55))
                .isInstanceOf(ResolutionException.class)
                .hasMessageContaining("55");
    }

    @Test
    void shouldResolveAllEpisodesOfMultiEpisodeFile() throws InterruptedException {
        enqueueJson("[{\"id\": 1001, \"episodeFileId\": 9}, {\"id\": 1002, \"episodeFileId\": 9}]");

        assertThat(client.episodeIdsForFile(9)).containsExactly(1001, 1002);
        assertThat(mockWebServer.takeRequest().getPath()).isEqualTo("/sonarr/api/v3/episode?episodeFileId=9");
    }

    @Test
    void shouldResolveSingleObjectResponse() {
        enqueueJson("{\"id\": 1001, \"episodeFileId\": 9}");

        assertThat(client.episodeIdsForFile(9)).containsExactly(1001);
    }

    @Test
    void shouldTagSeriesKeepingOtherFields() throws Exception {
        enqueueJson("{\"id\": 4, \"title\": \"Dark\", \"seasons\": [{\"seasonNumber\": 1}], \"tags\": []}");
        enqueueJson("{}");

        client.updateSeries(client.getSeries(4).withTag(3));

        mockWebServer.takeRequest();
        RecordedRequest put = mockWebServer.takeRequest();
        assertThat(put.getPath()).isEqualTo("/sonarr/api/v3/series/4");
        JsonNode body = objectMapper.readTree(put.getBody().readUtf8());
        assertThat(body.path("seasons").get(0).path("seasonNumber").asInt()).isEqualTo(1);
        assertThat(body.path("tags").get(0).asInt()).isEqualTo(3);
    }

    @Test
    void shouldSendEpisodeSearchCommand() throws Exception {
        enqueueJson("{}");

        client.searchEpisodes(List.of(1000, 1001));

        JsonNode body = objectMapper.readTree(mockWebServer.takeRequest().getBody().readUtf8());
        assertThat(body.path("name").asText()).isEqualTo("EpisodeSearch");
        assertThat(body.path("episodeIds").size()).isEqualTo(2);
    }
}
