package dev.upgrader.service;

import dev.upgrader.catalog.CatalogClientFactory;
import dev.upgrader.catalog.impl.EpisodeCatalogClient;
import dev.upgrader.catalog.impl.MovieCatalogClient;
import dev.upgrader.config.CatalogConfig;
import dev.upgrader.error.ResolutionException;
import dev.upgrader.error.UpgraderException;
import dev.upgrader.error.ValidationException;
import dev.upgrader.model.CatalogItem;
import dev.upgrader.model.CatalogKind;
import dev.upgrader.model.Episode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Single-item actions outside the cycle. For episodes the ID is an episode ID (not an
 * episode-file ID); the owning series is what gets tagged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ManualUpgradeService {

    private final CatalogClientFactory clientFactory;
    private final CatalogConfig catalogConfig;

    /**
     * Tag one item and trigger a search for it.
     */
    public void upgradeItem(CatalogKind kind, int itemId) {
        requireEnabled(kind);
        switch (kind) {
            case MOVIES -> upgradeMovie(itemId);
            case EPISODES -> upgradeEpisode(itemId);
        }
    }

    /**
     * Delete the current file of one item and trigger a search. A failed delete is
     * logged and the search still goes out.
     */
    public void forceUpgradeItem(CatalogKind kind, int itemId) {
        requireEnabled(kind);
        switch (kind) {
            case MOVIES -> forceUpgradeMovie(itemId);
            case EPISODES -> forceUpgradeEpisode(itemId);
        }
    }

    private void upgradeMovie(int movieId) {
        MovieCatalogClient client = clientFactory.movieClient();
        int tagId = client.getOrCreateTag(catalogConfig.getTagName()).id();
        CatalogItem movie = client.getMovie(movieId);
        client.updateMovie(movie.withTag(tagId));
        client.searchMovies(List.of(movieId));
        log.info("Triggered upgrade for movie '{}' (id={})", movie.getTitle(), movieId);
    }

    private void upgradeEpisode(int episodeId) {
        EpisodeCatalogClient client = clientFactory.episodeClient();
        int tagId = client.getOrCreateTag(catalogConfig.getTagName()).id();
        Episode episode = client.getEpisode(episodeId);
        if (episode.seriesId() == 0) {
            throw new ResolutionException("No seriesId found for episode " + episodeId);
        }
        CatalogItem series = client.getSeries(episode.seriesId());
        client.updateSeries(series.withTag(tagId));
        client.searchEpisodes(List.of(episodeId));
        log.info("Triggered upgrade for episode id={} (series '{}')", episodeId, series.getTitle());
    }

    private void forceUpgradeMovie(int movieId) {
        MovieCatalogClient client = clientFactory.movieClient();
        Integer fileId = client.getMovie(movieId).getFileId();
        if (fileId != null) {
            try {
                client.deleteMovieFile(fileId);
                log.info("Deleted movie file {} for movie id={}", fileId, movieId);
            } catch (UpgraderException e) {
                log.warn("Failed deleting movie file {}: {}", fileId, e.getMessage());
            }
        }
        client.searchMovies(List.of(movieId));
        log.info("Triggered forced upgrade for movie id={}", movieId);
    }

    private void forceUpgradeEpisode(int episodeId) {
        EpisodeCatalogClient client = clientFactory.episodeClient();
        Integer fileId = client.getEpisode(episodeId).episodeFileId();
        if (fileId != null) {
            try {
                client.deleteEpisodeFile(fileId);
                log.info("Deleted episode file {} for episode id={}", fileId, episodeId);
            } catch (UpgraderException e) {
                log.warn("Failed deleting episode file {}: {}", fileId, e.getMessage());
            }
        }
        client.searchEpisodes(List.of(episodeId));
        log.info("Triggered forced upgrade for episode id={}", episodeId);
    }

    private void requireEnabled(CatalogKind kind) {
        if (!clientFactory.isEnabled(kind)) {
            throw new ValidationException(kind.wireName() + " catalog is disabled");
        }
    }
}
