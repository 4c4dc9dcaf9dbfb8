package dev.upgrader.catalog.impl;

import com.fasterxml.jackson.databind.JsonNode;
import dev.upgrader.error.ResolutionException;
import dev.upgrader.http.ResilientFetcher;
import dev.upgrader.model.CatalogItem;
import dev.upgrader.model.CatalogKind;
import dev.upgrader.model.Episode;
import dev.upgrader.model.EpisodeFile;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

public class EpisodeCatalogClient extends AbstractCatalogClient {

    public EpisodeCatalogClient(ResilientFetcher fetcher, String baseUrl, String apiPath) {
        super(fetcher, baseUrl, apiPath);
    }

    @Override
    public CatalogKind getKind() {
        return CatalogKind.EPISODES;
    }

    public List<CatalogItem> listSeries() {
        return records(fetcher.get(url("series"))).stream()
                .map(CatalogItem::fromJson)
                .toList();
    }

    public CatalogItem getSeries(int seriesId) {
        return CatalogItem.fromJson(fetcher.get(url("series", seriesId)));
    }

    public void updateSeries(CatalogItem series) {
        fetcher.put(url("series", series.getId()), series.toJson());
    }

    public List<EpisodeFile> listEpisodeFiles(int seriesId) {
        String url = endpoint("episodefile").queryParam("seriesId", seriesId).toUriString();
        return records(fetcher.get(url)).stream()
                .map(EpisodeFile::fromJson)
                .toList();
    }

    /**
     * Fetch one episode. Some catalog versions answer with a one-element list.
     */
    public Episode getEpisode(int episodeId) {
        JsonNode response = fetcher.get(url("episode", episodeId));
        if (response.isArray()) {
            if (response.isEmpty()) {
                throw new ResolutionException("Episode " + episodeId + " not found");
            }
            response = response.get(0);
        }
        return Episode.fromJson(response);
    }

    /**
     * Episode IDs stored in an episode file (multi-episode files map to several).
     */
    public List<Integer> episodeIdsForFile(int episodeFileId) {
        String url = endpoint("episode").queryParam("episodeFileId", episodeFileId).toUriString();
        JsonNode response = fetcher.get(url);
        List<Integer> ids = new ArrayList<>();
        if (response.isArray()) {
            response.forEach(episode -> ids.add(episode.path("id").asInt()));
        } else if (response.isObject() && response.has("id")) {
            ids.add(response.get("id").asInt());
        }
        return ids;
    }

    public void deleteEpisodeFile(int episodeFileId) {
        fetcher.delete(url("episodefile", episodeFileId));
    }

    public JsonNode searchEpisodes(Collection<Integer> episodeIds) {
        return command("EpisodeSearch", "episodeIds", episodeIds);
    }
}
