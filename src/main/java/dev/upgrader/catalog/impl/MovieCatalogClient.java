package dev.upgrader.catalog.impl;

import com.fasterxml.jackson.databind.JsonNode;
import dev.upgrader.http.ResilientFetcher;
import dev.upgrader.model.CatalogItem;
import dev.upgrader.model.CatalogKind;

import java.util.Collection;
import java.util.List;

public class MovieCatalogClient extends AbstractCatalogClient {

    public MovieCatalogClient(ResilientFetcher fetcher, String baseUrl, String apiPath) {
        super(fetcher, baseUrl, apiPath);
    }

    @Override
    public CatalogKind getKind() {
        return CatalogKind.MOVIES;
    }

    public List<CatalogItem> listMovies() {
        return records(fetcher.get(url("movie"))).stream()
                .map(CatalogItem::fromJson)
                .toList();
    }

    public CatalogItem getMovie(int movieId) {
        return CatalogItem.fromJson(fetcher.get(url("movie", movieId)));
    }

    /**
     * Custom format score of a movie file; 0 when the catalog reports none.
     */
    public int movieFileScore(int fileId) {
        return fetcher.get(url("moviefile", fileId)).path("customFormatScore").asInt(0);
    }

    public void updateMovie(CatalogItem movie) {
        fetcher.put(url("movie", movie.getId()), movie.toJson());
    }

    public void deleteMovieFile(int fileId) {
        fetcher.delete(url("moviefile", fileId));
    }

    public JsonNode searchMovies(Collection<Integer> movieIds) {
        return command("MoviesSearch", "movieIds", movieIds);
    }
}
