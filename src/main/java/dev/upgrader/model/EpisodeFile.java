package dev.upgrader.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One file on disk belonging to a series, with the catalog's current format score.
 */
public record EpisodeFile(int id, int seriesId, int customFormatScore) {

    public static EpisodeFile fromJson(JsonNode node) {
        return new EpisodeFile(
                node.path("id").asInt(),
                node.path("seriesId").asInt(0),
                node.path("customFormatScore").asInt(0));
    }
}
