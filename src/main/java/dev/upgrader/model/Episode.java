package dev.upgrader.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The fields of an episode the engine needs for single-item actions.
 */
public record Episode(int id, int seriesId, Integer episodeFileId) {

    public static Episode fromJson(JsonNode node) {
        int fileId = node.path("episodeFileId").asInt(0);
        return new Episode(node.path("id").asInt(), node.path("seriesId").asInt(0), fileId != 0 ? fileId : null);
    }
}
