package dev.upgrader.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import dev.upgrader.model.CatalogKind;
import dev.upgrader.model.Tag;

import java.util.List;
import java.util.Map;

/**
 * Operations shared by both catalog services.
 * Each catalog kind implements this interface.
 */
public interface CatalogClient {

    CatalogKind getKind();

    /**
     * Look up a tag by label, creating it when missing. Calling twice with the same
     * label yields the same tag and creates at most one.
     */
    Tag getOrCreateTag(String label);

    /**
     * Quality profile ID to cutoff format score.
     */
    Map<Integer, Integer> qualityProfileCutoffs();

    /**
     * Current download/import queue records.
     */
    List<JsonNode> queue();
}
