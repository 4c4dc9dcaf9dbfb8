package dev.upgrader.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Snapshot of a movie or series as listed by its catalog.
 * <p>
 * The raw document is kept so an update can PUT it back with only the tag list
 * changed; the catalogs reject partial documents.
 */
@Getter
@Builder(toBuilder = true)
@ToString(exclude = "source")
public class CatalogItem {

    private final int id;
    private final String title;
    private final boolean monitored;
    private final int qualityProfileId;

    /** Movie file ID, {@code null} when the movie has no file. Always {@code null} for series. */
    private final Integer fileId;

    /** Number of episode files on disk. Series only. */
    private final int episodeFileCount;

    @Builder.Default
    private final SortedSet<Integer> tags = Collections.emptySortedSet();

    private final ObjectNode source;

    public static CatalogItem fromJson(JsonNode node) {
        SortedSet<Integer> tags = new TreeSet<>();
        for (JsonNode tag : node.path("tags")) {
            tags.add(tag.asInt());
        }
        int movieFileId = node.path("movieFileId").asInt(0);
        return CatalogItem.builder()
                .id(node.path("id").asInt())
                .title(node.path("title").asText(""))
                .monitored(node.path("monitored").asBoolean(false))
                .qualityProfileId(node.path("qualityProfileId").asInt(0))
                .fileId(movieFileId != 0 ? movieFileId : null)
                .episodeFileCount(node.path("statistics").path("episodeFileCount").asInt(0))
                .tags(Collections.unmodifiableSortedSet(tags))
                .source(node.isObject() ? ((ObjectNode) node).deepCopy() : null)
                .build();
    }

    public boolean hasFile() {
        return fileId != null;
    }

    public boolean hasTag(int tagId) {
        return tags.contains(tagId);
    }

    /**
     * Copy with {@code tagId} added to the existing tags.
     */
    public CatalogItem withTag(int tagId) {
        SortedSet<Integer> merged = new TreeSet<>(tags);
        merged.add(tagId);
        return toBuilder().tags(Collections.unmodifiableSortedSet(merged)).build();
    }

    /**
     * Copy with {@code tagId} removed, other tags untouched.
     */
    public CatalogItem withoutTag(int tagId) {
        SortedSet<Integer> remaining = new TreeSet<>(tags);
        remaining.remove(tagId);
        return toBuilder().tags(Collections.unmodifiableSortedSet(remaining)).build();
    }

    /**
     * The document to PUT back: the original JSON with the current tag set.
     */
    public ObjectNode toJson() {
        ObjectNode json = source != null ? source.deepCopy() : JsonNodeFactory.instance.objectNode().put("id", id);
        ArrayNode tagArray = json.putArray("tags");
        tags.forEach(tagArray::add);
        return json;
    }
}
