package dev.upgrader.catalog.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.upgrader.catalog.CatalogClient;
import dev.upgrader.error.ValidationException;
import dev.upgrader.http.ResilientFetcher;
import dev.upgrader.model.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
public abstract class AbstractCatalogClient implements CatalogClient {

    protected final ResilientFetcher fetcher;
    private final String baseUrl;
    private final String apiPath;

    protected AbstractCatalogClient(ResilientFetcher fetcher, String baseUrl, String apiPath) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new ValidationException("Base URL must not be empty.");
        }
        this.fetcher = fetcher;
        this.baseUrl = baseUrl.strip().replaceAll("/+$", "");
        String path = apiPath == null || apiPath.isBlank() ? "/" : apiPath.strip();
        path = path.startsWith("/") ? path : "/" + path;
        this.apiPath = path.endsWith("/") ? path : path + "/";
    }

    @Override
    public Tag getOrCreateTag(String label) {
        for (JsonNode tag : records(fetcher.get(url("tag")))) {
            if (label.equals(tag.path("label").asText(null))) {
                return new Tag(tag.path("id").asInt(), label);
            }
        }
        ObjectNode body = JsonNodeFactory.instance.objectNode().put("label", label);
        JsonNode created = fetcher.post(url("tag"), body);
        Tag tag = new Tag(created.path("id").asInt(), label);
        log.info("{}: created new tag '{}' with id={}", getKind().wireName(), label, tag.id());
        return tag;
    }

    @Override
    public Map<Integer, Integer> qualityProfileCutoffs() {
        Map<Integer, Integer> cutoffs = new LinkedHashMap<>();
        for (JsonNode profile : records(fetcher.get(url("qualityprofile")))) {
            cutoffs.put(profile.path("id").asInt(), profile.path("cutoffFormatScore").asInt(0));
        }
        return cutoffs;
    }

    @Override
    public List<JsonNode> queue() {
        JsonNode response = fetcher.get(url("queue"));
        if (response.isArray() || response.has("records")) {
            return records(response);
        }
        log.warn("{}: queue returned unexpected payload type: {}", getKind().wireName(), response.getNodeType());
        return List.of();
    }

    /**
     * Fire a named background command with a list of target IDs.
     */
    protected JsonNode command(String name, String idsField, Collection<Integer> ids) {
        ObjectNode body = JsonNodeFactory.instance.objectNode().put("name", name);
        ArrayNode idArray = body.putArray(idsField);
        ids.forEach(idArray::add);
        return fetcher.post(url("command"), body);
    }

    protected UriComponentsBuilder endpoint(Object... parts) {
        StringBuilder path = new StringBuilder();
        for (Object part : parts) {
            String segment = String.valueOf(part).replaceAll("^/+|/+$", "");
            if (!segment.isEmpty()) {
                if (path.length() > 0) {
                    path.append('/');
                }
                path.append(segment);
            }
        }
        return UriComponentsBuilder.fromUriString(baseUrl + apiPath + path);
    }

    protected String url(Object... parts) {
        return endpoint(parts).toUriString();
    }

    /**
     * Items of a list response; paged responses wrap them in {@code records}.
     */
    protected static List<JsonNode> records(JsonNode response) {
        JsonNode items = response.isObject() && response.has("records") ? response.get("records") : response;
        List<JsonNode> result = new ArrayList<>();
        if (items.isArray()) {
            items.forEach(result::add);
        }
        return result;
    }
}
