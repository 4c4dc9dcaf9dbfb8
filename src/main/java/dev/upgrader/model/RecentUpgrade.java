package dev.upgrader.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * An item tagged during the latest selection step.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RecentUpgrade(int id, String title, Integer seriesId) {
}
