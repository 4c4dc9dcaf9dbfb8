package dev.upgrader.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

/**
 * An item eligible for upgrade in the current cycle. For episodes {@code itemId} is
 * the episode-file ID and {@code seriesId} is set.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Candidate(int itemId, String title, int currentScore, int requiredScore, Integer seriesId) {
}
