package dev.upgrader.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Eligibility counts for one catalog kind.
 */
public record KindSummary(
        @JsonProperty("total_below_cutoff") int totalBelowCutoff,
        @JsonProperty("eligible_for_upgrade") int eligibleForUpgrade,
        List<SummaryRow> items) {

    /**
     * Detail row. Movie rows carry {@code title}; episode rows carry {@code series}
     * and {@code episodeFileId}.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SummaryRow(int id, String title, String series, Integer episodeFileId,
                             int score, int cutoff, boolean tagged) {
    }
}
