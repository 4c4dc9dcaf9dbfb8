package dev.upgrader.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

/**
 * One row of a catalog download queue. Movie rows carry {@code title}; episode rows
 * carry {@code series} and an {@code SxxEyy} label. Sizes are GiB.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueueEntry(String title, String series, String episode, String status, String protocol,
                         double size, double sizeleft, String timeleft, String errorMessage,
                         String indexer, String downloadId) {
}
