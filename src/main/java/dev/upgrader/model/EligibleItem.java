package dev.upgrader.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Row of the eligible-items listing: below cutoff and untagged.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EligibleItem(int id, String title, String series, String episode, String status,
                           int score, int cutoff) {

    public static EligibleItem movie(int id, String title, int score, int cutoff) {
        return new EligibleItem(id, title, null, null, statusText(score, cutoff), score, cutoff);
    }

    public static EligibleItem episodeFile(int fileId, String series, int score, int cutoff) {
        return new EligibleItem(fileId, null, series, "EpisodeFile " + fileId, statusText(score, cutoff), score, cutoff);
    }

    private static String statusText(int score, int cutoff) {
        return "Score " + score + " / " + cutoff;
    }
}
