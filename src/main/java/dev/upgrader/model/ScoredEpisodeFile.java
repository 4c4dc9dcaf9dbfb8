package dev.upgrader.model;

/**
 * An episode file paired with its series, score and the series' profile cutoff.
 * {@code seriesTagged} reflects the engine tag on the owning series.
 */
public record ScoredEpisodeFile(CatalogItem series, EpisodeFile file, int cutoff, boolean seriesTagged) {

    public boolean belowCutoff() {
        return file.customFormatScore() < cutoff;
    }

    public String displayTitle() {
        return series.getTitle() + " (EpisodeFile " + file.id() + ")";
    }
}
