package dev.upgrader.model;

/**
 * A monitored movie with a file, paired with its file score and its profile cutoff.
 */
public record ScoredMovie(CatalogItem movie, int score, int cutoff) {

    public boolean belowCutoff() {
        return score < cutoff;
    }
}
