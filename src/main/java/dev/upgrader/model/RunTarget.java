package dev.upgrader.model;

import dev.upgrader.error.ValidationException;

import java.util.List;
import java.util.Locale;

/**
 * What a trigger asks for: one catalog kind or both.
 */
public enum RunTarget {

    MOVIES(List.of(CatalogKind.MOVIES)),
    EPISODES(List.of(CatalogKind.EPISODES)),
    BOTH(List.of(CatalogKind.MOVIES, CatalogKind.EPISODES));

    private final List<CatalogKind> kinds;

    RunTarget(List<CatalogKind> kinds) {
        this.kinds = kinds;
    }

    /**
     * Kinds to run, movies first.
     */
    public List<CatalogKind> kinds() {
        return kinds;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a request value; {@code null} or blank means {@link #BOTH}.
     */
    public static RunTarget fromWire(String value) {
        if (value == null || value.isBlank()) {
            return BOTH;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("both".equals(normalized)) {
            return BOTH;
        }
        try {
            return switch (CatalogKind.fromWire(normalized)) {
                case MOVIES -> MOVIES;
                case EPISODES -> EPISODES;
            };
        } catch (ValidationException e) {
            throw new ValidationException("Invalid target '" + value + "' (expected 'movies', 'episodes' or 'both')");
        }
    }
}
