package dev.upgrader.model;

import dev.upgrader.error.ValidationException;

import java.util.Locale;

/**
 * The two catalog services the engine drives.
 */
public enum CatalogKind {

    MOVIES("movies", "radarr"),
    EPISODES("episodes", "sonarr");

    private final String wireName;
    private final String legacyName;

    CatalogKind(String wireName, String legacyName) {
        this.wireName = wireName;
        this.legacyName = legacyName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Parse a request value. Accepts the wire name and the legacy service name.
     */
    public static CatalogKind fromWire(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (CatalogKind kind : values()) {
                if (kind.wireName.equals(normalized) || kind.legacyName.equals(normalized)) {
                    return kind;
                }
            }
        }
        throw new ValidationException("Invalid target '" + value + "' (expected 'movies' or 'episodes')");
    }
}
