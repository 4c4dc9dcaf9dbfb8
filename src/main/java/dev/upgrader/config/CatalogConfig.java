package dev.upgrader.config;

import dev.upgrader.model.CatalogKind;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Connection and selection settings for the two catalog services.
 * Loaded from application.yml under 'catalog' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "catalog")
public class CatalogConfig {

    /** Label of the engine-owned tag. */
    private String tagName = "upgrade-cf";

    /** Versioned API path appended to each base URL. */
    private String apiPath = "/api/v3/";

    private Service movies = new Service();
    private Service episodes = new Service();

    public Service forKind(CatalogKind kind) {
        return switch (kind) {
            case MOVIES -> movies;
            case EPISODES -> episodes;
        };
    }

    @Data
    public static class Service {
        private boolean enabled = false;
        private String baseUrl = "";
        private String apiKey = "";
        /** Items selected per cycle. */
        private int numToUpgrade = 1;
    }
}
