package dev.upgrader.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.upgrader.catalog.impl.EpisodeCatalogClient;
import dev.upgrader.catalog.impl.MovieCatalogClient;
import dev.upgrader.config.CatalogConfig;
import dev.upgrader.config.HttpConfig;
import dev.upgrader.error.ValidationException;
import dev.upgrader.http.ResilientFetcher;
import dev.upgrader.http.RetryPolicy;
import dev.upgrader.http.Sleeper;
import dev.upgrader.metrics.UpgraderMetrics;
import dev.upgrader.model.CatalogKind;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * Builds catalog clients from configuration.
 */
@Component
@RequiredArgsConstructor
public class CatalogClientFactory {

    private static final int MAX_BODY_BYTES = 32 * 1024 * 1024;

    private final CatalogConfig catalogConfig;
    private final HttpConfig httpConfig;
    private final WebClient.Builder webClientBuilder;
    private final ObjectMapper objectMapper;
    private final UpgraderMetrics metrics;
    private final Sleeper sleeper;

    public boolean isEnabled(CatalogKind kind) {
        return catalogConfig.forKind(kind).isEnabled();
    }

    public MovieCatalogClient movieClient() {
        return new MovieCatalogClient(fetcherFor(CatalogKind.MOVIES),
                catalogConfig.getMovies().getBaseUrl(), catalogConfig.getApiPath());
    }

    public EpisodeCatalogClient episodeClient() {
        return new EpisodeCatalogClient(fetcherFor(CatalogKind.EPISODES),
                catalogConfig.getEpisodes().getBaseUrl(), catalogConfig.getApiPath());
    }

    ResilientFetcher fetcherFor(CatalogKind kind) {
        CatalogConfig.Service service = catalogConfig.forKind(kind);
        if (service.getBaseUrl() == null || service.getBaseUrl().isBlank()) {
            throw new ValidationException(kind.wireName() + " base URL must not be empty.");
        }
        if (service.getApiKey() == null || service.getApiKey().isBlank()) {
            throw new ValidationException(kind.wireName() + " API key must not be empty.");
        }

        HttpClient httpClient = HttpClient.create()
                .responseTimeout(httpConfig.getTimeout());

        WebClient webClient = webClientBuilder.clone()
                .codecs(config -> config.defaultCodecs().maxInMemorySize(MAX_BODY_BYTES))
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.AUTHORIZATION, service.getApiKey())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();

        return new ResilientFetcher(webClient, RetryPolicy.from(httpConfig), httpConfig.getTimeout(),
                sleeper, objectMapper, metrics);
    }
}
