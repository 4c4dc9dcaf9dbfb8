package dev.upgrader.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import dev.upgrader.error.HttpStatusException;
import dev.upgrader.error.TransportException;
import dev.upgrader.metrics.UpgraderMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Blocking JSON calls against one catalog service with timeout and retry.
 * <p>
 * Connection failures, timeouts and statuses 429/500/502/503/504 are retried per
 * {@link RetryPolicy}. An empty body yields an empty object; a body that is not JSON
 * yields a {@link TextNode} holding the raw text.
 */
@Slf4j
public class ResilientFetcher {

    private final WebClient webClient;
    private final RetryPolicy retryPolicy;
    private final Duration timeout;
    private final Sleeper sleeper;
    private final ObjectMapper objectMapper;
    private final UpgraderMetrics metrics;

    public ResilientFetcher(WebClient webClient, RetryPolicy retryPolicy, Duration timeout, Sleeper sleeper,
                            ObjectMapper objectMapper, UpgraderMetrics metrics) {
        this.webClient = webClient;
        this.retryPolicy = retryPolicy;
        this.timeout = timeout;
        this.sleeper = sleeper;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    public JsonNode get(String url) {
        return request(HttpMethod.GET, url, null);
    }

    public JsonNode post(String url, Object body) {
        return request(HttpMethod.POST, url, body);
    }

    public JsonNode put(String url, Object body) {
        return request(HttpMethod.PUT, url, body);
    }

    public JsonNode delete(String url) {
        return request(HttpMethod.DELETE, url, null);
    }

    /**
     * Execute a call, retrying retryable failures.
     *
     * @throws TransportException  when the service stays unreachable
     * @throws HttpStatusException when a non-2xx status is final
     */
    public JsonNode request(HttpMethod method, String url, @Nullable Object body) {
        int attempt = 0;
        while (true) {
            RawResponse response;
            try {
                response = exchange(method, url, body);
            } catch (TransportException e) {
                if (!retryPolicy.canRetry(attempt)) {
                    throw e;
                }
                log.warn("{} {} failed: {} (retry {}/{})", method, url, e.getMessage(),
                        attempt + 1, retryPolicy.getMaxRetries());
                backOff(attempt++);
                continue;
            }

            if (response.isSuccessful()) {
                return parseBody(response.body());
            }
            if (retryPolicy.isRetryableStatus(response.statusCode()) && retryPolicy.canRetry(attempt)) {
                log.warn("{} {} returned HTTP {} (retry {}/{})", method, url, response.statusCode(),
                        attempt + 1, retryPolicy.getMaxRetries());
                backOff(attempt++);
                continue;
            }
            throw new HttpStatusException(method.name(), url, response.statusCode(), response.body());
        }
    }

    JsonNode parseBody(String body) {
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("Response is not JSON, returning raw text ({} chars)", body.length());
            return TextNode.valueOf(body);
        }
    }

    private RawResponse exchange(HttpMethod method, String url, @Nullable Object body) {
        WebClient.RequestBodySpec bodySpec = webClient.method(method).uri(URI.create(url));
        WebClient.RequestHeadersSpec<?> request = body != null
                ? bodySpec.contentType(MediaType.APPLICATION_JSON).bodyValue(body)
                : bodySpec;
        try {
            return request
                    .exchangeToMono(resp -> resp.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(text -> new RawResponse(resp.statusCode().value(), text)))
                    .timeout(timeout)
                    .blockOptional()
                    .orElseThrow(() -> new TransportException(method + " " + url + " produced no response", null));
        } catch (WebClientRequestException e) {
            throw new TransportException(method + " " + url + " failed: " + e.getMessage(), e);
        } catch (TransportException e) {
            throw e;
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                throw new TransportException(method + " " + url + " timed out after " + timeout, cause);
            }
            // connection dropped mid-body surfaces as a wrapped IOException (PrematureCloseException)
            if (cause instanceof IOException || cause instanceof WebClientException) {
                throw new TransportException(method + " " + url + " failed: " + cause.getMessage(), cause);
            }
            throw e;
        }
    }

    private void backOff(int attempt) {
        metrics.recordHttpRetry();
        try {
            sleeper.sleep(retryPolicy.backoffDelay(attempt));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while backing off", e);
        }
    }

    private record RawResponse(int statusCode, String body) {
        boolean isSuccessful() {
            return statusCode >= 200 && statusCode < 300;
        }
    }
}
