package dev.upgrader.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Timeouts, retries and fan-out width for catalog calls.
 * Loaded from application.yml under 'http' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "http")
public class HttpConfig {

    private Duration timeout = Duration.ofSeconds(15);
    private int maxRetries = 3;
    private Duration backoffFactor = Duration.ofMillis(500);
    private Duration maxBackoff = Duration.ofSeconds(120);
    private int maxParallelRequests = 8;

    /**
     * Width of the score-fetch fan-out, never below 2.
     */
    public int getEffectiveParallelism() {
        return Math.max(2, maxParallelRequests);
    }
}
