package dev.upgrader.http;

import dev.upgrader.config.HttpConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    private final RetryPolicy policy = RetryPolicy.from(new HttpConfig());

    @Test
    @DisplayName("Backoff doubles from the factor")
    void backoffDoubles() {
        assertThat(policy.backoffDelay(0)).isEqualTo(Duration.ofMillis(500));
        assertThat(policy.backoffDelay(1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.backoffDelay(2)).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    @DisplayName("Backoff is capped at the maximum")
    void backoffIsCapped() {
        assertThat(policy.backoffDelay(10)).isEqualTo(Duration.ofSeconds(120));
        assertThat(policy.backoffDelay(62)).isEqualTo(Duration.ofSeconds(120));
    }

    @Test
    @DisplayName("Allows exactly maxRetries retries")
    void allowsMaxRetries() {
        assertThat(policy.canRetry(0)).isTrue();
        assertThat(policy.canRetry(2)).isTrue();
        assertThat(policy.canRetry(3)).isFalse();
    }

    @Test
    void zeroRetriesNeverRetries() {
        RetryPolicy noRetry = new RetryPolicy(0, Duration.ofMillis(500), Duration.ofSeconds(1));
        assertThat(noRetry.canRetry(0)).isFalse();
    }

    @ParameterizedTest
    @ValueSource(ints = {429, 500, 502, 503, 504})
    void retryableStatuses(int status) {
        assertThat(policy.isRetryableStatus(status)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(ints = {400, 401, 403, 404, 409, 501})
    void finalStatuses(int status) {
        assertThat(policy.isRetryableStatus(status)).isFalse();
    }

    @Test
    void rejectsNegativeRetries() {
        assertThatThrownBy(() -> new RetryPolicy(-1, Duration.ZERO, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
