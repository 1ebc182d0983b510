package com.phillippitts.callintel.service.retry;

import com.phillippitts.callintel.exception.ErrorCategory;
import com.phillippitts.callintel.exception.UpstreamException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;

class RetryPredicatesTest {

    @Test
    void shouldNotRetryTimedOutMessageWithoutTimeoutToken() {
        Predicate<Throwable> predicate = RetryPredicates.matchingTokens("429", "500");

        assertThat(predicate.test(new RuntimeException("Request timed out"))).isFalse();
    }

    @Test
    void shouldRetryTimedOutMessageWhenTimeoutTokenPresent() {
        Predicate<Throwable> predicate = RetryPredicates.matchingTokens("429", "500", "timeout");

        assertThat(predicate.test(new RuntimeException("Request timed out"))).isTrue();
    }

    @Test
    void shouldApplyTimeoutOverrideToOperationTimeouts() {
        OperationTimeoutException timeout = new OperationTimeoutException("upload", Duration.ofSeconds(5));

        assertThat(RetryPredicates.matchingTokens("429").test(timeout)).isFalse();
        assertThat(RetryPredicates.matchingTokens("429", "ETIMEDOUT").test(timeout)).isTrue();
    }

    @Test
    void shouldMatchErrorCodesExactly() {
        Predicate<Throwable> predicate = RetryPredicates.matchingTokens("429", "500", "503");

        assertThat(predicate.test(upstream("Too many requests", 429))).isTrue();
        assertThat(predicate.test(upstream("Service unavailable", 503))).isTrue();
        assertThat(predicate.test(upstream("Bad request", 400))).isFalse();
        // structured code wins over a "500" inside the message
        assertThat(predicate.test(new UpstreamException("quota 500 exceeded", "openai", 402, "402",
                ErrorCategory.PERMANENT_UPSTREAM))).isFalse();
    }

    @Test
    void shouldFallBackToMessageMatchingForUnclassifiedErrors() {
        Predicate<Throwable> predicate = RetryPredicates.matchingTokens("ECONNRESET", "503");

        assertThat(predicate.test(new RuntimeException("socket hang up: econnreset"))).isTrue();
        assertThat(predicate.test(new RuntimeException("HTTP 503 from gateway"))).isTrue();
        assertThat(predicate.test(new RuntimeException("invalid api key"))).isFalse();
    }

    @Test
    void shouldRetryEverythingWhenTokensEmpty() {
        assertThat(RetryPredicates.matchingTokens(List.of()).test(new RuntimeException("Request timed out"))).isTrue();
        assertThat(RetryPredicates.anyError().test(new IllegalStateException())).isTrue();
    }

    @Test
    void shouldHandleErrorsWithoutMessage() {
        assertThat(RetryPredicates.matchingTokens("429").test(new RuntimeException())).isFalse();
    }

    @Test
    void shouldRecognizeTimeoutTokens() {
        assertThat(RetryPredicates.isTimeoutToken("timeout")).isTrue();
        assertThat(RetryPredicates.isTimeoutToken("ETIMEDOUT")).isTrue();
        assertThat(RetryPredicates.isTimeoutToken("timed out")).isTrue();
        assertThat(RetryPredicates.isTimeoutToken("ECONNABORTED")).isFalse();
        assertThat(RetryPredicates.isTimeoutToken(null)).isFalse();
    }

    private static UpstreamException upstream(String message, int status) {
        return new UpstreamException(message, "openai", status, String.valueOf(status),
                ErrorCategory.TRANSIENT_UPSTREAM);
    }
}
