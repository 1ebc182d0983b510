package com.phillippitts.callintel.service.events;

import java.time.Instant;

/**
 * Published when a structured-extraction request fails for good: retries exhausted, a
 * non-retryable upstream error, a failed fallback call, or an unparseable response.
 * Never published for attempts that a later retry recovered.
 *
 * @param errorType  coarse type used for grouping and throttling
 *                   ({@code openai_api_failure}, {@code openai_response_parse_failed})
 * @param operation  which request failed (e.g. {@code individual}, {@code complete}, {@code fallback})
 * @param statusCode HTTP status, or 0 when none was received
 * @param errorCode  machine-matchable code, may be null
 * @param attempts   attempts made before giving up
 * @param message    failure message
 * @param occurredAt when the failure was observed
 */
public record ExtractionFailureEvent(
        String errorType,
        String operation,
        int statusCode,
        String errorCode,
        int attempts,
        String message,
        Instant occurredAt
) {
    public static final String API_FAILURE = "openai_api_failure";
    public static final String PARSE_FAILURE = "openai_response_parse_failed";
}
