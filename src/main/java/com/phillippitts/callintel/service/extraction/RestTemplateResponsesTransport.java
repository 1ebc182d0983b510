package com.phillippitts.callintel.service.extraction;

import com.phillippitts.callintel.exception.ErrorCategory;
import com.phillippitts.callintel.exception.MalformedResponseException;
import com.phillippitts.callintel.exception.PromptNotFoundException;
import com.phillippitts.callintel.exception.UpstreamException;
import com.phillippitts.callintel.exception.UpstreamExceptionBuilder;
import com.phillippitts.callintel.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.util.Objects;
import java.util.Set;

/**
 * {@link ResponsesApiTransport} over {@link RestTemplate}: {@code POST {baseUrl}/responses}
 * with a bearer credential.
 */
public class RestTemplateResponsesTransport implements ResponsesApiTransport {

    private static final Logger LOG = LogManager.getLogger(RestTemplateResponsesTransport.class);

    private static final String SERVICE = "openai";
    private static final Set<Integer> TRANSIENT_STATUSES = Set.of(429, 500, 502, 503, 504);
    private static final Set<Integer> CREDENTIAL_STATUSES = Set.of(401, 403);

    private final RestTemplate restTemplate;
    private final String endpoint;
    private final String apiKey;

    public RestTemplateResponsesTransport(RestTemplate restTemplate, String baseUrl, String apiKey) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate must not be null");
        this.endpoint = Objects.requireNonNull(baseUrl, "baseUrl must not be null") + "/responses";
        this.apiKey = Objects.requireNonNull(apiKey, "apiKey must not be null");
    }

    @Override
    public JSONObject createResponse(JSONObject request) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(apiKey);

        LOG.debug("POST {} ({} chars)", endpoint, request.toString().length());
        String body;
        try {
            body = restTemplate.postForObject(endpoint, new HttpEntity<>(request.toString(), headers), String.class);
        } catch (RestClientResponseException e) {
            throw classify(promptIdOf(request), e.getStatusCode().value(), e.getResponseBodyAsString(), e);
        } catch (ResourceAccessException e) {
            boolean timedOut = e.getCause() instanceof SocketTimeoutException;
            throw UpstreamExceptionBuilder.create(timedOut
                            ? "Responses API request timed out"
                            : "Responses API request failed: " + e.getMessage())
                    .service(SERVICE)
                    .errorCode(timedOut ? "ETIMEDOUT" : "ECONNERROR")
                    .category(ErrorCategory.TRANSIENT_UPSTREAM)
                    .cause(e)
                    .build();
        } catch (RestClientException e) {
            throw UpstreamExceptionBuilder.create("Responses API request failed: " + e.getMessage())
                    .service(SERVICE)
                    .category(ErrorCategory.PERMANENT_UPSTREAM)
                    .cause(e)
                    .build();
        }

        try {
            return new JSONObject(body == null ? "" : body);
        } catch (JSONException e) {
            throw new MalformedResponseException("Responses API returned a non-JSON body: "
                    + LogSanitizer.preview(body, 120), null, e);
        }
    }

    /**
     * Maps a non-2xx response. A 404 whose error message names a missing prompt becomes
     * {@link PromptNotFoundException}; everything else an {@link UpstreamException} coded with
     * the status. A rejected credential (401/403) is a configuration problem, not an upstream one.
     */
    static UpstreamException classify(String promptId, int status, String responseBody, Throwable cause) {
        String apiMessage = apiErrorMessage(responseBody);
        if (isPromptNotFound(status, apiMessage)) {
            return new PromptNotFoundException(promptId, apiMessage);
        }
        ErrorCategory category;
        if (CREDENTIAL_STATUSES.contains(status)) {
            category = ErrorCategory.CONFIGURATION;
        } else if (TRANSIENT_STATUSES.contains(status)) {
            category = ErrorCategory.TRANSIENT_UPSTREAM;
        } else {
            category = ErrorCategory.PERMANENT_UPSTREAM;
        }
        return UpstreamExceptionBuilder.create("Responses API call failed: "
                        + (apiMessage != null ? apiMessage : LogSanitizer.preview(responseBody, 200)))
                .service(SERVICE)
                .status(status)
                .category(category)
                .metadata("promptId", promptId)
                .cause(cause)
                .build();
    }

    static boolean isPromptNotFound(int status, String apiMessage) {
        return status == 404 && apiMessage != null
                && apiMessage.contains("Prompt with id") && apiMessage.contains("not found");
    }

    static String apiErrorMessage(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            return null;
        }
        try {
            JSONObject error = new JSONObject(responseBody).optJSONObject("error");
            return error == null ? null : error.optString("message", null);
        } catch (JSONException e) {
            return null;
        }
    }

    private static String promptIdOf(JSONObject request) {
        JSONObject prompt = request.optJSONObject("prompt");
        return prompt == null ? null : prompt.optString("id", null);
    }
}
