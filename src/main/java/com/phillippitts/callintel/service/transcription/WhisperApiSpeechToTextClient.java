package com.phillippitts.callintel.service.transcription;

import com.phillippitts.callintel.config.properties.SpeechToTextProperties;
import com.phillippitts.callintel.exception.ErrorCategory;
import com.phillippitts.callintel.exception.UpstreamException;
import com.phillippitts.callintel.exception.UpstreamExceptionBuilder;
import com.phillippitts.callintel.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.util.Objects;

/**
 * {@link SpeechToTextClient} for Whisper-compatible {@code /audio/transcriptions} endpoints.
 *
 * <p>Downloads the recording into memory (with basic auth when recording credentials are
 * configured) and posts it as multipart audio. Every failure is classified here, where the raw
 * HTTP status and body are still available:
 * <ul>
 *   <li>HTTP 403/404 or a "Recording not found" body: {@link ErrorCategory#NOT_YET_AVAILABLE}</li>
 *   <li>HTTP 429/5xx and network timeouts: {@link ErrorCategory#TRANSIENT_UPSTREAM}</li>
 *   <li>anything else: {@link ErrorCategory#PERMANENT_UPSTREAM}</li>
 * </ul>
 */
public class WhisperApiSpeechToTextClient implements SpeechToTextClient {

    private static final Logger LOG = LogManager.getLogger(WhisperApiSpeechToTextClient.class);

    static final String RECORDING_NOT_FOUND = "Recording not found";
    private static final int MAX_BODY_IN_MESSAGE = 300;

    private final RestTemplate restTemplate;
    private final SpeechToTextProperties props;

    public WhisperApiSpeechToTextClient(RestTemplate restTemplate, SpeechToTextProperties props) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
    }

    @Override
    public String transcribe(String recordingUrl) {
        if (recordingUrl == null || recordingUrl.isBlank()) {
            throw new IllegalArgumentException("recordingUrl must not be blank");
        }
        byte[] audio = download(recordingUrl);
        LOG.debug("Downloaded recording: {} bytes", audio.length);
        return requestTranscription(audio, fileNameOf(recordingUrl));
    }

    private byte[] download(String recordingUrl) {
        HttpHeaders headers = new HttpHeaders();
        if (props.hasRecordingCredentials()) {
            headers.setBasicAuth(props.recordingUsername(), props.recordingPassword());
        }
        ResponseEntity<byte[]> response;
        try {
            response = restTemplate.exchange(recordingUrl, HttpMethod.GET, new HttpEntity<>(headers), byte[].class);
        } catch (RestClientResponseException e) {
            throw classify("recording", "Recording download", e.getStatusCode().value(),
                    e.getResponseBodyAsString(), e);
        } catch (RestClientException e) {
            throw networkFailure("recording", "Recording download", e);
        }
        byte[] body = response.getBody();
        if (body == null || body.length == 0) {
            throw UpstreamExceptionBuilder.create(RECORDING_NOT_FOUND + ": empty download")
                    .service("recording")
                    .errorCode("EEMPTY")
                    .category(ErrorCategory.NOT_YET_AVAILABLE)
                    .build();
        }
        return body;
    }

    private String requestTranscription(byte[] audio, String fileName) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);
        headers.setBearerAuth(props.apiKey());

        MultiValueMap<String, Object> form = new LinkedMultiValueMap<>();
        form.add("file", new ByteArrayResource(audio) {
            @Override
            public String getFilename() {
                return fileName;
            }
        });
        form.add("model", props.model());
        form.add("response_format", "json");

        String url = props.baseUrl() + "/audio/transcriptions";
        String body;
        try {
            body = restTemplate.postForObject(url, new HttpEntity<>(form, headers), String.class);
        } catch (RestClientResponseException e) {
            throw classify("stt", "Transcription request", e.getStatusCode().value(),
                    e.getResponseBodyAsString(), e);
        } catch (RestClientException e) {
            throw networkFailure("stt", "Transcription request", e);
        }

        try {
            JSONObject json = new JSONObject(body == null ? "" : body);
            return json.optString("text", "");
        } catch (JSONException e) {
            throw UpstreamExceptionBuilder.create("Transcription response is not valid JSON")
                    .service("stt")
                    .errorCode("EMALFORMED")
                    .category(ErrorCategory.PERMANENT_UPSTREAM)
                    .metadata("preview", LogSanitizer.preview(body, 80))
                    .cause(e)
                    .build();
        }
    }

    /**
     * Maps an HTTP error response to a categorized exception. The message keeps the
     * {@code "<operation> failed with status N: body"} shape so operators see the raw detail.
     */
    static UpstreamException classify(String service, String operation, int status, String responseBody,
                                      Throwable cause) {
        String body = LogSanitizer.truncate(responseBody, MAX_BODY_IN_MESSAGE);
        String message = operation + " failed with status " + status + ": " + body;
        return new UpstreamException(message, service, status, String.valueOf(status),
                categorize(status, body), cause);
    }

    static ErrorCategory categorize(int status, String body) {
        if (status == 403 || status == 404 || (body != null && body.contains(RECORDING_NOT_FOUND))) {
            return ErrorCategory.NOT_YET_AVAILABLE;
        }
        if (status == 429 || status >= 500) {
            return ErrorCategory.TRANSIENT_UPSTREAM;
        }
        return ErrorCategory.PERMANENT_UPSTREAM;
    }

    private static UpstreamException networkFailure(String service, String operation, RestClientException e) {
        boolean timedOut = e instanceof ResourceAccessException && e.getCause() instanceof SocketTimeoutException;
        return UpstreamExceptionBuilder.create(operation + (timedOut ? " timed out" : " failed: " + e.getMessage()))
                .service(service)
                .errorCode(timedOut ? "ETIMEDOUT" : "ECONNERROR")
                .category(ErrorCategory.TRANSIENT_UPSTREAM)
                .cause(e)
                .build();
    }

    static String fileNameOf(String recordingUrl) {
        String path = recordingUrl;
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        String name = path.substring(path.lastIndexOf('/') + 1);
        return name.contains(".") ? name : "recording.mp3";
    }
}
