package com.phillippitts.callintel.service.extraction;

import org.json.JSONObject;

/**
 * Sends one request to the reasoning service's responses endpoint.
 *
 * <p>Implementations classify failures at the boundary: a missing prompt template raises
 * {@link com.phillippitts.callintel.exception.PromptNotFoundException}, any other non-2xx or
 * network failure an {@link com.phillippitts.callintel.exception.UpstreamException} whose error
 * code is the HTTP status or a network code ({@code ETIMEDOUT}, {@code ECONNERROR}).
 */
public interface ResponsesApiTransport {

    JSONObject createResponse(JSONObject request);
}
