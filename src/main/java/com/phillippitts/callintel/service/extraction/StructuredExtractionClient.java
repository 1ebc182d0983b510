package com.phillippitts.callintel.service.extraction;

import org.json.JSONObject;

/**
 * Prompt-based JSON extraction over a call transcript.
 */
public interface StructuredExtractionClient {

    /**
     * @param promptId   resolved prompt-template id
     * @param transcript transcript of the current call
     * @param history    prior calls for a complete analysis, or null for an individual analysis
     * @return the structured result returned by the model
     * @throws com.phillippitts.callintel.exception.ConfigurationException if the template is unknown
     *         and no fallback model is configured
     * @throws com.phillippitts.callintel.exception.MalformedResponseException if the model output
     *         is not valid JSON
     * @throws com.phillippitts.callintel.exception.UpstreamException if the request fails for good
     */
    JSONObject extract(String promptId, String transcript, ExtractionHistory history);
}
