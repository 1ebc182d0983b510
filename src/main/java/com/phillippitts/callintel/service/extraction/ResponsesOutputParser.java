package com.phillippitts.callintel.service.extraction;

import com.phillippitts.callintel.exception.MalformedResponseException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Pulls the structured JSON result out of a responses-API payload.
 *
 * <p>The payload's {@code output} list mixes reasoning traces with the model's message. The
 * parser takes the first segment of type {@code message}, the first content block in it of type
 * {@code output_text} or {@code text} with non-empty text, and falls back to the top-level
 * {@code output_text} field. Markdown code fences are stripped before parsing.
 */
final class ResponsesOutputParser {

    private ResponsesOutputParser() {
    }

    static JSONObject parse(JSONObject response) {
        String responseId = response == null ? null : response.optString("id", null);
        String text = extractText(response);
        if (text == null) {
            throw new MalformedResponseException("No text content in responses payload", responseId);
        }
        String cleaned = stripCodeFences(text);
        try {
            return new JSONObject(cleaned);
        } catch (JSONException e) {
            throw new MalformedResponseException("Failed to parse model output as JSON: " + e.getMessage(),
                    responseId, e);
        }
    }

    static String extractText(JSONObject response) {
        if (response == null) {
            return null;
        }
        JSONArray output = response.optJSONArray("output");
        if (output != null) {
            for (int i = 0; i < output.length(); i++) {
                JSONObject segment = output.optJSONObject(i);
                if (segment != null && "message".equals(segment.optString("type"))) {
                    String text = firstText(segment.optJSONArray("content"));
                    if (text != null) {
                        return text;
                    }
                    break;
                }
            }
        }
        String flat = response.optString("output_text", "");
        return flat.isEmpty() ? null : flat;
    }

    private static String firstText(JSONArray content) {
        if (content == null) {
            return null;
        }
        for (int i = 0; i < content.length(); i++) {
            JSONObject block = content.optJSONObject(i);
            if (block == null) {
                continue;
            }
            String type = block.optString("type");
            if ("output_text".equals(type) || "text".equals(type)) {
                String text = block.optString("text", "");
                if (!text.isEmpty()) {
                    return text;
                }
            }
        }
        return null;
    }

    static String stripCodeFences(String text) {
        return text.replaceAll("```json\\n?", "")
                .replaceAll("```\\n?", "")
                .trim();
    }
}
