package com.phillippitts.callintel.service.extraction;

import com.phillippitts.callintel.exception.MalformedResponseException;
import com.phillippitts.callintel.testutil.LeadAnalysisFixtures;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResponsesOutputParserTest {

    @Test
    void parsesMessageOutputAfterReasoningSegment() {
        JSONObject response = LeadAnalysisFixtures.responseWithText("{\"total_score\": 55, \"lead_status_tag\": \"Warm\"}");

        JSONObject parsed = ResponsesOutputParser.parse(response);

        assertThat(parsed.getInt("total_score")).isEqualTo(55);
        assertThat(parsed.getString("lead_status_tag")).isEqualTo("Warm");
    }

    @Test
    void stripsMarkdownCodeFences() {
        JSONObject response = LeadAnalysisFixtures.responseWithText("```json\n{\"intent_score\": 18}\n```");

        assertThat(ResponsesOutputParser.parse(response).getInt("intent_score")).isEqualTo(18);
    }

    @Test
    void stripsBareFences() {
        assertThat(ResponsesOutputParser.stripCodeFences("```\n{\"a\":1}\n```  ")).isEqualTo("{\"a\":1}");
    }

    @Test
    void skipsEmptyBlocksAndAcceptsTextType() {
        JSONObject response = new JSONObject().put("output", new JSONArray()
                .put(new JSONObject().put("type", "message").put("content", new JSONArray()
                        .put(new JSONObject().put("type", "output_text").put("text", ""))
                        .put(new JSONObject().put("type", "refusal").put("refusal", "no"))
                        .put(new JSONObject().put("type", "text").put("text", "{\"ok\":true}")))));

        assertThat(ResponsesOutputParser.extractText(response)).isEqualTo("{\"ok\":true}");
    }

    @Test
    void usesOnlyFirstMessageSegment() {
        JSONObject response = new JSONObject().put("output", new JSONArray()
                .put(new JSONObject().put("type", "message").put("content", new JSONArray()
                        .put(new JSONObject().put("type", "output_text").put("text", "{\"first\":1}"))))
                .put(new JSONObject().put("type", "message").put("content", new JSONArray()
                        .put(new JSONObject().put("type", "output_text").put("text", "{\"second\":2}")))));

        assertThat(ResponsesOutputParser.parse(response).has("first")).isTrue();
    }

    @Test
    void fallsBackToTopLevelOutputText() {
        JSONObject response = new JSONObject()
                .put("id", "resp_1")
                .put("output", new JSONArray().put(new JSONObject().put("type", "reasoning")))
                .put("output_text", "{\"fallback\":true}");

        assertThat(ResponsesOutputParser.parse(response).getBoolean("fallback")).isTrue();
    }

    @Test
    void rejectsPayloadWithoutText() {
        JSONObject response = new JSONObject()
                .put("id", "resp_empty")
                .put("output", new JSONArray().put(new JSONObject().put("type", "reasoning")));

        assertThatThrownBy(() -> ResponsesOutputParser.parse(response))
                .isInstanceOfSatisfying(MalformedResponseException.class, e -> {
                    assertThat(e).hasMessage("No text content in responses payload");
                    assertThat(e.getResponseId()).isEqualTo("resp_empty");
                });
    }

    @Test
    void rejectsNonJsonText() {
        JSONObject response = LeadAnalysisFixtures.responseWithText("Sure! Here is the analysis you asked for.");

        assertThatThrownBy(() -> ResponsesOutputParser.parse(response))
                .isInstanceOf(MalformedResponseException.class)
                .hasMessageStartingWith("Failed to parse model output as JSON");
    }
}
