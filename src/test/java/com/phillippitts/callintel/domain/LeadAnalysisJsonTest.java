package com.phillippitts.callintel.domain;

import com.phillippitts.callintel.testutil.LeadAnalysisFixtures;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LeadAnalysisJsonTest {

    @Test
    void shouldParseFullAnalysis() {
        JSONObject json = LeadAnalysisFixtures.analysisJson(15, "Hot", "Ready to buy");

        LeadAnalysis analysis = LeadAnalysisJson.fromJson(json);

        assertThat(analysis.intentLevel()).isEqualTo("High");
        assertThat(analysis.intentScore()).isEqualTo(15);
        assertThat(analysis.totalScore()).isEqualTo(75);
        assertThat(analysis.dimensionScoreSum()).isEqualTo(75);
        assertThat(analysis.leadStatusTag()).isEqualTo("Hot");
        assertThat(analysis.demoBookDatetime()).isNull();
        assertThat(analysis.reasoning().ctaBehavior()).isEqualTo("Requested a demo");
        assertThat(analysis.extraction().name()).isEqualTo("Dana Reyes");
        assertThat(analysis.extraction().smartNotification()).isEqualTo("Ready to buy");
        assertThat(analysis.extraction().customCta()).isNull();
        assertThat(analysis.ctaInteractions()).isEqualTo(CtaInteractions.none());
    }

    @Test
    void shouldDeriveTotalWhenAbsent() {
        JSONObject json = new JSONObject()
                .put("intent_score", 10)
                .put("urgency_score", 5)
                .put("fit_score", 20);

        LeadAnalysis analysis = LeadAnalysisJson.fromJson(json);

        assertThat(analysis.totalScore()).isEqualTo(35);
        assertThat(analysis.intentLevel()).isNull();
        assertThat(analysis.reasoning()).isEqualTo(LeadReasoning.empty());
        assertThat(analysis.extraction()).isEqualTo(ContactExtraction.empty());
    }

    @Test
    void shouldKeepExplicitTotalEvenIfInconsistent() {
        JSONObject json = new JSONObject().put("intent_score", 10).put("total_score", 99);

        assertThat(LeadAnalysisJson.fromJson(json).totalScore()).isEqualTo(99);
    }

    @Test
    void shouldWriteNullFieldsExplicitly() {
        LeadAnalysis analysis = LeadAnalysisJson.fromJson(new JSONObject().put("intent_score", 3));

        JSONObject json = LeadAnalysisJson.toJson(analysis);

        assertThat(json.has("lead_status_tag")).isTrue();
        assertThat(json.isNull("lead_status_tag")).isTrue();
        assertThat(json.getJSONObject("extraction").isNull("smartnotification")).isTrue();
        assertThat(json.getJSONObject("cta_interactions").getBoolean("demo_clicked")).isFalse();
    }

    @Test
    void shouldPreserveValuesThroughStoredForm() {
        LeadAnalysis original = LeadAnalysisJson.fromJson(LeadAnalysisFixtures.analysisJson(12, "Warm", "note"));

        LeadAnalysis restored = LeadAnalysisJson.fromJson(LeadAnalysisJson.toJson(original).toString());

        assertThat(restored).isEqualTo(original);
    }

    @Test
    void withoutSmartNotificationBlanksOnlyThatField() {
        LeadAnalysis original = LeadAnalysisJson.fromJson(LeadAnalysisFixtures.analysisJson(12, "Warm", "Call back Friday"));

        LeadAnalysis stripped = original.withoutSmartNotification();

        assertThat(stripped.extraction().smartNotification()).isEmpty();
        assertThat(stripped.extraction().name()).isEqualTo("Dana Reyes");
        assertThat(stripped.totalScore()).isEqualTo(original.totalScore());
        assertThat(original.extraction().smartNotification()).isEqualTo("Call back Friday");
    }
}
