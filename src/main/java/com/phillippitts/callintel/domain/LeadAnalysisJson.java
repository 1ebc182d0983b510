package com.phillippitts.callintel.domain;

import org.json.JSONObject;

/**
 * Maps {@link LeadAnalysis} to and from the snake_case JSON shape returned by the extraction
 * prompts and stored on the call record.
 *
 * <p>Lenient on input: missing fields become null, zero or false. When {@code total_score} is
 * absent it is derived as the sum of the five dimension scores.
 */
public final class LeadAnalysisJson {

    private LeadAnalysisJson() {
    }

    public static LeadAnalysis fromJson(String json) {
        return fromJson(new JSONObject(json));
    }

    public static LeadAnalysis fromJson(JSONObject obj) {
        int intentScore = obj.optInt("intent_score", 0);
        int urgencyScore = obj.optInt("urgency_score", 0);
        int budgetScore = obj.optInt("budget_score", 0);
        int fitScore = obj.optInt("fit_score", 0);
        int engagementScore = obj.optInt("engagement_score", 0);
        int total = isPresent(obj, "total_score")
                ? obj.optInt("total_score", 0)
                : intentScore + urgencyScore + budgetScore + fitScore + engagementScore;

        return new LeadAnalysis(
                text(obj, "intent_level"), intentScore,
                text(obj, "urgency_level"), urgencyScore,
                text(obj, "budget_constraint"), budgetScore,
                text(obj, "fit_alignment"), fitScore,
                text(obj, "engagement_health"), engagementScore,
                total,
                text(obj, "lead_status_tag"),
                text(obj, "demo_book_datetime"),
                text(obj, "transcript_summary"),
                reasoning(obj.optJSONObject("reasoning")),
                cta(obj.optJSONObject("cta_interactions")),
                extraction(obj.optJSONObject("extraction")));
    }

    public static JSONObject toJson(LeadAnalysis analysis) {
        JSONObject obj = new JSONObject();
        put(obj, "intent_level", analysis.intentLevel());
        obj.put("intent_score", analysis.intentScore());
        put(obj, "urgency_level", analysis.urgencyLevel());
        obj.put("urgency_score", analysis.urgencyScore());
        put(obj, "budget_constraint", analysis.budgetConstraint());
        obj.put("budget_score", analysis.budgetScore());
        put(obj, "fit_alignment", analysis.fitAlignment());
        obj.put("fit_score", analysis.fitScore());
        put(obj, "engagement_health", analysis.engagementHealth());
        obj.put("engagement_score", analysis.engagementScore());
        obj.put("total_score", analysis.totalScore());
        put(obj, "lead_status_tag", analysis.leadStatusTag());
        put(obj, "demo_book_datetime", analysis.demoBookDatetime());
        put(obj, "transcript_summary", analysis.transcriptSummary());

        LeadReasoning r = analysis.reasoning();
        JSONObject reasoning = new JSONObject();
        put(reasoning, "intent", r.intent());
        put(reasoning, "urgency", r.urgency());
        put(reasoning, "budget", r.budget());
        put(reasoning, "fit", r.fit());
        put(reasoning, "engagement", r.engagement());
        put(reasoning, "cta_behavior", r.ctaBehavior());
        obj.put("reasoning", reasoning);

        CtaInteractions c = analysis.ctaInteractions();
        JSONObject cta = new JSONObject();
        cta.put("pricing_clicked", c.pricingClicked());
        cta.put("demo_clicked", c.demoClicked());
        cta.put("followup_clicked", c.followupClicked());
        cta.put("sample_clicked", c.sampleClicked());
        cta.put("escalated_to_human", c.escalatedToHuman());
        obj.put("cta_interactions", cta);

        ContactExtraction e = analysis.extraction();
        JSONObject extraction = new JSONObject();
        put(extraction, "name", e.name());
        put(extraction, "email_address", e.emailAddress());
        put(extraction, "company_name", e.companyName());
        put(extraction, "smartnotification", e.smartNotification());
        put(extraction, "requirements", e.requirements());
        put(extraction, "custom_cta", e.customCta());
        put(extraction, "in_detail_summary", e.inDetailSummary());
        obj.put("extraction", extraction);
        return obj;
    }

    private static LeadReasoning reasoning(JSONObject obj) {
        if (obj == null) {
            return LeadReasoning.empty();
        }
        return new LeadReasoning(
                text(obj, "intent"),
                text(obj, "urgency"),
                text(obj, "budget"),
                text(obj, "fit"),
                text(obj, "engagement"),
                text(obj, "cta_behavior"));
    }

    private static CtaInteractions cta(JSONObject obj) {
        if (obj == null) {
            return CtaInteractions.none();
        }
        return new CtaInteractions(
                obj.optBoolean("pricing_clicked", false),
                obj.optBoolean("demo_clicked", false),
                obj.optBoolean("followup_clicked", false),
                obj.optBoolean("sample_clicked", false),
                obj.optBoolean("escalated_to_human", false));
    }

    private static ContactExtraction extraction(JSONObject obj) {
        if (obj == null) {
            return ContactExtraction.empty();
        }
        return new ContactExtraction(
                text(obj, "name"),
                text(obj, "email_address"),
                text(obj, "company_name"),
                text(obj, "smartnotification"),
                text(obj, "requirements"),
                text(obj, "custom_cta"),
                text(obj, "in_detail_summary"));
    }

    private static boolean isPresent(JSONObject obj, String key) {
        return obj.has(key) && !obj.isNull(key);
    }

    private static String text(JSONObject obj, String key) {
        return isPresent(obj, key) ? String.valueOf(obj.get(key)) : null;
    }

    // JSONObject.put(key, null) removes the key, so nulls are written explicitly
    private static void put(JSONObject obj, String key, String value) {
        obj.put(key, value == null ? JSONObject.NULL : value);
    }
}
