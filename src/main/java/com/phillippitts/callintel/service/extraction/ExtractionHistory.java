package com.phillippitts.callintel.service.extraction;

import com.phillippitts.callintel.domain.LeadAnalysis;
import com.phillippitts.callintel.domain.PriorCall;

import java.util.ArrayList;
import java.util.List;

/**
 * Context for a complete (historical) analysis: earlier transcripts and their individual
 * analyses for the same contact, both most recent first.
 */
public record ExtractionHistory(List<String> priorTranscripts, List<LeadAnalysis> priorAnalyses) {

    public ExtractionHistory {
        priorTranscripts = priorTranscripts == null ? List.of() : List.copyOf(priorTranscripts);
        priorAnalyses = priorAnalyses == null ? List.of() : List.copyOf(priorAnalyses);
    }

    /**
     * @param priorCalls prior calls, most recent first
     */
    public static ExtractionHistory from(List<PriorCall> priorCalls) {
        List<String> transcripts = new ArrayList<>();
        List<LeadAnalysis> analyses = new ArrayList<>();
        for (PriorCall call : priorCalls) {
            if (call.hasTranscript()) {
                transcripts.add(call.transcriptText());
            }
            if (call.individualAnalysis() != null) {
                analyses.add(call.individualAnalysis());
            }
        }
        return new ExtractionHistory(transcripts, analyses);
    }
}
