package com.phillippitts.callintel.service.extraction;

import com.phillippitts.callintel.domain.LeadAnalysis;
import com.phillippitts.callintel.domain.LeadAnalysisJson;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Builds the user-turn text sent with a prompt template.
 *
 * <p>Both variants open with the current date and time so the model can turn relative dates
 * mentioned in the call ("tomorrow", "next Monday") into absolute ones. The complete variant
 * numbers prior calls chronologically: the oldest is CALL 1 and the current call comes last.
 */
public class ExtractionPromptBuilder {

    static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("EEEE, MMMM d, yyyy, hh:mm:ss a zzz", Locale.US);

    private static final String DATE_GUIDANCE =
            "Use this date and time to resolve relative meeting times mentioned in the transcript. "
                    + "For example, if the caller says \"tomorrow\" or \"the day after tomorrow\", "
                    + "work out the actual date from the current date above.";

    private final Clock clock;
    private final ZoneId zone;

    public ExtractionPromptBuilder(Clock clock, ZoneId zone) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    public String currentDateTime() {
        return ZonedDateTime.ofInstant(clock.instant(), zone).format(TIMESTAMP_FORMAT);
    }

    public String individualPrompt(String transcript) {
        return "Current Date and Time: " + currentDateTime() + "\n\n"
                + DATE_GUIDANCE + "\n\n"
                + "Analyze the following call transcript and return the results in JSON format:\n\n"
                + transcript;
    }

    public String completePrompt(String currentTranscript, ExtractionHistory history) {
        StringBuilder sb = new StringBuilder()
                .append("Current Date and Time: ").append(currentDateTime()).append("\n\n")
                .append(DATE_GUIDANCE).append("\n\n")
                .append("Analyze the complete call history with this contact and return the results in JSON format.\n\n");

        List<String> transcripts = oldestFirst(history.priorTranscripts());
        if (transcripts.isEmpty()) {
            sb.append("No previous calls.\n\n");
        } else {
            sb.append("PREVIOUS CALL TRANSCRIPTS (").append(transcripts.size()).append(" calls):\n");
            for (int i = 0; i < transcripts.size(); i++) {
                sb.append("\n=== CALL ").append(i + 1).append(" TRANSCRIPT ===\n")
                        .append(transcripts.get(i)).append('\n');
            }
            sb.append('\n');
        }

        List<LeadAnalysis> analyses = oldestFirst(history.priorAnalyses());
        if (!analyses.isEmpty()) {
            sb.append("PREVIOUS CALL ANALYSES (").append(analyses.size()).append(" calls):\n");
            for (int i = 0; i < analyses.size(); i++) {
                sb.append("\n=== CALL ").append(i + 1).append(" ANALYSIS ===\n")
                        .append(LeadAnalysisJson.toJson(analyses.get(i)).toString()).append('\n');
            }
            sb.append('\n');
        }

        sb.append("=== CURRENT CALL (Call ").append(transcripts.size() + 1).append(") TRANSCRIPT ===\n")
                .append(currentTranscript);
        return sb.toString();
    }

    private static <T> List<T> oldestFirst(List<T> mostRecentFirst) {
        List<T> copy = new ArrayList<>(mostRecentFirst);
        Collections.reverse(copy);
        return copy;
    }
}
