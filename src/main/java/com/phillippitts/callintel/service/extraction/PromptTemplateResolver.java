package com.phillippitts.callintel.service.extraction;

import com.phillippitts.callintel.config.properties.ExtractionProperties;
import com.phillippitts.callintel.domain.AnalysisType;
import com.phillippitts.callintel.exception.ConfigurationException;

import java.util.Locale;
import java.util.Objects;

/**
 * Chooses the prompt-template id for an analysis: the user's own template when set, otherwise
 * the system default for the analysis type.
 */
public class PromptTemplateResolver {

    private final ExtractionProperties props;

    public PromptTemplateResolver(ExtractionProperties props) {
        this.props = Objects.requireNonNull(props, "props must not be null");
    }

    /**
     * @throws ConfigurationException if neither a user override nor a system default exists
     */
    public String resolve(String userPromptId, AnalysisType type) {
        if (userPromptId != null && !userPromptId.isBlank()) {
            return userPromptId.trim();
        }
        String systemDefault = type == AnalysisType.INDIVIDUAL ? props.individualPromptId() : props.completePromptId();
        if (systemDefault == null || systemDefault.isBlank()) {
            String setting = type == AnalysisType.INDIVIDUAL
                    ? "extraction.openai.individual-prompt-id"
                    : "extraction.openai.complete-prompt-id";
            throw new ConfigurationException(setting, "No prompt template configured for "
                    + type.name().toLowerCase(Locale.ROOT) + " analysis; set " + setting);
        }
        return systemDefault.trim();
    }
}
