package com.phillippitts.callintel.exception;

/**
 * Thrown when the pipeline is missing configuration it needs at call time
 * (API credential, prompt template id, fallback model).
 * Never retried; the operator has to fix the configuration.
 */
public class ConfigurationException extends CallIntelException {

    private final String setting;

    public ConfigurationException(String setting, String message) {
        super(message);
        this.setting = setting;
    }

    public String getSetting() {
        return setting;
    }
}
