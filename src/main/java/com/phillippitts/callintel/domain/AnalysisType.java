package com.phillippitts.callintel.domain;

/**
 * Individual analyses cover one call; complete analyses roll up a contact's recent history.
 */
public enum AnalysisType {
    INDIVIDUAL,
    COMPLETE
}
