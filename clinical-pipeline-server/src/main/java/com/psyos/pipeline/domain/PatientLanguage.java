package com.psyos.pipeline.domain;

/**
 * Language a patient prefers for AI replies. Spanish when the profile does not say.
 */
public enum PatientLanguage {
    PT,
    ES,
    EN;

    public static PatientLanguage orDefault(PatientLanguage language) {
        return language != null ? language : ES;
    }
}
