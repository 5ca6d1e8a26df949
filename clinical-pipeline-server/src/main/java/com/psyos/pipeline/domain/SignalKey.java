package com.psyos.pipeline.domain;

public enum SignalKey {
    ANGER("anger"),
    DISCONNECT("disconnect"),
    RUMINATION("rumination"),
    HIGH_RISK("highRisk");

    private final String jsonName;

    SignalKey(String jsonName) {
        this.jsonName = jsonName;
    }

    public String jsonName() {
        return jsonName;
    }
}
