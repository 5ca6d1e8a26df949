package com.psyos.pipeline.domain;

import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

@Value
public class DetectedSignals {

    public static final DetectedSignals NONE = new DetectedSignals(false, false, false, false);

    boolean anger;
    boolean disconnect;
    boolean rumination;
    boolean highRisk;

    public boolean isFired(SignalKey key) {
        return switch (key) {
            case ANGER -> anger;
            case DISCONNECT -> disconnect;
            case RUMINATION -> rumination;
            case HIGH_RISK -> highRisk;
        };
    }

    /**
     * Flags keyed by their JSON names, in a stable order, for audit metadata.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> flags = new LinkedHashMap<>();
        for (SignalKey key : SignalKey.values()) {
            flags.put(key.jsonName(), isFired(key));
        }
        return flags;
    }
}
