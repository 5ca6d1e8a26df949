package com.psyos.pipeline.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Psychologist overrides for the signal detector, one optional rule per signal.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SignalOverrides {

    private SignalRule anger;
    private SignalRule disconnect;
    private SignalRule rumination;
    private SignalRule highRisk;

    public SignalRule get(SignalKey key) {
        return switch (key) {
            case ANGER -> anger;
            case DISCONNECT -> disconnect;
            case RUMINATION -> rumination;
            case HIGH_RISK -> highRisk;
        };
    }
}
