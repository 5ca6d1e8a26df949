package com.psyos.pipeline.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Typed policy flags persisted as JSON next to the policy text.
 *
 * Every field is optional. Signal overrides merge key by key over the defaults
 * (see SignalDetector#resolveConfig); AI settings are clamped by AiTuning.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PolicyFlags {

    public static final int CURRENT_VERSION = 1;

    @Builder.Default
    private int version = CURRENT_VERSION;

    private SignalOverrides signalConfig;

    private AiSettings aiSettings;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AiSettings {
        private Integer maxTokens;
        private Integer maxTurns;
        private Double temperature;
        private Boolean turnLimitDisabled;
    }
}
