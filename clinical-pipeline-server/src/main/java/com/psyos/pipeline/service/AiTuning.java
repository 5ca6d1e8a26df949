package com.psyos.pipeline.service;

import com.psyos.pipeline.domain.PolicyFlags.AiSettings;
import lombok.Value;

/**
 * Model and episode parameters after clamping the psychologist's settings.
 */
@Value
public class AiTuning {

    public static final int DEFAULT_MAX_TURNS = 3;
    public static final int DEFAULT_MAX_TOKENS = 300;
    public static final double DEFAULT_TEMPERATURE = 0.4;

    static final int MIN_TURNS = 1;
    static final int MAX_TURNS = 10;
    static final int MIN_TOKENS = 50;
    static final int MAX_TOKENS = 2000;

    public static final AiTuning DEFAULTS =
            new AiTuning(DEFAULT_MAX_TURNS, DEFAULT_MAX_TOKENS, DEFAULT_TEMPERATURE, false);

    int maxTurns;
    int maxTokens;
    double temperature;
    boolean turnLimitDisabled;

    public static AiTuning from(AiSettings settings) {
        if (settings == null) {
            return DEFAULTS;
        }
        int turns = settings.getMaxTurns() != null ? settings.getMaxTurns() : DEFAULT_MAX_TURNS;
        int tokens = settings.getMaxTokens() != null ? settings.getMaxTokens() : DEFAULT_MAX_TOKENS;
        double temperature = settings.getTemperature() != null && !settings.getTemperature().isNaN()
                ? settings.getTemperature()
                : DEFAULT_TEMPERATURE;
        return new AiTuning(
                clamp(turns, MIN_TURNS, MAX_TURNS),
                clamp(tokens, MIN_TOKENS, MAX_TOKENS),
                Math.max(0.0, Math.min(temperature, 1.0)),
                Boolean.TRUE.equals(settings.getTurnLimitDisabled()));
    }

    /**
     * Turns left in an episode that already used {@code aiTurnsUsed}. Unbounded when the
     * turn limit is disabled.
     */
    public int remainingTurns(int aiTurnsUsed) {
        return turnLimitDisabled ? Integer.MAX_VALUE : maxTurns - aiTurnsUsed;
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(value, max));
    }
}
