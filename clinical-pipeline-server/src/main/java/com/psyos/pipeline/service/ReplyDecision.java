package com.psyos.pipeline.service;

/**
 * Outcome of one AI reply attempt within an episode.
 */
public enum ReplyDecision {
    /** High-risk signal: fixed safety text, no model call. */
    SAFETY_CLOSE(true),
    /** No turns left: fixed closing text, no model call. */
    LIMIT_CLOSE(true),
    /** Pre-call decision only; resolved into one of the outcomes below once the model answers. */
    GENERATE(false),
    PROVIDER_CLOSE(true),
    EMPTY_CLOSE(true),
    /** Model reply followed by the closing text. */
    LAST_TURN_CLOSE(true),
    CONTINUE(false);

    private final boolean closesEpisode;

    ReplyDecision(boolean closesEpisode) {
        this.closesEpisode = closesEpisode;
    }

    public boolean closesEpisode() {
        return closesEpisode;
    }
}
