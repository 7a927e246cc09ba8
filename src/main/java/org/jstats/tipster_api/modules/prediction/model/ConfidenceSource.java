package org.jstats.tipster_api.modules.prediction.model;

import org.jspecify.annotations.Nullable;

/**
 * Which response field the canonical confidence was taken from.
 */
public enum ConfidenceSource {
    PROB_HOME_RL("prob_home_rl", false),
    PROB_AWAY_RL("prob_away_rl", false),
    PROB_DRAW_RL("prob_draw_rl", false),
    PROB_HOME_WIN("prob_home_win", false),
    PROB_AWAY_WIN("prob_away_win", false),
    PROB_DRAW("prob_draw", false),
    WINNER_CONFIDENCE("winner_confidence", true),
    OVERALL_CONFIDENCE("overall_confidence", true),
    GENERIC_CONFIDENCE("confidence", true),
    /** No recognized field; confidence defaulted to 0. */
    NONE(null, true);

    private final @Nullable String field;
    private final boolean fallback;

    ConfidenceSource(@Nullable String field, boolean fallback) {
        this.field = field;
        this.fallback = fallback;
    }

    public @Nullable String field() {
        return field;
    }

    public boolean isFallback() {
        return fallback;
    }
}
