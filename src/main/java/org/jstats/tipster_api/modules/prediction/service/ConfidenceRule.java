package org.jstats.tipster_api.modules.prediction.service;

import org.jspecify.annotations.Nullable;
import org.jstats.tipster_api.modules.prediction.model.ConfidenceSource;
import org.jstats.tipster_api.modules.prediction.model.RawPredictionResponse;

import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

import static org.jstats.tipster_api.modules.prediction.model.RawPredictionResponse.*;

/**
 * One row of the confidence resolution table.
 *
 * @param winnerLabel predicted winner the rule applies to, or null when it applies to any winner
 * @param source      the field read and reported as the confidence source
 */
record ConfidenceRule(@Nullable String winnerLabel, ConfidenceSource source) {

    /**
     * Evaluated top to bottom, first match wins. Reinforcement-learning fields come first because
     * the RL service labels winners "Home"/"Away"/"Draw" while the other models say "Home Win",
     * "Away Win", "Draw"; "Draw" therefore matches both {@code prob_draw_rl} and {@code prob_draw}.
     */
    static final List<ConfidenceRule> TABLE = List.of(
            new ConfidenceRule("Home", ConfidenceSource.PROB_HOME_RL),
            new ConfidenceRule("Away", ConfidenceSource.PROB_AWAY_RL),
            new ConfidenceRule("Draw", ConfidenceSource.PROB_DRAW_RL),
            new ConfidenceRule("Home Win", ConfidenceSource.PROB_HOME_WIN),
            new ConfidenceRule("Away Win", ConfidenceSource.PROB_AWAY_WIN),
            new ConfidenceRule("Draw", ConfidenceSource.PROB_DRAW),
            new ConfidenceRule(null, ConfidenceSource.WINNER_CONFIDENCE),
            new ConfidenceRule(null, ConfidenceSource.OVERALL_CONFIDENCE),
            new ConfidenceRule(null, ConfidenceSource.GENERIC_CONFIDENCE)
    );

    /** Every field the table reads, for malformed-field diagnostics. */
    static final List<String> FIELDS = List.of(
            PROB_HOME_RL, PROB_AWAY_RL, PROB_DRAW_RL,
            PROB_HOME_WIN, PROB_AWAY_WIN, PROB_DRAW,
            WINNER_CONFIDENCE, OVERALL_CONFIDENCE, CONFIDENCE);

    ConfidenceRule {
        Objects.requireNonNull(source.field(), "rule needs a field");
    }

    OptionalDouble apply(@Nullable String winner, RawPredictionResponse raw) {
        if (winnerLabel != null && !winnerLabel.equals(winner)) {
            return OptionalDouble.empty();
        }
        return raw.number(source.field());
    }
}
