package org.jstats.tipster_api.modules.prediction.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * Body POSTed to a model endpoint.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PredictionPayload(
        @JsonProperty("team_a") String teamA,
        @JsonProperty("team_b") String teamB,
        @JsonProperty("match_date_str") String matchDateStr,
        @JsonProperty("odd_a") @Nullable Double oddA,
        @JsonProperty("odd_b") @Nullable Double oddB,
        @JsonProperty("odds_home_win") @Nullable Double oddsHomeWin,
        @JsonProperty("odds_away_win") @Nullable Double oddsAwayWin
) {

    /**
     * {@code odd_a}/{@code odd_b} are only sent to models trained with odds;
     * {@code odds_home_win}/{@code odds_away_win} are sent whenever the caller gave odds.
     */
    public static PredictionPayload from(PredictionRequest request, ModelDescriptor model) {
        var home = request.oddsHome();
        var away = request.oddsAway();
        return new PredictionPayload(
                request.teamA(),
                request.teamB(),
                request.matchDateISO(),
                model.acceptsOdds() ? home : null,
                model.acceptsOdds() ? away : null,
                home,
                away);
    }
}
