package org.jstats.tipster_api.modules.prediction.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import org.jspecify.annotations.Nullable;

/**
 * Request DTO for a match prediction.
 *
 * @param teamA         home team name
 * @param teamB         away team name
 * @param matchDateISO  match date, {@code yyyy-MM-dd}
 * @param oddsHome      optional bookmaker odds for a home win
 * @param oddsAway      optional bookmaker odds for an away win
 */
public record PredictionRequest(
        @NotBlank String teamA,
        @NotBlank String teamB,
        @NotBlank
        @Pattern(regexp = "^\\d{4}-\\d{2}-\\d{2}$", message = "matchDateISO must be formatted as yyyy-MM-dd")
        String matchDateISO,
        @Nullable @Positive Double oddsHome,
        @Nullable @Positive Double oddsAway
) {

    public PredictionRequest(String teamA, String teamB, String matchDateISO) {
        this(teamA, teamB, matchDateISO, null, null);
    }

    @JsonIgnore
    @AssertTrue(message = "teamA and teamB must be different teams")
    public boolean isDistinctTeams() {
        return teamA == null || teamB == null || !teamA.trim().equalsIgnoreCase(teamB.trim());
    }
}
