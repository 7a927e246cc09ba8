package org.jstats.tipster_api.modules.history.model;

import org.jspecify.annotations.Nullable;
import org.jstats.tipster_api.modules.prediction.model.CanonicalPredictionResult;

import java.time.Instant;

/**
 * One stored prediction of the caller, as returned by the user service and normalized.
 *
 * @param result              the normalized prediction; its alias is the stored model name
 * @param homeTeam            home team name as stored
 * @param awayTeam            away team name as stored
 * @param matchDate           match date as stored, not reinterpreted
 * @param predictionTimestamp when the prediction was saved; null when missing or unreadable
 * @param userRating          the caller's 1-5 rating, if given
 * @param actualWinner        actual outcome, if reported
 * @param actualMargin        actual goal margin, if reported
 */
public record HistoricalPrediction(
        CanonicalPredictionResult result,
        @Nullable String homeTeam,
        @Nullable String awayTeam,
        @Nullable String matchDate,
        @Nullable Instant predictionTimestamp,
        @Nullable Integer userRating,
        @Nullable String actualWinner,
        @Nullable Double actualMargin
) {}
