package org.jstats.tipster_api.modules.prediction.model;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

/**
 * Shape-independent prediction consumed by display and storage code.
 *
 * @param predictedWinner  winner label as the model reported it ("Home", "Away Win", "Draw", ...)
 * @param confidence       probability of the predicted outcome, 0.0 to 1.0, always present
 * @param margin           predicted margin, a number or a {@code [low, high]} pair, passed through as received
 * @param modelAlias       alias of the model that produced the prediction
 * @param predictionId     id assigned by the user service, when it stored the prediction
 * @param confidenceSource field the confidence was read from
 * @param aliasSource      where {@code modelAlias} came from
 */
public record CanonicalPredictionResult(
        @Nullable String predictedWinner,
        double confidence,
        @Nullable JsonNode margin,
        String modelAlias,
        @Nullable Long predictionId,
        ConfidenceSource confidenceSource,
        AliasSource aliasSource
) {

    public boolean usedConfidenceFallback() {
        return confidenceSource.isFallback();
    }
}
