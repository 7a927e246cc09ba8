package org.jstats.tipster_api.modules.prediction.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Untyped payload returned by a model endpoint or stored by the user service.
 * <p>
 * The model services answer with overlapping, optional fields (standard win probabilities,
 * reinforcement-learning probabilities, generic confidences), so the payload is kept as a field
 * bag and read through lenient accessors. Numbers sent as strings are accepted.
 */
public final class RawPredictionResponse {

    public static final String PREDICTED_WINNER = "predicted_winner";
    public static final String PROB_HOME_WIN = "prob_home_win";
    public static final String PROB_AWAY_WIN = "prob_away_win";
    public static final String PROB_DRAW = "prob_draw";
    public static final String PROB_HOME_RL = "prob_home_rl";
    public static final String PROB_AWAY_RL = "prob_away_rl";
    public static final String PROB_DRAW_RL = "prob_draw_rl";
    public static final String WINNER_CONFIDENCE = "winner_confidence";
    public static final String OVERALL_CONFIDENCE = "overall_confidence";
    public static final String CONFIDENCE = "confidence";
    public static final String MARGIN = "margin";
    public static final String PREDICTED_MARGIN = "predicted_margin";
    public static final String MODEL_ALIAS = "model_alias";
    public static final String MODEL_NAME = "model_name";
    public static final String PREDICTION_ID = "prediction_id";

    private static final RawPredictionResponse EMPTY =
            new RawPredictionResponse(JsonNodeFactory.instance.objectNode(), true);

    private final ObjectNode fields;
    private final boolean wellFormed;

    private RawPredictionResponse(ObjectNode fields, boolean wellFormed) {
        this.fields = fields;
        this.wellFormed = wellFormed;
    }

    /**
     * Wraps a parsed body. Anything other than a JSON object yields an empty, malformed bag.
     */
    public static RawPredictionResponse of(@Nullable JsonNode body) {
        if (body instanceof ObjectNode object) {
            return new RawPredictionResponse(object.deepCopy(), true);
        }
        return malformed();
    }

    public static RawPredictionResponse empty() {
        return EMPTY;
    }

    public static RawPredictionResponse malformed() {
        return new RawPredictionResponse(JsonNodeFactory.instance.objectNode(), false);
    }

    /**
     * @return false when the body could not be read as a JSON object
     */
    public boolean isWellFormed() {
        return wellFormed;
    }

    /**
     * @return true when the field exists and is not JSON {@code null}
     */
    public boolean has(String field) {
        return fields.hasNonNull(field);
    }

    public @Nullable JsonNode node(String field) {
        var value = fields.get(field);
        return value == null || value.isNull() ? null : value.deepCopy();
    }

    public @Nullable String text(String field) {
        var value = fields.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        var text = value.asText();
        return text.isBlank() ? null : text;
    }

    /**
     * A finite number, or a string holding one. Anything else reads as absent.
     */
    public OptionalDouble number(String field) {
        var value = fields.get(field);
        if (value == null || value.isNull()) {
            return OptionalDouble.empty();
        }
        if (value.isNumber()) {
            var d = value.doubleValue();
            return Double.isFinite(d) ? OptionalDouble.of(d) : OptionalDouble.empty();
        }
        if (value.isTextual()) {
            try {
                var d = Double.parseDouble(value.asText().trim());
                return Double.isFinite(d) ? OptionalDouble.of(d) : OptionalDouble.empty();
            } catch (NumberFormatException nfe) {
                return OptionalDouble.empty();
            }
        }
        return OptionalDouble.empty();
    }

    /**
     * @return true when the field holds something that {@link #number(String)} cannot read
     */
    public boolean isMalformedNumber(String field) {
        return has(field) && number(field).isEmpty();
    }

    public Optional<Long> integer(String field) {
        var value = fields.get(field);
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        if (value.isIntegralNumber()) {
            return Optional.of(value.longValue());
        }
        if (value.isTextual()) {
            try {
                return Optional.of(Long.parseLong(value.asText().trim()));
            } catch (NumberFormatException nfe) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "RawPredictionResponse" + fields;
    }
}
