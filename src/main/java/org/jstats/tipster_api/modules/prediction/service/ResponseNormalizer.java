package org.jstats.tipster_api.modules.prediction.service;

import org.jspecify.annotations.Nullable;
import org.jstats.tipster_api.modules.prediction.model.AliasSource;
import org.jstats.tipster_api.modules.prediction.model.CanonicalPredictionResult;
import org.jstats.tipster_api.modules.prediction.model.ConfidenceSource;
import org.jstats.tipster_api.modules.prediction.model.RawPredictionResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import static org.jstats.tipster_api.modules.prediction.model.RawPredictionResponse.*;

/**
 * Converts the heterogeneous model responses into {@link CanonicalPredictionResult}s.
 * <p>
 * Normalization never throws: missing or unreadable data degrades to a confidence of 0 and the
 * requested alias, and the degradation is logged and recorded on the result.
 */
@Component
public class ResponseNormalizer {

    private static final Logger log = LoggerFactory.getLogger(ResponseNormalizer.class);

    static final String UNKNOWN_ALIAS = "unknown";

    /**
     * Normalizes a fresh prediction response.
     *
     * @param raw            the model's response body, possibly empty or malformed
     * @param requestedAlias alias the caller asked for; used when the response names no model
     */
    public CanonicalPredictionResult normalize(@Nullable RawPredictionResponse raw, @Nullable String requestedAlias) {
        var bag = raw == null ? RawPredictionResponse.empty() : raw;
        try {
            var alias = resolveAlias(bag, requestedAlias);
            return build(bag, alias.alias(), alias.source());
        } catch (RuntimeException unexpected) {
            log.error("Normalization failed unexpectedly for {}; using defaults", bag, unexpected);
            return degraded(requestedAlias, AliasSource.REQUESTED);
        }
    }

    /**
     * Normalizes a record stored by the user service. The stored {@code model} column names the
     * model, so it replaces whatever alias the record carries.
     */
    public CanonicalPredictionResult normalizeStored(@Nullable RawPredictionResponse raw, @Nullable String storedModel) {
        var bag = raw == null ? RawPredictionResponse.empty() : raw;
        try {
            if (storedModel != null && !storedModel.isBlank()) {
                return build(bag, storedModel, AliasSource.STORED_MODEL);
            }
            var alias = resolveAlias(bag, null);
            return build(bag, alias.alias(), alias.source());
        } catch (RuntimeException unexpected) {
            log.error("Normalization failed unexpectedly for stored record {}; using defaults", bag, unexpected);
            return degraded(storedModel, AliasSource.STORED_MODEL);
        }
    }

    private CanonicalPredictionResult build(RawPredictionResponse bag, String alias, AliasSource aliasSource) {
        if (!bag.isWellFormed()) {
            log.warn("Malformed prediction payload for model '{}'; normalizing from an empty body", alias);
        }
        var winner = bag.text(PREDICTED_WINNER);
        reportMalformedFields(bag, alias);

        var source = ConfidenceSource.NONE;
        var confidence = 0.0;
        for (ConfidenceRule rule : ConfidenceRule.TABLE) {
            var value = rule.apply(winner, bag);
            if (value.isPresent()) {
                source = rule.source();
                confidence = value.getAsDouble();
                break;
            }
        }

        if (source == ConfidenceSource.NONE) {
            log.warn("Could not determine confidence for predicted winner '{}' from model '{}'. Using 0.", winner, alias);
        } else if (source.isFallback()) {
            log.info("Using fallback '{}' field from model '{}'", source.field(), alias);
        }

        var margin = bag.node(MARGIN);
        if (margin == null) {
            margin = bag.node(PREDICTED_MARGIN);
        }
        Long predictionId = bag.integer(PREDICTION_ID).orElse(null);
        if (predictionId == null && bag.has(PREDICTION_ID)) {
            log.warn("Ignoring unreadable prediction_id {} from model '{}'", bag.node(PREDICTION_ID), alias);
        }

        return new CanonicalPredictionResult(winner, clamp(confidence, source, alias), margin, alias, predictionId, source, aliasSource);
    }

    private record ResolvedAlias(String alias, AliasSource source) {}

    private ResolvedAlias resolveAlias(RawPredictionResponse bag, @Nullable String requestedAlias) {
        var returnedAlias = bag.text(MODEL_ALIAS);
        var returnedName = bag.text(MODEL_NAME);

        if (returnedAlias == null && returnedName == null) {
            if (requestedAlias != null) {
                log.warn("Response missing 'model_alias' and 'model_name', using requested alias '{}'", requestedAlias);
                return new ResolvedAlias(requestedAlias, AliasSource.REQUESTED);
            }
            log.warn("Response names no model and none was requested");
            return new ResolvedAlias(UNKNOWN_ALIAS, AliasSource.REQUESTED);
        }
        if (returnedAlias != null) {
            if (requestedAlias != null && !returnedAlias.equals(requestedAlias)) {
                log.warn("Backend returned alias '{}' but requested '{}'. Using backend alias.", returnedAlias, requestedAlias);
            }
            return new ResolvedAlias(returnedAlias, AliasSource.RESPONSE_ALIAS);
        }
        if (requestedAlias != null && !returnedName.equals(requestedAlias) && log.isInfoEnabled()) {
            log.info("Backend model_name '{}' differs from requested alias '{}'", returnedName, requestedAlias);
        }
        return new ResolvedAlias(returnedName, AliasSource.RESPONSE_NAME);
    }

    private static void reportMalformedFields(RawPredictionResponse bag, String alias) {
        for (String field : ConfidenceRule.FIELDS) {
            if (bag.isMalformedNumber(field)) {
                log.warn("Ignoring non-numeric '{}' value {} from model '{}'", field, bag.node(field), alias);
            }
        }
    }

    private static double clamp(double confidence, ConfidenceSource source, String alias) {
        if (confidence < 0.0 || confidence > 1.0) {
            log.warn("Confidence {} from '{}' of model '{}' is outside [0, 1]; clamping", confidence, source.field(), alias);
            return Math.max(0.0, Math.min(1.0, confidence));
        }
        return confidence;
    }

    private static CanonicalPredictionResult degraded(@Nullable String alias, AliasSource aliasSource) {
        return new CanonicalPredictionResult(null, 0.0, null,
                alias == null || alias.isBlank() ? UNKNOWN_ALIAS : alias,
                null, ConfidenceSource.NONE, aliasSource);
    }
}
