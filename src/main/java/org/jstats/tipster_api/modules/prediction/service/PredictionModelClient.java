package org.jstats.tipster_api.modules.prediction.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.jstats.tipster_api.core.config.UpstreamClientsConfig;
import org.jstats.tipster_api.core.upstream.UpstreamErrors;
import org.jstats.tipster_api.modules.prediction.model.ModelDescriptor;
import org.jstats.tipster_api.modules.prediction.model.PredictionPayload;
import org.jstats.tipster_api.modules.prediction.model.RawPredictionResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * HTTP access to the model services.
 */
@Component
public class PredictionModelClient {

    private static final Logger log = LoggerFactory.getLogger(PredictionModelClient.class);

    private final RestClient http;
    private final ObjectMapper mapper;

    public PredictionModelClient(
            @Qualifier(UpstreamClientsConfig.MODELS) RestClient http,
            ObjectMapper mapper) {
        this.http = http;
        this.mapper = mapper;
    }

    /**
     * POST {model endpoint}
     * - 2xx JSON object -> field bag
     * - 2xx anything else -> malformed (empty) field bag, logged
     * - non-2xx / IO / timeout -> TransportException (no retry)
     */
    public RawPredictionResponse predict(ModelDescriptor model, PredictionPayload payload, @Nullable String credential) {
        var service = "model '" + model.alias() + "'";
        if (log.isDebugEnabled()) {
            log.debug("Sending prediction request to {} ({} vs {} on {}), authenticated={}",
                    model.endpoint(), payload.teamA(), payload.teamB(), payload.matchDateStr(), credential != null);
        }
        try {
            var body = http.post()
                    .uri(model.endpoint())
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .headers(h -> {
                        if (credential != null && !credential.isBlank()) {
                            h.setBearerAuth(credential);
                        }
                    })
                    .body(payload)
                    .retrieve()
                    .onStatus(s -> !s.is2xxSuccessful(), (req, res) -> {
                        throw UpstreamErrors.statusError(res);
                    })
                    .body(String.class);
            return parse(body, model.alias());
        } catch (RestClientException ex) {
            throw UpstreamErrors.translate(service, ex, mapper);
        }
    }

    private RawPredictionResponse parse(@Nullable String body, String alias) {
        if (body == null || body.isBlank()) {
            log.warn("Model '{}' returned an empty body", alias);
            return RawPredictionResponse.malformed();
        }
        try {
            var parsed = RawPredictionResponse.of(mapper.readTree(body));
            if (!parsed.isWellFormed()) {
                log.warn("Model '{}' returned JSON that is not an object", alias);
            }
            return parsed;
        } catch (JsonProcessingException jpe) {
            log.warn("Failed to parse response of model '{}' as JSON: {}", alias, jpe.getOriginalMessage());
            return RawPredictionResponse.malformed();
        }
    }
}
