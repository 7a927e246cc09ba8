package org.jstats.tipster_api.modules.history.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jstats.tipster_api.core.config.UpstreamClientsConfig;
import org.jstats.tipster_api.core.upstream.UpstreamErrors;
import org.jstats.tipster_api.modules.prediction.model.RawPredictionResponse;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP access to the user service: stored predictions and prediction feedback.
 * Every call is authenticated with the caller's bearer token.
 */
@Component
public class UserServiceClient {

    private static final Logger log = LoggerFactory.getLogger(UserServiceClient.class);

    static final String SERVICE = "user service";

    private final RestClient http;
    private final ObjectMapper mapper;

    public UserServiceClient(
            @Qualifier(UpstreamClientsConfig.USER_SERVICE) RestClient http,
            ObjectMapper mapper) {
        this.http = http;
        this.mapper = mapper;
    }

    /**
     * GET /users/me/predictions
     * - 2xx JSON array -> one field bag per element, in upstream order
     * - 2xx anything else -> empty list, logged
     * - non-2xx / IO -> TransportException
     */
    public List<RawPredictionResponse> fetchPredictions(String credential) {
        String body;
        try {
            body = http.get()
                    .uri("/users/me/predictions")
                    .accept(MediaType.APPLICATION_JSON)
                    .headers(h -> h.setBearerAuth(credential))
                    .retrieve()
                    .onStatus(s -> !s.is2xxSuccessful(), (req, res) -> {
                        throw UpstreamErrors.statusError(res);
                    })
                    .body(String.class);
        } catch (RestClientException ex) {
            throw UpstreamErrors.translate(SERVICE, ex, mapper);
        }
        return parseRecords(body);
    }

    /**
     * POST /users/feedback/rating {prediction_id, rating_value}
     */
    public void submitRating(String credential, long predictionId, int rating) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("prediction_id", predictionId);
        body.put("rating_value", rating);
        post("/users/feedback/rating", body, credential);
    }

    /**
     * POST /users/feedback/result {prediction_id, actual_winner, actual_margin}
     */
    public void submitActualResult(String credential, long predictionId, String actualWinner, int actualMargin) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("prediction_id", predictionId);
        body.put("actual_winner", actualWinner);
        body.put("actual_margin", actualMargin);
        post("/users/feedback/result", body, credential);
    }

    private void post(String path, Map<String, Object> body, String credential) {
        if (log.isDebugEnabled()) {
            log.debug("Calling user service POST {} for prediction {}", path, body.get("prediction_id"));
        }
        try {
            http.post()
                    .uri(path)
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(h -> h.setBearerAuth(credential))
                    .body(body)
                    .retrieve()
                    .onStatus(s -> !s.is2xxSuccessful(), (req, res) -> {
                        throw UpstreamErrors.statusError(res);
                    })
                    .toBodilessEntity();
        } catch (RestClientException ex) {
            throw UpstreamErrors.translate(SERVICE, ex, mapper);
        }
    }

    private List<RawPredictionResponse> parseRecords(@Nullable String body) {
        if (body == null || body.isBlank()) {
            log.warn("User service returned an empty prediction history body");
            return List.of();
        }
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException jpe) {
            log.warn("Failed to parse prediction history as JSON: {}", jpe.getOriginalMessage());
            return List.of();
        }
        if (root == null || !root.isArray()) {
            log.warn("Prediction history is not a JSON array: {}", root == null ? null : root.getNodeType());
            return List.of();
        }
        var records = new ArrayList<RawPredictionResponse>(root.size());
        for (JsonNode element : root) {
            var entry = RawPredictionResponse.of(element);
            if (!entry.isWellFormed()) {
                log.warn("Prediction history entry is not a JSON object: {}", element.getNodeType());
            }
            records.add(entry);
        }
        return records;
    }
}
