package org.jstats.tipster_api.modules.history.service;

import org.jspecify.annotations.Nullable;
import org.jstats.tipster_api.core.config.ExecutorConfig;
import org.jstats.tipster_api.modules.history.model.HistoricalPrediction;
import org.jstats.tipster_api.modules.prediction.model.RawPredictionResponse;
import org.jstats.tipster_api.modules.prediction.service.ResponseNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Function;

/**
 * Fetches the caller's stored predictions, normalizes each one and orders them newest first.
 */
@Service
public class HistoryReconciler {

    private static final Logger log = LoggerFactory.getLogger(HistoryReconciler.class);

    static final String MODEL = "model";
    static final String MATCH_DATE = "match_date";
    static final String HOME_TEAM_NAME = "home_team_name";
    static final String AWAY_TEAM_NAME = "away_team_name";
    static final String PREDICTION_TIMESTAMP = "prediction_timestamp";
    static final String USER_RATING = "user_rating";
    static final String ACTUAL_WINNER = "actual_winner";
    static final String ACTUAL_MARGIN = "actual_margin";

    // entries without a readable timestamp sort as the epoch; List.sort is stable so ties keep upstream order
    static final Comparator<HistoricalPrediction> NEWEST_FIRST = Comparator.comparing(
            HistoryReconciler::sortInstant, Comparator.reverseOrder());

    private static final List<Function<String, Instant>> TIMESTAMP_PARSERS = List.of(
            s -> OffsetDateTime.parse(s).toInstant(),
            s -> LocalDateTime.parse(s.replace(' ', 'T')).toInstant(ZoneOffset.UTC),
            s -> LocalDate.parse(s).atStartOfDay(ZoneOffset.UTC).toInstant());

    private final UserServiceClient userService;
    private final ResponseNormalizer normalizer;
    private final ExecutorService executor;

    public HistoryReconciler(
            UserServiceClient userService,
            ResponseNormalizer normalizer,
            @Qualifier(ExecutorConfig.OUTBOUND_EXECUTOR) ExecutorService executor) {
        this.userService = userService;
        this.normalizer = normalizer;
        this.executor = executor;
    }

    /**
     * @param credential the caller's bearer token
     * @return a new list ordered by prediction timestamp, newest first
     * @throws org.jstats.tipster_api.core.upstream.TransportException when the user service call fails
     */
    public List<HistoricalPrediction> fetchHistory(String credential) {
        var records = userService.fetchPredictions(credential);
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("History fetch was cancelled");
        }
        var history = reconcile(records);
        log.info("Loaded {} stored predictions", history.size());
        return history;
    }

    public Future<List<HistoricalPrediction>> fetchHistoryAsync(String credential) {
        return executor.submit(() -> fetchHistory(credential));
    }

    /**
     * Normalizes and orders {@code records}. The input list is not modified.
     */
    public List<HistoricalPrediction> reconcile(List<RawPredictionResponse> records) {
        var history = new ArrayList<HistoricalPrediction>(records.size());
        for (RawPredictionResponse entry : records) {
            history.add(toHistorical(entry));
        }
        history.sort(NEWEST_FIRST);
        return history;
    }

    /**
     * @throws IllegalArgumentException when {@code rating} is outside 1..5
     */
    public void submitRating(String credential, long predictionId, int rating) {
        if (rating < 1 || rating > 5) {
            throw new IllegalArgumentException("Rating must be between 1 and 5, got " + rating);
        }
        userService.submitRating(credential, predictionId, rating);
        log.info("Rating {} submitted for prediction {}", rating, predictionId);
    }

    /**
     * @throws IllegalArgumentException when the winner is blank or the margin is negative
     */
    public void submitActualResult(String credential, long predictionId, String actualWinner, int actualMargin) {
        if (actualWinner.isBlank()) {
            throw new IllegalArgumentException("Actual winner must not be blank");
        }
        if (actualMargin < 0) {
            throw new IllegalArgumentException("Actual margin must not be negative, got " + actualMargin);
        }
        userService.submitActualResult(credential, predictionId, actualWinner.trim(), actualMargin);
        log.info("Actual result '{}' ({}) submitted for prediction {}", actualWinner, actualMargin, predictionId);
    }

    private HistoricalPrediction toHistorical(RawPredictionResponse entry) {
        var result = normalizer.normalizeStored(entry, entry.text(MODEL));
        var rating = entry.integer(USER_RATING).map(Long::intValue).orElse(null);
        var margin = entry.number(ACTUAL_MARGIN);
        return new HistoricalPrediction(
                result,
                entry.text(HOME_TEAM_NAME),
                entry.text(AWAY_TEAM_NAME),
                entry.text(MATCH_DATE),
                parseTimestamp(entry),
                rating,
                entry.text(ACTUAL_WINNER),
                margin.isPresent() ? margin.getAsDouble() : null);
    }

    private static @Nullable Instant parseTimestamp(RawPredictionResponse entry) {
        var node = entry.node(PREDICTION_TIMESTAMP);
        if (node == null) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return Instant.ofEpochMilli(node.longValue());
        }
        var text = entry.text(PREDICTION_TIMESTAMP);
        var parsed = text == null || !node.isTextual() ? null : parseTimestamp(text.trim());
        if (parsed == null) {
            log.warn("Unreadable prediction_timestamp {} for prediction {}; sorting it as the epoch",
                    node, entry.node(RawPredictionResponse.PREDICTION_ID));
        }
        return parsed;
    }

    /**
     * Accepts ISO-8601 with an offset, a local date-time (read as UTC, 'T' or space separated)
     * or a bare date.
     */
    private static Instant sortInstant(HistoricalPrediction prediction) {
        var timestamp = prediction.predictionTimestamp();
        return timestamp == null ? Instant.EPOCH : timestamp;
    }

    static @Nullable Instant parseTimestamp(String text) {
        for (Function<String, Instant> parser : TIMESTAMP_PARSERS) {
            try {
                return parser.apply(text);
            } catch (DateTimeException dte) {
                if (log.isTraceEnabled()) {
                    log.trace("Timestamp format mismatch for '{}': {}", text, dte.getMessage());
                }
            }
        }
        return null;
    }
}
