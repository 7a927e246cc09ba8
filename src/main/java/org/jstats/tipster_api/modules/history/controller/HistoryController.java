package org.jstats.tipster_api.modules.history.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.jspecify.annotations.Nullable;
import org.jstats.tipster_api.modules.entitlement.model.Identity;
import org.jstats.tipster_api.modules.history.model.ActualResultRequest;
import org.jstats.tipster_api.modules.history.model.HistoricalPrediction;
import org.jstats.tipster_api.modules.history.model.RatingRequest;
import org.jstats.tipster_api.modules.history.service.HistoryReconciler;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * The caller's stored predictions and the feedback attached to them.
 */
@Tag(name = "Prediction History", description = "Stored predictions, ratings and actual results")
@Validated
@RestController
@RequestMapping("/api/predictions")
public class HistoryController {

    private final HistoryReconciler reconciler;

    public HistoryController(HistoryReconciler reconciler) {
        this.reconciler = reconciler;
    }

    @Operation(
            summary = "Prediction history",
            description = "Stored predictions of the caller, newest first; entries without a readable timestamp come last",
            responses = {
                    @ApiResponse(
                            responseCode = "200",
                            description = "Ordered history",
                            content = @Content(
                                    mediaType = "application/json",
                                    array = @ArraySchema(schema = @Schema(implementation = HistoricalPrediction.class))
                            )
                    ),
                    @ApiResponse(responseCode = "401", description = "No bearer token", content = @Content(mediaType = "application/problem+json")),
                    @ApiResponse(responseCode = "502", description = "User service failure", content = @Content(mediaType = "application/problem+json"))
            }
    )
    @GetMapping("/history")
    public List<HistoricalPrediction> history(
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) @Nullable String authorization) {
        return reconciler.fetchHistory(requireCredential(authorization));
    }

    @Operation(summary = "Rate a stored prediction", description = "Forwards a 1-5 rating to the user service")
    @PostMapping("/{id}/rating")
    public ResponseEntity<Void> rate(
            @PathVariable("id") long predictionId,
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) @Nullable String authorization,
            @RequestBody @Valid RatingRequest request) {
        reconciler.submitRating(requireCredential(authorization), predictionId, request.rating());
        return ResponseEntity.status(HttpStatus.CREATED).build();
    }

    @Operation(summary = "Report the actual result", description = "Forwards the actual winner and margin to the user service")
    @PostMapping("/{id}/result")
    public ResponseEntity<Void> result(
            @PathVariable("id") long predictionId,
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) @Nullable String authorization,
            @RequestBody @Valid ActualResultRequest request) {
        reconciler.submitActualResult(requireCredential(authorization), predictionId,
                request.actualWinner(), request.actualMargin());
        return ResponseEntity.status(HttpStatus.CREATED).build();
    }

    private static String requireCredential(@Nullable String authorization) {
        var credential = Identity.fromHeaders(null, authorization).credential();
        if (credential == null) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "A bearer token is required");
        }
        return credential;
    }
}
