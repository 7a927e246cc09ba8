package org.jstats.tipster_api.modules.prediction.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.jspecify.annotations.Nullable;
import org.jstats.tipster_api.modules.entitlement.model.Identity;
import org.jstats.tipster_api.modules.entitlement.model.ModelCatalog;
import org.jstats.tipster_api.modules.entitlement.service.EntitlementGate;
import org.jstats.tipster_api.modules.entitlement.service.ModelNotEntitledException;
import org.jstats.tipster_api.modules.prediction.model.CanonicalPredictionResult;
import org.jstats.tipster_api.modules.prediction.model.PredictionRequest;
import org.jstats.tipster_api.modules.prediction.registry.ModelRegistry;
import org.jstats.tipster_api.modules.prediction.service.PredictionOrchestrator;
import org.springframework.http.HttpHeaders;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for match predictions.
 */
@Tag(name = "Predictions", description = "Match outcome predictions from the registered models")
@Validated
@RestController
@RequestMapping("/api")
public class PredictionController {

    private final PredictionOrchestrator orchestrator;
    private final EntitlementGate gate;
    private final ModelRegistry registry;

    public PredictionController(
            PredictionOrchestrator orchestrator,
            EntitlementGate gate,
            ModelRegistry registry) {
        this.orchestrator = orchestrator;
        this.gate = gate;
        this.registry = registry;
    }

    @Operation(
            summary = "List prediction models",
            description = "Every registered model with whether the caller may currently use it"
    )
    @GetMapping("/models")
    public ModelCatalog models(
            @RequestHeader(name = Identity.USER_ID_HEADER, required = false) @Nullable String userId,
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) @Nullable String authorization) {
        var entitlements = gate.switchIdentity(Identity.fromHeaders(userId, authorization));
        return new ModelCatalog(gate.modelChoices(entitlements), registry.defaultModel().alias(), gate.redemptionAvailable(entitlements));
    }

    @Operation(
            summary = "Predict match outcome",
            description = "Calls the selected model once and returns the normalized prediction",
            responses = {
                    @ApiResponse(
                            responseCode = "200",
                            description = "Prediction generated successfully",
                            content = @Content(
                                    mediaType = "application/json",
                                    schema = @Schema(implementation = CanonicalPredictionResult.class)
                            )
                    ),
                    @ApiResponse(
                            responseCode = "400",
                            description = "Invalid request",
                            content = @Content(mediaType = "application/problem+json")
                    ),
                    @ApiResponse(
                            responseCode = "403",
                            description = "Model requires a premium entitlement",
                            content = @Content(mediaType = "application/problem+json")
                    ),
                    @ApiResponse(
                            responseCode = "404",
                            description = "Unknown model alias",
                            content = @Content(mediaType = "application/problem+json")
                    ),
                    @ApiResponse(
                            responseCode = "502",
                            description = "Model service failure",
                            content = @Content(mediaType = "application/problem+json")
                    )
            }
    )
    @PostMapping("/predictions")
    public CanonicalPredictionResult predict(
            @RequestHeader(name = Identity.USER_ID_HEADER, required = false) @Nullable String userId,
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) @Nullable String authorization,
            @RequestParam(name = "model", defaultValue = ModelRegistry.DEFAULT_ALIAS) String alias,
            @RequestBody @Valid PredictionRequest request) {
        var identity = Identity.fromHeaders(userId, authorization);
        // unknown aliases are a 404 regardless of entitlements
        var model = registry.require(alias);
        if (!gate.switchIdentity(identity).contains(model.alias())) {
            throw new ModelNotEntitledException(model.alias());
        }
        return orchestrator.predict(request, model.alias(), identity.credential());
    }
}
