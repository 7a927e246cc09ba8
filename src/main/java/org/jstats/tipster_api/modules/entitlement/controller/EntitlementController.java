package org.jstats.tipster_api.modules.entitlement.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.jspecify.annotations.Nullable;
import org.jstats.tipster_api.modules.entitlement.model.AccessStatus;
import org.jstats.tipster_api.modules.entitlement.model.CouponRequest;
import org.jstats.tipster_api.modules.entitlement.model.EntitlementSet;
import org.jstats.tipster_api.modules.entitlement.model.EntitlementsView;
import org.jstats.tipster_api.modules.entitlement.model.Identity;
import org.jstats.tipster_api.modules.entitlement.model.OneTimeCodeRequest;
import org.jstats.tipster_api.modules.entitlement.service.EntitlementGate;
import org.jstats.tipster_api.modules.entitlement.service.RedemptionService;
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
 * Entitlement state and premium code redemption for the calling user.
 */
@Tag(name = "Entitlements", description = "Premium model access and code redemption")
@Validated
@RestController
@RequestMapping("/api/entitlements")
public class EntitlementController {

    private final EntitlementGate gate;
    private final RedemptionService redemptions;

    public EntitlementController(EntitlementGate gate, RedemptionService redemptions) {
        this.gate = gate;
        this.redemptions = redemptions;
    }

    @Operation(
            summary = "Current entitlements",
            description = "Returns the caller's cached entitlement set without contacting the billing service",
            responses = @ApiResponse(
                    responseCode = "200",
                    description = "Cached entitlement set",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = EntitlementsView.class))
            )
    )
    @GetMapping
    public EntitlementsView current(
            @RequestHeader(name = Identity.USER_ID_HEADER, required = false) @Nullable String userId,
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) @Nullable String authorization) {
        return view(gate.switchIdentity(Identity.fromHeaders(userId, authorization)));
    }

    @Operation(
            summary = "Refresh entitlements now",
            description = "Fetches the caller's entitlements from the billing service. Failures fall back to the free tier."
    )
    @PostMapping("/refresh")
    public EntitlementsView refresh(
            @RequestHeader(name = Identity.USER_ID_HEADER, required = false) @Nullable String userId,
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) @Nullable String authorization) {
        return view(gate.refresh(Identity.fromHeaders(userId, authorization)));
    }

    @Operation(
            summary = "Redeem a coupon",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Coupon redeemed, entitlements refreshed"),
                    @ApiResponse(responseCode = "400", description = "Invalid request", content = @Content(mediaType = "application/problem+json")),
                    @ApiResponse(responseCode = "502", description = "Billing service rejected the coupon", content = @Content(mediaType = "application/problem+json"))
            }
    )
    @PostMapping("/coupon")
    public EntitlementsView redeemCoupon(
            @RequestHeader(name = Identity.USER_ID_HEADER, required = false) @Nullable String userId,
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) @Nullable String authorization,
            @RequestBody @Valid CouponRequest request) {
        return view(redemptions.redeemCoupon(Identity.fromHeaders(userId, authorization), request.couponCode()));
    }

    @Operation(
            summary = "Redeem a one-time code",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Code redeemed, entitlements refreshed"),
                    @ApiResponse(responseCode = "400", description = "Invalid request", content = @Content(mediaType = "application/problem+json")),
                    @ApiResponse(responseCode = "502", description = "Billing service rejected the code", content = @Content(mediaType = "application/problem+json"))
            }
    )
    @PostMapping("/one-time")
    public EntitlementsView redeemOneTimeCode(
            @RequestHeader(name = Identity.USER_ID_HEADER, required = false) @Nullable String userId,
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) @Nullable String authorization,
            @RequestBody @Valid OneTimeCodeRequest request) {
        return view(redemptions.redeemOneTimeCode(Identity.fromHeaders(userId, authorization), request.sessionId(), request.oneTimeCode()));
    }

    @Operation(summary = "Premium access status", description = "Access status as reported by the billing service")
    @GetMapping("/status")
    public AccessStatus status(
            @RequestHeader(name = Identity.USER_ID_HEADER, required = false) @Nullable String userId,
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) @Nullable String authorization,
            @RequestParam(name = "session_id", required = false) @Nullable String sessionId) {
        return redemptions.accessStatus(Identity.fromHeaders(userId, authorization), sessionId);
    }

    private EntitlementsView view(EntitlementSet entitlements) {
        return EntitlementsView.of(entitlements, gate.redemptionAvailable(entitlements));
    }
}
