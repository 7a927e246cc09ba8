package org.jstats.tipster_api.modules.entitlement.model;

import jakarta.validation.constraints.NotBlank;

public record CouponRequest(@NotBlank String couponCode) {}
