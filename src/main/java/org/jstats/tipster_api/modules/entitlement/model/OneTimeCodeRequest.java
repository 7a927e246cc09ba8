package org.jstats.tipster_api.modules.entitlement.model;

import jakarta.validation.constraints.NotBlank;

public record OneTimeCodeRequest(@NotBlank String sessionId, @NotBlank String oneTimeCode) {}
