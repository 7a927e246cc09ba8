package org.jstats.tipster_api.modules.entitlement.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * Premium access status as reported by the billing service.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AccessStatus(
        @JsonProperty("has_access") boolean hasAccess,
        @JsonProperty("tier") @Nullable String tier,
        @JsonProperty("expires_at") @Nullable String expiresAt
) {}
