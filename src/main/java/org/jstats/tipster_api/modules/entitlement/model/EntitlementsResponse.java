package org.jstats.tipster_api.modules.entitlement.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Body of {@code GET /entitlements}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EntitlementsResponse(@JsonProperty("entitlements") @Nullable List<String> entitlements) {}
